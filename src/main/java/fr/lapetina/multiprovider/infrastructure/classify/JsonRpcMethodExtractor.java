package fr.lapetina.multiprovider.infrastructure.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts JSON-RPC method names from an encoded request payload.
 *
 * A single call yields one name, a batch yields one name per item in payload order.
 * Items without a textual {@code method} yield an empty string so that positions stay
 * aligned with the batch. Never throws: an unreadable payload yields an empty list.
 */
public final class JsonRpcMethodExtractor {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcMethodExtractor.class);

    private final ObjectMapper objectMapper;

    public JsonRpcMethodExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<String> extract(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return List.of();
        }
        try {
            JsonNode root = objectMapper.readTree(payload);
            if (root == null) {
                return List.of();
            }
            if (root.isArray()) {
                List<String> methods = new ArrayList<>(root.size());
                root.forEach(item -> methods.add(methodOf(item)));
                return methods;
            }
            return List.of(methodOf(root));
        } catch (IOException e) {
            log.debug("JSON-RPC method extraction failed: error={}", e.getMessage());
            return List.of();
        }
    }

    private static String methodOf(JsonNode call) {
        JsonNode method = call.get("method");
        return method != null && method.isTextual() ? method.asText() : "";
    }
}
