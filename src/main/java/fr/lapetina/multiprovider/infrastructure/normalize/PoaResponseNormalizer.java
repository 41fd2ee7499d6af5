package fr.lapetina.multiprovider.infrastructure.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.multiprovider.domain.model.RpcCall;
import fr.lapetina.multiprovider.domain.model.RpcRequest;
import fr.lapetina.multiprovider.domain.model.RpcResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Makes proof-of-authority block headers readable by consumers expecting at most
 * 32 bytes of {@code extraData}.
 *
 * For {@code eth_getBlockByHash} and {@code eth_getBlockByNumber} results whose
 * {@code extraData} exceeds 32 bytes, the field is renamed to
 * {@code proofOfAuthorityData}; the block no longer carries {@code extraData}.
 * Batch items are matched to their call through the JSON-RPC id when present,
 * by position otherwise. Any other response is returned untouched.
 */
public final class PoaResponseNormalizer implements ResponseNormalizer {

    private static final Logger log = LoggerFactory.getLogger(PoaResponseNormalizer.class);

    public static final Set<String> BLOCK_METHODS = Set.of("eth_getBlockByHash", "eth_getBlockByNumber");

    static final String EXTRA_DATA = "extraData";
    static final String POA_DATA = "proofOfAuthorityData";

    private static final int MAX_EXTRA_DATA_BYTES = 32;

    @Override
    public RpcResponse normalize(RpcResponse response) {
        RpcRequest request = response.request();
        switch (request.kind()) {
            case JSON_RPC:
                if (BLOCK_METHODS.contains(request.target())) {
                    sanitize(response.body());
                }
                break;

            case JSON_RPC_BATCH:
                normalizeBatch(request, response.body());
                break;

            default:
                break;
        }
        return response;
    }

    private void normalizeBatch(RpcRequest request, JsonNode items) {
        if (!items.isArray()) {
            return;
        }
        for (int i = 0; i < items.size(); i++) {
            JsonNode item = items.get(i);
            String method = methodOf(request, item, i);
            if (BLOCK_METHODS.contains(method)) {
                sanitize(item);
            }
        }
    }

    private static String methodOf(RpcRequest request, JsonNode item, int position) {
        int index = position;
        JsonNode id = item.get("id");
        if (id != null && id.canConvertToInt()) {
            index = id.asInt();
        }
        if (index < 0 || index >= request.calls().size()) {
            return "";
        }
        RpcCall call = request.calls().get(index);
        return call.method();
    }

    private void sanitize(JsonNode envelope) {
        if (envelope == null || !envelope.has("result")) {
            return;
        }
        JsonNode result = envelope.get("result");
        if (!result.isObject() || result.has(POA_DATA)) {
            return;
        }
        JsonNode extraData = result.get(EXTRA_DATA);
        if (extraData == null || !extraData.isTextual()) {
            return;
        }

        String value = extraData.asText();
        String hex = value.startsWith("0x") ? value.substring(2) : value;
        if (hex.length() <= MAX_EXTRA_DATA_BYTES * 2) {
            return;
        }

        ObjectNode block = (ObjectNode) result;
        block.set(POA_DATA, block.remove(EXTRA_DATA));
        log.debug("Moved PoA extraData: blockHash={}, originalBytes={}", block.path("hash").asText(""), hex.length() / 2);
    }
}
