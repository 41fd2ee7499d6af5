package fr.lapetina.multiprovider.infrastructure.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.multiprovider.domain.exception.InvalidRequestException;
import fr.lapetina.multiprovider.domain.exception.MalformedResponseException;
import fr.lapetina.multiprovider.domain.model.RpcCall;
import fr.lapetina.multiprovider.domain.model.RpcRequest;
import fr.lapetina.multiprovider.infrastructure.http.EndpointRequest;
import fr.lapetina.multiprovider.infrastructure.http.EndpointResponse;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Encodes {@link RpcRequest}s into HTTP exchanges and decodes response bodies.
 *
 * Single JSON-RPC calls get a process-wide increasing id. Batch items are numbered
 * by their position in the batch so that response items can be matched back to
 * their call whatever order the node answers in.
 */
public final class RequestCodec {

    static final String JSON_RPC_VERSION = "2.0";

    private final ObjectMapper objectMapper;
    private final AtomicLong nextId = new AtomicLong(1);

    public RequestCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws InvalidRequestException if the parameters cannot be serialized
     */
    public EndpointRequest encode(RpcRequest request) {
        switch (request.kind()) {
            case JSON_RPC:
                return EndpointRequest.post("", write(envelope(request.target(), request.params(), nextId.getAndIncrement())));

            case JSON_RPC_BATCH:
                ArrayNode batch = objectMapper.createArrayNode();
                for (int i = 0; i < request.calls().size(); i++) {
                    RpcCall call = request.calls().get(i);
                    batch.add(envelope(call.method(), call.params(), i));
                }
                return EndpointRequest.post("", write(batch));

            case REST_POST:
                byte[] body = request.params() != null ? write(toTree(request.params())) : new byte[0];
                return EndpointRequest.post(request.target(), body);

            default:
                return EndpointRequest.get(request.target(), request.query());
        }
    }

    private ObjectNode envelope(String method, Object params, long id) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("jsonrpc", JSON_RPC_VERSION);
        envelope.put("method", method);
        envelope.set("params", params(params));
        envelope.put("id", id);
        return envelope;
    }

    private JsonNode params(Object params) {
        if (params == null) {
            return objectMapper.createArrayNode();
        }
        JsonNode tree = toTree(params);
        if (!tree.isArray() && !tree.isObject()) {
            throw new InvalidRequestException("JSON-RPC params must be a list or an object");
        }
        return tree;
    }

    private JsonNode toTree(Object value) {
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Request parameters cannot be serialized: " + e.getMessage());
        }
    }

    private byte[] write(JsonNode tree) {
        try {
            return objectMapper.writeValueAsBytes(tree);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("Request cannot be encoded: " + e.getOriginalMessage());
        }
    }

    /**
     * Decodes a response body. An empty body decodes to JSON null for REST requests.
     *
     * @throws MalformedResponseException if the body is not JSON, or is empty for a JSON-RPC request
     */
    public JsonNode decode(RpcRequest request, String provider, EndpointResponse response) {
        byte[] body = response.body();
        if (body.length == 0) {
            if (request.kind().isRest()) {
                return NullNode.getInstance();
            }
            throw new MalformedResponseException(provider, new IOException("Empty JSON-RPC response body"));
        }
        try {
            JsonNode tree = objectMapper.readTree(body);
            if (tree == null || tree.isMissingNode()) {
                throw new MalformedResponseException(provider, new IOException("Empty response document"));
            }
            return tree;
        } catch (IOException e) {
            throw new MalformedResponseException(provider, e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
