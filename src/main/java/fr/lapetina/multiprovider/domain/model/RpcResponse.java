package fr.lapetina.multiprovider.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded response returned to the caller.
 *
 * The body is a mutable Jackson tree: the response normalizer rewrites it in place
 * before the caller sees it. Nothing else modifies it.
 *
 * @param request    the request this response answers
 * @param body       decoded JSON body (JSON-RPC envelope, batch array, or REST document)
 * @param statusCode HTTP status code
 * @param provider   normalized identity of the endpoint that answered
 */
public record RpcResponse(
        RpcRequest request,
        JsonNode body,
        int statusCode,
        String provider
) {
    public RpcResponse {
        Objects.requireNonNull(request, "Request is required");
        Objects.requireNonNull(body, "Body is required");
    }

    /**
     * Returns the JSON-RPC {@code result} member, or the whole document for REST responses.
     */
    public JsonNode result() {
        if (request.kind().isRest()) {
            return body;
        }
        return body.get("result");
    }

    /**
     * True when a single JSON-RPC response carries an {@code error} member.
     */
    public boolean hasError() {
        return !request.isBatch() && body.has("error");
    }

    public Optional<JsonNode> error() {
        return hasError() ? Optional.of(body.get("error")) : Optional.empty();
    }

    /**
     * Batch response items in the order the node returned them.
     */
    public List<JsonNode> items() {
        List<JsonNode> items = new ArrayList<>();
        if (body.isArray()) {
            body.forEach(items::add);
        }
        return items;
    }

    /**
     * Extracts the JSON-RPC error code of an envelope, or an empty string when
     * the envelope carries no error or no code.
     */
    public static String errorCodeOf(JsonNode envelope) {
        if (envelope == null || !envelope.has("error")) {
            return "";
        }
        JsonNode error = envelope.get("error");
        if (error.isObject() && error.has("code")) {
            return error.get("code").asText();
        }
        return "";
    }
}
