package fr.lapetina.multiprovider.domain.model;

import fr.lapetina.multiprovider.domain.exception.InvalidRequestException;

/**
 * One JSON-RPC method invocation, standalone or as a batch item.
 */
public record RpcCall(String method, Object params) {

    public RpcCall {
        if (method == null || method.isBlank()) {
            throw new InvalidRequestException("JSON-RPC method is required");
        }
    }

    public static RpcCall of(String method, Object params) {
        return new RpcCall(method, params);
    }
}
