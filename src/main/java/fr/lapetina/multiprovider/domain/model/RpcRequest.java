package fr.lapetina.multiprovider.domain.model;

import fr.lapetina.multiprovider.domain.exception.InvalidRequestException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A logical request that the failover engine satisfies against one endpoint of a pool.
 * Immutable and thread-safe.
 *
 * @param kind   request shape
 * @param target JSON-RPC method name, or REST path for REST kinds, or {@code "batch"} for batches
 * @param params JSON-RPC params or REST POST body; encoded with Jackson
 * @param query  REST query parameters
 * @param calls  batch items, empty unless {@code kind == JSON_RPC_BATCH}
 */
public record RpcRequest(
        RequestKind kind,
        String target,
        Object params,
        Map<String, String> query,
        List<RpcCall> calls
) {
    public RpcRequest {
        Objects.requireNonNull(kind, "Request kind is required");
        query = query != null ? Map.copyOf(query) : Map.of();
        calls = calls != null ? List.copyOf(calls) : List.of();

        switch (kind) {
            case JSON_RPC:
                if (target == null || target.isBlank()) {
                    throw new InvalidRequestException("JSON-RPC method is required");
                }
                break;

            case JSON_RPC_BATCH:
                if (calls.isEmpty()) {
                    throw new InvalidRequestException("Batch request must contain at least one call");
                }
                target = "batch";
                break;

            default:
                if (target == null || !target.startsWith("/")) {
                    throw new InvalidRequestException("REST path must start with '/': " + target);
                }
        }
    }

    /**
     * Creates a single JSON-RPC request.
     */
    public static RpcRequest jsonRpc(String method, Object params) {
        return new RpcRequest(RequestKind.JSON_RPC, method, params, null, null);
    }

    /**
     * Creates a JSON-RPC batch request.
     */
    public static RpcRequest batch(List<RpcCall> calls) {
        return new RpcRequest(RequestKind.JSON_RPC_BATCH, null, null, null, calls);
    }

    /**
     * Creates a REST GET request.
     */
    public static RpcRequest get(String path) {
        return get(path, null);
    }

    public static RpcRequest get(String path, Map<String, String> query) {
        return new RpcRequest(RequestKind.REST_GET, path, null, query, null);
    }

    /**
     * Creates a REST POST request with a JSON body.
     */
    public static RpcRequest post(String path, Object body) {
        return new RpcRequest(RequestKind.REST_POST, path, body, null, null);
    }

    public boolean isBatch() {
        return kind == RequestKind.JSON_RPC_BATCH;
    }

    /**
     * JSON-RPC method names carried by this request, in payload order.
     * Empty for REST requests.
     */
    public List<String> methods() {
        if (kind == RequestKind.JSON_RPC) {
            return List.of(target);
        }
        if (kind == RequestKind.JSON_RPC_BATCH) {
            return calls.stream().map(RpcCall::method).toList();
        }
        return List.of();
    }
}
