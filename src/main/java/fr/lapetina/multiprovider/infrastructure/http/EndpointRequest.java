package fr.lapetina.multiprovider.infrastructure.http;

import java.util.Map;
import java.util.Objects;

/**
 * One encoded HTTP exchange to perform against an endpoint.
 *
 * @param method HTTP method ({@code GET} or {@code POST})
 * @param path   path relative to the endpoint address; empty for JSON-RPC
 * @param query  query parameters
 * @param body   encoded body, empty for GET
 */
public record EndpointRequest(
        String method,
        String path,
        Map<String, String> query,
        byte[] body
) {
    public EndpointRequest {
        Objects.requireNonNull(method, "HTTP method is required");
        path = path != null ? path : "";
        query = query != null ? Map.copyOf(query) : Map.of();
        body = body != null ? body : new byte[0];
    }

    public static EndpointRequest post(String path, byte[] body) {
        return new EndpointRequest("POST", path, null, body);
    }

    public static EndpointRequest get(String path, Map<String, String> query) {
        return new EndpointRequest("GET", path, query, null);
    }
}
