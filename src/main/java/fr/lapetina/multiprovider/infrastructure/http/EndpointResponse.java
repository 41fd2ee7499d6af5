package fr.lapetina.multiprovider.infrastructure.http;

/**
 * Raw response received from an endpoint.
 *
 * @param statusCode    HTTP status code
 * @param contentLength value of the {@code Content-Length} header, or -1 when absent
 * @param body          materialized body
 */
public record EndpointResponse(
        int statusCode,
        long contentLength,
        byte[] body
) {
    public EndpointResponse {
        body = body != null ? body : new byte[0];
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Response payload size: the declared content length when present, otherwise the body length.
     */
    public long payloadSize() {
        return contentLength >= 0 ? contentLength : body.length;
    }
}
