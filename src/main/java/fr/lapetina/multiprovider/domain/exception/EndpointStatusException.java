package fr.lapetina.multiprovider.domain.exception;

/**
 * Thrown when an endpoint answers with a non-2xx HTTP status.
 */
public final class EndpointStatusException extends EndpointTransportException {

    private final int statusCode;

    public EndpointStatusException(String provider, int statusCode) {
        super(provider, "HTTP " + statusCode + " from provider " + provider);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
