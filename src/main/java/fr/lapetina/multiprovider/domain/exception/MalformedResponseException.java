package fr.lapetina.multiprovider.domain.exception;

/**
 * Thrown when an endpoint answers with a body that is not valid JSON.
 */
public final class MalformedResponseException extends EndpointTransportException {

    public MalformedResponseException(String provider, Throwable cause) {
        super(provider, "Malformed response from provider " + provider, cause);
    }
}
