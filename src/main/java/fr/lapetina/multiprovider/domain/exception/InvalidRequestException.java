package fr.lapetina.multiprovider.domain.exception;

/**
 * Thrown when the caller builds a request that cannot be sent (missing method,
 * unencodable params, malformed REST path).
 *
 * Never triggers failover: every endpoint would reject it the same way.
 */
public final class InvalidRequestException extends MultiProviderException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
