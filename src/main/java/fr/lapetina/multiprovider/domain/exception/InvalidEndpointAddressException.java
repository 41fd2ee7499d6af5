package fr.lapetina.multiprovider.domain.exception;

/**
 * Thrown at pool construction when an endpoint address cannot be parsed or labelled.
 * The message does not repeat the address, which may embed credentials.
 */
public final class InvalidEndpointAddressException extends MultiProviderException {

    public InvalidEndpointAddressException(String message) {
        super(message);
    }

    public InvalidEndpointAddressException(String message, Throwable cause) {
        super(message, cause);
    }
}
