package fr.lapetina.multiprovider.domain.exception;

/**
 * Thrown while building an endpoint client when its identity probe fails.
 */
public final class ProviderInitializationException extends MultiProviderException {

    public ProviderInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
