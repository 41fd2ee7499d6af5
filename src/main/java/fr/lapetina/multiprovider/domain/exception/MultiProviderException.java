package fr.lapetina.multiprovider.domain.exception;

/**
 * Base class of every error raised by the library.
 */
public class MultiProviderException extends RuntimeException {

    public MultiProviderException(String message) {
        super(message);
    }

    public MultiProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
