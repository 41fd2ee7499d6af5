package fr.lapetina.multiprovider.domain.exception;

/**
 * Thrown when one endpoint could not deliver a usable response: connection failure,
 * I/O error, timeout, error status or undecodable body.
 *
 * This is the only exception class the failover engine catches to move on to the
 * next endpoint. The message never contains the endpoint address.
 */
public class EndpointTransportException extends MultiProviderException {

    private final String provider;

    public EndpointTransportException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public EndpointTransportException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    /**
     * Normalized label of the endpoint that failed.
     */
    public String getProvider() {
        return provider;
    }
}
