package fr.lapetina.multiprovider.domain.exception;

/**
 * Thrown at pool construction when an endpoint address uses a scheme other than http or https.
 */
public final class ProtocolNotSupportedException extends MultiProviderException {

    private final String protocol;

    public ProtocolNotSupportedException(String protocol) {
        super("Protocol \"" + protocol + "\" is not supported.");
        this.protocol = protocol;
    }

    public String getProtocol() {
        return protocol;
    }
}
