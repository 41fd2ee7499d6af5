package fr.lapetina.multiprovider.domain.exception;

/**
 * Thrown when a call is issued against a pool built with zero endpoints.
 * Raised before any network activity.
 */
public final class NoProvidersConfiguredException extends MultiProviderException {

    public NoProvidersConfiguredException() {
        super("No providers configured.");
    }
}
