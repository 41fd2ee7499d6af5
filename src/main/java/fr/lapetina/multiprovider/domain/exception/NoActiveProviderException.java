package fr.lapetina.multiprovider.domain.exception;

import java.util.List;

/**
 * Thrown when every endpoint of a pool failed for one logical call.
 *
 * Carries one failure per endpoint tried, in the order they were tried. The failures
 * are also attached as suppressed exceptions so that stack traces show all of them.
 */
public final class NoActiveProviderException extends MultiProviderException {

    private final List<EndpointTransportException> failures;

    public NoActiveProviderException(List<EndpointTransportException> failures) {
        super("No active provider available.");
        this.failures = List.copyOf(failures);
        for (EndpointTransportException failure : this.failures) {
            addSuppressed(failure);
        }
    }

    public List<EndpointTransportException> getFailures() {
        return failures;
    }
}
