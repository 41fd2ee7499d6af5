package fr.lapetina.multiprovider.infrastructure.http;

import fr.lapetina.multiprovider.domain.model.EndpointAddress;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Transport to a single endpoint: performs one request/response cycle.
 *
 * Implementations apply their own timeouts and must be safe for concurrent use.
 * They report connectivity problems as {@link IOException} (blocking) or as a future
 * completed exceptionally with one (async), and return any HTTP status as a response.
 */
public interface EndpointClient extends AutoCloseable {

    /**
     * The address this client talks to.
     */
    EndpointAddress address();

    /**
     * Performs the exchange on the calling thread.
     */
    EndpointResponse execute(EndpointRequest request) throws IOException;

    /**
     * Performs the exchange without blocking the calling thread.
     */
    CompletableFuture<EndpointResponse> executeAsync(EndpointRequest request);

    @Override
    default void close() {
        // Default no-op
    }
}
