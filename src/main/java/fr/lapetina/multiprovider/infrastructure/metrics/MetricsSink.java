package fr.lapetina.multiprovider.infrastructure.metrics;

import fr.lapetina.multiprovider.domain.model.CallStatus;
import fr.lapetina.multiprovider.domain.model.EndpointIdentity;
import fr.lapetina.multiprovider.domain.model.MetricLabels;

import java.time.Duration;

/**
 * Destination of the observations produced by the instrumentation layer.
 *
 * Implementations must be thread-safe and must not throw: the instrumentation layer
 * drops an observation that fails, it never fails a call because of one.
 */
public interface MetricsSink {

    /**
     * Counts one RPC request (one per JSON-RPC method of a batch).
     */
    void incrementRequest(MetricLabels labels);

    /**
     * Counts one HTTP exchange.
     *
     * @param responseCode HTTP status code, empty when no response was received
     */
    void incrementHttpRequest(EndpointIdentity identity, boolean batched, String responseCode, CallStatus status);

    void observeRequestPayload(EndpointIdentity identity, long bytes);

    void observeResponsePayload(EndpointIdentity identity, long bytes);

    void observeLatency(EndpointIdentity identity, Duration elapsed);

    void observeBatchSize(EndpointIdentity identity, int size);

    /**
     * Returns a sink that discards every observation.
     */
    static MetricsSink noop() {
        return NoopMetricsSink.INSTANCE;
    }
}
