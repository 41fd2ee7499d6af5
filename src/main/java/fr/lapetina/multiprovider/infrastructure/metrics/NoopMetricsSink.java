package fr.lapetina.multiprovider.infrastructure.metrics;

import fr.lapetina.multiprovider.domain.model.CallStatus;
import fr.lapetina.multiprovider.domain.model.EndpointIdentity;
import fr.lapetina.multiprovider.domain.model.MetricLabels;

import java.time.Duration;

/**
 * Sink used when metrics are disabled.
 */
final class NoopMetricsSink implements MetricsSink {

    static final NoopMetricsSink INSTANCE = new NoopMetricsSink();

    private NoopMetricsSink() {
    }

    @Override
    public void incrementRequest(MetricLabels labels) {
    }

    @Override
    public void incrementHttpRequest(EndpointIdentity identity, boolean batched, String responseCode, CallStatus status) {
    }

    @Override
    public void observeRequestPayload(EndpointIdentity identity, long bytes) {
    }

    @Override
    public void observeResponsePayload(EndpointIdentity identity, long bytes) {
    }

    @Override
    public void observeLatency(EndpointIdentity identity, Duration elapsed) {
    }

    @Override
    public void observeBatchSize(EndpointIdentity identity, int size) {
    }
}
