package fr.lapetina.multiprovider.infrastructure.metrics;

import fr.lapetina.multiprovider.domain.model.CallStatus;
import fr.lapetina.multiprovider.domain.model.EndpointIdentity;
import fr.lapetina.multiprovider.domain.model.MetricLabels;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics sink backed by Micrometer.
 *
 * Provides:
 * - RPC request counter per method, result and JSON-RPC error code
 * - HTTP request counter per batch flag, response code and result
 * - Request/response payload size and batch size distributions
 * - Response latency timer
 * - Prometheus exposition when the sink owns its registry
 *
 * All meters carry the endpoint identity tags: network, layer, chain_id, provider.
 */
public final class MicrometerMetricsSink implements MetricsSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsSink.class);

    private final MeterRegistry registry;
    private final String prefix;
    private final boolean ownsRegistry;

    // Cache for dynamic meters
    private final ConcurrentHashMap<MetricLabels, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> httpRequestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<EndpointIdentity, DistributionSummary> requestPayloads = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<EndpointIdentity, DistributionSummary> responsePayloads = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<EndpointIdentity, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<EndpointIdentity, DistributionSummary> batchSizes = new ConcurrentHashMap<>();

    /**
     * Creates a sink that publishes to a registry owned by the caller.
     */
    public MicrometerMetricsSink(MeterRegistry registry, String prefix) {
        this(registry, prefix, false);
    }

    /**
     * Creates a sink with its own Prometheus registry, JVM metrics included.
     */
    public MicrometerMetricsSink(String prefix) {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), prefix, true);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
    }

    private MicrometerMetricsSink(MeterRegistry registry, String prefix, boolean ownsRegistry) {
        this.registry = registry;
        this.prefix = prefix;
        this.ownsRegistry = ownsRegistry;
        log.info("MicrometerMetricsSink initialized with prefix: {}", prefix);
    }

    @Override
    public void incrementRequest(MetricLabels labels) {
        requestCounters.computeIfAbsent(labels, k ->
                Counter.builder(prefix + "_rpc_request")
                        .description("Total number of RPC requests")
                        .tags(Tags.of(
                                "network", labels.network(),
                                "layer", labels.layer(),
                                "chain_id", labels.chainId(),
                                "provider", labels.provider(),
                                "method", labels.method(),
                                "result", labels.result(),
                                "rpc_error_code", labels.errorCode()))
                        .register(registry)
        ).increment();
    }

    @Override
    public void incrementHttpRequest(EndpointIdentity identity, boolean batched, String responseCode, CallStatus status) {
        String code = responseCode != null ? responseCode : "";
        String key = identity + ":" + batched + ":" + code + ":" + status.name();
        httpRequestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_http_rpc_requests")
                        .description("Total HTTP requests sent to providers")
                        .tags(identityTags(identity))
                        .tag("batched", String.valueOf(batched))
                        .tag("response_code", code)
                        .tag("result", status.label())
                        .register(registry)
        ).increment();
    }

    @Override
    public void observeRequestPayload(EndpointIdentity identity, long bytes) {
        requestPayloads.computeIfAbsent(identity, k ->
                DistributionSummary.builder(prefix + "_http_rpc_request_payload_bytes")
                        .description("Distribution of request payload sizes")
                        .baseUnit("bytes")
                        .tags(identityTags(identity))
                        .register(registry)
        ).record(bytes);
    }

    @Override
    public void observeResponsePayload(EndpointIdentity identity, long bytes) {
        responsePayloads.computeIfAbsent(identity, k ->
                DistributionSummary.builder(prefix + "_http_rpc_response_payload_bytes")
                        .description("Distribution of response payload sizes")
                        .baseUnit("bytes")
                        .tags(identityTags(identity))
                        .register(registry)
        ).record(bytes);
    }

    @Override
    public void observeLatency(EndpointIdentity identity, Duration elapsed) {
        latencyTimers.computeIfAbsent(identity, k ->
                Timer.builder(prefix + "_http_rpc_response")
                        .description("Distribution of provider response times")
                        .tags(identityTags(identity))
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(elapsed);
    }

    @Override
    public void observeBatchSize(EndpointIdentity identity, int size) {
        batchSizes.computeIfAbsent(identity, k ->
                DistributionSummary.builder(prefix + "_http_rpc_batch_size")
                        .description("Distribution of JSON-RPC calls per HTTP request")
                        .tags(identityTags(identity))
                        .register(registry)
        ).record(size);
    }

    private static Tags identityTags(EndpointIdentity identity) {
        return Tags.of(
                "network", identity.network(),
                "layer", identity.layer().label(),
                "chain_id", identity.chainId(),
                "provider", identity.provider());
    }

    /**
     * Returns the Prometheus scrape output, or an empty string when the registry is not a Prometheus one.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry) {
            return ((PrometheusMeterRegistry) registry).scrape();
        }
        return "";
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        if (ownsRegistry) {
            registry.close();
        }
    }
}
