package fr.lapetina.multiprovider;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.multiprovider.domain.model.EndpointAddress;
import fr.lapetina.multiprovider.domain.model.Layer;
import fr.lapetina.multiprovider.domain.policy.PolicyFactory;
import fr.lapetina.multiprovider.domain.policy.SelectionPolicy;
import fr.lapetina.multiprovider.failover.FailoverProvider;
import fr.lapetina.multiprovider.infrastructure.classify.PathTemplateClassifier;
import fr.lapetina.multiprovider.infrastructure.config.ConfigLoader;
import fr.lapetina.multiprovider.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.multiprovider.infrastructure.config.MultiProviderConfig;
import fr.lapetina.multiprovider.infrastructure.http.EndpointClient;
import fr.lapetina.multiprovider.infrastructure.http.HttpEndpointClient;
import fr.lapetina.multiprovider.infrastructure.metrics.MetricsSink;
import fr.lapetina.multiprovider.infrastructure.metrics.MicrometerMetricsSink;
import fr.lapetina.multiprovider.infrastructure.session.ChainRegistry;
import fr.lapetina.multiprovider.infrastructure.session.EndpointIdentityResolver;
import fr.lapetina.multiprovider.infrastructure.session.ProbingIdentityResolver;
import fr.lapetina.multiprovider.infrastructure.session.RequestCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Factory for creating fully-wired provider pools from configuration.
 * This is the primary entry point for obtaining configured FailoverProviders.
 *
 * <p>Usage:
 * <pre>{@code
 * try (MultiProviderFactory factory = MultiProviderFactory.create("multi-provider.yaml")) {
 *     FailoverProvider execution = factory.getProvider("execution");
 *     // use provider...
 * }
 * }</pre>
 */
public class MultiProviderFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MultiProviderFactory.class);

    private final MultiProviderConfig config;
    private final MetricsSink metricsSink;
    private final ChainRegistry chainRegistry;
    private final Map<String, FailoverProvider> providers = new LinkedHashMap<>();

    protected MultiProviderFactory(String configPath, Function<EndpointAddress, EndpointClient> clientFactoryOverride) {
        log.info("Initializing MultiProviderFactory from config: {}", configPath);

        // Load configuration
        this.config = new ConfigLoader(configPath).load();

        // Initialize metrics
        this.metricsSink = config.getMetrics().isEnabled()
                ? new MicrometerMetricsSink(config.getMetrics().getPrefix())
                : MetricsSink.noop();
        this.chainRegistry = ChainRegistry.withOverrides(networkOverrides());

        // Initialize transport (allow override for testing)
        Function<EndpointAddress, EndpointClient> clientFactory =
                clientFactoryOverride != null ? clientFactoryOverride : createClientFactory();

        ObjectMapper objectMapper = new ObjectMapper();
        PathTemplateClassifier pathClassifier = new PathTemplateClassifier();
        EndpointIdentityResolver identityResolver = createIdentityResolver(new RequestCodec(objectMapper));

        try {
            for (MultiProviderConfig.ProviderConfig providerConfig : config.getProviders()) {
                if (providerConfig.getName() == null || providerConfig.getName().isBlank()) {
                    throw new ConfigurationException("Provider name is required");
                }
                FailoverProvider provider = FailoverProvider.builder()
                        .name(providerConfig.getName())
                        .layer(parseLayer(providerConfig))
                        .endpoints(providerConfig.getEndpoints())
                        .policy(createPolicy(providerConfig))
                        .metricsSink(metricsSink)
                        .clientFactory(clientFactory)
                        .identityResolver(identityResolver)
                        .objectMapper(objectMapper)
                        .pathClassifier(pathClassifier)
                        .chainRegistry(chainRegistry)
                        .build();
                if (providers.putIfAbsent(provider.getName(), provider) != null) {
                    provider.close();
                    throw new ConfigurationException("Duplicate provider name: " + provider.getName());
                }
            }
        } catch (RuntimeException e) {
            close();
            throw e;
        }

        log.info("MultiProviderFactory initialized with {} providers", providers.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static MultiProviderFactory create(String configPath) {
        return new MultiProviderFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (multi-provider.yaml).
     */
    public static MultiProviderFactory create() {
        return create("multi-provider.yaml");
    }

    /**
     * Returns the provider pool with the given configured name.
     *
     * @throws IllegalArgumentException if no pool has that name
     */
    public FailoverProvider getProvider(String name) {
        FailoverProvider provider = providers.get(name);
        if (provider == null) {
            throw new IllegalArgumentException("Unknown provider: " + name);
        }
        return provider;
    }

    public Optional<FailoverProvider> findProvider(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    public Collection<FailoverProvider> getProviders() {
        return providers.values();
    }

    public MetricsSink getMetricsSink() {
        return metricsSink;
    }

    public ChainRegistry getChainRegistry() {
        return chainRegistry;
    }

    public MultiProviderConfig getConfig() {
        return config;
    }

    private Function<EndpointAddress, EndpointClient> createClientFactory() {
        HttpClient httpClient = HttpEndpointClient.newSharedClient(
                Duration.ofMillis(config.getHttp().getConnectTimeoutMs()));
        Duration requestTimeout = Duration.ofMillis(config.getHttp().getRequestTimeoutMs());
        return address -> new HttpEndpointClient(address, httpClient, requestTimeout);
    }

    private EndpointIdentityResolver createIdentityResolver(RequestCodec codec) {
        MultiProviderConfig.IdentityConfig identity = config.getIdentity();
        if (identity.isProbe()) {
            return new ProbingIdentityResolver(codec, chainRegistry);
        }
        log.info("Identity probing disabled: chainId={}, network={}", identity.getChainId(), identity.getNetwork());
        return EndpointIdentityResolver.fixed(identity.getChainId(), identity.getNetwork(), chainRegistry);
    }

    private Map<String, String> networkOverrides() {
        Map<String, String> overrides = new LinkedHashMap<>();
        for (MultiProviderConfig.NetworkConfig network : config.getMetrics().getNetworks()) {
            overrides.put(network.getChainId(), network.getName());
        }
        return overrides;
    }

    private static SelectionPolicy createPolicy(MultiProviderConfig.ProviderConfig providerConfig) {
        return PolicyFactory.create(providerConfig.getPolicy())
                .orElseThrow(() -> new ConfigurationException(
                        "Unknown policy '" + providerConfig.getPolicy() + "' for provider " + providerConfig.getName()));
    }

    private static Layer parseLayer(MultiProviderConfig.ProviderConfig providerConfig) {
        try {
            return Layer.fromString(providerConfig.getLayer());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    "Invalid layer '" + providerConfig.getLayer() + "' for provider " + providerConfig.getName(), e);
        }
    }

    @Override
    public void close() {
        log.info("Shutting down MultiProviderFactory...");

        for (FailoverProvider provider : providers.values()) {
            try {
                provider.close();
            } catch (Exception e) {
                log.warn("Error closing provider {}", provider.getName(), e);
            }
        }
        providers.clear();

        if (metricsSink instanceof MicrometerMetricsSink) {
            try {
                ((MicrometerMetricsSink) metricsSink).close();
            } catch (Exception e) {
                log.warn("Error closing metrics sink", e);
            }
        }

        log.info("MultiProviderFactory shut down");
    }
}
