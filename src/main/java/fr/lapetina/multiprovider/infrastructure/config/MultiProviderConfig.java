package fr.lapetina.multiprovider.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the multi-provider.
 * Designed to be populated from YAML.
 */
public class MultiProviderConfig {

    private List<ProviderConfig> providers = new ArrayList<>();
    private HttpConfig http = new HttpConfig();
    private IdentityConfig identity = new IdentityConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public HttpConfig getHttp() { return http; }
    public void setHttp(HttpConfig http) { this.http = http; }

    public IdentityConfig getIdentity() { return identity; }
    public void setIdentity(IdentityConfig identity) { this.identity = identity; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * One named endpoint pool.
     */
    public static class ProviderConfig {
        private String name;
        private String layer = "execution";
        private String policy = "rotating";
        private List<String> endpoints = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getLayer() { return layer; }
        public void setLayer(String layer) { this.layer = layer; }

        public String getPolicy() { return policy; }
        public void setPolicy(String policy) { this.policy = policy; }

        public List<String> getEndpoints() { return endpoints; }
        public void setEndpoints(List<String> endpoints) { this.endpoints = endpoints; }
    }

    /**
     * HTTP transport timeouts.
     */
    public static class HttpConfig {
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 30000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Endpoint identity resolution. When {@code probe} is false every endpoint is
     * labelled with the configured chain id and network.
     */
    public static class IdentityConfig {
        private boolean probe = true;
        private String chainId = "";
        private String network;

        public boolean isProbe() { return probe; }
        public void setProbe(boolean probe) { this.probe = probe; }

        public String getChainId() { return chainId; }
        public void setChainId(String chainId) { this.chainId = chainId; }

        public String getNetwork() { return network; }
        public void setNetwork(String network) { this.network = network; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "web3";
        private List<NetworkConfig> networks = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public List<NetworkConfig> getNetworks() { return networks; }
        public void setNetworks(List<NetworkConfig> networks) { this.networks = networks; }
    }

    /**
     * Additional chain id to network name mapping.
     */
    public static class NetworkConfig {
        private String chainId;
        private String name;

        public String getChainId() { return chainId; }
        public void setChainId(String chainId) { this.chainId = chainId; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }
}
