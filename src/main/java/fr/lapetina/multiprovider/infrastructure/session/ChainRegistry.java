package fr.lapetina.multiprovider.infrastructure.session;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps chain ids to the network names used in metric tags.
 * Immutable and thread-safe.
 */
public final class ChainRegistry {

    public static final String UNKNOWN_NETWORK = "unknown";

    private static final Map<String, String> DEFAULT_NETWORKS;

    static {
        Map<String, String> networks = new LinkedHashMap<>();
        networks.put("1", "ethereum");
        networks.put("10", "optimism");
        networks.put("137", "polygon");
        networks.put("42161", "arbitrum");
        networks.put("100", "gnosis");
        networks.put("10200", "chiado");
        networks.put("11155111", "sepolia");
        networks.put("560048", "hoodi");
        networks.put("17000", "holesky");
        DEFAULT_NETWORKS = Map.copyOf(networks);
    }

    private final Map<String, String> networks;

    private ChainRegistry(Map<String, String> networks) {
        this.networks = Map.copyOf(networks);
    }

    /**
     * Registry of the well-known public networks.
     */
    public static ChainRegistry defaults() {
        return new ChainRegistry(DEFAULT_NETWORKS);
    }

    /**
     * Default networks overlaid with the given entries; an entry replaces the default of the same chain id.
     */
    public static ChainRegistry withOverrides(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(DEFAULT_NETWORKS);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return new ChainRegistry(merged);
    }

    /**
     * Returns the network name of a decimal chain id, or {@value #UNKNOWN_NETWORK}.
     */
    public String networkOf(String chainId) {
        if (chainId == null) {
            return UNKNOWN_NETWORK;
        }
        return networks.getOrDefault(chainId, UNKNOWN_NETWORK);
    }

    public Map<String, String> getNetworks() {
        return networks;
    }
}
