package fr.lapetina.multiprovider.domain.model;

import java.util.Locale;

/**
 * Protocol layer served by an endpoint.
 *
 * EXECUTION: JSON-RPC over HTTP (eth_* methods)
 * CONSENSUS: Beacon REST API
 */
public enum Layer {
    EXECUTION("el"),
    CONSENSUS("cl");

    private final String label;

    Layer(String label) {
        this.label = label;
    }

    /**
     * Short value used as the {@code layer} metric tag.
     */
    public String label() {
        return label;
    }

    /**
     * Parses a configuration value: accepts the enum name or the short label.
     */
    public static Layer fromString(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Layer layer : values()) {
            if (layer.label.equals(normalized) || layer.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return layer;
            }
        }
        throw new IllegalArgumentException("Unknown layer: " + value);
    }
}
