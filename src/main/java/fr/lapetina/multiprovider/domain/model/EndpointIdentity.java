package fr.lapetina.multiprovider.domain.model;

import java.util.Objects;

/**
 * Metric identity of one endpoint, resolved once while the endpoint's client is built.
 * Immutable and thread-safe.
 *
 * @param network  network name ({@code ethereum}, {@code sepolia}, ... or {@code unknown})
 * @param layer    protocol layer
 * @param chainId  chain id as a decimal string, empty when not known
 * @param provider normalized endpoint label
 */
public record EndpointIdentity(
        String network,
        Layer layer,
        String chainId,
        String provider
) {
    public EndpointIdentity {
        Objects.requireNonNull(layer, "Layer is required");
        Objects.requireNonNull(provider, "Provider is required");
        network = network != null ? network : "unknown";
        chainId = chainId != null ? chainId : "";
    }

    /**
     * Builds the labels of a request counter observation for this endpoint.
     */
    public MetricLabels labels(String method, CallStatus status, String errorCode) {
        return new MetricLabels(network, layer.label(), chainId, provider, method, status.label(), errorCode);
    }
}
