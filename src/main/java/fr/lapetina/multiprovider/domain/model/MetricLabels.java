package fr.lapetina.multiprovider.domain.model;

/**
 * Label set of one request counter observation. Computed per call, never stored.
 * A dimension that could not be classified is carried as an empty string.
 */
public record MetricLabels(
        String network,
        String layer,
        String chainId,
        String provider,
        String method,
        String result,
        String errorCode
) {
    public MetricLabels {
        network = valueOrEmpty(network);
        layer = valueOrEmpty(layer);
        chainId = valueOrEmpty(chainId);
        provider = valueOrEmpty(provider);
        method = valueOrEmpty(method);
        result = valueOrEmpty(result);
        errorCode = valueOrEmpty(errorCode);
    }

    private static String valueOrEmpty(String value) {
        return value != null ? value : "";
    }
}
