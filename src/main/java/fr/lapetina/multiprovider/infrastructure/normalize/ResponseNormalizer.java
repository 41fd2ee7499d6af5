package fr.lapetina.multiprovider.infrastructure.normalize;

import fr.lapetina.multiprovider.domain.model.RpcResponse;

/**
 * Rewrites a successful response before the caller sees it.
 *
 * Called exactly once per successful logical call, by the failover engine. Must be
 * thread-safe and idempotent.
 */
@FunctionalInterface
public interface ResponseNormalizer {

    RpcResponse normalize(RpcResponse response);

    /**
     * Normalizer returning responses unchanged.
     */
    static ResponseNormalizer identity() {
        return response -> response;
    }
}
