package fr.lapetina.multiprovider.infrastructure.session;

import fr.lapetina.multiprovider.domain.exception.ProviderInitializationException;
import fr.lapetina.multiprovider.domain.model.EndpointIdentity;
import fr.lapetina.multiprovider.domain.model.Layer;
import fr.lapetina.multiprovider.infrastructure.http.EndpointClient;

/**
 * Resolves the metric identity of an endpoint while its client is being built.
 */
@FunctionalInterface
public interface EndpointIdentityResolver {

    /**
     * @throws ProviderInitializationException if the identity cannot be determined
     */
    EndpointIdentity resolve(EndpointClient client, Layer layer);

    /**
     * Resolver that never touches the network and labels every endpoint with the given chain.
     *
     * @param chainId decimal chain id, may be empty
     * @param network network name; looked up in {@code registry} when null
     */
    static EndpointIdentityResolver fixed(String chainId, String network, ChainRegistry registry) {
        String resolvedNetwork = network != null ? network : registry.networkOf(chainId);
        return (client, layer) -> new EndpointIdentity(resolvedNetwork, layer, chainId, client.address().getLabel());
    }
}
