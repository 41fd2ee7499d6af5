package fr.lapetina.multiprovider.infrastructure.session;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.multiprovider.domain.exception.EndpointTransportException;
import fr.lapetina.multiprovider.domain.exception.ProviderInitializationException;
import fr.lapetina.multiprovider.domain.model.EndpointAddress;
import fr.lapetina.multiprovider.domain.model.EndpointIdentity;
import fr.lapetina.multiprovider.domain.model.Layer;
import fr.lapetina.multiprovider.domain.model.RpcRequest;
import fr.lapetina.multiprovider.infrastructure.http.EndpointClient;
import fr.lapetina.multiprovider.infrastructure.http.EndpointResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Resolves an endpoint's chain by asking the endpoint itself.
 *
 * Execution layer: {@code eth_chainId}, hex quantity in {@code result}.
 * Consensus layer: {@code GET /eth/v1/config/deposit_contract}, decimal {@code data.chain_id}.
 */
public final class ProbingIdentityResolver implements EndpointIdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(ProbingIdentityResolver.class);

    static final String CHAIN_ID_METHOD = "eth_chainId";
    static final String DEPOSIT_CONTRACT_PATH = "/eth/v1/config/deposit_contract";

    private final RequestCodec codec;
    private final ChainRegistry registry;

    public ProbingIdentityResolver(RequestCodec codec, ChainRegistry registry) {
        this.codec = codec;
        this.registry = registry;
    }

    @Override
    public EndpointIdentity resolve(EndpointClient client, Layer layer) {
        EndpointAddress address = client.address();
        RpcRequest probe = layer == Layer.EXECUTION
                ? RpcRequest.jsonRpc(CHAIN_ID_METHOD, null)
                : RpcRequest.get(DEPOSIT_CONTRACT_PATH);
        try {
            EndpointResponse response = client.execute(codec.encode(probe));
            if (!response.isSuccessful()) {
                throw new ProviderInitializationException(
                        "Chain id probe failed with HTTP " + response.statusCode() + " for provider " + address.getLabel(), null);
            }
            JsonNode body = codec.decode(probe, address.getLabel(), response);
            String chainId = layer == Layer.EXECUTION ? executionChainId(body) : consensusChainId(body);

            EndpointIdentity identity = new EndpointIdentity(registry.networkOf(chainId), layer, chainId, address.getLabel());
            log.info("Resolved provider identity: provider={}, layer={}, chainId={}, network={}",
                    identity.provider(), layer.label(), chainId, identity.network());
            return identity;
        } catch (IOException e) {
            throw new ProviderInitializationException(
                    "Chain id probe failed for provider " + address.getLabel() + ": " + address.redact(e.getMessage()),
                    address.redact(e));
        } catch (EndpointTransportException e) {
            throw new ProviderInitializationException("Chain id probe failed: " + e.getMessage(), e);
        }
    }

    private String executionChainId(JsonNode body) {
        JsonNode result = body.path("result");
        if (!result.isTextual()) {
            throw new ProviderInitializationException("eth_chainId returned no result", null);
        }
        return parseQuantity(result.asText());
    }

    private String consensusChainId(JsonNode body) {
        JsonNode chainId = body.path("data").path("chain_id");
        if (chainId.isMissingNode() || chainId.isNull()) {
            throw new ProviderInitializationException("deposit_contract returned no chain_id", null);
        }
        return parseQuantity(chainId.asText());
    }

    /**
     * Parses a hex ({@code 0x}-prefixed) or decimal quantity into a decimal string.
     */
    static String parseQuantity(String value) {
        try {
            if (value.startsWith("0x") || value.startsWith("0X")) {
                return new BigInteger(value.substring(2), 16).toString();
            }
            return new BigInteger(value).toString();
        } catch (NumberFormatException e) {
            throw new ProviderInitializationException("Invalid chain id: " + value, e);
        }
    }
}
