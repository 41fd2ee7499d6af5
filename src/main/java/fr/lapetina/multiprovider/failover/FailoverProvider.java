package fr.lapetina.multiprovider.failover;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.multiprovider.domain.exception.EndpointTransportException;
import fr.lapetina.multiprovider.domain.exception.NoActiveProviderException;
import fr.lapetina.multiprovider.domain.exception.NoProvidersConfiguredException;
import fr.lapetina.multiprovider.domain.model.EndpointAddress;
import fr.lapetina.multiprovider.domain.model.Layer;
import fr.lapetina.multiprovider.domain.model.RpcCall;
import fr.lapetina.multiprovider.domain.model.RpcRequest;
import fr.lapetina.multiprovider.domain.model.RpcResponse;
import fr.lapetina.multiprovider.domain.policy.CandidateSequence;
import fr.lapetina.multiprovider.domain.policy.FallbackPolicy;
import fr.lapetina.multiprovider.domain.policy.RotatingPolicy;
import fr.lapetina.multiprovider.domain.policy.SelectionPolicy;
import fr.lapetina.multiprovider.infrastructure.classify.PathTemplateClassifier;
import fr.lapetina.multiprovider.infrastructure.http.EndpointClient;
import fr.lapetina.multiprovider.infrastructure.http.HttpEndpointClient;
import fr.lapetina.multiprovider.infrastructure.metrics.MetricsSink;
import fr.lapetina.multiprovider.infrastructure.normalize.PoaResponseNormalizer;
import fr.lapetina.multiprovider.infrastructure.normalize.ResponseNormalizer;
import fr.lapetina.multiprovider.infrastructure.session.ChainRegistry;
import fr.lapetina.multiprovider.infrastructure.session.EndpointIdentityResolver;
import fr.lapetina.multiprovider.infrastructure.session.InstrumentedClient;
import fr.lapetina.multiprovider.infrastructure.session.ProbingIdentityResolver;
import fr.lapetina.multiprovider.infrastructure.session.RequestCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Routes each logical call to the endpoints of a fixed pool until one answers.
 *
 * Candidates are tried one at a time in the order given by the {@link SelectionPolicy};
 * at most one attempt per endpoint per call. Only {@link EndpointTransportException}
 * moves on to the next candidate: any other exception is caller misuse and propagates
 * untouched. When every endpoint failed the call fails with
 * {@link NoActiveProviderException} carrying one failure per endpoint.
 *
 * Every successful response passes through the {@link ResponseNormalizer} exactly once.
 *
 * <p>Usage:
 * <pre>{@code
 * FailoverProvider provider = FailoverProvider.rotating(List.of(
 *         "https://eth-mainnet.alchemy.com/v2/KEY",
 *         "https://mainnet.infura.io/v3/KEY"));
 * JsonNode block = provider.call("eth_blockNumber", List.of()).result();
 * }</pre>
 */
public final class FailoverProvider implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FailoverProvider.class);

    private final String name;
    private final Layer layer;
    private final List<InstrumentedClient> pool;
    private final SelectionPolicy policy;
    private final ResponseNormalizer normalizer;

    public FailoverProvider(String name, Layer layer, List<InstrumentedClient> pool,
                            SelectionPolicy policy, ResponseNormalizer normalizer) {
        this.name = Objects.requireNonNull(name, "Name is required");
        this.layer = Objects.requireNonNull(layer, "Layer is required");
        this.pool = List.copyOf(pool);
        this.policy = Objects.requireNonNull(policy, "Selection policy is required");
        this.normalizer = Objects.requireNonNull(normalizer, "Response normalizer is required");
        log.info("FailoverProvider created: name={}, layer={}, policy={}, providers={}",
                name, layer.label(), policy.getName(), pool.stream().map(InstrumentedClient::provider).toList());
    }

    /**
     * Creates a provider over the given execution-layer addresses with the rotating policy
     * and default collaborators. Probes every endpoint for its chain id.
     */
    public static FailoverProvider rotating(List<String> endpoints) {
        return builder().endpoints(endpoints).policy(new RotatingPolicy()).build();
    }

    /**
     * Creates a provider over the given execution-layer addresses with the fallback policy
     * and default collaborators. Probes every endpoint for its chain id.
     */
    public static FailoverProvider fallback(List<String> endpoints) {
        return builder().endpoints(endpoints).policy(new FallbackPolicy()).build();
    }

    /**
     * Sends a request, blocking the calling thread until an endpoint answered or all failed.
     *
     * @throws NoProvidersConfiguredException if the pool is empty
     * @throws NoActiveProviderException      if every endpoint failed
     */
    public RpcResponse send(RpcRequest request) {
        Objects.requireNonNull(request, "Request is required");
        if (pool.isEmpty()) {
            throw new NoProvidersConfiguredException();
        }

        CandidateSequence<InstrumentedClient> candidates = policy.candidates(pool);
        List<EndpointTransportException> failures = new ArrayList<>(pool.size());
        while (candidates.hasNext()) {
            InstrumentedClient candidate = candidates.next();
            try {
                RpcResponse response = candidate.send(request);
                logSent(candidate, request);
                return normalizer.normalize(response);
            } catch (EndpointTransportException e) {
                candidates.recordFailure();
                failures.add(e);
                logFailure(candidate, e);
            }
        }
        throw new NoActiveProviderException(failures);
    }

    /**
     * Sends a request without blocking. Candidates are still tried one after the other;
     * cancelling the returned future stops the remaining candidates.
     */
    public CompletableFuture<RpcResponse> sendAsync(RpcRequest request) {
        Objects.requireNonNull(request, "Request is required");
        CompletableFuture<RpcResponse> result = new CompletableFuture<>();
        if (pool.isEmpty()) {
            result.completeExceptionally(new NoProvidersConfiguredException());
            return result;
        }
        attempt(request, policy.candidates(pool), new ArrayList<>(pool.size()), result);
        return result;
    }

    private void attempt(RpcRequest request, CandidateSequence<InstrumentedClient> candidates,
                         List<EndpointTransportException> failures, CompletableFuture<RpcResponse> result) {
        if (result.isDone()) {
            return;
        }
        if (!candidates.hasNext()) {
            result.completeExceptionally(new NoActiveProviderException(failures));
            return;
        }

        InstrumentedClient candidate = candidates.next();
        CompletableFuture<RpcResponse> exchange;
        try {
            exchange = candidate.sendAsync(request);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }

        exchange.whenComplete((response, error) -> {
            if (error == null) {
                logSent(candidate, request);
                try {
                    result.complete(normalizer.normalize(response));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
                return;
            }

            Throwable cause = unwrap(error);
            if (cause instanceof EndpointTransportException) {
                EndpointTransportException failure = (EndpointTransportException) cause;
                candidates.recordFailure();
                failures.add(failure);
                logFailure(candidate, failure);
                attempt(request, candidates, failures, result);
            } else {
                result.completeExceptionally(cause);
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void logSent(InstrumentedClient candidate, RpcRequest request) {
        if (log.isDebugEnabled()) {
            log.debug("Send request: pool={}, provider={}, method={}, params={}",
                    name, candidate.provider(), request.target(),
                    request.isBatch() ? request.methods() : request.params());
        }
    }

    private void logFailure(InstrumentedClient candidate, EndpointTransportException e) {
        log.warn("Provider not responding: pool={}, provider={}, error={}",
                name, candidate.provider(), candidate.address().redact(e.getMessage()));
    }

    /**
     * Calls a single JSON-RPC method.
     */
    public RpcResponse call(String method, Object params) {
        return send(RpcRequest.jsonRpc(method, params));
    }

    public CompletableFuture<RpcResponse> callAsync(String method, Object params) {
        return sendAsync(RpcRequest.jsonRpc(method, params));
    }

    /**
     * Sends a JSON-RPC batch; only a failure of the whole exchange moves to the next endpoint.
     */
    public RpcResponse batch(List<RpcCall> calls) {
        return send(RpcRequest.batch(calls));
    }

    public CompletableFuture<RpcResponse> batchAsync(List<RpcCall> calls) {
        return sendAsync(RpcRequest.batch(calls));
    }

    /**
     * Sends a REST GET request (consensus layer).
     */
    public RpcResponse get(String path) {
        return send(RpcRequest.get(path));
    }

    public RpcResponse get(String path, Map<String, String> query) {
        return send(RpcRequest.get(path, query));
    }

    /**
     * Sends a REST POST request with a JSON body (consensus layer).
     */
    public RpcResponse post(String path, Object body) {
        return send(RpcRequest.post(path, body));
    }

    public String getName() {
        return name;
    }

    public Layer getLayer() {
        return layer;
    }

    public SelectionPolicy getPolicy() {
        return policy;
    }

    /**
     * Endpoints of the pool in configured order.
     */
    public List<InstrumentedClient> getPool() {
        return pool;
    }

    @Override
    public void close() {
        for (InstrumentedClient client : pool) {
            try {
                client.close();
            } catch (RuntimeException e) {
                log.warn("Error closing provider client: provider={}", client.provider(), e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FailoverProvider.
     *
     * All addresses are validated before any endpoint is contacted, so a bad scheme
     * fails construction without network activity.
     */
    public static class Builder {
        private String name = "default";
        private Layer layer = Layer.EXECUTION;
        private List<String> endpoints = List.of();
        private SelectionPolicy policy;
        private ResponseNormalizer normalizer;
        private MetricsSink metricsSink = MetricsSink.noop();
        private Function<EndpointAddress, EndpointClient> clientFactory;
        private EndpointIdentityResolver identityResolver;
        private ObjectMapper objectMapper;
        private PathTemplateClassifier pathClassifier;
        private ChainRegistry chainRegistry = ChainRegistry.defaults();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder layer(Layer layer) {
            this.layer = layer;
            return this;
        }

        public Builder endpoints(List<String> endpoints) {
            this.endpoints = List.copyOf(endpoints);
            return this;
        }

        public Builder policy(SelectionPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder normalizer(ResponseNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder metricsSink(MetricsSink metricsSink) {
            this.metricsSink = metricsSink;
            return this;
        }

        /**
         * Transport factory, one client per endpoint. Defaults to {@link HttpEndpointClient}.
         */
        public Builder clientFactory(Function<EndpointAddress, EndpointClient> clientFactory) {
            this.clientFactory = clientFactory;
            return this;
        }

        public Builder identityResolver(EndpointIdentityResolver identityResolver) {
            this.identityResolver = identityResolver;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder pathClassifier(PathTemplateClassifier pathClassifier) {
            this.pathClassifier = pathClassifier;
            return this;
        }

        public Builder chainRegistry(ChainRegistry chainRegistry) {
            this.chainRegistry = chainRegistry;
            return this;
        }

        public FailoverProvider build() {
            Objects.requireNonNull(layer, "Layer is required");

            List<EndpointAddress> addresses = new ArrayList<>(endpoints.size());
            for (String endpoint : endpoints) {
                addresses.add(EndpointAddress.parse(endpoint));
            }

            if (policy == null) {
                policy = new RotatingPolicy();
            }
            if (normalizer == null) {
                normalizer = layer == Layer.EXECUTION ? new PoaResponseNormalizer() : ResponseNormalizer.identity();
            }
            if (objectMapper == null) {
                objectMapper = new ObjectMapper();
            }
            if (pathClassifier == null) {
                pathClassifier = new PathTemplateClassifier();
            }
            RequestCodec codec = new RequestCodec(objectMapper);
            if (identityResolver == null) {
                identityResolver = new ProbingIdentityResolver(codec, chainRegistry);
            }
            if (clientFactory == null) {
                HttpClient httpClient = HttpEndpointClient.newSharedClient(Duration.ofSeconds(10));
                clientFactory = address -> new HttpEndpointClient(address, httpClient, Duration.ofSeconds(30));
            }

            List<InstrumentedClient> pool = new ArrayList<>(addresses.size());
            try {
                for (EndpointAddress address : addresses) {
                    EndpointClient client = clientFactory.apply(address);
                    try {
                        pool.add(InstrumentedClient.builder(client)
                                .layer(layer)
                                .metricsSink(metricsSink)
                                .codec(codec)
                                .pathClassifier(pathClassifier)
                                .identityResolver(identityResolver)
                                .build());
                    } catch (RuntimeException e) {
                        client.close();
                        throw e;
                    }
                }
            } catch (RuntimeException e) {
                pool.forEach(InstrumentedClient::close);
                throw e;
            }
            return new FailoverProvider(name, layer, pool, policy, normalizer);
        }
    }
}
