package fr.lapetina.multiprovider.infrastructure.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.multiprovider.domain.exception.EndpointStatusException;
import fr.lapetina.multiprovider.domain.exception.EndpointTransportException;
import fr.lapetina.multiprovider.domain.model.CallStatus;
import fr.lapetina.multiprovider.domain.model.EndpointAddress;
import fr.lapetina.multiprovider.domain.model.EndpointIdentity;
import fr.lapetina.multiprovider.domain.model.Layer;
import fr.lapetina.multiprovider.domain.model.RpcRequest;
import fr.lapetina.multiprovider.domain.model.RpcResponse;
import fr.lapetina.multiprovider.infrastructure.classify.JsonRpcMethodExtractor;
import fr.lapetina.multiprovider.infrastructure.classify.PathTemplateClassifier;
import fr.lapetina.multiprovider.infrastructure.http.EndpointClient;
import fr.lapetina.multiprovider.infrastructure.http.EndpointRequest;
import fr.lapetina.multiprovider.infrastructure.http.EndpointResponse;
import fr.lapetina.multiprovider.infrastructure.metrics.MetricsSink;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * One endpoint of a pool: runs a request/response cycle and records its observations.
 *
 * Every invocation emits exactly one set of observations, whatever the outcome:
 * latency, request payload size, one request counter increment per method label and
 * one HTTP request counter increment; plus the response payload size when a response
 * was received and the batch size for batches.
 *
 * Connectivity failures, non-2xx statuses and undecodable bodies surface as
 * {@link EndpointTransportException} whose message never contains the endpoint
 * address. A JSON-RPC {@code error} member is not a transport failure: the response
 * is returned and counted as {@code fail} with the error code.
 */
public final class InstrumentedClient implements AutoCloseable {

    private final EndpointClient client;
    private final EndpointIdentity identity;
    private final MetricsSink metricsSink;
    private final RequestCodec codec;
    private final JsonRpcMethodExtractor methodExtractor;
    private final PathTemplateClassifier pathClassifier;

    private InstrumentedClient(Builder builder, EndpointIdentity identity) {
        this.client = builder.client;
        this.identity = identity;
        this.metricsSink = builder.metricsSink;
        this.codec = builder.codec;
        this.methodExtractor = new JsonRpcMethodExtractor(builder.codec.getObjectMapper());
        this.pathClassifier = builder.pathClassifier;
    }

    /**
     * Runs the request on the calling thread.
     *
     * @throws EndpointTransportException if this endpoint could not deliver a usable response
     */
    public RpcResponse send(RpcRequest request) {
        EndpointRequest encoded = codec.encode(request);
        CallObservation observation = observe(request, encoded);
        try {
            observation.start();
            EndpointResponse response = client.execute(encoded);
            return complete(request, response, observation);
        } catch (IOException e) {
            throw transportFailure(e);
        } finally {
            observation.emit(metricsSink);
        }
    }

    /**
     * Runs the request without blocking the calling thread.
     * The returned future fails with {@link EndpointTransportException} for transport problems.
     */
    public CompletableFuture<RpcResponse> sendAsync(RpcRequest request) {
        EndpointRequest encoded = codec.encode(request);
        CallObservation observation = observe(request, encoded);

        CompletableFuture<EndpointResponse> exchange;
        try {
            observation.start();
            exchange = client.executeAsync(encoded);
        } catch (RuntimeException e) {
            observation.emit(metricsSink);
            throw e;
        }

        return exchange.handle((response, error) -> {
            try {
                if (error != null) {
                    throw asRuntime(unwrap(error));
                }
                return complete(request, response, observation);
            } finally {
                observation.emit(metricsSink);
            }
        });
    }

    private CallObservation observe(RpcRequest request, EndpointRequest encoded) {
        List<String> methods;
        if (request.kind().isJsonRpc()) {
            methods = methodExtractor.extract(encoded.body());
        } else {
            methods = List.of(pathClassifier.classify(request.target()).orElse(""));
        }
        return new CallObservation(identity, methods, request.isBatch(), encoded.body().length);
    }

    private RpcResponse complete(RpcRequest request, EndpointResponse response, CallObservation observation) {
        observation.responseReceived(response.statusCode(), response.payloadSize());
        if (!response.isSuccessful()) {
            throw new EndpointStatusException(identity.provider(), response.statusCode());
        }

        JsonNode body = codec.decode(request, identity.provider(), response);
        observation.httpSucceeded();
        recordOutcomes(request, body, observation);
        return new RpcResponse(request, body, response.statusCode(), identity.provider());
    }

    private static void recordOutcomes(RpcRequest request, JsonNode body, CallObservation observation) {
        if (!request.isBatch()) {
            boolean failed = request.kind().isJsonRpc() && body.has("error");
            observation.outcome(0, failed ? CallStatus.FAIL : CallStatus.SUCCESS,
                    failed ? RpcResponse.errorCodeOf(body) : "");
            return;
        }

        if (!body.isArray()) {
            // Whole batch rejected with a single error envelope
            String errorCode = RpcResponse.errorCodeOf(body);
            for (int i = 0; i < observation.size(); i++) {
                observation.outcome(i, CallStatus.FAIL, errorCode);
            }
            return;
        }

        // Items missing from the response keep their initial fail status
        for (int i = 0; i < body.size(); i++) {
            JsonNode item = body.get(i);
            JsonNode id = item.get("id");
            int position = id != null && id.canConvertToInt() ? id.asInt() : i;
            boolean failed = item.has("error");
            observation.outcome(position, failed ? CallStatus.FAIL : CallStatus.SUCCESS, RpcResponse.errorCodeOf(item));
        }
    }

    private EndpointTransportException transportFailure(IOException e) {
        String detail = e.getMessage() != null ? e.getMessage() : "no detail";
        String message = "Request to provider " + identity.provider() + " failed: "
                + e.getClass().getSimpleName() + ": " + address().redact(detail);
        return new EndpointTransportException(identity.provider(), message, address().redact(e));
    }

    private RuntimeException asRuntime(Throwable error) {
        if (error instanceof IOException) {
            return transportFailure((IOException) error);
        }
        if (error instanceof RuntimeException) {
            return (RuntimeException) error;
        }
        return new CompletionException(error);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public EndpointAddress address() {
        return client.address();
    }

    public EndpointIdentity getIdentity() {
        return identity;
    }

    /**
     * Normalized provider label of this endpoint.
     */
    public String provider() {
        return identity.provider();
    }

    @Override
    public void close() {
        client.close();
    }

    @Override
    public String toString() {
        return "InstrumentedClient{" +
                "provider='" + identity.provider() + '\'' +
                ", layer=" + identity.layer().label() +
                ", chainId='" + identity.chainId() + '\'' +
                '}';
    }

    public static Builder builder(EndpointClient client) {
        return new Builder(client);
    }

    /**
     * Builder for InstrumentedClient.
     *
     * {@link #build()} resolves the endpoint identity before returning, which probes the
     * endpoint unless a fixed resolver is supplied.
     */
    public static class Builder {
        private final EndpointClient client;
        private Layer layer = Layer.EXECUTION;
        private MetricsSink metricsSink = MetricsSink.noop();
        private RequestCodec codec;
        private PathTemplateClassifier pathClassifier;
        private EndpointIdentityResolver identityResolver;

        private Builder(EndpointClient client) {
            this.client = Objects.requireNonNull(client, "Endpoint client is required");
        }

        public Builder layer(Layer layer) {
            this.layer = layer;
            return this;
        }

        public Builder metricsSink(MetricsSink metricsSink) {
            this.metricsSink = metricsSink;
            return this;
        }

        public Builder codec(RequestCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder pathClassifier(PathTemplateClassifier pathClassifier) {
            this.pathClassifier = pathClassifier;
            return this;
        }

        public Builder identityResolver(EndpointIdentityResolver identityResolver) {
            this.identityResolver = identityResolver;
            return this;
        }

        public InstrumentedClient build() {
            Objects.requireNonNull(layer, "Layer is required");
            Objects.requireNonNull(metricsSink, "Metrics sink is required");
            if (codec == null) {
                codec = new RequestCodec(new ObjectMapper());
            }
            if (pathClassifier == null) {
                pathClassifier = new PathTemplateClassifier();
            }
            if (identityResolver == null) {
                identityResolver = new ProbingIdentityResolver(codec, ChainRegistry.defaults());
            }
            EndpointIdentity identity = identityResolver.resolve(client, layer);
            return new InstrumentedClient(this, identity);
        }
    }
}
