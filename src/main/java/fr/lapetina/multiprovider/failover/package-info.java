/**
 * Endpoint failover engine.
 *
 * <p>{@link fr.lapetina.multiprovider.failover.FailoverProvider} owns a fixed pool of
 * instrumented endpoint clients and a selection policy. A logical call walks the
 * policy's candidate sequence until one endpoint answers:
 *
 * <pre>
 * caller -> FailoverProvider -> InstrumentedClient -> EndpointClient
 *                 |                    |
 *                 |                    +-> MetricsSink (one observation set per attempt)
 *                 +-> ResponseNormalizer (once, on success)
 * </pre>
 *
 * <p>Both a blocking ({@code send}) and a {@link java.util.concurrent.CompletableFuture}
 * based ({@code sendAsync}) mode are provided; neither fans out.
 */
package fr.lapetina.multiprovider.failover;
