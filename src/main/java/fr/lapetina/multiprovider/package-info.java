/**
 * Web3 multi-provider: failover over pools of equivalent blockchain node endpoints.
 *
 * <h2>Architecture</h2>
 * <pre>
 * MultiProviderFactory (YAML configuration)
 *     |
 *     v
 * FailoverProvider (one per pool) ---- SelectionPolicy (rotating | fallback)
 *     |
 *     v  one candidate at a time
 * InstrumentedClient ---- MetricsSink (Micrometer)
 *     |                \-- PathTemplateClassifier / JsonRpcMethodExtractor (labels)
 *     v
 * EndpointClient (HTTP)
 *     |
 *     v  on success
 * ResponseNormalizer (PoA extraData)
 * </pre>
 *
 * <h2>Packages</h2>
 * <ul>
 *   <li>{@code domain.model} - requests, responses, endpoint addresses and identities</li>
 *   <li>{@code domain.policy} - candidate ordering</li>
 *   <li>{@code domain.exception} - error taxonomy</li>
 *   <li>{@code failover} - the failover engine</li>
 *   <li>{@code infrastructure.*} - transport, instrumentation, classification, metrics, configuration</li>
 * </ul>
 */
package fr.lapetina.multiprovider;
