/**
 * Domain model classes shared by the failover engine and the instrumentation layer.
 *
 * <p>This package contains immutable value objects only; mutable failover state lives in
 * {@link fr.lapetina.multiprovider.domain.policy.RotatingPolicy}.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.multiprovider.domain.model.RpcRequest} - Logical request (JSON-RPC, batch or REST)</li>
 *   <li>{@link fr.lapetina.multiprovider.domain.model.RpcResponse} - Decoded response handed back to the caller</li>
 *   <li>{@link fr.lapetina.multiprovider.domain.model.EndpointAddress} - Validated address and its metric label</li>
 *   <li>{@link fr.lapetina.multiprovider.domain.model.EndpointIdentity} - Network, layer and chain of an endpoint</li>
 *   <li>{@link fr.lapetina.multiprovider.domain.model.MetricLabels} - Per-call request counter labels</li>
 * </ul>
 *
 * @see fr.lapetina.multiprovider.domain.model.RpcRequest
 * @see fr.lapetina.multiprovider.domain.model.EndpointAddress
 */
package fr.lapetina.multiprovider.domain.model;
