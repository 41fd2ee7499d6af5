/**
 * Instrumented session layer: one request/response cycle against one endpoint.
 *
 * <p>{@link fr.lapetina.multiprovider.infrastructure.session.InstrumentedClient} composes an
 * {@link fr.lapetina.multiprovider.infrastructure.http.EndpointClient}, the request codec and the
 * metrics sink. Its identity (network, layer, chain id, provider label) is resolved once while
 * it is built, by probing the endpoint or from a fixed configuration.
 */
package fr.lapetina.multiprovider.infrastructure.session;
