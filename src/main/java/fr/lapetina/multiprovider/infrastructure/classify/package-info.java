/**
 * Request classification for metric labels.
 *
 * <p>Keeps the {@code method} metric dimension bounded: JSON-RPC requests are labelled by
 * method name, REST requests by a path template where identifiers (slots, roots, validator
 * indices, peer ids) are replaced by placeholders.
 *
 * <p>Classification never fails a request. Anything that cannot be classified is reported
 * as "no label" and the dimension is emitted empty.
 *
 * @see fr.lapetina.multiprovider.infrastructure.classify.PathTemplateClassifier
 * @see fr.lapetina.multiprovider.infrastructure.classify.JsonRpcMethodExtractor
 */
package fr.lapetina.multiprovider.infrastructure.classify;
