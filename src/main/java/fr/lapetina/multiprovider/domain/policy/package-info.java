/**
 * Selection policies deciding the order in which pool endpoints are tried.
 *
 * <p>All implementations are thread-safe; one instance serves every concurrent call of its pool.
 *
 * <h2>Available Policies</h2>
 * <table border="1">
 *   <tr><th>Policy</th><th>Description</th><th>Best For</th></tr>
 *   <tr><td>{@code rotating}</td><td>Starts where the last call succeeded, skips failed endpoints</td><td>Equivalent vendor nodes</td></tr>
 *   <tr><td>{@code fallback}</td><td>Always starts from the first endpoint</td><td>Primary node with backups</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * SelectionPolicy policy = PolicyFactory.create("rotating").orElseThrow();
 * CandidateSequence<InstrumentedClient> candidates = policy.candidates(pool);
 * }</pre>
 *
 * @see fr.lapetina.multiprovider.domain.policy.SelectionPolicy
 * @see fr.lapetina.multiprovider.domain.policy.PolicyFactory
 */
package fr.lapetina.multiprovider.domain.policy;
