package fr.lapetina.multiprovider.domain.policy;

import java.util.List;

/**
 * Policy deciding in which order the endpoints of a pool are tried for one logical call.
 *
 * Implementations must be thread-safe: one policy instance serves every concurrent
 * call of its pool.
 */
public interface SelectionPolicy {

    /**
     * Returns the name of this policy for configuration and logs.
     */
    String getName();

    /**
     * Returns the candidate sequence of one logical call.
     *
     * @param pool fixed, ordered pool
     * @return a sequence yielding every pool member exactly once
     */
    <T> CandidateSequence<T> candidates(List<T> pool);

    /**
     * Resets any internal state.
     */
    default void reset() {
        // Default no-op
    }
}
