package fr.lapetina.multiprovider.domain.policy;

import java.util.Iterator;

/**
 * Ordered candidates for one logical call.
 *
 * Yields each pool member at most once. The engine reports a failed draw through
 * {@link #recordFailure()} before drawing the next candidate.
 *
 * @param <T> pool member type
 */
public interface CandidateSequence<T> extends Iterator<T> {

    /**
     * Called when the candidate most recently returned by {@link #next()} failed.
     */
    default void recordFailure() {
        // Default no-op, override for policies that keep state across calls
    }
}
