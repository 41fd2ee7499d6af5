package fr.lapetina.multiprovider.domain.policy;

import java.util.Iterator;
import java.util.List;

/**
 * Fallback policy: always tries the pool in configuration order, starting from the first endpoint.
 *
 * Stateless, so trivially thread-safe. The first endpoint is the primary node; the others
 * are only used while it fails.
 */
public final class FallbackPolicy implements SelectionPolicy {

    public static final String NAME = "fallback";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public <T> CandidateSequence<T> candidates(List<T> pool) {
        Iterator<T> iterator = List.copyOf(pool).iterator();
        return new CandidateSequence<>() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public T next() {
                return iterator.next();
            }
        };
    }
}
