package fr.lapetina.multiprovider.domain.policy;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rotating policy: starts each logical call at a shared cursor and moves the cursor past
 * every endpoint that fails.
 *
 * The cursor persists across calls. With pool {@code [A, B]} where A is down, the first
 * call tries A, advances the cursor to B and succeeds on B; every following call starts
 * at B until B fails in turn.
 *
 * Thread-safe: every failure moves the cursor one step forward in a single atomic update,
 * so interleaved calls end on the same cursor as some sequential ordering of them.
 */
public final class RotatingPolicy implements SelectionPolicy {

    public static final String NAME = "rotating";

    private final AtomicInteger cursor = new AtomicInteger(0);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public <T> CandidateSequence<T> candidates(List<T> pool) {
        List<T> members = List.copyOf(pool);
        int size = members.size();
        int start = size == 0 ? 0 : Math.floorMod(cursor.get(), size);
        return new RotatingSequence<>(members, start);
    }

    /**
     * Current cursor position.
     */
    public int getCursor() {
        return cursor.get();
    }

    @Override
    public void reset() {
        cursor.set(0);
    }

    private final class RotatingSequence<T> implements CandidateSequence<T> {

        private final List<T> members;
        private final int start;
        private int drawn;
        private int lastIndex = -1;

        private RotatingSequence(List<T> members, int start) {
            this.members = members;
            this.start = start;
        }

        @Override
        public boolean hasNext() {
            return drawn < members.size();
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            lastIndex = (start + drawn) % members.size();
            drawn++;
            return members.get(lastIndex);
        }

        @Override
        public void recordFailure() {
            if (lastIndex < 0) {
                return;
            }
            int size = members.size();
            cursor.updateAndGet(current -> Math.floorMod(current + 1, size));
        }
    }
}
