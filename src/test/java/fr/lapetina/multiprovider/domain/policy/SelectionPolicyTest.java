package fr.lapetina.multiprovider.domain.policy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SelectionPolicyTest {

    private static final List<String> POOL = List.of("A", "B", "C");

    private static List<String> drain(CandidateSequence<String> candidates) {
        List<String> drawn = new ArrayList<>();
        candidates.forEachRemaining(drawn::add);
        return drawn;
    }

    @Nested
    @DisplayName("RotatingPolicy")
    class RotatingTests {

        private RotatingPolicy policy;

        @BeforeEach
        void setUp() {
            policy = new RotatingPolicy();
        }

        @Test
        @DisplayName("should yield every member exactly once")
        void shouldYieldEveryMemberOnce() {
            assertThat(drain(policy.candidates(POOL))).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("should keep the cursor on a successful endpoint")
        void shouldKeepCursorOnSuccess() {
            CandidateSequence<String> first = policy.candidates(POOL);
            assertThat(first.next()).isEqualTo("A");

            assertThat(policy.getCursor()).isZero();
            assertThat(policy.candidates(POOL).next()).isEqualTo("A");
        }

        @Test
        @DisplayName("should start the next call after the failed endpoint")
        void shouldStartAfterFailedEndpoint() {
            // Call 1: A fails, B succeeds
            CandidateSequence<String> call1 = policy.candidates(List.of("A", "B"));
            assertThat(call1.next()).isEqualTo("A");
            call1.recordFailure();
            assertThat(call1.next()).isEqualTo("B");

            // Call 2 starts at B
            CandidateSequence<String> call2 = policy.candidates(List.of("A", "B"));
            assertThat(drain(call2)).containsExactly("B", "A");
        }

        @Test
        @DisplayName("should wrap around the end of the pool")
        void shouldWrapAround() {
            CandidateSequence<String> call1 = policy.candidates(POOL);
            call1.next();
            call1.recordFailure();
            call1.next();
            call1.recordFailure();
            call1.next();
            call1.recordFailure();

            assertThat(policy.getCursor()).isZero();
            assertThat(drain(policy.candidates(POOL))).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("should count every failure when concurrent calls fail on the same endpoint")
        void shouldCountEachConcurrentFailure() {
            CandidateSequence<String> call1 = policy.candidates(POOL);
            CandidateSequence<String> call2 = policy.candidates(POOL);
            call1.next();
            call2.next();

            call1.recordFailure();
            call2.recordFailure();

            assertThat(policy.getCursor()).isEqualTo(2);
        }

        @Test
        @DisplayName("should end where sequential calls would when interleaved calls exhaust the pool")
        void shouldMatchSequentialCursorForInterleavedExhaustion() {
            List<String> pool = List.of("A", "B");
            CandidateSequence<String> call1 = policy.candidates(pool);
            call1.next();
            call1.recordFailure();
            CandidateSequence<String> call2 = policy.candidates(pool);
            call2.next();
            call2.recordFailure();
            call1.next();
            call1.recordFailure();
            call2.next();
            call2.recordFailure();

            // Two calls, two failures each: four steps on a pool of two
            assertThat(policy.getCursor()).isZero();
        }

        @Test
        @DisplayName("should not lose cursor updates under concurrent failures")
        void shouldStayConsistentUnderConcurrency() throws Exception {
            int threads = 8;
            int callsPerThread = 500;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch done = new CountDownLatch(threads);

            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    try {
                        for (int i = 0; i < callsPerThread; i++) {
                            CandidateSequence<String> candidates = policy.candidates(POOL);
                            List<String> drawn = new ArrayList<>();
                            while (candidates.hasNext()) {
                                drawn.add(candidates.next());
                                candidates.recordFailure();
                            }
                            assertThat(drawn).containsExactlyInAnyOrder("A", "B", "C");
                        }
                    } finally {
                        done.countDown();
                    }
                });
            }

            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();
            // Every call fails on all three endpoints, so the cursor makes whole turns
            assertThat(policy.getCursor()).isZero();
        }

        @Test
        @DisplayName("should reset the cursor")
        void shouldResetCursor() {
            CandidateSequence<String> call = policy.candidates(POOL);
            call.next();
            call.recordFailure();

            policy.reset();

            assertThat(policy.getCursor()).isZero();
        }
    }

    @Nested
    @DisplayName("FallbackPolicy")
    class FallbackTests {

        private FallbackPolicy policy;

        @BeforeEach
        void setUp() {
            policy = new FallbackPolicy();
        }

        @Test
        @DisplayName("should always start from the first endpoint")
        void shouldAlwaysStartFromFirst() {
            CandidateSequence<String> call1 = policy.candidates(POOL);
            call1.next();
            call1.recordFailure();
            call1.next();

            assertThat(drain(policy.candidates(POOL))).containsExactly("A", "B", "C");
        }
    }

    @Nested
    @DisplayName("PolicyFactory")
    class FactoryTests {

        @Test
        @DisplayName("should create policies by name")
        void shouldCreatePoliciesByName() {
            assertThat(PolicyFactory.create("rotating")).containsInstanceOf(RotatingPolicy.class);
            assertThat(PolicyFactory.create("FALLBACK")).containsInstanceOf(FallbackPolicy.class);
        }

        @Test
        @DisplayName("should return a fresh instance per call")
        void shouldReturnFreshInstance() {
            assertThat(PolicyFactory.create("rotating").orElseThrow())
                    .isNotSameAs(PolicyFactory.create("rotating").orElseThrow());
        }

        @Test
        @DisplayName("should return empty for unknown policy")
        void shouldReturnEmptyForUnknown() {
            assertThat(PolicyFactory.create("round-robin")).isEmpty();
        }
    }
}
