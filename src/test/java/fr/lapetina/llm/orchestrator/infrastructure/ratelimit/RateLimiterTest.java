package fr.lapetina.llm.orchestrator.infrastructure.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private static final Duration LONG_WINDOW = Duration.ofMinutes(1);

    @Nested
    @DisplayName("Per-process budgets")
    class PerProcessTests {

        @Test
        @DisplayName("should divide totals across worker processes")
        void shouldDivideTotals() {
            RateLimitBudget total = new RateLimitBudget(10, 1000, 8, LONG_WINDOW, RateLimitPolicy.REJECT);

            RateLimitBudget share = total.perProcess(4);

            assertThat(share.requestsPerWindow()).isEqualTo(2);
            assertThat(share.tokensPerWindow()).isEqualTo(250);
            assertThat(share.maxConcurrent()).isEqualTo(2);
        }

        @Test
        @DisplayName("should keep at least one unit and unlimited zeros")
        void shouldKeepMinimums() {
            RateLimitBudget total = new RateLimitBudget(3, 0, 0, LONG_WINDOW, RateLimitPolicy.WAIT);

            RateLimitBudget share = total.perProcess(8);

            assertThat(share.requestsPerWindow()).isEqualTo(1);
            assertThat(share.tokensPerWindow()).isZero();
            assertThat(share.maxConcurrent()).isZero();
        }

        @Test
        @DisplayName("should flag limits that the per-process minimum over-grants")
        void shouldFlagOverGrant() {
            RateLimitBudget small = new RateLimitBudget(3, 0, 0, LONG_WINDOW, RateLimitPolicy.WAIT);
            RateLimitBudget tightConcurrency = new RateLimitBudget(100, 0, 2, LONG_WINDOW, RateLimitPolicy.WAIT);
            RateLimitBudget roomy = new RateLimitBudget(8, 1000, 8, LONG_WINDOW, RateLimitPolicy.WAIT);

            assertThat(small.exceedsTotalWhenSplit(4)).isTrue();
            assertThat(small.perProcess(4).requestsPerWindow() * 4).isGreaterThan(small.requestsPerWindow());
            assertThat(tightConcurrency.exceedsTotalWhenSplit(4)).isTrue();
            assertThat(roomy.exceedsTotalWhenSplit(4)).isFalse();
            assertThat(small.exceedsTotalWhenSplit(1)).isFalse();
        }

        @Test
        @DisplayName("should reject non-positive process counts")
        void shouldRejectBadProcessCount() {
            assertThatThrownBy(() -> new RateLimiter(0)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should enforce the per-process share, not the total")
        void shouldEnforceShare() {
            RateLimiter limiter = new RateLimiter(4);
            limiter.register("dashscope", new RateLimitBudget(10, 0, 0, LONG_WINDOW, RateLimitPolicy.REJECT));

            Permit first = limiter.acquire("dashscope", Duration.ZERO);
            Permit second = limiter.acquire("dashscope", Duration.ZERO);
            Permit third = limiter.acquire("dashscope", Duration.ZERO);

            assertThat(first.isGranted()).isTrue();
            assertThat(second.isGranted()).isTrue();
            assertThat(third.isGranted()).isFalse();
            assertThat(third.getOutcome()).isEqualTo(Permit.Outcome.REJECTED);
            assertThat(third.getRetryAfter()).isPositive();
        }
    }

    @Nested
    @DisplayName("Policies")
    class PolicyTests {

        @Test
        @DisplayName("should time out with WAIT outcome when the window does not replenish")
        void shouldTimeOutUnderWait() {
            RateLimiter limiter = new RateLimiter(1);
            limiter.register("volcengine", new RateLimitBudget(1, 0, 0, LONG_WINDOW, RateLimitPolicy.WAIT));
            limiter.acquire("volcengine", Duration.ZERO);

            long start = System.nanoTime();
            Permit permit = limiter.acquire("volcengine", Duration.ofMillis(100));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(permit.getOutcome()).isEqualTo(Permit.Outcome.WAIT);
            assertThat(elapsedMs).isGreaterThanOrEqualTo(90);
        }

        @Test
        @DisplayName("should grant after the window replenishes")
        void shouldGrantAfterReplenish() {
            RateLimiter limiter = new RateLimiter(1);
            limiter.register("hunyuan", new RateLimitBudget(1, 0, 0, Duration.ofMillis(100), RateLimitPolicy.WAIT));
            limiter.acquire("hunyuan", Duration.ZERO);

            Permit permit = limiter.acquire("hunyuan", Duration.ofSeconds(2));

            assertThat(permit.isGranted()).isTrue();
        }

        @Test
        @DisplayName("should wake a waiter when a concurrency slot is released")
        void shouldWakeOnRelease() throws Exception {
            RateLimiter limiter = new RateLimiter(1);
            limiter.register("dashscope", new RateLimitBudget(100, 0, 1, LONG_WINDOW, RateLimitPolicy.WAIT));
            Permit holder = limiter.acquire("dashscope", Duration.ZERO);

            CompletableFuture<Permit> waiter = CompletableFuture.supplyAsync(
                    () -> limiter.acquire("dashscope", Duration.ofSeconds(5)));
            Thread.sleep(100);
            assertThat(waiter).isNotDone();

            holder.release();

            assertThat(waiter.get(2, TimeUnit.SECONDS).isGranted()).isTrue();
        }

        @Test
        @DisplayName("should block new calls once tokens are overdrawn")
        void shouldLimitTokens() {
            RateLimiter limiter = new RateLimiter(1);
            limiter.register("dashscope", new RateLimitBudget(100, 500, 0, LONG_WINDOW, RateLimitPolicy.REJECT));

            assertThat(limiter.acquire("dashscope", Duration.ZERO).isGranted()).isTrue();
            limiter.recordTokens("dashscope", 800);

            assertThat(limiter.acquire("dashscope", Duration.ZERO).getOutcome())
                    .isEqualTo(Permit.Outcome.REJECTED);
            assertThat(limiter.getStats().get("dashscope").tokensRemaining()).isZero();
        }
    }

    @Nested
    @DisplayName("Unlimited classes")
    class UnlimitedTests {

        @Test
        @DisplayName("should always grant unregistered classes")
        void shouldGrantUnregistered() {
            RateLimiter limiter = new RateLimiter(2);

            for (int i = 0; i < 100; i++) {
                assertThat(limiter.acquire("unknown", Duration.ZERO).isGranted()).isTrue();
            }
            assertThat(limiter.isLimited("unknown")).isFalse();
            assertThat(limiter.getStats()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Statistics")
    class StatsTests {

        @Test
        @DisplayName("should count grants, denials and in-flight calls")
        void shouldTrackStats() {
            RateLimiter limiter = new RateLimiter(1);
            limiter.register("dashscope", new RateLimitBudget(2, 0, 5, LONG_WINDOW, RateLimitPolicy.REJECT));

            Permit first = limiter.acquire("dashscope", Duration.ZERO);
            limiter.acquire("dashscope", Duration.ZERO);
            limiter.acquire("dashscope", Duration.ZERO);
            first.release();
            first.release();

            RateLimiterStats stats = limiter.getStats().get("dashscope");
            assertThat(stats.granted()).isEqualTo(2);
            assertThat(stats.denied()).isEqualTo(1);
            assertThat(stats.requestsRemaining()).isZero();
            assertThat(stats.inFlight()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should parse policy names")
    void shouldParsePolicies() {
        assertThat(RateLimitPolicy.fromName(" Reject ")).isEqualTo(RateLimitPolicy.REJECT);
        assertThat(RateLimitPolicy.fromName(null)).isEqualTo(RateLimitPolicy.WAIT);
        assertThatThrownBy(() -> RateLimitPolicy.fromName("drop"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
