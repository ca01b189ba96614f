package fr.lapetina.llm.orchestrator.infrastructure.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-class request, token and concurrency budget with fixed-window
 * replenishment.
 *
 * <p>Budgets are configured as totals for the whole deployment and divided by
 * the worker-process count given at construction. Processes share no state,
 * so each enforces its own share; the effective global limit is conservative
 * whenever load is uneven across processes.
 *
 * <p>Classes never registered, or registered as disabled, are not limited:
 * {@link #acquire} returns a granted no-op permit.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final int workerProcesses;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimiter(int workerProcesses) {
        if (workerProcesses < 1) {
            throw new IllegalArgumentException("workerProcesses must be at least 1");
        }
        this.workerProcesses = workerProcesses;
    }

    /**
     * Registers the total budget of a class; the per-process share is derived here.
     */
    public void register(String rateLimitClass, RateLimitBudget totalBudget) {
        RateLimitBudget share = totalBudget.perProcess(workerProcesses);
        if (totalBudget.exceedsTotalWhenSplit(workerProcesses)) {
            log.warn("Rate limit smaller than worker count, processes together may exceed it: class={}, "
                            + "totalRequests={}, maxConcurrent={}, workerProcesses={}",
                    rateLimitClass, totalBudget.requestsPerWindow(), totalBudget.maxConcurrent(), workerProcesses);
        }
        buckets.put(rateLimitClass, new Bucket(rateLimitClass, share));
        log.info("Rate limit registered: class={}, totalRequests={}, workerProcesses={}, "
                        + "requestsPerWindow={}, tokensPerWindow={}, maxConcurrent={}, windowMs={}, policy={}",
                rateLimitClass, totalBudget.requestsPerWindow(), workerProcesses,
                share.requestsPerWindow(), share.tokensPerWindow(), share.maxConcurrent(),
                share.window().toMillis(), share.policy());
    }

    /**
     * Acquires permission for one call.
     *
     * @param rateLimitClass class to charge
     * @param timeout        longest time to wait under the {@link RateLimitPolicy#WAIT} policy
     * @return granted, wait (timed out) or rejected permit
     */
    public Permit acquire(String rateLimitClass, Duration timeout) {
        Bucket bucket = buckets.get(rateLimitClass);
        if (bucket == null) {
            return Permit.unlimited(rateLimitClass);
        }
        return bucket.acquire(timeout);
    }

    /**
     * Debits tokens reported after a call. May overdraw the current window;
     * further calls then wait for the next one.
     */
    public void recordTokens(String rateLimitClass, long tokens) {
        Bucket bucket = buckets.get(rateLimitClass);
        if (bucket != null && tokens > 0) {
            bucket.debitTokens(tokens);
        }
    }

    public boolean isLimited(String rateLimitClass) {
        return buckets.containsKey(rateLimitClass);
    }

    public int getWorkerProcesses() {
        return workerProcesses;
    }

    /**
     * Returns a snapshot per registered class, sorted by class name.
     */
    public Map<String, RateLimiterStats> getStats() {
        Map<String, RateLimiterStats> stats = new TreeMap<>();
        buckets.forEach((name, bucket) -> stats.put(name, bucket.stats()));
        return stats;
    }

    /**
     * One fixed window. All mutable state is guarded by {@code lock}.
     */
    private static final class Bucket {

        private final String name;
        private final RateLimitBudget budget;
        private final long windowNanos;
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition capacityChanged = lock.newCondition();

        private long windowStart = System.nanoTime();
        private int requestsUsed;
        private long tokensUsed;
        private int inFlight;
        private long granted;
        private long denied;

        Bucket(String name, RateLimitBudget budget) {
            this.name = name;
            this.budget = budget;
            this.windowNanos = budget.window().toNanos();
        }

        Permit acquire(Duration timeout) {
            long remaining = timeout.toNanos();
            lock.lock();
            try {
                while (true) {
                    long now = System.nanoTime();
                    rollWindow(now);
                    if (hasCapacity()) {
                        requestsUsed++;
                        inFlight++;
                        granted++;
                        return Permit.granted(name, this::release);
                    }
                    long untilReset = windowStart + windowNanos - now;
                    if (budget.policy() == RateLimitPolicy.REJECT) {
                        return deny(Permit.Outcome.REJECTED, untilReset);
                    }
                    if (remaining <= 0) {
                        return deny(Permit.Outcome.WAIT, untilReset);
                    }
                    long waitFor = Math.min(remaining, Math.max(untilReset, 1));
                    long before = System.nanoTime();
                    capacityChanged.awaitNanos(waitFor);
                    remaining -= System.nanoTime() - before;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return deny(Permit.Outcome.WAIT, windowStart + windowNanos - System.nanoTime());
            } finally {
                lock.unlock();
            }
        }

        private Permit deny(Permit.Outcome outcome, long untilResetNanos) {
            denied++;
            Duration retryAfter = Duration.ofNanos(Math.max(0, untilResetNanos));
            log.warn("Rate limited: class={}, outcome={}, requestsUsed={}/{}, inFlight={}/{}, retryAfterMs={}",
                    name, outcome, requestsUsed, budget.requestsPerWindow(),
                    inFlight, budget.maxConcurrent(), retryAfter.toMillis());
            return Permit.denied(name, outcome, retryAfter);
        }

        private boolean hasCapacity() {
            if (requestsUsed >= budget.requestsPerWindow()) {
                return false;
            }
            if (budget.tokensPerWindow() > 0 && tokensUsed >= budget.tokensPerWindow()) {
                return false;
            }
            return budget.maxConcurrent() == 0 || inFlight < budget.maxConcurrent();
        }

        private void rollWindow(long now) {
            if (now - windowStart >= windowNanos) {
                long elapsedWindows = (now - windowStart) / windowNanos;
                windowStart += elapsedWindows * windowNanos;
                requestsUsed = 0;
                tokensUsed = 0;
            }
        }

        private void release() {
            lock.lock();
            try {
                if (inFlight > 0) {
                    inFlight--;
                }
                capacityChanged.signalAll();
            } finally {
                lock.unlock();
            }
        }

        void debitTokens(long tokens) {
            lock.lock();
            try {
                rollWindow(System.nanoTime());
                tokensUsed += tokens;
            } finally {
                lock.unlock();
            }
        }

        RateLimiterStats stats() {
            lock.lock();
            try {
                rollWindow(System.nanoTime());
                long tokenBudget = budget.tokensPerWindow();
                return new RateLimiterStats(
                        name,
                        budget.requestsPerWindow(),
                        Math.max(0, budget.requestsPerWindow() - requestsUsed),
                        tokenBudget,
                        tokenBudget == 0 ? 0 : Math.max(0, tokenBudget - tokensUsed),
                        budget.maxConcurrent(),
                        inFlight,
                        granted,
                        denied
                );
            } finally {
                lock.unlock();
            }
        }
    }
}
