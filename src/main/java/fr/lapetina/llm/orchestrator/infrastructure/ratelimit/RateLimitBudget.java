package fr.lapetina.llm.orchestrator.infrastructure.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Budget of one rate-limit class.
 *
 * @param requestsPerWindow calls allowed per window
 * @param tokensPerWindow   tokens allowed per window, 0 for unlimited
 * @param maxConcurrent     simultaneous calls, 0 for unlimited
 * @param window            fixed window length
 * @param policy            behaviour once exhausted
 */
public record RateLimitBudget(
        int requestsPerWindow,
        long tokensPerWindow,
        int maxConcurrent,
        Duration window,
        RateLimitPolicy policy
) {
    public RateLimitBudget {
        if (requestsPerWindow < 1) {
            throw new IllegalArgumentException("requestsPerWindow must be at least 1");
        }
        if (tokensPerWindow < 0 || maxConcurrent < 0) {
            throw new IllegalArgumentException("Budgets cannot be negative");
        }
        Objects.requireNonNull(window, "Window is required");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Window must be positive");
        }
        Objects.requireNonNull(policy, "Policy is required");
    }

    /**
     * Splits a total budget evenly across worker processes, rounding down
     * but keeping at least one unit of each enabled limit. When a limit is
     * smaller than the process count the shares add up to more than the
     * total; see {@link #exceedsTotalWhenSplit(int)}.
     */
    public RateLimitBudget perProcess(int workerProcesses) {
        if (workerProcesses < 1) {
            throw new IllegalArgumentException("workerProcesses must be at least 1");
        }
        return new RateLimitBudget(
                Math.max(1, requestsPerWindow / workerProcesses),
                tokensPerWindow == 0 ? 0 : Math.max(1, tokensPerWindow / workerProcesses),
                maxConcurrent == 0 ? 0 : Math.max(1, maxConcurrent / workerProcesses),
                window,
                policy
        );
    }

    /**
     * True when {@link #perProcess(int)} rounds some enabled limit up to one,
     * so that all processes together may exceed this total.
     */
    public boolean exceedsTotalWhenSplit(int workerProcesses) {
        return requestsPerWindow < workerProcesses
                || (tokensPerWindow > 0 && tokensPerWindow < workerProcesses)
                || (maxConcurrent > 0 && maxConcurrent < workerProcesses);
    }
}
