/**
 * Per-process rate limiting of provider calls.
 *
 * <p>Each rate-limit class (usually one per provider, sometimes one per
 * provider model) has a request budget, an optional token budget and an
 * optional concurrency ceiling, all replenished on a fixed window. Totals are
 * divided by {@code deployment.workerProcesses} because worker processes share
 * no memory.
 *
 * @see fr.lapetina.llm.orchestrator.infrastructure.ratelimit.RateLimiter
 */
package fr.lapetina.llm.orchestrator.infrastructure.ratelimit;
