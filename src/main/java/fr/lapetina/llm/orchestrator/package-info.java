/**
 * LLM candidate orchestrator - routes, fans out and merges LLM calls for a
 * staged diagram-building workflow.
 *
 * <p>One logical request is fanned out to several models under one route,
 * their streams are merged through an LMAX Disruptor ring and deduplicated,
 * and a per-session state machine gates which stage may be generated or
 * selected.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.orchestrator.OrchestratorFactory} - Main entry point for creating
 *       a fully-configured orchestrator from YAML configuration</li>
 *   <li>{@link fr.lapetina.llm.orchestrator.CandidateOrchestrator} - Operations exposed to the
 *       calling HTTP/SSE layer</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     CandidateOrchestrator orchestrator = factory.getOrchestrator();
 *
 *     orchestrator.start("s1", "brace_map", diagram, sink);
 *     BatchHandle batch = orchestrator.nextBatch("s1", StageKey.of("dimensions"), 10, sink);
 *     batch.completion().join();
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Stateless weighted route selection, safe across worker processes</li>
 *   <li>Per-provider rate limits divided across worker processes</li>
 *   <li>Arrival-order merge with stage-wide deduplication</li>
 *   <li>Partial-failure tolerant batches with bounded retries</li>
 *   <li>Resumable staged workflow with locking</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.llm.orchestrator.OrchestratorFactory
 * @see fr.lapetina.llm.orchestrator.aggregation.StreamAggregator
 */
package fr.lapetina.llm.orchestrator;
