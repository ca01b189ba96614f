/**
 * Multi-model fan-out and merge.
 *
 * <p>{@link fr.lapetina.llm.orchestrator.aggregation.StreamAggregator} launches
 * one call per model, segments each stream into candidate texts and publishes
 * them to the {@link fr.lapetina.llm.orchestrator.aggregation.AggregationPipeline},
 * a Disruptor ring whose handler chain deduplicates and emits in arrival order:
 *
 * <pre>
 * model streams --&gt; [Dedup] --&gt; [Emission] --&gt; [Metrics]
 * </pre>
 *
 * <p>Dedup keys are computed by
 * {@link fr.lapetina.llm.orchestrator.aggregation.DedupKeys#normalize(String)}.
 */
package fr.lapetina.llm.orchestrator.aggregation;
