/**
 * Immutable domain model shared across routing, aggregation and workflow.
 *
 * <h2>Key Types</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.orchestrator.domain.model.ChatRequest} - A call addressed to a physical model</li>
 *   <li>{@link fr.lapetina.llm.orchestrator.domain.model.ChatResult} - Uniform content plus usage result</li>
 *   <li>{@link fr.lapetina.llm.orchestrator.domain.model.Candidate} - A generated, deduplicated text unit</li>
 *   <li>{@link fr.lapetina.llm.orchestrator.domain.model.StageKey} - Stage, optionally narrowed to an item tab</li>
 *   <li>{@link fr.lapetina.llm.orchestrator.domain.model.ErrorKind} - Closed provider error taxonomy</li>
 *   <li>{@link fr.lapetina.llm.orchestrator.domain.model.ProviderError} - Classified failure with a message digest</li>
 * </ul>
 *
 * <p>All types are records and thread-safe.
 */
package fr.lapetina.llm.orchestrator.domain.model;
