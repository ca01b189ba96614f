/**
 * Events streamed from the orchestrator to the calling layer.
 *
 * <p>A batch produces {@code batch_start}, then interleaved {@code candidate},
 * {@code model_complete} and {@code error} events in arrival order, and
 * always ends with {@code batch_complete} unless it was cancelled.
 */
package fr.lapetina.llm.orchestrator.domain.event;
