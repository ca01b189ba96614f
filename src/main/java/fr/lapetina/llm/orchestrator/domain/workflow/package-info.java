/**
 * Staged candidate workflow.
 *
 * <p>Each diagram type has up to three stages. A typical brace map session:
 *
 * <pre>
 * dimensions (select one) --&gt; parts (select several) --&gt; subparts/{part} (one tab per part)
 * </pre>
 *
 * <p>Locked stages never change. Misuse raises
 * {@link fr.lapetina.llm.orchestrator.domain.workflow.StateException}.
 */
package fr.lapetina.llm.orchestrator.domain.workflow;
