/**
 * Route selection and the logical to physical model table.
 *
 * <p>A batch picks exactly one {@link fr.lapetina.llm.orchestrator.domain.routing.Route};
 * every model of the batch is then resolved under that route through the
 * {@link fr.lapetina.llm.orchestrator.domain.routing.ModelRegistry}.
 *
 * <h2>Available Selectors</h2>
 * <ul>
 *   <li>{@code weighted} - Stateless weighted random, safe across processes (recommended)</li>
 *   <li>{@code round-robin} - Process-local counter, skews under multi-process deployment</li>
 *   <li>{@code disabled} - Always the default route</li>
 * </ul>
 *
 * @see fr.lapetina.llm.orchestrator.domain.routing.RouteSelectorFactory
 */
package fr.lapetina.llm.orchestrator.domain.routing;
