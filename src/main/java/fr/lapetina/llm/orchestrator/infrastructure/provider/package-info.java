/**
 * Provider clients behind one capability interface.
 *
 * <p>Every provider speaks an OpenAI-compatible dialect, so the transport,
 * request body and server-sent-event parsing live in
 * {@link fr.lapetina.llm.orchestrator.infrastructure.provider.OpenAiCompatibleClient}.
 * Variants differ in error format (see the {@code error} sub-package) and a
 * few body flags.
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.orchestrator.infrastructure.provider.DashscopeClient} - Alibaba Dashscope</li>
 *   <li>{@link fr.lapetina.llm.orchestrator.infrastructure.provider.VolcengineClient} - Volcengine ARK endpoints</li>
 *   <li>{@link fr.lapetina.llm.orchestrator.infrastructure.provider.HunyuanClient} - Tencent Hunyuan</li>
 * </ul>
 */
package fr.lapetina.llm.orchestrator.infrastructure.provider;
