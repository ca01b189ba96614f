/**
 * YAML configuration loading and validation.
 *
 * <h2>Configuration File Format</h2>
 * <pre>{@code
 * routing:
 *   strategy: weighted
 *   defaultRoute: A
 *   routes:
 *     - name: A
 *       weight: 50
 *     - name: B
 *       weight: 50
 *
 * providers:
 *   - name: dashscope
 *     type: dashscope
 *     baseUrl: https://dashscope.aliyuncs.com/compatible-mode/v1
 *     apiKeyEnv: QWEN_API_KEY
 *
 * rateLimits:
 *   - name: dashscope
 *     requestsPerWindow: 13500
 *     maxConcurrent: 500
 *
 * models:
 *   - name: deepseek
 *     bindings:
 *       A: { provider: dashscope, physicalId: deepseek-v3 }
 *       B: { provider: volcengine, physicalId: ep-deepseek }
 *
 * deployment:
 *   workerProcesses: 4
 * }</pre>
 *
 * @see fr.lapetina.llm.orchestrator.infrastructure.config.ConfigLoader
 */
package fr.lapetina.llm.orchestrator.infrastructure.config;
