package fr.lapetina.llm.orchestrator.infrastructure.provider;

import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.llm.orchestrator.domain.model.ChatRequest;
import fr.lapetina.llm.orchestrator.infrastructure.provider.error.DashscopeErrorClassifier;

/**
 * Alibaba Dashscope in OpenAI-compatible mode (Qwen, DeepSeek hosted models).
 */
public class DashscopeClient extends OpenAiCompatibleClient {

    public DashscopeClient(ProviderSettings settings) {
        super(settings, new DashscopeErrorClassifier());
    }

    @Override
    protected void customizeBody(ObjectNode body, ChatRequest request, boolean stream) {
        // Hybrid-thinking models reason by default, which only delays candidate lines
        body.put("enable_thinking", false);
    }
}
