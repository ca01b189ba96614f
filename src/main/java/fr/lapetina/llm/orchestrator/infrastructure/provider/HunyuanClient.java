package fr.lapetina.llm.orchestrator.infrastructure.provider;

import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.llm.orchestrator.domain.model.ChatRequest;
import fr.lapetina.llm.orchestrator.infrastructure.provider.error.HunyuanErrorClassifier;

/**
 * Tencent Hunyuan through its OpenAI-compatible endpoint.
 */
public class HunyuanClient extends OpenAiCompatibleClient {

    public HunyuanClient(ProviderSettings settings) {
        super(settings, new HunyuanErrorClassifier());
    }

    @Override
    protected void customizeBody(ObjectNode body, ChatRequest request, boolean stream) {
        // Search enhancement adds latency and off-topic lines
        body.put("enable_enhancement", false);
    }
}
