package fr.lapetina.llm.orchestrator.infrastructure.provider;

import fr.lapetina.llm.orchestrator.infrastructure.provider.error.VolcengineErrorClassifier;

/**
 * Volcengine ARK. The physical model id of a binding is the ARK endpoint id.
 */
public class VolcengineClient extends OpenAiCompatibleClient {

    public VolcengineClient(ProviderSettings settings) {
        super(settings, new VolcengineErrorClassifier());
    }
}
