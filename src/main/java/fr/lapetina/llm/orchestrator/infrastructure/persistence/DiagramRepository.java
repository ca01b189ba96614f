package fr.lapetina.llm.orchestrator.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.orchestrator.domain.model.Candidate;
import fr.lapetina.llm.orchestrator.domain.model.StageKey;

import java.util.List;
import java.util.Optional;

/**
 * Boundary to the diagram persistence collaborator.
 */
public interface DiagramRepository {

    /**
     * Reads the current diagram content of a session, if any.
     */
    Optional<JsonNode> load(String sessionId);

    /**
     * Writes the confirmed selection of a locked stage.
     */
    void saveSelection(String sessionId, String diagramType, StageKey stage, List<Candidate> selected);
}
