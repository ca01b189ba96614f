package fr.lapetina.llm.orchestrator.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.orchestrator.domain.model.Candidate;
import fr.lapetina.llm.orchestrator.domain.model.StageKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local repository, used when no external store is wired.
 */
public final class InMemoryDiagramRepository implements DiagramRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDiagramRepository.class);

    private final Map<String, JsonNode> diagrams = new ConcurrentHashMap<>();
    private final Map<String, Map<StageKey, List<Candidate>>> selections = new ConcurrentHashMap<>();

    public void putDiagram(String sessionId, JsonNode diagram) {
        diagrams.put(sessionId, diagram);
    }

    @Override
    public Optional<JsonNode> load(String sessionId) {
        return Optional.ofNullable(diagrams.get(sessionId));
    }

    @Override
    public void saveSelection(String sessionId, String diagramType, StageKey stage, List<Candidate> selected) {
        selections.computeIfAbsent(sessionId, k -> new ConcurrentHashMap<>())
                .put(stage, List.copyOf(selected));
        log.debug("Selection saved: sessionId={}, diagramType={}, stage={}, count={}",
                sessionId, diagramType, stage, selected.size());
    }

    /**
     * Returns the saved selections of a session, in no particular order.
     */
    public Map<StageKey, List<Candidate>> getSelections(String sessionId) {
        return new LinkedHashMap<>(selections.getOrDefault(sessionId, Map.of()));
    }
}
