package fr.lapetina.llm.orchestrator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llm.orchestrator.domain.event.WorkflowEvent;
import fr.lapetina.llm.orchestrator.domain.model.BatchSummary;
import fr.lapetina.llm.orchestrator.domain.model.Candidate;
import fr.lapetina.llm.orchestrator.domain.model.ModelStats;
import fr.lapetina.llm.orchestrator.domain.model.StageKey;
import fr.lapetina.llm.orchestrator.domain.workflow.StageView;
import fr.lapetina.llm.orchestrator.domain.workflow.WorkflowSnapshot;

import java.util.Locale;

/**
 * Renders workflow events as the JSON payloads streamed by the SSE layer.
 *
 * Field names are snake_case. Only logical model names and classified error
 * kinds are written; provider details never leave the process.
 */
public final class EventCodec {

    private final ObjectMapper objectMapper;

    public EventCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Renders one event as a JSON object.
     */
    public ObjectNode toJson(WorkflowEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", event.type().getWireName());
        node.put("session_id", event.sessionId());
        node.set("timestamp", objectMapper.valueToTree(event.timestamp()));

        switch (event.type()) {
            case STATE_CHANGED -> node.set("state", state(event.state()));
            case BATCH_START -> {
                stage(node, event.stage());
                node.put("batch_number", event.batchNumber());
                node.put("route", event.route());
                node.put("model_count", event.modelCount());
            }
            case CANDIDATE -> {
                Candidate candidate = event.candidate();
                node.put("id", candidate.id());
                node.put("text", candidate.text());
                node.put("model", candidate.model());
                stage(node, candidate.stage());
                node.put("batch_number", candidate.batchNumber());
            }
            case MODEL_COMPLETE -> {
                stage(node, event.stage());
                node.put("batch_number", event.batchNumber());
                modelStats(node, event.modelStats());
            }
            case ERROR -> {
                stage(node, event.stage());
                node.put("batch_number", event.batchNumber());
                modelStats(node, event.modelStats());
                node.put("error_type", event.errorKind().name().toLowerCase(Locale.ROOT));
                node.put("message_key", event.messageKey());
            }
            case BATCH_COMPLETE -> summary(node, event.summary());
        }
        return node;
    }

    /**
     * Renders one event as a compact JSON string.
     */
    public String encode(WorkflowEvent event) {
        try {
            return objectMapper.writeValueAsString(toJson(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode event: " + event.type(), e);
        }
    }

    /**
     * Renders one event as a server-sent event frame.
     */
    public String toSseFrame(WorkflowEvent event) {
        return "event: " + event.type().getWireName() + "\ndata: " + encode(event) + "\n\n";
    }

    private ObjectNode state(WorkflowSnapshot snapshot) {
        ObjectNode state = objectMapper.createObjectNode();
        state.put("diagram_type", snapshot.diagramType());
        state.put("phase", snapshot.phase().name().toLowerCase(Locale.ROOT));
        if (snapshot.activeStage() != null) {
            ObjectNode active = state.putObject("active_stage");
            stage(active, snapshot.activeStage());
        } else {
            state.putNull("active_stage");
        }
        ArrayNode stages = state.putArray("stages");
        for (StageView view : snapshot.stages()) {
            ObjectNode stage = stages.addObject();
            stage(stage, view.key());
            stage.put("locked", view.locked());
            stage.put("candidate_count", view.candidateCount());
            stage.put("batches", view.batches());
            ArrayNode selected = stage.putArray("selected_ids");
            view.selectedIds().forEach(selected::add);
        }
        return state;
    }

    private void summary(ObjectNode node, BatchSummary summary) {
        stage(node, summary.stage());
        node.put("batch_number", summary.batchNumber());
        node.put("route", summary.route());
        node.put("new_candidates", summary.newCandidates().size());
        node.put("total_candidates", summary.totalCandidates());
        node.put("cancelled", summary.cancelled());
        node.put("fully_failed", summary.isFullyFailed());
        ArrayNode models = node.putArray("models");
        for (ModelStats stats : summary.modelStats()) {
            modelStats(models.addObject(), stats);
        }
    }

    private void modelStats(ObjectNode node, ModelStats stats) {
        node.put("model", stats.model());
        node.put("candidates", stats.candidates());
        node.put("attempts", stats.attempts());
        node.put("elapsed_ms", stats.elapsedMs());
        if (stats.error() != null) {
            node.put("error", stats.error().name().toLowerCase(Locale.ROOT));
        }
    }

    private static void stage(ObjectNode node, StageKey key) {
        if (key == null) {
            return;
        }
        node.put("stage", key.stage());
        if (key.item() != null) {
            node.put("item", key.item());
        }
    }
}
