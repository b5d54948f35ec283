package com.contextgraph.controllers;

import com.contextgraph.AppLogger;
import com.contextgraph.ExplainService;
import com.contextgraph.models.DecisionRecord;
import com.contextgraph.models.DecisionSummary;
import com.contextgraph.models.Explanation;
import com.contextgraph.models.Outcome;
import com.contextgraph.storage.DecisionQuery;
import com.contextgraph.storage.DecisionStore;
import com.contextgraph.storage.UpsertResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ingest, fetch, list and explain decision records.
 */
public class DecisionController implements Controller {

    private static final List<String> REQUIRED_FIELDS = List.of("decision_id", "run_id", "timestamp", "outcome");

    private final DecisionStore store;
    private final ExplainService explainService;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public DecisionController(DecisionStore store, ExplainService explainService, ObjectMapper objectMapper) {
        this.store = store;
        this.explainService = explainService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/v1/decisions", this::createDecision);
        app.get("/v1/decisions", this::listDecisions);
        app.get("/v1/decisions/{id}", this::getDecision);
        app.get("/v1/decisions/{id}/explain", this::explainDecision);
    }

    private void createDecision(Context ctx) {
        DecisionRecord record;
        try {
            JsonNode body = objectMapper.readTree(ctx.body());
            if (body == null || !body.isObject()) {
                ctx.status(422).json(Controller.errorBody("Request body must be a JSON object"));
                return;
            }
            for (String field : REQUIRED_FIELDS) {
                if (!body.hasNonNull(field)) {
                    ctx.status(422).json(Controller.errorBody("Missing required field: " + field));
                    return;
                }
            }
            record = objectMapper.treeToValue(body, DecisionRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            String detail = e instanceof JsonProcessingException
                ? ((JsonProcessingException) e).getOriginalMessage()
                : e.getMessage();
            ctx.status(422).json(Controller.errorBody("Invalid decision record: " + detail));
            return;
        }

        try {
            UpsertResult result = store.upsert(record);
            ctx.json(Map.of("decision_id", record.getDecisionId(), "status", result.getValue()));
        } catch (IllegalArgumentException e) {
            ctx.status(422).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("[DecisionController] Failed to store decision " + record.getDecisionId()
                + ": " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getDecision(Context ctx) {
        String id = ctx.pathParam("id");
        DecisionRecord record = store.get(id);
        if (record == null) {
            ctx.status(404).json(Controller.errorBody("Decision not found: " + id));
            return;
        }
        ctx.json(record);
    }

    private void explainDecision(Context ctx) {
        String id = ctx.pathParam("id");
        Explanation explanation = explainService.explain(id);
        if (explanation == null) {
            ctx.status(404).json(Controller.errorBody("Decision not found: " + id));
            return;
        }
        ctx.json(explanation);
    }

    private void listDecisions(Context ctx) {
        DecisionQuery query;
        try {
            String outcome = ctx.queryParam("outcome");
            query = DecisionQuery.of(
                ctx.queryParam("run_id"),
                outcome != null && !outcome.isBlank() ? Outcome.fromValue(outcome) : null,
                intParam(ctx, "limit", DecisionQuery.DEFAULT_LIMIT),
                intParam(ctx, "offset", 0));
        } catch (IllegalArgumentException e) {
            ctx.status(422).json(Controller.errorBody(e));
            return;
        }
        List<DecisionSummary> decisions = store.list(query).stream()
            .map(DecisionSummary::of)
            .collect(Collectors.toList());
        ctx.json(Map.of("decisions", decisions, "count", decisions.size()));
    }

    static int intParam(Context ctx, String name, int fallback) {
        String raw = ctx.queryParam(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + raw);
        }
    }
}
