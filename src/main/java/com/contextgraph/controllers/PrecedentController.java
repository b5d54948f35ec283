package com.contextgraph.controllers;

import com.contextgraph.models.Outcome;
import com.contextgraph.models.PrecedentMatch;
import com.contextgraph.storage.DecisionStore;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.List;
import java.util.Map;

/**
 * Filter-based search for past decisions that touched the same policy or tool.
 */
public class PrecedentController implements Controller {

    private final DecisionStore store;

    public PrecedentController(DecisionStore store) {
        this.store = store;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/v1/precedents/search", this::searchPrecedents);
    }

    private void searchPrecedents(Context ctx) {
        List<PrecedentMatch> precedents;
        try {
            String outcome = ctx.queryParam("outcome");
            precedents = store.searchPrecedents(
                ctx.queryParam("policy_id"),
                ctx.queryParam("tool"),
                outcome != null && !outcome.isBlank() ? Outcome.fromValue(outcome) : null,
                DecisionController.intParam(ctx, "limit", DecisionStore.DEFAULT_PRECEDENT_LIMIT));
        } catch (IllegalArgumentException e) {
            ctx.status(422).json(Controller.errorBody(e));
            return;
        }
        ctx.json(Map.of("precedents", precedents, "count", precedents.size()));
    }
}
