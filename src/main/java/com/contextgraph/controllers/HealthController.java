package com.contextgraph.controllers;

import com.contextgraph.storage.DecisionStore;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public class HealthController implements Controller {

    private final DecisionStore store;
    private final String version;

    public HealthController(DecisionStore store, String version) {
        this.store = store;
        this.version = version;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/health", this::health);
    }

    private void health(Context ctx) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("version", version);
        body.put("timestamp", Instant.now().toString());
        body.put("storage", store.describe());
        ctx.json(body);
    }
}
