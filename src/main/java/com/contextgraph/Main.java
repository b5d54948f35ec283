package com.contextgraph;

import com.contextgraph.controllers.Controller;
import com.contextgraph.controllers.DecisionController;
import com.contextgraph.controllers.HealthController;
import com.contextgraph.controllers.PrecedentController;
import com.contextgraph.storage.DecisionStore;
import com.contextgraph.storage.FileDecisionStore;
import com.contextgraph.storage.JsonStorage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;

public class Main {

    public static final String VERSION = "0.1.0";
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .fromEnvironment(System.getenv())
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            ObjectMapper objectMapper = JsonStorage.mapper();
            DecisionStore store = new FileDecisionStore(config.getDataPath(), objectMapper);
            logger.info("Decision store initialized: " + store.describe());

            Javalin app = createApp(store, objectMapper);
            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Data: " + config.getDataPath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start ContextGraph: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Build the HTTP app around {@code store} without starting it.
     */
    public static Javalin createApp(DecisionStore store, ObjectMapper objectMapper) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper));
            cfg.http.defaultContentType = "application/json";
        });

        List<Controller> controllers = List.of(
            new HealthController(store, VERSION),
            new DecisionController(store, new ExplainService(store), objectMapper),
            new PrecedentController(store)
        );
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }

        registerExceptionHandlers(app);
        return app;
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  ContextGraph v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(JsonProcessingException.class, (e, ctx) -> {
            AppLogger.get().warn("Malformed JSON: " + e.getOriginalMessage());
            ctx.status(422).json(Controller.errorBody(e));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            AppLogger.get().warn("Invalid request: " + e.getMessage());
            ctx.status(422).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            AppLogger.get().error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
