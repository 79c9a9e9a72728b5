package com.storyroom;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyroom.condition.ConditionValidationException;
import com.storyroom.controllers.Controller;
import com.storyroom.controllers.StoryController;
import com.storyroom.engine.StoryInvariantException;
import com.storyroom.models.EngineSettings;
import com.storyroom.parser.StoryParseException;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.util.List;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            EngineSettingsStore settingsStore = new EngineSettingsStore(config.getStoriesPath(), objectMapper);
            if (!Files.exists(settingsStore.getSettingsPath())) {
                settingsStore.save(EngineSettings.defaults());
                logger.info("Wrote default engine settings to " + settingsStore.getSettingsPath());
            }
            StorySessionService sessionService = new StorySessionService(config.getStoriesPath(), settingsStore);
            logger.info("Stories folder: " + config.getStoriesPath());
            sessionService.seedExamples();

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper, false));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(new StoryController(sessionService, objectMapper));
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }

            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Stories: " + config.getStoriesPath());
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
            System.err.println("Failed to start Story Room: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Story Room v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(StoryParseException.class, (e, ctx) -> {
            logger.warn("Story parse error: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(ConditionValidationException.class, (e, ctx) -> {
            logger.warn("Invalid condition: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(FileNotFoundException.class, (e, ctx) -> {
            logger.warn("File not found: " + e.getMessage());
            ctx.status(404).json(Controller.errorBody(e));
        });

        app.exception(SecurityException.class, (e, ctx) -> {
            logger.warn("Security violation: " + e.getMessage());
            ctx.status(403).json(Controller.errorBody(e));
        });

        app.exception(StoryInvariantException.class, (e, ctx) -> {
            logger.error("Story graph invariant broken: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
