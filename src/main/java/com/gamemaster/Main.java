package com.gamemaster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamemaster.controllers.AdventureController;
import com.gamemaster.controllers.Controller;
import com.gamemaster.controllers.StatusController;
import com.gamemaster.providers.chat.ChatProviderFactory;
import com.gamemaster.resolver.ActionResolver;
import com.gamemaster.resolver.ChatSemanticResolver;
import com.gamemaster.resolver.SemanticFallbackStage;
import com.gamemaster.tools.ToolCallParser;
import com.gamemaster.tools.ToolExecutionService;
import com.gamemaster.tools.ToolSchemaRegistry;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.time.Clock;
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

            WorldGraph world = loadWorld(config);
            logger.info("World '" + world.getName() + "' loaded: " + world.size() + " scenes, entry '"
                + world.getEntrySceneId() + "'");

            SemanticFallbackStage fallback = null;
            ActionResolver resolver;
            if (config.isResolverEnabled()) {
                ChatSemanticResolver semantic = new ChatSemanticResolver(
                    new ChatProviderFactory(objectMapper), config.getResolver(), config.getResolverApiKey(), objectMapper);
                fallback = new SemanticFallbackStage(semantic, config.getResolver().effectiveTimeoutMs());
                resolver = ActionResolver.withFallback(fallback);
                logger.info("Semantic fallback: " + semantic.getProviderName() + " / " + config.getResolver().getModel()
                    + " (timeout " + config.getResolver().effectiveTimeoutMs() + "ms)");
                if (config.getResolverApiKey() == null) {
                    logger.warn(AppConfig.API_KEY_ENV + " is not set; hosted providers will reject fallback requests");
                }
            } else {
                resolver = ActionResolver.deterministic();
                logger.info("Semantic fallback disabled; deterministic resolution only");
            }

            NarrativeComposer composer = new NarrativeComposer(world);
            GameSessionService sessions = new GameSessionService(world, resolver, new EffectEngine(), composer,
                Clock.systemUTC());
            SessionRegistry sessionRegistry = new SessionRegistry(sessions);
            ToolSchemaRegistry schemaRegistry = ToolSchemaRegistry.adventureTools();

            List<Controller> controllers = List.of(
                new AdventureController(sessionRegistry, schemaRegistry,
                    new ToolCallParser(objectMapper, schemaRegistry), new ToolExecutionService(sessions)),
                new StatusController(world, sessionRegistry,
                    GameMasterInstructions.load(GameMasterInstructions.DEFAULT_RESOURCE))
            );

            Javalin app = createApp(objectMapper, controllers);
            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            SemanticFallbackStage fallbackToStop = fallback;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                if (fallbackToStop != null) {
                    fallbackToStop.shutdown();
                }
                logger.close();
            }));

        } catch (WorldGraphException e) {
            String message = "Invalid world: " + e.getMessage();
            if (logger != null) {
                logger.error(message);
            }
            System.err.println(message);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Failed to start Game Master: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Builds the HTTP app without starting it.
     */
    public static Javalin createApp(ObjectMapper mapper, List<Controller> controllers) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(mapper));
            cfg.http.defaultContentType = "application/json";
        });
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }
        registerExceptionHandlers(app);
        return app;
    }

    private static WorldGraph loadWorld(AppConfig config) {
        WorldLoader loader = new WorldLoader(objectMapper);
        if (config.getWorldPath() != null) {
            logger.info("Loading world from " + config.getWorldPath());
            return loader.loadFile(config.getWorldPath());
        }
        return loader.loadResource(WorldLoader.DEFAULT_WORLD_RESOURCE);
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Brinmere Game Master v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            AppLogger.get().warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            AppLogger.get().error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
