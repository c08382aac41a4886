package com.chatgateway;

import com.chatgateway.controllers.AdminController;
import com.chatgateway.controllers.ChatController;
import com.chatgateway.controllers.Controller;
import com.chatgateway.controllers.ModelController;
import com.chatgateway.controllers.ProfileController;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.HttpResponseException;
import io.javalin.json.JavalinJackson;

import java.util.List;
import java.util.Map;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            // Parse configuration from args and environment
            AppConfig appConfig = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            // Initialize logging
            AppLogger.initialize(appConfig.getLogPath(), true, appConfig.isDevMode());
            logger = AppLogger.get();

            printBanner(appConfig);

            GatewayConfig config = GatewayConfig.load(objectMapper, appConfig.getConfigFile());
            GatewayContext context = new GatewayContext(config, appConfig.getDataPath(), objectMapper);

            Javalin app = createApp(context, objectMapper);
            app.start(appConfig.getPort());

            String url = "http://localhost:" + appConfig.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Data: " + appConfig.getDataPath());
            logger.console("  Log file: " + appConfig.getLogPath());
            if (config.getAdminKey() == null || config.getAdminKey().isBlank()) {
                logger.console("  Admin API: disabled (set adminKey to enable)");
            }
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            // Add shutdown hook for clean shutdown
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                context.shutdown();
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Chat Gateway: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Builds the Javalin app with every controller and exception handler registered, not yet started.
     */
    public static Javalin createApp(GatewayContext context, ObjectMapper mapper) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(mapper));
            cfg.http.defaultContentType = "application/json";
        });

        List<Controller> controllers = List.of(
            new ChatController(context.queue(), mapper, context.config().getResponseTimeoutMs(),
                context.config().getStreamKeepAliveMs()),
            new ProfileController(context.settings(), mapper),
            new ModelController(context.catalog(), context.config()),
            new AdminController(context.store(), context.ledger(), context.settings(), context.catalog(),
                context.registry(), mapper, context.config().getAdminKey())
        );
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }
        app.get("/api/health", ctx -> ctx.json(Map.of("status", "ok", "version", VERSION)));

        registerExceptionHandlers(app);
        return app;
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Chat Gateway v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(HttpResponseException.class, (e, ctx) -> {
            warn("Rejected " + ctx.method() + " " + ctx.path() + ": " + e.getMessage());
            ctx.status(e.getStatus()).json(Map.of("error", e.getMessage()));
        });

        app.exception(GatewayException.class, (e, ctx) -> {
            warn("Request failed (" + e.getKind() + "): " + e.getMessage());
            ctx.status(e.getKind().getHttpStatus()).json(Controller.errorBody(e));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            AppLogger log = AppLogger.get();
            if (log != null) {
                log.error("Unhandled exception: " + e.getMessage(), e);
            }
            ctx.status(500).json(Controller.errorBody(e));
        });
    }

    private static void warn(String message) {
        AppLogger log = AppLogger.get();
        if (log != null) {
            log.warn(message);
        }
    }
}
