package com.civicdesk;

import com.civicdesk.controllers.BadgeController;
import com.civicdesk.controllers.Controller;
import com.civicdesk.controllers.IssueController;
import com.civicdesk.controllers.NotificationController;
import com.civicdesk.controllers.UserController;
import com.fasterxml.jackson.databind.ObjectMapper;
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
            // Parse configuration from args and environment
            AppConfig config = new AppConfig.Builder()
                    .environment(System.getenv())
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            Clock clock = Clock.systemUTC();
            IssueStore store = new IssueStore(clock);
            SecondaryIndexes indexes = new SecondaryIndexes(LocationZoneResolver.keywords());
            BadgeCatalog catalog = BadgeCatalog.standard();
            GamificationEngine engine = new GamificationEngine(catalog);
            NotificationDispatcher dispatcher = new NotificationDispatcher();
            IssueLifecycleCoordinator coordinator =
                    new IssueLifecycleCoordinator(store, indexes, engine, dispatcher, clock);

            NotificationFeed feed = new NotificationFeed();
            feed.register(dispatcher);
            LeaderboardService leaderboardService = new LeaderboardService(coordinator);
            IssueAnalyticsService analyticsService = new IssueAnalyticsService(coordinator);
            logger.info("Issue services initialized with " + catalog.size() + " badges");

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                    new IssueController(coordinator, analyticsService, objectMapper),
                    new UserController(coordinator, engine, leaderboardService),
                    new BadgeController(engine),
                    new NotificationController(feed)
            );
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }

            registerExceptionHandlers(app);

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

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Civic Desk: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Civic Desk v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(ValidationException.class, (e, ctx) -> {
            logger.warn("Validation failed: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e.getMessage(), e.getFields()));
        });

        app.exception(IssueNotFoundException.class, (e, ctx) -> {
            logger.warn("Issue not found: " + e.getMessage());
            ctx.status(404).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
