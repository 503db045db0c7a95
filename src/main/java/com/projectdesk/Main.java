package com.projectdesk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectdesk.agent.FallbackAgent;
import com.projectdesk.controllers.AskController;
import com.projectdesk.controllers.Controller;
import com.projectdesk.controllers.ProjectController;
import com.projectdesk.controllers.StagingController;
import com.projectdesk.events.EventStreamPublisher;
import com.projectdesk.pipeline.AskService;
import com.projectdesk.pipeline.MentionResolver;
import com.projectdesk.pipeline.PromptRouter;
import com.projectdesk.pipeline.StructuredPipeline;
import com.projectdesk.providers.ProviderTextGenerator;
import com.projectdesk.providers.RetryPolicy;
import com.projectdesk.providers.chat.HttpChatClient;
import com.projectdesk.tools.SandboxedToolExecutor;
import com.projectdesk.tools.ShellRunner;
import com.projectdesk.tools.ToolCallParser;
import com.projectdesk.tools.ToolSchemaRegistry;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.time.Duration;
import java.util.List;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            // Parse configuration from args and environment
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            // Initialize logging
            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            ProjectRegistry registry = ProjectRegistry.load(config.getProjectsPath(), objectMapper);
            logger.info("Loaded " + registry.size() + " project(s) from " + config.getProjectsPath());

            StagingStore staging = new StagingStore(new PathLocks());
            ProjectFileService fileService = new ProjectFileService();
            MentionResolver mentionResolver = new MentionResolver();

            ProviderTextGenerator generator = new ProviderTextGenerator(
                new HttpChatClient(objectMapper, Duration.ofMillis(config.getGenerationTimeoutMs())),
                config.getEndpoint(),
                config.getApiKey(),
                config.getGenerationTimeoutMs(),
                RetryPolicy.forEndpoint(config.getEndpoint())
            );

            ToolSchemaRegistry toolSchemas = ToolSchemaRegistry.projectTools(config.isShellEnabled());
            SandboxedToolExecutor toolExecutor = new SandboxedToolExecutor(
                staging, fileService, mentionResolver,
                config.isShellEnabled() ? new ShellRunner() : null
            );
            FallbackAgent agent = new FallbackAgent(generator, toolExecutor,
                new ToolCallParser(objectMapper, toolSchemas), toolSchemas, FallbackAgent.DEFAULT_MAX_TURNS);

            AskService askService = new AskService(registry, mentionResolver, new PromptRouter(),
                new StructuredPipeline(generator, staging), agent);

            // Create and configure Javalin
            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
                cfg.plugins.enableCors(cors -> cors.add(it -> {
                    for (String origin : config.getCorsOrigins()) {
                        it.allowHost(origin);
                    }
                }));
            });

            List<Controller> controllers = List.of(
                new ProjectController(registry, fileService, config.getEndpoint(), config.getApiKey() != null),
                new AskController(askService, new EventStreamPublisher(), objectMapper),
                new StagingController(registry, staging, objectMapper)
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
            logger.console("  Projects: " + config.getProjectsPath());
            logger.console("  Provider: " + config.getEndpoint().describe());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            // Add shutdown hook for clean shutdown
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                askService.shutdown();
                generator.shutdown();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Project Desk: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Project Desk v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
        if (!config.isShellEnabled()) {
            logger.console("  Shell tool: disabled");
        }
        if (config.getApiKey() == null) {
            logger.console("  Warning: no API key configured (DESK_API_KEY / ANTHROPIC_API_KEY)");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(ProjectDeskException.class, (e, ctx) -> {
            logger.warn("Request failed (" + e.getKind().wireName() + "): " + e.getMessage());
            Controller.fail(ctx, e);
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
