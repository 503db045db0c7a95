package com.projectdesk.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectdesk.AppLogger;
import com.projectdesk.ProjectDeskException;
import com.projectdesk.events.EventChannel;
import com.projectdesk.events.EventStreamPublisher;
import com.projectdesk.models.AskResult;
import com.projectdesk.pipeline.AskService;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.sse.SseClient;

import java.util.Map;

/**
 * Controller for natural-language requests.
 * Handles: blocking ask, streamed ask (SSE)
 */
public class AskController implements Controller {

    private final AskService askService;
    private final EventStreamPublisher publisher;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public AskController(AskService askService, EventStreamPublisher publisher, ObjectMapper objectMapper) {
        this.askService = askService;
        this.publisher = publisher;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/ask", this::ask);
        app.sse("/api/ask/stream", this::stream);
    }

    private void ask(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            String projectId = text(json, "projectId", "project_id");
            String prompt = text(json, "prompt");
            if (projectId == null || projectId.isBlank()) {
                ctx.status(400).json(Map.of("error", "projectId is required"));
                return;
            }
            AskResult result = askService.ask(projectId, prompt);
            ctx.json(result);
        } catch (ProjectDeskException e) {
            logger.warn("Ask failed: " + e.getMessage());
            Controller.fail(ctx, e);
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Invalid JSON body"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.status(503).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error handling ask: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void stream(SseClient client) {
        Context ctx = client.ctx();
        String projectId = ctx.queryParam("projectId");
        if (projectId == null || projectId.isBlank()) {
            projectId = ctx.queryParam("project_id");
        }
        String prompt = ctx.queryParam("prompt");
        logger.info("[SSE] open project=" + projectId);

        EventChannel channel = askService.stream(projectId, prompt);
        boolean completed = publisher.publish(new SseEventConnection(client, objectMapper), channel);
        logger.info("[SSE] " + (completed ? "done" : "closed early") + " project=" + projectId);
    }

    private static String text(JsonNode json, String... names) {
        if (json == null) {
            return null;
        }
        for (String name : names) {
            JsonNode node = json.get(name);
            if (node != null && node.isTextual()) {
                return node.asText();
            }
        }
        return null;
    }
}
