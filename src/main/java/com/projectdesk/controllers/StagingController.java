package com.projectdesk.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectdesk.AppLogger;
import com.projectdesk.ProjectDeskException;
import com.projectdesk.ProjectRegistry;
import com.projectdesk.StagingStore;
import com.projectdesk.models.Project;
import com.projectdesk.models.StagedFile;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Controller for the approval flow.
 * Handles: staged list, diff, promote, reject
 */
public class StagingController implements Controller {

    private final ProjectRegistry registry;
    private final StagingStore staging;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public StagingController(ProjectRegistry registry, StagingStore staging, ObjectMapper objectMapper) {
        this.registry = registry;
        this.staging = staging;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/projects/{id}/staged", this::listStaged);
        app.get("/api/projects/{id}/diff", this::diff);
        app.post("/api/projects/{id}/promote", this::promote);
        app.delete("/api/projects/{id}/staged", this::reject);
    }

    private void listStaged(Context ctx) {
        try {
            Project project = registry.get(ctx.pathParam("id"));
            ctx.json(Map.of(
                "writeDir", project.getWriteDir(),
                "stagingDir", project.getStagingDir(),
                "files", staging.list(project)
            ));
        } catch (ProjectDeskException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            logger.error("Error listing staged files: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void diff(Context ctx) {
        try {
            Project project = registry.get(ctx.pathParam("id"));
            String path = ctx.queryParam("path");
            String rel = staging.normalize(project, path);
            ctx.json(Map.of("path", rel, "diff", staging.diff(project, rel)));
        } catch (ProjectDeskException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            logger.error("Error computing diff: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void promote(Context ctx) {
        try {
            Project project = registry.get(ctx.pathParam("id"));
            JsonNode json = objectMapper.readTree(ctx.body());
            String path = json != null && json.has("path") ? json.get("path").asText() : null;
            boolean overwrite = json != null && json.path("overwrite").asBoolean(false);
            StagedFile promoted = staging.promote(project, path, overwrite);
            ctx.json(Map.of("promotedTo", project.getWriteDir() + "/" + promoted.getPath()));
        } catch (ProjectDeskException e) {
            Controller.fail(ctx, e);
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Invalid JSON body"));
        } catch (Exception e) {
            logger.error("Error promoting file: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void reject(Context ctx) {
        try {
            Project project = registry.get(ctx.pathParam("id"));
            StagedFile rejected = staging.reject(project, ctx.queryParam("path"));
            ctx.json(Map.of("deleted", project.getStagingDir() + "/" + rejected.getPath()));
        } catch (ProjectDeskException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            logger.error("Error rejecting file: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
