package com.projectdesk.controllers;

import com.projectdesk.AppLogger;
import com.projectdesk.ProjectDeskException;
import com.projectdesk.ProjectFileService;
import com.projectdesk.ProjectRegistry;
import com.projectdesk.models.Project;
import com.projectdesk.providers.GenerationEndpoint;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Controller for project metadata and read-only browsing.
 * Handles: health, project list/descriptor, fs listing, file preview, name search
 */
public class ProjectController implements Controller {

    private final ProjectRegistry registry;
    private final ProjectFileService fileService;
    private final GenerationEndpoint endpoint;
    private final boolean apiKeyConfigured;
    private final AppLogger logger;

    public ProjectController(ProjectRegistry registry, ProjectFileService fileService,
                             GenerationEndpoint endpoint, boolean apiKeyConfigured) {
        this.registry = registry;
        this.fileService = fileService;
        this.endpoint = endpoint;
        this.apiKeyConfigured = apiKeyConfigured;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/health", this::health);
        app.get("/api/projects", this::listProjects);
        app.get("/api/projects/{id}", this::getProject);
        app.get("/api/projects/{id}/fs", this::listFs);
        app.get("/api/projects/{id}/file", this::getFile);
        app.get("/api/projects/{id}/search", this::search);
    }

    private void health(Context ctx) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("provider", endpoint.provider());
        body.put("model", endpoint.model());
        body.put("apiKeyConfigured", apiKeyConfigured);
        body.put("projects", registry.size());
        ctx.json(body);
    }

    private void listProjects(Context ctx) {
        List<Map<String, Object>> projects = registry.list().stream()
            .map(p -> {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("id", p.getId());
                item.put("name", p.getName());
                item.put("aliases", p.getAliases());
                return item;
            })
            .collect(Collectors.toList());
        ctx.json(projects);
    }

    private void getProject(Context ctx) {
        try {
            Project project = registry.get(ctx.pathParam("id"));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("id", project.getId());
            body.put("name", project.getName());
            body.put("aliases", project.getAliases());
            body.put("readRoots", project.getReadDirs());
            body.put("inputDir", project.getInputDir());
            body.put("guidelineDir", project.getGuidelineDir());
            body.put("writeRoot", project.getWriteDir());
            body.put("stagingRoot", project.getStagingDir());
            body.put("requireApproval", true);
            ctx.json(body);
        } catch (ProjectDeskException e) {
            Controller.fail(ctx, e);
        }
    }

    private void listFs(Context ctx) {
        try {
            Project project = registry.get(ctx.pathParam("id"));
            String path = ctx.queryParam("path");
            ctx.json(Map.of(
                "path", path == null ? "" : path,
                "entries", fileService.listEntries(project, path)
            ));
        } catch (ProjectDeskException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            logger.error("Error listing directory: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getFile(Context ctx) {
        try {
            Project project = registry.get(ctx.pathParam("id"));
            String path = ctx.queryParam("path");
            if (path == null || path.isEmpty()) {
                ctx.status(400).json(Map.of("error", "Path parameter required"));
                return;
            }
            ctx.json(fileService.preview(project, path));
        } catch (ProjectDeskException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            logger.error("Error reading file: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void search(Context ctx) {
        try {
            Project project = registry.get(ctx.pathParam("id"));
            String query = ctx.queryParam("q");
            int limit = parseLimit(ctx.queryParam("limit"));
            ctx.json(Map.of(
                "q", query == null ? "" : query,
                "results", fileService.search(project, query, limit)
            ));
        } catch (ProjectDeskException e) {
            Controller.fail(ctx, e);
        } catch (Exception e) {
            logger.error("Error searching: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private static int parseLimit(String raw) {
        if (raw == null || raw.isBlank()) {
            return ProjectFileService.DEFAULT_SEARCH_LIMIT;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw ProjectDeskException.invalidRequest("limit must be an integer: " + raw);
        }
    }
}
