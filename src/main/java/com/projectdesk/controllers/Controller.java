package com.projectdesk.controllers;

import com.projectdesk.ProjectDeskException;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    /**
     * Register this controller's routes with the Javalin app.
     */
    void registerRoutes(Javalin app);

    /**
     * Safe error body helper that handles null exception messages.
     * Typed failures also carry their kind.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", m);
        if (e instanceof ProjectDeskException) {
            body.put("kind", ((ProjectDeskException) e).getKind().wireName());
        }
        return body;
    }

    /**
     * Writes a typed failure with its mapped status.
     */
    static void fail(Context ctx, ProjectDeskException e) {
        ctx.status(e.getKind().httpStatus()).json(errorBody(e));
    }
}
