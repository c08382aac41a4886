package com.chatgateway.controllers;

import com.chatgateway.GatewayException;
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
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", m);
        if (e instanceof GatewayException) {
            body.put("kind", ((GatewayException) e).getKind().code());
        }
        return body;
    }

    /**
     * Writes the conventional status for an exception: the kind's status for gateway errors,
     * 400 for validation errors, 409 for state conflicts, 500 otherwise.
     */
    static void respondError(Context ctx, Exception e) {
        int status;
        if (e instanceof GatewayException) {
            status = ((GatewayException) e).getKind().getHttpStatus();
        } else if (e instanceof IllegalArgumentException) {
            status = 400;
        } else if (e instanceof IllegalStateException) {
            status = 409;
        } else {
            status = 500;
        }
        ctx.status(status).json(errorBody(e));
    }
}
