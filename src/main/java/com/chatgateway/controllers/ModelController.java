package com.chatgateway.controllers;

import com.chatgateway.GatewayConfig;
import com.chatgateway.ModelCatalog;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Controller for the public model list.
 */
public class ModelController implements Controller {

    private final ModelCatalog catalog;
    private final GatewayConfig config;

    public ModelController(ModelCatalog catalog, GatewayConfig config) {
        this.catalog = catalog;
        this.config = config;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/models", this::listModels);
    }

    private void listModels(Context ctx) {
        try {
            ctx.json(Map.of(
                "defaultModel", config.getDefaultModel(),
                "models", catalog.list(),
                "byAccessLevel", catalog.groupedByAccessLevel()
            ));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }
}
