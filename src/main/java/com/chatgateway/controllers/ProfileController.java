package com.chatgateway.controllers;

import com.chatgateway.UserSettingsService;
import com.chatgateway.models.UserProfile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller for a user's own settings and memory.
 */
public class ProfileController implements Controller {

    private final UserSettingsService settings;
    private final ObjectMapper objectMapper;

    public ProfileController(UserSettingsService settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/users/{userId}/profile", this::getProfile);
        app.put("/api/users/{userId}/model", this::setModel);
        app.get("/api/users/{userId}/system-prompt", this::getSystemPrompt);
        app.put("/api/users/{userId}/system-prompt", this::setSystemPrompt);
        app.post("/api/users/{userId}/reset", this::reset);
        app.get("/api/users/{userId}/memory", this::inspectMemory);
        app.delete("/api/users/{userId}/memory", this::clearMemory);
    }

    private void getProfile(Context ctx) {
        try {
            ctx.json(view(settings.getProfile(ctx.pathParam("userId"))));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void setModel(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            String model = json != null ? json.path("model").asText(null) : null;
            ctx.json(view(settings.setModel(ctx.pathParam("userId"), model)));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void getSystemPrompt(Context ctx) {
        try {
            UserProfile profile = settings.getProfile(ctx.pathParam("userId"));
            boolean custom = profile.getSystemPrompt() != null && !profile.getSystemPrompt().isBlank();
            ctx.json(Map.of(
                "prompt", settings.effectiveSystemPrompt(profile),
                "custom", custom
            ));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void setSystemPrompt(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            String prompt = json != null ? json.path("prompt").asText(null) : null;
            ctx.json(view(settings.setSystemPrompt(ctx.pathParam("userId"), prompt)));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void reset(Context ctx) {
        try {
            ctx.json(view(settings.reset(ctx.pathParam("userId"))));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void inspectMemory(Context ctx) {
        try {
            String userId = ctx.pathParam("userId");
            String target = ctx.queryParam("target");
            if (target == null || target.isBlank() || target.equals(userId)) {
                ctx.json(settings.inspectMemory(userId));
            } else {
                ctx.json(settings.inspectMemory(userId, target));
            }
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void clearMemory(Context ctx) {
        try {
            String userId = ctx.pathParam("userId");
            boolean cleared = settings.clearMemory(userId, ctx.queryParam("target"));
            ctx.json(Map.of("cleared", cleared));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private Map<String, Object> view(UserProfile profile) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", profile.getUserId());
        body.put("model", settings.effectiveModel(profile));
        body.put("customModel", profile.getPreferredModel() != null);
        body.put("customSystemPrompt", profile.getSystemPrompt() != null && !profile.getSystemPrompt().isBlank());
        body.put("accessLevel", profile.getAccessLevel());
        body.put("credit", profile.getCredit());
        body.put("createdAt", profile.getCreatedAt());
        body.put("updatedAt", profile.getUpdatedAt());
        return body;
    }
}
