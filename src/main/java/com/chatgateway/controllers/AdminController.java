package com.chatgateway.controllers;

import com.chatgateway.AppLogger;
import com.chatgateway.CreditLedger;
import com.chatgateway.ModelCatalog;
import com.chatgateway.UserSettingsService;
import com.chatgateway.models.AccessLevel;
import com.chatgateway.models.ModelDescriptor;
import com.chatgateway.providers.ProviderRegistry;
import com.chatgateway.storage.ConversationStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.ForbiddenResponse;
import io.javalin.http.UnauthorizedResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Controller for operator commands: credits, access levels, the allowlist, memory and the model catalog.
 * Every route requires the {@code X-Admin-Key} header.
 */
public class AdminController implements Controller {

    public static final String ADMIN_KEY_HEADER = "X-Admin-Key";

    private final ConversationStore store;
    private final CreditLedger ledger;
    private final UserSettingsService settings;
    private final ModelCatalog catalog;
    private final ProviderRegistry registry;
    private final ObjectMapper objectMapper;
    private final String adminKey;
    private final AppLogger logger = AppLogger.get();

    public AdminController(ConversationStore store, CreditLedger ledger, UserSettingsService settings,
                           ModelCatalog catalog, ProviderRegistry registry, ObjectMapper objectMapper,
                           String adminKey) {
        this.store = store;
        this.ledger = ledger;
        this.settings = settings;
        this.catalog = catalog;
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.adminKey = adminKey;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.before("/api/admin/*", this::requireAdminKey);
        app.get("/api/admin/users", this::listUsers);
        app.post("/api/admin/users/{userId}/credits/add", this::addCredit);
        app.post("/api/admin/users/{userId}/credits/set", this::setCredit);
        app.post("/api/admin/users/{userId}/credits/deduct", this::deductCredit);
        app.get("/api/admin/authorized", this::listAuthorized);
        app.put("/api/admin/authorized/{userId}", this::authorize);
        app.delete("/api/admin/authorized/{userId}", this::deauthorize);
        app.post("/api/admin/users/{userId}/level", this::setLevel);
        app.get("/api/admin/users/{userId}/memory", this::inspectMemory);
        app.delete("/api/admin/users/{userId}/memory", this::clearMemory);
        app.post("/api/admin/models", this::addModel);
        app.put("/api/admin/models/{name}", this::updateModel);
        app.delete("/api/admin/models/{name}", this::removeModel);
    }

    private void requireAdminKey(Context ctx) {
        if (adminKey == null || adminKey.isBlank()) {
            throw new ForbiddenResponse("Admin API is disabled (no adminKey configured)");
        }
        String provided = ctx.header(ADMIN_KEY_HEADER);
        if (provided == null || !MessageDigest.isEqual(
            provided.getBytes(StandardCharsets.UTF_8), adminKey.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedResponse("Invalid admin key");
        }
    }

    private void listUsers(Context ctx) {
        try {
            ctx.json(store.listProfiles());
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void addCredit(Context ctx) {
        try {
            String userId = ctx.pathParam("userId");
            int balance = ledger.addCredit(userId, readAmount(ctx));
            ctx.json(Map.of("userId", userId, "credit", balance));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void setCredit(Context ctx) {
        try {
            String userId = ctx.pathParam("userId");
            int balance = ledger.setCredit(userId, readAmount(ctx));
            ctx.json(Map.of("userId", userId, "credit", balance));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void deductCredit(Context ctx) {
        try {
            String userId = ctx.pathParam("userId");
            int balance = ledger.deductCredit(userId, readAmount(ctx));
            ctx.json(Map.of("userId", userId, "credit", balance));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void listAuthorized(Context ctx) {
        ctx.json(Map.of("authorized", settings.listAuthorized()));
    }

    private void authorize(Context ctx) {
        try {
            String userId = ctx.pathParam("userId");
            boolean changed = settings.authorize(userId);
            ctx.json(Map.of("userId", userId, "authorized", true, "changed", changed));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void deauthorize(Context ctx) {
        try {
            String userId = ctx.pathParam("userId");
            boolean changed = settings.deauthorize(userId);
            ctx.json(Map.of("userId", userId, "authorized", false, "changed", changed));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void setLevel(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            JsonNode level = json != null ? json.path("level") : null;
            if (level == null || level.isMissingNode() || level.isNull()) {
                ctx.status(400).json(Map.of("error", "level is required"));
                return;
            }
            String userId = ctx.pathParam("userId");
            ctx.json(settings.setAccessLevel(userId, AccessLevel.parse(level.asText())));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void inspectMemory(Context ctx) {
        try {
            ctx.json(settings.inspectMemory(ctx.pathParam("userId")));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void clearMemory(Context ctx) {
        try {
            ctx.json(Map.of("cleared", settings.clearMemory(ctx.pathParam("userId"))));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void addModel(Context ctx) {
        try {
            ModelDescriptor descriptor = objectMapper.readValue(ctx.body(), ModelDescriptor.class);
            requireKnownProvider(descriptor.getProvider());
            ctx.status(201).json(catalog.add(descriptor));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void updateModel(Context ctx) {
        try {
            ModelDescriptor changes = objectMapper.readValue(ctx.body(), ModelDescriptor.class);
            if (changes.getProvider() != null && !changes.getProvider().isBlank()) {
                requireKnownProvider(changes.getProvider());
            }
            ctx.json(catalog.update(ctx.pathParam("name"), changes));
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void removeModel(Context ctx) {
        try {
            String name = ctx.pathParam("name");
            catalog.remove(name);
            if (logger != null) {
                logger.info("[AdminController] Model removed by operator: " + name);
            }
            ctx.status(204);
        } catch (Exception e) {
            Controller.respondError(ctx, e);
        }
    }

    private void requireKnownProvider(String provider) {
        if (!registry.hasProvider(provider)) {
            throw new IllegalArgumentException("Unknown provider '" + provider + "'; configured: "
                + registry.providerKeys());
        }
    }

    private int readAmount(Context ctx) throws IOException {
        JsonNode json = objectMapper.readTree(ctx.body());
        JsonNode amount = json != null ? json.path("amount") : null;
        if (amount == null || !amount.canConvertToInt()) {
            throw new IllegalArgumentException("amount must be an integer");
        }
        return amount.asInt();
    }
}
