package com.chatgateway;

import com.chatgateway.models.AccessLevel;
import com.chatgateway.models.ModelDescriptor;
import com.chatgateway.storage.ConversationStore;
import com.chatgateway.storage.JsonStorage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registered models, persisted to {@code models.json} under the data directory. Seeded from
 * configuration the first time the file does not exist.
 */
public class ModelCatalog {

    private static final Comparator<ModelDescriptor> DISPLAY_ORDER =
        Comparator.comparing(ModelDescriptor::getMinAccessLevel)
            .thenComparing(ModelDescriptor::getName);

    private final Map<String, ModelDescriptor> models = new ConcurrentHashMap<>();
    private final Path storagePath;
    private final ConversationStore store;
    private final AppLogger logger = AppLogger.get();

    public ModelCatalog(Path dataRoot, List<ModelDescriptor> seed, ConversationStore store) {
        this.storagePath = dataRoot.resolve("models.json");
        this.store = store;
        loadFromDisk(seed);
    }

    /**
     * @return a copy, or null when no model has that name
     */
    public ModelDescriptor find(String name) {
        if (name == null) {
            return null;
        }
        ModelDescriptor model = models.get(name);
        return model != null ? model.copy() : null;
    }

    public ModelDescriptor get(String name) {
        ModelDescriptor model = find(name);
        if (model == null) {
            throw new GatewayException(ErrorKind.MODEL_UNKNOWN, "Model '" + name + "' is not available");
        }
        return model;
    }

    public boolean contains(String name) {
        return name != null && models.containsKey(name);
    }

    public List<ModelDescriptor> list() {
        List<ModelDescriptor> results = new ArrayList<>();
        for (ModelDescriptor model : models.values()) {
            results.add(model.copy());
        }
        results.sort(DISPLAY_ORDER);
        return results;
    }

    /**
     * Models keyed by the display name of their minimum access level, lowest level first.
     */
    public Map<String, List<ModelDescriptor>> groupedByAccessLevel() {
        Map<String, List<ModelDescriptor>> grouped = new LinkedHashMap<>();
        for (AccessLevel level : AccessLevel.values()) {
            List<ModelDescriptor> tier = new ArrayList<>();
            for (ModelDescriptor model : list()) {
                if (model.getMinAccessLevel() == level) {
                    tier.add(model);
                }
            }
            if (!tier.isEmpty()) {
                grouped.put(level.displayName(), tier);
            }
        }
        return grouped;
    }

    public synchronized ModelDescriptor add(ModelDescriptor descriptor) {
        validate(descriptor);
        if (models.containsKey(descriptor.getName())) {
            throw new IllegalArgumentException("Model '" + descriptor.getName() + "' already exists");
        }
        ModelDescriptor stored = descriptor.copy();
        stored.setCreatedAt(System.currentTimeMillis());
        models.put(stored.getName(), stored);
        saveAll();
        log("Model added: " + stored.getName() + " (" + stored.getProvider() + ", cost "
            + stored.getCreditCost() + ", " + stored.getMinAccessLevel() + ")");
        return stored.copy();
    }

    /**
     * Replaces provider, upstream name, cost and level of an existing model. The name is the key
     * and cannot change.
     */
    public synchronized ModelDescriptor update(String name, ModelDescriptor changes) {
        ModelDescriptor existing = models.get(name);
        if (existing == null) {
            throw new GatewayException(ErrorKind.NOT_FOUND, "Model '" + name + "' not found");
        }
        ModelDescriptor updated = existing.copy();
        if (changes.getProvider() != null && !changes.getProvider().isBlank()) {
            updated.setProvider(changes.getProvider().trim());
        }
        if (changes.getUpstreamModel() != null) {
            updated.setUpstreamModel(changes.getUpstreamModel().isBlank() ? null : changes.getUpstreamModel().trim());
        }
        updated.setCreditCost(changes.getCreditCost());
        updated.setMinAccessLevel(changes.getMinAccessLevel());
        validate(updated);
        models.put(name, updated);
        saveAll();
        log("Model updated: " + name);
        return updated.copy();
    }

    /**
     * Runs {@code action} while {@code name} is guaranteed to stay in the catalog, so a preference
     * written by it cannot race {@link #remove}.
     *
     * @throws GatewayException MODEL_UNKNOWN when the model is not in the catalog
     */
    public synchronized <T> T withModel(String name, Supplier<T> action) {
        if (!models.containsKey(name)) {
            throw new GatewayException(ErrorKind.MODEL_UNKNOWN, "Model '" + name + "' is not available");
        }
        return action.get();
    }

    /**
     * Rejected while any user history or preference still refers to the model.
     */
    public synchronized void remove(String name) {
        if (!models.containsKey(name)) {
            throw new GatewayException(ErrorKind.NOT_FOUND, "Model '" + name + "' not found");
        }
        if (store.isModelReferenced(name)) {
            throw new IllegalStateException("Model '" + name + "' is in use and cannot be removed");
        }
        models.remove(name);
        saveAll();
        log("Model removed: " + name);
    }

    private void validate(ModelDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("Model payload is required");
        }
        String name = descriptor.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Model name is required");
        }
        if (!name.equals(name.trim()) || name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Model name cannot contain whitespace");
        }
        if (descriptor.getProvider() == null || descriptor.getProvider().isBlank()) {
            throw new IllegalArgumentException("Model provider is required");
        }
        if (descriptor.getCreditCost() < 0) {
            throw new IllegalArgumentException("Credit cost must be >= 0");
        }
    }

    private void loadFromDisk(List<ModelDescriptor> seed) {
        try {
            List<ModelDescriptor> stored = JsonStorage.readJsonList(storagePath, ModelDescriptor[].class);
            if (stored.isEmpty() && !storagePath.toFile().exists()) {
                long now = System.currentTimeMillis();
                for (ModelDescriptor model : seed) {
                    validate(model);
                    ModelDescriptor copy = model.copy();
                    copy.setCreatedAt(now);
                    models.put(copy.getName(), copy);
                }
                saveAll();
                log("Seeded " + models.size() + " models from configuration");
                return;
            }
            for (ModelDescriptor model : stored) {
                if (model != null && model.getName() != null) {
                    models.put(model.getName(), model);
                }
            }
            log("Loaded " + models.size() + " models from " + storagePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load model catalog from " + storagePath, e);
        }
    }

    private void saveAll() {
        try {
            JsonStorage.writeJson(storagePath, list());
        } catch (IOException e) {
            logWarning("Failed to save model catalog: " + e.getMessage());
            throw new UncheckedIOException("Failed to save model catalog", e);
        }
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[ModelCatalog] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[ModelCatalog] " + message);
        }
    }
}
