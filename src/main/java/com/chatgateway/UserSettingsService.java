package com.chatgateway;

import com.chatgateway.models.AccessLevel;
import com.chatgateway.models.ConversationTurn;
import com.chatgateway.models.ModelDescriptor;
import com.chatgateway.models.UserProfile;
import com.chatgateway.storage.ConversationStore;
import com.chatgateway.storage.ProfileUpdate;

import java.util.ArrayList;
import java.util.List;

/**
 * User-facing settings and memory commands: model choice, system prompt, reset, and history
 * inspection and clearing.
 */
public class UserSettingsService {

    public static final int MAX_SYSTEM_PROMPT_CHARS = 10_000;
    public static final int MEMORY_PREVIEW_TURNS = 10;
    public static final int MEMORY_PREVIEW_CHARS = 120;

    private final ConversationStore store;
    private final ModelCatalog catalog;
    private final GatewayConfig config;
    private final AppLogger logger = AppLogger.get();

    public UserSettingsService(ConversationStore store, ModelCatalog catalog, GatewayConfig config) {
        this.store = store;
        this.catalog = catalog;
        this.config = config;
    }

    public UserProfile getProfile(String userId) {
        return store.getProfile(userId);
    }

    public String effectiveModel(UserProfile profile) {
        String preferred = profile.getPreferredModel();
        return preferred != null && !preferred.isBlank() ? preferred : config.getDefaultModel();
    }

    /**
     * @throws GatewayException MODEL_UNKNOWN when the model is not in the catalog
     */
    public UserProfile setModel(String userId, String modelName) {
        String name = modelName != null ? modelName.trim() : "";
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Model name is required");
        }
        UserProfile profile = catalog.withModel(name,
            () -> store.upsertProfile(userId, ProfileUpdate.create().preferredModel(name)));
        log("User " + userId + " switched to model " + name);
        return profile;
    }

    public UserProfile setSystemPrompt(String userId, String prompt) {
        String trimmed = prompt != null ? prompt.trim() : "";
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("System prompt cannot be empty");
        }
        if (trimmed.length() > MAX_SYSTEM_PROMPT_CHARS) {
            throw new IllegalArgumentException("System prompt is too long (max " + MAX_SYSTEM_PROMPT_CHARS
                + " characters)");
        }
        UserProfile profile = store.upsertProfile(userId, ProfileUpdate.create().systemPrompt(trimmed));
        log("User " + userId + " updated system prompt (" + trimmed.length() + " chars)");
        return profile;
    }

    public String effectiveSystemPrompt(UserProfile profile) {
        String prompt = profile.getSystemPrompt();
        return prompt != null && !prompt.isBlank() ? prompt : config.getDefaultSystemPrompt();
    }

    /**
     * Restores the default model and system prompt. Credit, level and history are untouched.
     */
    public UserProfile reset(String userId) {
        UserProfile profile = store.upsertProfile(userId,
            ProfileUpdate.create().clearPreferredModel().clearSystemPrompt());
        log("User " + userId + " reset settings to defaults");
        return profile;
    }

    public UserProfile setAccessLevel(String userId, AccessLevel level) {
        if (level == null) {
            throw new IllegalArgumentException("Access level is required");
        }
        UserProfile profile = store.upsertProfile(userId, ProfileUpdate.create().accessLevel(level));
        log("Access level for " + userId + " set to " + level);
        return profile;
    }

    /**
     * Adds the user to the allowlist.
     *
     * @return false when the user was already on it
     */
    public boolean authorize(String userId) {
        if (store.getProfile(userId).isAuthorized()) {
            return false;
        }
        store.upsertProfile(userId, ProfileUpdate.create().authorized(true));
        log("Authorized " + userId);
        return true;
    }

    /**
     * @return false when the user was not on the allowlist
     */
    public boolean deauthorize(String userId) {
        if (!store.getProfile(userId).isAuthorized()) {
            return false;
        }
        store.upsertProfile(userId, ProfileUpdate.create().authorized(false));
        log("Deauthorized " + userId);
        return true;
    }

    public List<String> listAuthorized() {
        List<String> ids = new ArrayList<>();
        for (UserProfile profile : store.listProfiles()) {
            if (profile.isAuthorized()) {
                ids.add(profile.getUserId());
            }
        }
        return ids;
    }

    /**
     * Clears {@code targetId}'s history on behalf of {@code actorId}. Only an owner may clear
     * someone else's memory.
     */
    public boolean clearMemory(String actorId, String targetId) {
        String target = targetId != null && !targetId.isBlank() ? targetId : actorId;
        if (!target.equals(actorId)) {
            requireOwner(actorId);
        }
        return clearMemory(target);
    }

    public boolean clearMemory(String userId) {
        return store.clear(userId);
    }

    /**
     * Owner-only view of another user's history.
     */
    public MemorySummary inspectMemory(String actorId, String targetId) {
        requireOwner(actorId);
        return inspectMemory(targetId != null && !targetId.isBlank() ? targetId : actorId);
    }

    public MemorySummary inspectMemory(String userId) {
        List<ConversationTurn> history = store.getHistory(userId);
        int totalTokens = 0;
        for (ConversationTurn turn : history) {
            totalTokens += turn.getTokenEstimate();
        }
        List<MemorySummary.Entry> recent = new ArrayList<>();
        for (int i = Math.max(0, history.size() - MEMORY_PREVIEW_TURNS); i < history.size(); i++) {
            ConversationTurn turn = history.get(i);
            recent.add(new MemorySummary.Entry(turn.getSeq(), turn.getRole().wireName(), turn.getModel(),
                preview(turn.plainText()), turn.getTokenEstimate()));
        }
        return new MemorySummary(userId, history.size(), totalTokens, recent);
    }

    public List<ModelDescriptor> listModels() {
        return catalog.list();
    }

    private void requireOwner(String actorId) {
        if (store.getProfile(actorId).getAccessLevel() != AccessLevel.OWNER) {
            throw new GatewayException(ErrorKind.INSUFFICIENT_ACCESS_LEVEL, "Only the owner can do that");
        }
    }

    static String preview(String text) {
        String flat = text.replace('\n', ' ').trim();
        return flat.length() > MEMORY_PREVIEW_CHARS ? flat.substring(0, MEMORY_PREVIEW_CHARS) + "..." : flat;
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[UserSettings] " + message);
        }
    }

    public static class MemorySummary {
        private final String userId;
        private final int totalTurns;
        private final int totalTokens;
        private final List<Entry> recent;

        public MemorySummary(String userId, int totalTurns, int totalTokens, List<Entry> recent) {
            this.userId = userId;
            this.totalTurns = totalTurns;
            this.totalTokens = totalTokens;
            this.recent = recent;
        }

        public String getUserId() {
            return userId;
        }

        public int getTotalTurns() {
            return totalTurns;
        }

        public int getTotalTokens() {
            return totalTokens;
        }

        public List<Entry> getRecent() {
            return recent;
        }

        public static class Entry {
            private final long seq;
            private final String role;
            private final String model;
            private final String preview;
            private final int tokens;

            public Entry(long seq, String role, String model, String preview, int tokens) {
                this.seq = seq;
                this.role = role;
                this.model = model;
                this.preview = preview;
                this.tokens = tokens;
            }

            public long getSeq() {
                return seq;
            }

            public String getRole() {
                return role;
            }

            public String getModel() {
                return model;
            }

            public String getPreview() {
                return preview;
            }

            public int getTokens() {
                return tokens;
            }
        }
    }
}
