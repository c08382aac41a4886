package com.chatgateway.storage;

import com.chatgateway.AppLogger;
import com.chatgateway.models.AccessLevel;
import com.chatgateway.models.ConversationTurn;
import com.chatgateway.models.UserProfile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON-file conversation store. Layout per user:
 * {@code <root>/users/<encoded-id>/profile.json} and {@code history.json}.
 * Each user's record doubles as that user's lock; there is no store-wide lock.
 */
public class FileConversationStore implements ConversationStore {

    private static final int MAX_USER_ID_LENGTH = 128;

    private final Path usersRoot;
    private final int initialCredit;
    private final Map<String, UserRecord> records = new ConcurrentHashMap<>();
    private final AppLogger logger = AppLogger.get();

    public FileConversationStore(Path dataRoot, int initialCredit) {
        this.usersRoot = dataRoot.resolve("users");
        this.initialCredit = Math.max(0, initialCredit);
        try {
            Files.createDirectories(usersRoot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create user storage at " + usersRoot, e);
        }
    }

    @Override
    public UserProfile getProfile(String userId) {
        UserRecord record = record(userId);
        synchronized (record) {
            ensureProfile(record);
            return record.profile.copy();
        }
    }

    @Override
    public List<ConversationTurn> getHistory(String userId) {
        UserRecord record = record(userId);
        synchronized (record) {
            ensureHistory(record);
            List<ConversationTurn> copy = new ArrayList<>(record.history.size());
            for (ConversationTurn turn : record.history) {
                copy.add(turn.copy());
            }
            return copy;
        }
    }

    @Override
    public ConversationTurn append(String userId, ConversationTurn turn) {
        return appendAll(userId, List.of(turn)).get(0);
    }

    @Override
    public List<ConversationTurn> appendAll(String userId, List<ConversationTurn> turns) {
        Objects.requireNonNull(turns, "turns");
        UserRecord record = record(userId);
        synchronized (record) {
            ensureHistory(record);
            List<ConversationTurn> updated = new ArrayList<>(record.history);
            List<ConversationTurn> appended = new ArrayList<>(turns.size());
            long seq = record.nextSeq;
            long now = System.currentTimeMillis();
            for (ConversationTurn turn : turns) {
                if (turn == null || turn.getRole() == null) {
                    throw new IllegalArgumentException("Turn and role are required");
                }
                ConversationTurn stored = turn.copy();
                stored.setSeq(seq++);
                if (stored.getCreatedAt() <= 0) {
                    stored.setCreatedAt(now);
                }
                updated.add(stored);
                appended.add(stored.copy());
            }
            writeHistory(record, updated);
            record.history = updated;
            record.nextSeq = seq;
            return appended;
        }
    }

    @Override
    public boolean clear(String userId) {
        UserRecord record = record(userId);
        synchronized (record) {
            ensureHistory(record);
            boolean hadHistory = !record.history.isEmpty();
            writeHistory(record, new ArrayList<>());
            record.history = new ArrayList<>();
            log("Cleared history for user " + userId + " (had history: " + hadHistory + ")");
            return hadHistory;
        }
    }

    @Override
    public OptionalInt adjustCredit(String userId, int delta, int expectedMinBalance) {
        UserRecord record = record(userId);
        synchronized (record) {
            ensureProfile(record);
            int current = record.profile.getCredit();
            long next = (long) current + delta;
            if (current < expectedMinBalance || next < 0 || next > Integer.MAX_VALUE) {
                return OptionalInt.empty();
            }
            UserProfile updated = record.profile.copy();
            updated.setCredit((int) next);
            updated.setUpdatedAt(System.currentTimeMillis());
            writeProfile(record, updated);
            record.profile = updated;
            return OptionalInt.of(updated.getCredit());
        }
    }

    @Override
    public UserProfile upsertProfile(String userId, ProfileUpdate update) {
        Objects.requireNonNull(update, "update");
        UserRecord record = record(userId);
        synchronized (record) {
            ensureProfile(record);
            UserProfile updated = record.profile.copy();
            if (update.isClearPreferredModel()) {
                updated.setPreferredModel(null);
            } else if (update.getPreferredModel() != null) {
                updated.setPreferredModel(update.getPreferredModel());
            }
            if (update.isClearSystemPrompt()) {
                updated.setSystemPrompt(null);
            } else if (update.getSystemPrompt() != null) {
                updated.setSystemPrompt(update.getSystemPrompt());
            }
            if (update.getAccessLevel() != null) {
                updated.setAccessLevel(update.getAccessLevel());
            }
            if (update.getCredit() != null) {
                updated.setCredit(update.getCredit());
            }
            if (update.getAuthorized() != null) {
                updated.setAuthorized(update.getAuthorized());
            }
            updated.setUpdatedAt(System.currentTimeMillis());
            writeProfile(record, updated);
            record.profile = updated;
            return updated.copy();
        }
    }

    @Override
    public List<UserProfile> listProfiles() {
        List<UserProfile> profiles = new ArrayList<>();
        for (String userId : knownUserIds()) {
            profiles.add(getProfile(userId));
        }
        profiles.sort(Comparator.comparing(UserProfile::getUserId));
        return profiles;
    }

    @Override
    public boolean isModelReferenced(String modelName) {
        if (modelName == null) {
            return false;
        }
        for (String userId : knownUserIds()) {
            UserRecord record = record(userId);
            synchronized (record) {
                ensureProfile(record);
                if (modelName.equals(record.profile.getPreferredModel())) {
                    return true;
                }
                ensureHistory(record);
                for (ConversationTurn turn : record.history) {
                    if (modelName.equals(turn.getModel())) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private Set<String> knownUserIds() {
        Set<String> ids = new LinkedHashSet<>(records.keySet());
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(usersRoot, Files::isDirectory)) {
            for (Path dir : dirs) {
                ids.add(decodeUserId(dir.getFileName().toString()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list users under " + usersRoot, e);
        }
        return ids;
    }

    private UserRecord record(String userId) {
        validateUserId(userId);
        return records.computeIfAbsent(userId, id -> new UserRecord(id, usersRoot.resolve(encodeUserId(id))));
    }

    private void ensureProfile(UserRecord record) {
        if (record.profile != null) {
            return;
        }
        Path path = record.dir.resolve("profile.json");
        try {
            UserProfile stored = JsonStorage.readJson(path, UserProfile.class);
            if (stored != null) {
                stored.setUserId(record.userId);
                record.profile = stored;
                return;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read profile for " + record.userId, e);
        }
        long now = System.currentTimeMillis();
        UserProfile created = new UserProfile(record.userId);
        created.setAccessLevel(AccessLevel.BASIC);
        created.setCredit(initialCredit);
        created.setCreatedAt(now);
        created.setUpdatedAt(now);
        writeProfile(record, created);
        record.profile = created;
        log("Created profile for user " + record.userId + " with " + initialCredit + " credit");
    }

    private void ensureHistory(UserRecord record) {
        if (record.history != null) {
            return;
        }
        Path path = record.dir.resolve("history.json");
        try {
            List<ConversationTurn> stored = new ArrayList<>(JsonStorage.readJsonList(path, ConversationTurn[].class));
            stored.sort(Comparator.comparingLong(ConversationTurn::getSeq));
            record.history = stored;
            record.nextSeq = stored.isEmpty() ? 1 : stored.get(stored.size() - 1).getSeq() + 1;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read history for " + record.userId, e);
        }
    }

    private void writeProfile(UserRecord record, UserProfile profile) {
        try {
            JsonStorage.writeJson(record.dir.resolve("profile.json"), profile);
        } catch (IOException e) {
            logWarning("Failed to save profile for " + record.userId + ": " + e.getMessage());
            throw new UncheckedIOException("Failed to save profile for " + record.userId, e);
        }
    }

    private void writeHistory(UserRecord record, List<ConversationTurn> history) {
        try {
            JsonStorage.writeJson(record.dir.resolve("history.json"), history);
        } catch (IOException e) {
            logWarning("Failed to save history for " + record.userId + ": " + e.getMessage());
            throw new UncheckedIOException("Failed to save history for " + record.userId, e);
        }
    }

    private static void validateUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (userId.length() > MAX_USER_ID_LENGTH) {
            throw new IllegalArgumentException("userId is too long (max " + MAX_USER_ID_LENGTH + " characters)");
        }
    }

    static String encodeUserId(String userId) {
        return URLEncoder.encode(userId, StandardCharsets.UTF_8).replace(".", "%2E").replace("*", "%2A");
    }

    static String decodeUserId(String dirName) {
        return URLDecoder.decode(dirName, StandardCharsets.UTF_8);
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[ConversationStore] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[ConversationStore] " + message);
        }
    }

    private static final class UserRecord {
        private final String userId;
        private final Path dir;
        private UserProfile profile;
        private List<ConversationTurn> history;
        private long nextSeq = 1;

        private UserRecord(String userId, Path dir) {
            this.userId = userId;
            this.dir = dir;
        }
    }
}
