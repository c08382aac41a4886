package com.chatgateway.storage;

import com.chatgateway.models.ConversationTurn;
import com.chatgateway.models.UserProfile;

import java.util.List;
import java.util.OptionalInt;

/**
 * Durable per-user profile and history storage. Every operation is strongly consistent for a
 * single user; nothing is promised across users.
 */
public interface ConversationStore {

    /**
     * Returns a snapshot of the profile, creating and persisting the default profile on first access.
     */
    UserProfile getProfile(String userId);

    /**
     * Oldest turn first. The returned list is a copy.
     */
    List<ConversationTurn> getHistory(String userId);

    ConversationTurn append(String userId, ConversationTurn turn);

    /**
     * Appends all turns or none, in order, assigning consecutive sequence numbers.
     */
    List<ConversationTurn> appendAll(String userId, List<ConversationTurn> turns);

    /**
     * @return true if there was history to clear
     */
    boolean clear(String userId);

    /**
     * Conditional balance update: applied only while the current balance is at least
     * {@code expectedMinBalance}. The resulting balance is never negative.
     *
     * @return the new balance, or empty when the condition did not hold
     */
    OptionalInt adjustCredit(String userId, int delta, int expectedMinBalance);

    UserProfile upsertProfile(String userId, ProfileUpdate update);

    List<UserProfile> listProfiles();

    /**
     * True when any stored turn or any user's preferred model names the given model.
     */
    boolean isModelReferenced(String modelName);
}
