package com.chatgateway.storage;

import com.chatgateway.models.AccessLevel;
import com.chatgateway.models.ContentPart;
import com.chatgateway.models.ConversationTurn;
import com.chatgateway.models.Role;
import com.chatgateway.models.UserProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class FileConversationStoreTest {

    @TempDir
    Path dataRoot;

    private static ConversationTurn turn(Role role, String text, String model) {
        ConversationTurn turn = new ConversationTurn(role, List.of(ContentPart.text(text)));
        turn.setModel(model);
        return turn;
    }

    @Test
    void unknownUserGetsDefaultProfile() {
        FileConversationStore store = new FileConversationStore(dataRoot, 5);
        UserProfile profile = store.getProfile("alice");

        assertEquals("alice", profile.getUserId());
        assertEquals(AccessLevel.BASIC, profile.getAccessLevel());
        assertEquals(5, profile.getCredit());
        assertNull(profile.getPreferredModel());
        assertTrue(store.getHistory("alice").isEmpty());
    }

    @Test
    void appendAllAssignsIncreasingSequenceNumbers() {
        FileConversationStore store = new FileConversationStore(dataRoot, 0);
        List<ConversationTurn> first = store.appendAll("alice",
            List.of(turn(Role.USER, "hi", null), turn(Role.ASSISTANT, "hello", "gpt-4o-mini")));
        ConversationTurn third = store.append("alice", turn(Role.USER, "again", null));

        assertEquals(1, first.get(0).getSeq());
        assertEquals(2, first.get(1).getSeq());
        assertEquals(3, third.getSeq());
        assertTrue(first.get(0).getCreatedAt() > 0);
    }

    @Test
    void historyAndProfileSurviveRestart() {
        FileConversationStore store = new FileConversationStore(dataRoot, 3);
        store.appendAll("alice", List.of(turn(Role.USER, "one", null), turn(Role.ASSISTANT, "two", "m")));
        store.upsertProfile("alice", ProfileUpdate.create().systemPrompt("be terse").accessLevel(AccessLevel.ULTIMATE));

        FileConversationStore reopened = new FileConversationStore(dataRoot, 99);
        List<ConversationTurn> history = reopened.getHistory("alice");
        assertEquals(2, history.size());
        assertEquals("one", history.get(0).plainText());
        assertEquals("m", history.get(1).getModel());
        UserProfile profile = reopened.getProfile("alice");
        assertEquals("be terse", profile.getSystemPrompt());
        assertEquals(AccessLevel.ULTIMATE, profile.getAccessLevel());
        assertEquals(3, profile.getCredit());

        assertEquals(3, reopened.append("alice", turn(Role.USER, "three", null)).getSeq());
    }

    @Test
    void returnedHistoryIsACopy() {
        FileConversationStore store = new FileConversationStore(dataRoot, 0);
        store.append("alice", turn(Role.USER, "hi", null));
        store.getHistory("alice").clear();
        assertEquals(1, store.getHistory("alice").size());
    }

    @Test
    void adjustCreditOnlyAppliesWhenBalanceCoversIt() {
        FileConversationStore store = new FileConversationStore(dataRoot, 5);

        OptionalInt first = store.adjustCredit("alice", -3, 3);
        assertEquals(2, first.getAsInt());
        assertTrue(store.adjustCredit("alice", -3, 3).isEmpty());
        assertEquals(2, store.getProfile("alice").getCredit());
        assertEquals(12, store.adjustCredit("alice", 10, Integer.MIN_VALUE).getAsInt());
    }

    @Test
    void clearRemovesHistoryButKeepsProfile() {
        FileConversationStore store = new FileConversationStore(dataRoot, 7);
        store.append("alice", turn(Role.USER, "hi", null));

        assertTrue(store.clear("alice"));
        assertFalse(store.clear("alice"));
        assertTrue(store.getHistory("alice").isEmpty());
        assertEquals(7, store.getProfile("alice").getCredit());
    }

    @Test
    void clearFlagsResetOptionalFields() {
        FileConversationStore store = new FileConversationStore(dataRoot, 0);
        store.upsertProfile("alice", ProfileUpdate.create().preferredModel("gpt-4o").systemPrompt("x"));
        UserProfile cleared = store.upsertProfile("alice",
            ProfileUpdate.create().clearPreferredModel().clearSystemPrompt());

        assertNull(cleared.getPreferredModel());
        assertNull(cleared.getSystemPrompt());
    }

    @Test
    void findsModelReferencesInPreferencesAndHistory() {
        FileConversationStore store = new FileConversationStore(dataRoot, 0);
        store.upsertProfile("alice", ProfileUpdate.create().preferredModel("gpt-4o"));
        store.append("bob", turn(Role.ASSISTANT, "reply", "claude-sonnet"));

        FileConversationStore reopened = new FileConversationStore(dataRoot, 0);
        assertTrue(reopened.isModelReferenced("gpt-4o"));
        assertTrue(reopened.isModelReferenced("claude-sonnet"));
        assertFalse(reopened.isModelReferenced("gemini-2.5-pro"));
    }

    @Test
    void listsUsersFoundOnDisk() {
        FileConversationStore store = new FileConversationStore(dataRoot, 0);
        store.getProfile("bob");
        store.getProfile("alice");

        List<UserProfile> profiles = new FileConversationStore(dataRoot, 0).listProfiles();
        assertEquals(2, profiles.size());
        assertEquals("alice", profiles.get(0).getUserId());
        assertEquals("bob", profiles.get(1).getUserId());
    }

    @Test
    void userIdsCannotEscapeTheDataDirectory() {
        FileConversationStore store = new FileConversationStore(dataRoot, 0);
        store.append("../evil", turn(Role.USER, "hi", null));

        assertFalse(Files.exists(dataRoot.resolve("evil")));
        assertTrue(Files.isDirectory(dataRoot.resolve("users").resolve(FileConversationStore.encodeUserId("../evil"))));
        assertEquals("../evil", store.listProfiles().get(0).getUserId());
    }

    @Test
    void rejectsBlankUserId() {
        FileConversationStore store = new FileConversationStore(dataRoot, 0);
        assertThrows(IllegalArgumentException.class, () -> store.getProfile(" "));
        assertThrows(IllegalArgumentException.class, () -> store.getProfile("x".repeat(200)));
    }
}
