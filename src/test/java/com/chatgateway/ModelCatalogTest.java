package com.chatgateway;

import com.chatgateway.models.AccessLevel;
import com.chatgateway.models.ModelDescriptor;
import com.chatgateway.storage.FileConversationStore;
import com.chatgateway.storage.ProfileUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelCatalogTest {

    @TempDir
    Path dataRoot;

    private FileConversationStore store;
    private ModelCatalog catalog;

    @BeforeEach
    void setUp() {
        store = new FileConversationStore(dataRoot, 0);
        catalog = new ModelCatalog(dataRoot, List.of(
            new ModelDescriptor("gpt-4o", "openai", 10, AccessLevel.ADVANCED),
            new ModelDescriptor("gpt-4o-mini", "openai", 1, AccessLevel.BASIC)
        ), store);
    }

    @Test
    void seedsOnFirstStartAndPersists() {
        assertTrue(Files.exists(dataRoot.resolve("models.json")));
        ModelCatalog reopened = new ModelCatalog(dataRoot, List.of(), store);
        assertTrue(reopened.contains("gpt-4o"));
        assertEquals(2, reopened.list().size());
    }

    @Test
    void listIsOrderedByLevelThenName() {
        List<ModelDescriptor> models = catalog.list();
        assertEquals("gpt-4o-mini", models.get(0).getName());
        assertEquals("gpt-4o", models.get(1).getName());

        Map<String, List<ModelDescriptor>> grouped = catalog.groupedByAccessLevel();
        assertEquals(List.of("Basic", "Advanced"), List.copyOf(grouped.keySet()));
    }

    @Test
    void getOfUnknownModelFails() {
        assertNull(catalog.find("ghost"));
        GatewayException error = assertThrows(GatewayException.class, () -> catalog.get("ghost"));
        assertEquals(ErrorKind.MODEL_UNKNOWN, error.getKind());
    }

    @Test
    void addRejectsDuplicatesAndBadInput() {
        catalog.add(new ModelDescriptor("gemini-2.5-flash", "gemini", 2, AccessLevel.BASIC));
        assertTrue(catalog.contains("gemini-2.5-flash"));

        assertThrows(IllegalArgumentException.class,
            () -> catalog.add(new ModelDescriptor("gpt-4o", "openai", 1, AccessLevel.BASIC)));
        assertThrows(IllegalArgumentException.class,
            () -> catalog.add(new ModelDescriptor("bad name", "openai", 1, AccessLevel.BASIC)));
        assertThrows(IllegalArgumentException.class,
            () -> catalog.add(new ModelDescriptor("neg", "openai", -1, AccessLevel.BASIC)));
    }

    @Test
    void updateReplacesCostAndLevel() {
        ModelDescriptor changes = new ModelDescriptor("gpt-4o", null, 4, AccessLevel.BASIC);
        ModelDescriptor updated = catalog.update("gpt-4o", changes);

        assertEquals("openai", updated.getProvider());
        assertEquals(4, updated.getCreditCost());
        assertEquals(AccessLevel.BASIC, catalog.get("gpt-4o").getMinAccessLevel());

        GatewayException error = assertThrows(GatewayException.class, () -> catalog.update("ghost", changes));
        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
    }

    @Test
    void removeRefusesModelsStillInUse() {
        store.upsertProfile("alice", ProfileUpdate.create().preferredModel("gpt-4o"));

        assertThrows(IllegalStateException.class, () -> catalog.remove("gpt-4o"));
        catalog.remove("gpt-4o-mini");
        assertFalse(catalog.contains("gpt-4o-mini"));
        assertFalse(new ModelCatalog(dataRoot, List.of(), store).contains("gpt-4o-mini"));
    }

    @Test
    void returnedDescriptorsAreCopies() {
        catalog.find("gpt-4o").setCreditCost(999);
        assertEquals(10, catalog.get("gpt-4o").getCreditCost());
    }
}
