package com.chatgateway.providers;

import com.chatgateway.ErrorKind;
import com.chatgateway.FakeChatProvider;
import com.chatgateway.GatewayConfig;
import com.chatgateway.GatewayException;
import com.chatgateway.ModelCatalog;
import com.chatgateway.models.AccessLevel;
import com.chatgateway.models.ChatMessage;
import com.chatgateway.models.ContentPart;
import com.chatgateway.models.ModelDescriptor;
import com.chatgateway.models.Role;
import com.chatgateway.providers.chat.ChatStream;
import com.chatgateway.providers.chat.StreamEvent;
import com.chatgateway.storage.FileConversationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProviderGatewayTest {

    @TempDir
    Path dataRoot;

    private FakeChatProvider provider;
    private ProviderGateway gateway;

    private static final List<ChatMessage> MESSAGES =
        List.of(new ChatMessage(Role.USER, List.of(ContentPart.text("hi"))));

    @BeforeEach
    void setUp() {
        ModelDescriptor sonnet = new ModelDescriptor("claude-sonnet", "anthropic", 20, AccessLevel.ULTIMATE);
        sonnet.setUpstreamModel("claude-3-5-sonnet-latest");
        ModelCatalog catalog = new ModelCatalog(dataRoot, List.of(
            sonnet,
            new ModelDescriptor("orphan", "nowhere", 1, AccessLevel.BASIC)
        ), new FileConversationStore(dataRoot, 0));
        ProviderRegistry registry = new ProviderRegistry(catalog);
        provider = new FakeChatProvider("anthropic");
        registry.register("anthropic", provider);

        GatewayConfig.RetrySettings retry = new GatewayConfig.RetrySettings();
        retry.setMaxAttempts(3);
        retry.setInitialBackoffMs(1);
        retry.setMaxBackoffMs(5);
        gateway = new ProviderGateway(registry, retry);
    }

    private static List<StreamEvent> drain(ChatStream stream) throws InterruptedException {
        List<StreamEvent> events = new ArrayList<>();
        StreamEvent event;
        do {
            event = stream.next();
            events.add(event);
        } while (!event.isTerminal());
        return events;
    }

    @Test
    void sendsUpstreamModelName() throws Exception {
        provider.thenReply("hello");
        drain(gateway.stream("claude-sonnet", MESSAGES));
        assertEquals("claude-3-5-sonnet-latest", provider.getRequests().get(0).getModel());
        assertEquals(MESSAGES, provider.getRequests().get(0).getMessages());
    }

    @Test
    void retriesRetryableFailureBeforeOutput() throws Exception {
        provider.thenEvents(StreamEvent.failed(ErrorKind.RATE_LIMITED, "slow down"))
            .thenEvents(StreamEvent.failed(ErrorKind.UPSTREAM_UNAVAILABLE, "503"))
            .thenReply("fine");

        List<StreamEvent> events = drain(gateway.stream("claude-sonnet", MESSAGES));
        assertEquals(3, provider.callCount());
        assertEquals("fine", events.get(0).getText());
        assertEquals(StreamEvent.Type.DONE, events.get(1).getType());
    }

    @Test
    void neverRetriesAfterFirstChunk() throws Exception {
        provider.thenEvents(StreamEvent.chunk("par"), StreamEvent.failed(ErrorKind.UPSTREAM_UNAVAILABLE, "reset"))
            .thenReply("should not be used");

        List<StreamEvent> events = drain(gateway.stream("claude-sonnet", MESSAGES));
        assertEquals(1, provider.callCount());
        assertEquals(ErrorKind.UPSTREAM_UNAVAILABLE, events.get(events.size() - 1).getErrorKind());
    }

    @Test
    void doesNotRetryNonRetryableKinds() throws Exception {
        provider.thenEvents(StreamEvent.failed(ErrorKind.AUTH_ERROR, "bad key"));
        List<StreamEvent> events = drain(gateway.stream("claude-sonnet", MESSAGES));
        assertEquals(1, provider.callCount());
        assertEquals(ErrorKind.AUTH_ERROR, events.get(0).getErrorKind());
    }

    @Test
    void givesUpAfterMaxAttempts() throws Exception {
        for (int i = 0; i < 5; i++) {
            provider.thenEvents(StreamEvent.failed(ErrorKind.RATE_LIMITED, "429"));
        }
        List<StreamEvent> events = drain(gateway.stream("claude-sonnet", MESSAGES));
        assertEquals(3, provider.callCount());
        assertEquals(ErrorKind.RATE_LIMITED, events.get(0).getErrorKind());
    }

    @Test
    void closedStreamReportsCancelled() throws Exception {
        provider.thenReply("a", "b");
        ChatStream stream = gateway.stream("claude-sonnet", MESSAGES);
        assertEquals("a", stream.next().getText());
        stream.close();
        assertEquals(ErrorKind.CANCELLED, stream.next().getErrorKind());
    }

    @Test
    void unknownModelOrProviderIsModelUnknown() {
        GatewayException missing = assertThrows(GatewayException.class, () -> gateway.stream("ghost", MESSAGES));
        assertEquals(ErrorKind.MODEL_UNKNOWN, missing.getKind());
        GatewayException unrouted = assertThrows(GatewayException.class, () -> gateway.stream("orphan", MESSAGES));
        assertEquals(ErrorKind.MODEL_UNKNOWN, unrouted.getKind());
    }

    @Test
    void backoffGrowsAndIsCapped() {
        GatewayConfig.RetrySettings retry = new GatewayConfig.RetrySettings();
        retry.setInitialBackoffMs(100);
        retry.setMaxBackoffMs(1000);
        ProviderGateway slow = new ProviderGateway(null, retry);

        long first = slow.backoffMillis(1);
        assertTrue(first >= 100 && first <= 151, "first was " + first);
        long third = slow.backoffMillis(3);
        assertTrue(third >= 400 && third <= 451, "third was " + third);
        assertEquals(1000, slow.backoffMillis(8));
    }
}
