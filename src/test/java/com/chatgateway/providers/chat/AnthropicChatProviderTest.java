package com.chatgateway.providers.chat;

import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayConfig.ProviderSettings;
import com.chatgateway.models.ChatMessage;
import com.chatgateway.models.ContentPart;
import com.chatgateway.models.Role;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.List;

import static com.chatgateway.providers.chat.StreamTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class AnthropicChatProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private AnthropicChatProvider.AnthropicStream stream(String... lines) {
        return new AnthropicChatProvider.AnthropicStream(body(lines), mapper, "anthropic");
    }

    @Test
    void readsMessagesEventStream() throws Exception {
        List<StreamEvent> events = drain(stream(
            "event: message_start",
            "data: {\"type\":\"message_start\",\"message\":{\"usage\":{\"input_tokens\":25}}}",
            "",
            "event: ping",
            "data: {\"type\":\"ping\"}",
            "",
            "event: content_block_delta",
            "data: {\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Bon\"}}",
            "",
            "event: content_block_delta",
            "data: {\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"jour\"}}",
            "",
            "event: message_delta",
            "data: {\"type\":\"message_delta\",\"delta\":{\"stop_reason\":\"end_turn\"},\"usage\":{\"output_tokens\":3}}",
            "",
            "event: message_stop",
            "data: {\"type\":\"message_stop\"}",
            ""
        ));

        assertEquals("Bonjour", text(events));
        StreamEvent done = last(events);
        assertEquals(StreamEvent.Type.DONE, done.getType());
        assertEquals(25, done.getUsage().getPromptTokens());
        assertEquals(3, done.getUsage().getCompletionTokens());
    }

    @Test
    void overloadedErrorIsRetryableKind() throws Exception {
        List<StreamEvent> events = drain(stream(
            "event: error",
            "data: {\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}",
            ""
        ));
        assertEquals(ErrorKind.UPSTREAM_UNAVAILABLE, last(events).getErrorKind());
        assertTrue(last(events).getErrorKind().isRetryable());
    }

    @Test
    void missingMessageStopIsInvalid() throws Exception {
        List<StreamEvent> events = drain(stream(
            "event: content_block_delta",
            "data: {\"type\":\"content_block_delta\",\"delta\":{\"type\":\"text_delta\",\"text\":\"Hi\"}}",
            ""
        ));
        assertEquals(ErrorKind.INVALID_RESPONSE, last(events).getErrorKind());
    }

    @Test
    void errorTypesMapToKinds() {
        assertEquals(ErrorKind.AUTH_ERROR, AnthropicChatProvider.AnthropicStream.classifyError("authentication_error"));
        assertEquals(ErrorKind.RATE_LIMITED, AnthropicChatProvider.AnthropicStream.classifyError("rate_limit_error"));
        assertEquals(ErrorKind.INVALID_RESPONSE, AnthropicChatProvider.AnthropicStream.classifyError("invalid_request_error"));
    }

    @Test
    void payloadUsesTopLevelSystemAndImageSources() {
        ProviderSettings settings = new ProviderSettings();
        settings.setTemperature(1.7);
        AnthropicChatProvider provider =
            new AnthropicChatProvider(mapper, HttpClient.newHttpClient(), "anthropic", settings);

        JsonNode payload = provider.buildPayload(new ChatRequest("claude-3-5-sonnet-latest", List.of(
            ChatMessage.system("Be brief."),
            new ChatMessage(Role.USER, List.of(
                ContentPart.text("compare"),
                ContentPart.image("data:image/jpeg;base64,QUJD", null, null),
                ContentPart.image("https://example.com/b.png", null, null)))
        )));

        assertEquals("Be brief.", payload.path("system").asText());
        assertEquals(1024, payload.path("max_tokens").asInt());
        assertEquals(1.0, payload.path("temperature").asDouble());
        JsonNode messages = payload.path("messages");
        assertEquals(1, messages.size());
        JsonNode content = messages.get(0).path("content");
        assertEquals("compare", content.get(0).path("text").asText());
        assertEquals("base64", content.get(1).path("source").path("type").asText());
        assertEquals("image/jpeg", content.get(1).path("source").path("media_type").asText());
        assertEquals("QUJD", content.get(1).path("source").path("data").asText());
        assertEquals("url", content.get(2).path("source").path("type").asText());
    }
}
