package com.chatgateway.providers.chat;

import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayConfig.ProviderSettings;
import com.chatgateway.models.ChatMessage;
import com.chatgateway.models.ContentPart;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;

public class AnthropicChatProvider extends AbstractChatProvider {

    private static final int DEFAULT_MAX_TOKENS = 1024;

    public AnthropicChatProvider(ObjectMapper mapper, HttpClient httpClient, String providerName,
                                 ProviderSettings settings) {
        super(mapper, httpClient, providerName, settings);
    }

    @Override
    protected HttpRequest buildHttpRequest(ChatRequest request, String apiKey) throws IOException {
        String url = normalizeBaseUrl(settings.getBaseUrl(), "https://api.anthropic.com") + "/v1/messages";
        return jsonPost(url, mapper.writeValueAsString(buildPayload(request)))
            .header("x-api-key", apiKey)
            .header("anthropic-version", "2023-06-01")
            .build();
    }

    ObjectNode buildPayload(ChatRequest request) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", request.getModel());
        payload.put("max_tokens", settings.getMaxOutputTokens() != null ? settings.getMaxOutputTokens() : DEFAULT_MAX_TOKENS);
        payload.put("stream", true);

        String system = buildSystemText(request.getMessages());
        if (!system.isEmpty()) {
            payload.put("system", system);
        }
        if (settings.getTemperature() != null) {
            // Anthropic accepts [0, 1]
            payload.put("temperature", Math.min(1.0, settings.getTemperature()));
        }
        if (settings.getTopP() != null) {
            payload.put("top_p", settings.getTopP());
        }

        ArrayNode messages = payload.putArray("messages");
        for (ChatMessage message : conversationMessages(request.getMessages())) {
            ObjectNode msg = messages.addObject();
            msg.put("role", message.getRole().wireName());
            ArrayNode content = msg.putArray("content");
            for (ContentPart part : message.getParts()) {
                if (isImage(part)) {
                    ObjectNode image = content.addObject();
                    image.put("type", "image");
                    ObjectNode source = image.putObject("source");
                    String[] data = parseDataUri(part.getUri());
                    if (data != null) {
                        source.put("type", "base64");
                        source.put("media_type", data[0]);
                        source.put("data", data[1]);
                    } else {
                        source.put("type", "url");
                        source.put("url", part.getUri());
                    }
                } else if (part.isText() && part.getText() != null && !part.getText().isEmpty()) {
                    content.addObject().put("type", "text").put("text", part.getText());
                }
            }
        }
        return payload;
    }

    @Override
    protected ChatStream createStream(InputStream body) {
        return new AnthropicStream(body, mapper, providerName);
    }

    /**
     * Messages API event stream: text arrives in {@code content_block_delta}, completion is
     * {@code message_stop}, and failures arrive as {@code error} events.
     */
    static class AnthropicStream extends SseChatStream {

        private Integer inputTokens;
        private Integer outputTokens;

        AnthropicStream(InputStream body, ObjectMapper mapper, String providerName) {
            super(body, mapper, providerName);
        }

        @Override
        protected void onEvent(String eventName, String data) throws JsonProcessingException {
            JsonNode node = parse(data);
            String type = node.path("type").asText(eventName != null ? eventName : "");
            switch (type) {
                case "message_start":
                    JsonNode startUsage = node.path("message").path("usage");
                    if (startUsage.path("input_tokens").isNumber()) {
                        inputTokens = startUsage.path("input_tokens").asInt();
                    }
                    break;
                case "content_block_delta":
                    JsonNode delta = node.path("delta");
                    if ("text_delta".equals(delta.path("type").asText())) {
                        emitChunk(delta.path("text").asText());
                    }
                    break;
                case "message_delta":
                    JsonNode deltaUsage = node.path("usage");
                    if (deltaUsage.path("output_tokens").isNumber()) {
                        outputTokens = deltaUsage.path("output_tokens").asInt();
                    }
                    break;
                case "message_stop":
                    emitDone(new Usage(inputTokens, outputTokens));
                    break;
                case "error":
                    JsonNode error = node.path("error");
                    emitFailure(classifyError(error.path("type").asText()),
                        getProviderName() + " error: " + error.path("message").asText(error.toString()));
                    break;
                default:
                    // ping, content_block_start, content_block_stop
                    break;
            }
        }

        static ErrorKind classifyError(String type) {
            switch (type) {
                case "authentication_error":
                case "permission_error":
                    return ErrorKind.AUTH_ERROR;
                case "rate_limit_error":
                    return ErrorKind.RATE_LIMITED;
                case "overloaded_error":
                case "api_error":
                case "timeout_error":
                    return ErrorKind.UPSTREAM_UNAVAILABLE;
                default:
                    return ErrorKind.INVALID_RESPONSE;
            }
        }
    }
}
