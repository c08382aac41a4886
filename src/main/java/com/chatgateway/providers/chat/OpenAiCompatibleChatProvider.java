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

/**
 * OpenAI-compatible chat completions with {@code stream: true}.
 * Handles: openai, openrouter, grok, togetherai, ollama, lmstudio, custom
 */
public class OpenAiCompatibleChatProvider extends AbstractChatProvider {

    public OpenAiCompatibleChatProvider(ObjectMapper mapper, HttpClient httpClient, String providerName,
                                        ProviderSettings settings) {
        super(mapper, httpClient, providerName, settings);
    }

    @Override
    protected boolean requiresApiKey() {
        return settings.getApiKeyEnv() != null && !settings.getApiKeyEnv().isBlank();
    }

    @Override
    protected HttpRequest buildHttpRequest(ChatRequest request, String apiKey) throws IOException {
        String url = normalizeOpenAiBaseUrl(settings.getBaseUrl(), defaultOpenAiBase(providerName)) + "/v1/chat/completions";
        HttpRequest.Builder builder = jsonPost(url, mapper.writeValueAsString(buildPayload(request)));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    ObjectNode buildPayload(ChatRequest request) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", request.getModel());
        payload.put("stream", true);
        payload.putObject("stream_options").put("include_usage", true);

        ArrayNode messages = payload.putArray("messages");
        String system = buildSystemText(request.getMessages());
        if (!system.isEmpty()) {
            messages.addObject().put("role", "system").put("content", system);
        }
        for (ChatMessage message : conversationMessages(request.getMessages())) {
            ObjectNode msg = messages.addObject();
            msg.put("role", message.getRole().wireName());
            if (!message.hasImages()) {
                msg.put("content", message.joinedText());
                continue;
            }
            ArrayNode content = msg.putArray("content");
            for (ContentPart part : message.getParts()) {
                if (isImage(part)) {
                    ObjectNode image = content.addObject();
                    image.put("type", "image_url");
                    image.putObject("image_url").put("url", part.getUri());
                } else if (part.isText() && part.getText() != null && !part.getText().isEmpty()) {
                    content.addObject().put("type", "text").put("text", part.getText());
                }
            }
        }

        if (settings.getTemperature() != null) {
            payload.put("temperature", settings.getTemperature());
        }
        if (settings.getTopP() != null) {
            payload.put("top_p", settings.getTopP());
        }
        if (settings.getMaxOutputTokens() != null) {
            payload.put("max_tokens", settings.getMaxOutputTokens());
        }
        return payload;
    }

    @Override
    protected ChatStream createStream(InputStream body) {
        return new OpenAiStream(body, mapper, providerName);
    }

    private String defaultOpenAiBase(String provider) {
        switch (provider) {
            case "openai":
                return "https://api.openai.com";
            case "openrouter":
                return "https://openrouter.ai/api";
            case "grok":
                return "https://api.x.ai";
            case "togetherai":
                return "https://api.together.xyz";
            case "ollama":
                return "http://localhost:11434";
            default:
                return "http://localhost:1234";
        }
    }

    private String normalizeOpenAiBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }

    /**
     * {@code data:} lines carrying completion chunks, terminated by {@code data: [DONE]}. Servers that
     * omit the marker still complete cleanly once a finish reason was seen.
     */
    static class OpenAiStream extends SseChatStream {

        private Usage usage;
        private boolean finished;

        OpenAiStream(InputStream body, ObjectMapper mapper, String providerName) {
            super(body, mapper, providerName);
        }

        @Override
        protected void onEvent(String eventName, String data) throws JsonProcessingException {
            String trimmed = data.trim();
            if (trimmed.isEmpty()) {
                return;
            }
            if ("[DONE]".equals(trimmed)) {
                emitDone(usage);
                return;
            }
            JsonNode node = parse(trimmed);
            JsonNode error = node.path("error");
            if (!error.isMissingNode() && !error.isNull()) {
                emitFailure(classifyError(error), getProviderName() + " error: " + error.path("message").asText(error.toString()));
                return;
            }
            JsonNode usageNode = node.path("usage");
            if (usageNode.isObject()) {
                usage = new Usage(intOrNull(usageNode.path("prompt_tokens")), intOrNull(usageNode.path("completion_tokens")));
            }
            JsonNode choices = node.path("choices");
            if (choices.isArray() && choices.size() > 0) {
                JsonNode choice = choices.get(0);
                JsonNode content = choice.path("delta").path("content");
                if (content.isTextual()) {
                    emitChunk(content.asText());
                }
                JsonNode finishReason = choice.path("finish_reason");
                if (finishReason.isTextual()) {
                    finished = true;
                }
            }
        }

        @Override
        protected void onEndOfStream() {
            if (finished) {
                emitDone(usage);
            } else {
                super.onEndOfStream();
            }
        }

        private static ErrorKind classifyError(JsonNode error) {
            JsonNode code = error.path("code");
            if (code.isInt()) {
                return classifyStatus(code.asInt());
            }
            String type = error.path("type").asText("") + " " + code.asText("");
            if (type.contains("rate_limit")) {
                return ErrorKind.RATE_LIMITED;
            }
            if (type.contains("auth") || type.contains("invalid_api_key")) {
                return ErrorKind.AUTH_ERROR;
            }
            if (type.contains("server_error") || type.contains("overloaded")) {
                return ErrorKind.UPSTREAM_UNAVAILABLE;
            }
            return ErrorKind.INVALID_RESPONSE;
        }

        private static Integer intOrNull(JsonNode node) {
            return node.isNumber() ? node.asInt() : null;
        }
    }
}
