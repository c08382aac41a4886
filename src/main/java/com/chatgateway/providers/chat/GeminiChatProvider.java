package com.chatgateway.providers.chat;

import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayConfig.ProviderSettings;
import com.chatgateway.models.ChatMessage;
import com.chatgateway.models.ContentPart;
import com.chatgateway.models.Role;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

public class GeminiChatProvider extends AbstractChatProvider {

    public GeminiChatProvider(ObjectMapper mapper, HttpClient httpClient, String providerName,
                              ProviderSettings settings) {
        super(mapper, httpClient, providerName, settings);
    }

    @Override
    protected HttpRequest buildHttpRequest(ChatRequest request, String apiKey) throws IOException {
        String baseUrl = normalizeGeminiBaseUrl(settings.getBaseUrl(), "https://generativelanguage.googleapis.com");
        String url = baseUrl + "/v1beta/models/" + URLEncoder.encode(request.getModel(), StandardCharsets.UTF_8)
            + ":streamGenerateContent?alt=sse";
        return jsonPost(url, mapper.writeValueAsString(buildPayload(request)))
            .header("x-goog-api-key", apiKey)
            .build();
    }

    ObjectNode buildPayload(ChatRequest request) {
        ObjectNode payload = mapper.createObjectNode();
        String system = buildSystemText(request.getMessages());
        if (!system.isEmpty()) {
            payload.putObject("systemInstruction").putArray("parts").addObject().put("text", system);
        }

        ArrayNode contents = payload.putArray("contents");
        for (ChatMessage message : conversationMessages(request.getMessages())) {
            ObjectNode content = contents.addObject();
            content.put("role", message.getRole() == Role.ASSISTANT ? "model" : "user");
            ArrayNode parts = content.putArray("parts");
            for (ContentPart part : message.getParts()) {
                if (isImage(part)) {
                    String[] data = parseDataUri(part.getUri());
                    if (data != null) {
                        ObjectNode inline = parts.addObject().putObject("inline_data");
                        inline.put("mime_type", data[0]);
                        inline.put("data", data[1]);
                    } else {
                        ObjectNode file = parts.addObject().putObject("file_data");
                        file.put("mime_type", imageMimeType(part.getUri()));
                        file.put("file_uri", part.getUri());
                    }
                } else if (part.isText() && part.getText() != null && !part.getText().isEmpty()) {
                    parts.addObject().put("text", part.getText());
                }
            }
        }

        ObjectNode generationConfig = mapper.createObjectNode();
        if (settings.getTemperature() != null) {
            generationConfig.put("temperature", settings.getTemperature());
        }
        if (settings.getTopP() != null) {
            generationConfig.put("topP", settings.getTopP());
        }
        if (settings.getMaxOutputTokens() != null) {
            generationConfig.put("maxOutputTokens", settings.getMaxOutputTokens());
        }
        if (generationConfig.size() > 0) {
            payload.set("generationConfig", generationConfig);
        }
        return payload;
    }

    @Override
    protected ChatStream createStream(InputStream body) {
        return new GeminiStream(body, mapper, providerName);
    }

    /**
     * Gemini needs a mime type next to every file URI. Guessed from the extension, JPEG when there
     * is none.
     */
    static String imageMimeType(String uri) {
        String path = uri;
        int cut = path.indexOf('?');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        cut = path.indexOf('#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".png")) {
            return "image/png";
        }
        if (lower.endsWith(".webp")) {
            return "image/webp";
        }
        if (lower.endsWith(".gif")) {
            return "image/gif";
        }
        if (lower.endsWith(".heic")) {
            return "image/heic";
        }
        if (lower.endsWith(".heif")) {
            return "image/heif";
        }
        return "image/jpeg";
    }

    private String normalizeGeminiBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/v1beta/models")) {
            url = url.substring(0, url.length() - 14);
        }
        if (url.endsWith("/v1beta")) {
            url = url.substring(0, url.length() - 7);
        }
        return url;
    }

    /**
     * {@code streamGenerateContent?alt=sse}: every event is a full response fragment. There is no
     * end marker, so the stream is complete when the body ends after a finish reason.
     */
    static class GeminiStream extends SseChatStream {

        private Usage usage;
        private boolean finished;

        GeminiStream(InputStream body, ObjectMapper mapper, String providerName) {
            super(body, mapper, providerName);
        }

        @Override
        protected void onEvent(String eventName, String data) throws JsonProcessingException {
            JsonNode node = parse(data);
            JsonNode error = node.path("error");
            if (error.isObject()) {
                ErrorKind kind = error.path("code").isInt()
                    ? classifyStatus(error.path("code").asInt())
                    : ErrorKind.INVALID_RESPONSE;
                emitFailure(kind, getProviderName() + " error: " + error.path("message").asText(error.toString()));
                return;
            }
            String blockReason = node.path("promptFeedback").path("blockReason").asText("");
            if (!blockReason.isEmpty()) {
                emitFailure(ErrorKind.INVALID_RESPONSE, getProviderName() + " blocked the prompt: " + blockReason);
                return;
            }
            JsonNode usageNode = node.path("usageMetadata");
            if (usageNode.isObject()) {
                usage = new Usage(
                    usageNode.path("promptTokenCount").isNumber() ? usageNode.path("promptTokenCount").asInt() : null,
                    usageNode.path("candidatesTokenCount").isNumber() ? usageNode.path("candidatesTokenCount").asInt() : null);
            }
            JsonNode candidates = node.path("candidates");
            if (candidates.isArray() && candidates.size() > 0) {
                JsonNode first = candidates.get(0);
                JsonNode parts = first.path("content").path("parts");
                if (parts.isArray()) {
                    StringBuilder text = new StringBuilder();
                    for (JsonNode part : parts) {
                        if (part.path("text").isTextual() && !part.path("thought").asBoolean(false)) {
                            text.append(part.path("text").asText());
                        }
                    }
                    emitChunk(text.toString());
                }
                if (first.path("finishReason").isTextual()) {
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
    }
}
