package com.chatgateway.providers.chat;

import com.chatgateway.AppLogger;
import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayConfig.ProviderSettings;
import com.chatgateway.models.ChatMessage;
import com.chatgateway.models.ContentPart;
import com.chatgateway.models.Role;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Abstract base class for streaming chat providers with shared HTTP logic.
 */
public abstract class AbstractChatProvider implements ChatProvider {

    protected static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 100;
    private static final int MAX_ERROR_BODY_CHARS = 2000;
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;
    protected final String providerName;
    protected final ProviderSettings settings;
    private Clock clock = Clock.systemUTC();

    protected AbstractChatProvider(ObjectMapper mapper, HttpClient httpClient, String providerName,
                                   ProviderSettings settings) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.providerName = providerName;
        this.settings = settings != null ? settings : new ProviderSettings();
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    /**
     * Builds the HTTP request for a streaming completion.
     */
    protected abstract HttpRequest buildHttpRequest(ChatRequest request, String apiKey) throws IOException;

    /**
     * Wraps a successful (2xx) response body.
     */
    protected abstract ChatStream createStream(InputStream body);

    protected boolean requiresApiKey() {
        return true;
    }

    @Override
    public ChatStream stream(ChatRequest request) {
        String apiKey = settings.resolveApiKey();
        if (requiresApiKey() && (apiKey == null || apiKey.isBlank())) {
            return ChatStream.failed(ErrorKind.AUTH_ERROR, "No API key configured for " + providerName
                + (settings.getApiKeyEnv() != null ? " (set " + settings.getApiKeyEnv() + ")" : ""));
        }
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request, apiKey);
        } catch (IOException | IllegalArgumentException e) {
            return ChatStream.failed(ErrorKind.INVALID_REQUEST, "Could not build " + providerName + " request: "
                + e.getMessage());
        }

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            logWarning(providerName + " request timed out");
            return ChatStream.failed(ErrorKind.UPSTREAM_UNAVAILABLE, providerName + " request timed out");
        } catch (IOException e) {
            logWarning(providerName + " request failed: " + e.getMessage());
            return ChatStream.failed(ErrorKind.UPSTREAM_UNAVAILABLE, providerName + " is unreachable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ChatStream.failed(ErrorKind.CANCELLED, "Interrupted before " + providerName + " responded");
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String body = readErrorBody(response.body());
            ErrorKind kind = classifyStatus(status);
            logWarning(providerName + " request failed (" + status + "): " + body);
            return ChatStream.failed(kind, providerName + " request failed (" + status + "): " + body);
        }
        return createStream(response.body());
    }

    /**
     * Maps an HTTP status to the failure taxonomy.
     */
    public static ErrorKind classifyStatus(int status) {
        if (status == 401 || status == 403) {
            return ErrorKind.AUTH_ERROR;
        }
        if (status == 429) {
            return ErrorKind.RATE_LIMITED;
        }
        if (status == 408 || (status >= 500 && status <= 599)) {
            return ErrorKind.UPSTREAM_UNAVAILABLE;
        }
        return ErrorKind.INVALID_RESPONSE;
    }

    protected HttpRequest.Builder jsonPost(String url, String jsonBody) {
        return HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(resolveTimeout(settings.getTimeoutMs()))
            .header("Content-Type", "application/json")
            .header("Accept", "text/event-stream")
            .POST(HttpRequest.BodyPublishers.ofString(jsonBody));
    }

    protected Duration resolveTimeout(Integer timeoutMs) {
        if (timeoutMs != null && timeoutMs > 0) {
            return Duration.ofMillis(timeoutMs);
        }
        return Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);
    }

    /**
     * Normalize a base URL by removing trailing slashes.
     */
    protected String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    /**
     * System text as sent upstream: optional timestamp line, optional provider preamble, then the
     * conversation's own system prompt.
     */
    protected String buildSystemText(List<ChatMessage> messages) {
        List<String> sections = new ArrayList<>();
        if (settings.isInjectTimestamp()) {
            ZoneId zone = resolveZone(settings.getTimeZone());
            sections.add("Current time: " + ZonedDateTime.now(clock.withZone(zone)).format(TIMESTAMP_FORMAT));
        }
        if (settings.getSystemPreamble() != null && !settings.getSystemPreamble().isBlank()) {
            sections.add(settings.getSystemPreamble().trim());
        }
        for (ChatMessage message : messages) {
            if (message.getRole() == Role.SYSTEM) {
                String text = message.joinedText();
                if (!text.isBlank()) {
                    sections.add(text);
                }
            }
        }
        return String.join("\n\n", sections);
    }

    protected static List<ChatMessage> conversationMessages(List<ChatMessage> messages) {
        List<ChatMessage> result = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.getRole() != Role.SYSTEM) {
                result.add(message);
            }
        }
        return result;
    }

    /**
     * Splits a {@code data:} URI into media type and base64 payload; null for other URIs.
     */
    protected static String[] parseDataUri(String uri) {
        if (uri == null || !uri.startsWith("data:")) {
            return null;
        }
        int comma = uri.indexOf(',');
        int base64 = uri.indexOf(";base64");
        if (comma < 0 || base64 < 0 || base64 > comma) {
            return null;
        }
        String mediaType = uri.substring(5, base64);
        return new String[] {mediaType.isEmpty() ? "image/png" : mediaType, uri.substring(comma + 1)};
    }

    protected static boolean isImage(ContentPart part) {
        return part.isImage() && part.getUri() != null && !part.getUri().isBlank();
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    private static ZoneId resolveZone(String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (RuntimeException e) {
            return ZoneId.of("UTC");
        }
    }

    private static String readErrorBody(InputStream body) {
        try (InputStream in = body) {
            byte[] bytes = in.readNBytes(MAX_ERROR_BODY_CHARS * 4);
            String text = new String(bytes, StandardCharsets.UTF_8).trim();
            return text.length() > MAX_ERROR_BODY_CHARS ? text.substring(0, MAX_ERROR_BODY_CHARS) + "..." : text;
        } catch (IOException e) {
            return "(no body: " + e.getMessage() + ")";
        }
    }

    protected void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[" + getClass().getSimpleName() + "] " + message);
        }
    }
}
