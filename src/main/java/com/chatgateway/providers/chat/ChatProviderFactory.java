package com.chatgateway.providers.chat;

import com.chatgateway.GatewayConfig.ProviderSettings;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for creating and caching chat provider instances by provider key.
 */
public class ChatProviderFactory {

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final Map<String, ChatProvider> providerCache = new ConcurrentHashMap<>();

    public ChatProviderFactory(ObjectMapper mapper) {
        this.mapper = mapper;
        this.httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    /**
     * Get a chat provider for the given provider key. The adapter family comes from
     * {@code settings.type}, falling back to the key itself. Providers are cached for reuse.
     */
    public ChatProvider getProvider(String providerName, ProviderSettings settings) {
        if (providerName == null || providerName.isBlank()) {
            throw new IllegalArgumentException("Provider name is required");
        }
        return providerCache.computeIfAbsent(providerName, name -> createProvider(name, settings));
    }

    private ChatProvider createProvider(String providerName, ProviderSettings settings) {
        String type = settings != null && settings.getType() != null && !settings.getType().isBlank()
            ? settings.getType().trim().toLowerCase()
            : providerName;
        switch (type) {
            case "anthropic":
                return new AnthropicChatProvider(mapper, httpClient, providerName, settings);
            case "gemini":
                return new GeminiChatProvider(mapper, httpClient, providerName, settings);
            case "openai":
            case "openrouter":
            case "grok":
            case "togetherai":
            case "ollama":
            case "lmstudio":
            case "custom":
            default:
                return new OpenAiCompatibleChatProvider(mapper, httpClient, providerName, settings);
        }
    }
}
