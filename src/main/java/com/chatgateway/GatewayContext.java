package com.chatgateway;

import com.chatgateway.context.ContextAssembler;
import com.chatgateway.context.TokenEstimator;
import com.chatgateway.policy.AccessPolicy;
import com.chatgateway.providers.ProviderGateway;
import com.chatgateway.providers.ProviderRegistry;
import com.chatgateway.providers.chat.ChatProvider;
import com.chatgateway.providers.chat.ChatProviderFactory;
import com.chatgateway.queue.AdmissionQueue;
import com.chatgateway.storage.ConversationStore;
import com.chatgateway.storage.FileConversationStore;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.Map;

/**
 * Runtime holder wiring the store, catalog, policy, assembler, gateway and queue together.
 */
public class GatewayContext {

    private final GatewayConfig config;
    private final ConversationStore store;
    private final ModelCatalog catalog;
    private final CreditLedger ledger;
    private final ProviderRegistry registry;
    private final ProviderGateway gateway;
    private final ChatPipeline pipeline;
    private final AdmissionQueue queue;
    private final UserSettingsService settings;
    private final AppLogger logger = AppLogger.get();

    /**
     * Builds adapters for every configured provider.
     */
    public GatewayContext(GatewayConfig config, Path dataRoot, ObjectMapper objectMapper) {
        this(config, dataRoot, Map.of(), new ChatProviderFactory(objectMapper));
    }

    /**
     * @param overrides adapters to register instead of the configured ones, by provider key
     */
    public GatewayContext(GatewayConfig config, Path dataRoot, Map<String, ChatProvider> overrides,
                          ChatProviderFactory factory) {
        this.config = config;
        this.store = new FileConversationStore(dataRoot, config.getInitialCredit());
        this.catalog = new ModelCatalog(dataRoot, config.getModels(), store);
        this.ledger = new CreditLedger(store);
        this.registry = new ProviderRegistry(catalog);
        for (Map.Entry<String, GatewayConfig.ProviderSettings> entry : config.getProviders().entrySet()) {
            if (!overrides.containsKey(entry.getKey())) {
                registry.register(entry.getKey(), factory.getProvider(entry.getKey(), entry.getValue()));
            }
        }
        overrides.forEach(registry::register);
        this.gateway = new ProviderGateway(registry, config.getRetry());
        TokenEstimator estimator = new TokenEstimator();
        this.pipeline = new ChatPipeline(store, catalog, new AccessPolicy(), ledger,
            new ContextAssembler(estimator, config.getMaxTokens(), config.getMaxTurns()),
            gateway, estimator, config);
        this.queue = new AdmissionQueue(pipeline, config.getPerUserQueueDepth(),
            config.getGlobalConcurrencyLimit(), config.getRequestTimeoutMs());
        this.settings = new UserSettingsService(store, catalog, config);
        if (logger != null) {
            logger.info("Gateway context loaded: " + catalog.list().size() + " models, providers "
                + registry.providerKeys() + ", data in " + dataRoot);
        }
    }

    public GatewayConfig config() {
        return config;
    }

    public ConversationStore store() {
        return store;
    }

    public ModelCatalog catalog() {
        return catalog;
    }

    public CreditLedger ledger() {
        return ledger;
    }

    public ProviderRegistry registry() {
        return registry;
    }

    public ProviderGateway gateway() {
        return gateway;
    }

    public ChatPipeline pipeline() {
        return pipeline;
    }

    public AdmissionQueue queue() {
        return queue;
    }

    public UserSettingsService settings() {
        return settings;
    }

    public void shutdown() {
        queue.shutdown();
    }
}
