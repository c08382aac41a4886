package com.chatgateway.providers;

import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayException;
import com.chatgateway.ModelCatalog;
import com.chatgateway.models.ModelDescriptor;
import com.chatgateway.providers.chat.ChatProvider;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes a model name to the adapter that serves it. Adapters are registered by provider key;
 * model-to-provider routes are read from the catalog on every lookup, so catalog edits apply at once.
 */
public class ProviderRegistry {

    private final ModelCatalog catalog;
    private final Map<String, ChatProvider> providers = new ConcurrentHashMap<>();

    public ProviderRegistry(ModelCatalog catalog) {
        this.catalog = catalog;
    }

    public void register(String providerKey, ChatProvider provider) {
        if (providerKey == null || providerKey.isBlank()) {
            throw new IllegalArgumentException("Provider key is required");
        }
        providers.put(providerKey, provider);
    }

    public boolean hasProvider(String providerKey) {
        return providerKey != null && providers.containsKey(providerKey);
    }

    public Set<String> providerKeys() {
        return new TreeSet<>(providers.keySet());
    }

    /**
     * @throws GatewayException MODEL_UNKNOWN when the model is not registered or its provider is not configured
     */
    public Route resolve(String modelName) {
        ModelDescriptor model = catalog.find(modelName);
        if (model == null) {
            throw new GatewayException(ErrorKind.MODEL_UNKNOWN, "Model '" + modelName + "' is not available");
        }
        ChatProvider provider = providers.get(model.getProvider());
        if (provider == null) {
            throw new GatewayException(ErrorKind.MODEL_UNKNOWN,
                "Model '" + modelName + "' uses provider '" + model.getProvider() + "', which is not configured");
        }
        return new Route(model.getName(), model.resolveUpstreamModel(), provider);
    }

    public static final class Route {
        private final String modelName;
        private final String upstreamModel;
        private final ChatProvider provider;

        Route(String modelName, String upstreamModel, ChatProvider provider) {
            this.modelName = modelName;
            this.upstreamModel = upstreamModel;
            this.provider = provider;
        }

        public String getModelName() {
            return modelName;
        }

        public String getUpstreamModel() {
            return upstreamModel;
        }

        public ChatProvider getProvider() {
            return provider;
        }
    }
}
