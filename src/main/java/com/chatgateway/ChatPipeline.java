package com.chatgateway;

import com.chatgateway.context.AssembledContext;
import com.chatgateway.context.ContextAssembler;
import com.chatgateway.context.TokenEstimator;
import com.chatgateway.models.AccessLevel;
import com.chatgateway.models.ChatMessage;
import com.chatgateway.models.ContentPart;
import com.chatgateway.models.ConversationTurn;
import com.chatgateway.models.ModelDescriptor;
import com.chatgateway.models.Role;
import com.chatgateway.models.UserProfile;
import com.chatgateway.policy.AccessPolicy;
import com.chatgateway.policy.Authorization;
import com.chatgateway.providers.ProviderGateway;
import com.chatgateway.providers.chat.ChatStream;
import com.chatgateway.providers.chat.StreamEvent;
import com.chatgateway.providers.chat.Usage;
import com.chatgateway.queue.TurnHandle;
import com.chatgateway.queue.TurnProcessor;
import com.chatgateway.queue.TurnResult;
import com.chatgateway.storage.ConversationStore;

import java.util.List;

/**
 * One turn, start to finish: authorize, assemble context, stream from the provider, then commit
 * the exchange and the charge together. Nothing is written unless the provider completed.
 */
public class ChatPipeline implements TurnProcessor {

    private final ConversationStore store;
    private final ModelCatalog catalog;
    private final AccessPolicy policy;
    private final CreditLedger ledger;
    private final ContextAssembler assembler;
    private final ProviderGateway gateway;
    private final TokenEstimator estimator;
    private final GatewayConfig config;
    private final AppLogger logger = AppLogger.get();

    public ChatPipeline(ConversationStore store, ModelCatalog catalog, AccessPolicy policy, CreditLedger ledger,
                        ContextAssembler assembler, ProviderGateway gateway, TokenEstimator estimator,
                        GatewayConfig config) {
        this.store = store;
        this.catalog = catalog;
        this.policy = policy;
        this.ledger = ledger;
        this.assembler = assembler;
        this.gateway = gateway;
        this.estimator = estimator;
        this.config = config;
    }

    @Override
    public void process(TurnHandle handle) {
        String userId = handle.getUserId();
        List<ContentPart> parts = handle.getRequest().toParts();

        UserProfile profile = store.getProfile(userId);
        if (config.isRestrictToAuthorizedUsers() && !profile.isAuthorized()
                && profile.getAccessLevel() != AccessLevel.OWNER) {
            throw new GatewayException(ErrorKind.NOT_AUTHORIZED, "You do not have permission to use this gateway");
        }
        String modelName = resolveModel(profile);
        ModelDescriptor model = catalog.find(modelName);
        Authorization authorization = policy.authorize(profile, model, modelName).orThrow();

        List<ConversationTurn> history = store.getHistory(userId);
        ChatMessage userMessage = new ChatMessage(Role.USER, parts);
        AssembledContext context = assembler.assemble(resolveSystemPrompt(profile), history, userMessage);
        if (context.getDroppedTurns() > 0) {
            log("Trimmed " + context.getDroppedTurns() + " history turn(s) for " + userId
                + " (~" + context.getEstimatedTokens() + " tokens kept)");
        }
        if (!handle.isRunning()) {
            return;
        }

        StringBuilder output = new StringBuilder();
        Usage usage;
        ChatStream stream = gateway.stream(model.getName(), context.getMessages());
        handle.attach(stream);
        try {
            usage = consume(handle, stream, output);
        } finally {
            stream.close();
        }
        if (usage == null) {
            return;
        }
        if (output.toString().isBlank()) {
            throw new GatewayException(ErrorKind.INVALID_RESPONSE, "Model '" + model.getName() + "' returned an empty response");
        }
        if (!handle.beginCommit()) {
            return;
        }
        commit(handle, model, authorization, userMessage, output.toString(), usage, context);
    }

    /**
     * Relays chunks until the terminal event.
     *
     * @return usage on success, null when the handle stopped running (cancelled or timed out)
     */
    private Usage consume(TurnHandle handle, ChatStream stream, StringBuilder output) {
        while (true) {
            if (!handle.isRunning()) {
                return null;
            }
            StreamEvent event;
            try {
                event = stream.next();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (!handle.isRunning()) {
                    return null;
                }
                throw new GatewayException(ErrorKind.CANCELLED, "Interrupted while streaming");
            }
            if (!handle.isRunning()) {
                return null;
            }
            switch (event.getType()) {
                case CHUNK:
                    output.append(event.getText());
                    handle.emitChunk(event.getText());
                    break;
                case DONE:
                    return event.getUsage();
                default:
                    if (output.length() > 0) {
                        logWarning("Discarding " + output.length() + " chars of partial output for "
                            + handle.getUserId() + ": " + event.getErrorKind());
                    }
                    throw new GatewayException(event.getErrorKind(), event.getMessage());
            }
        }
    }

    private void commit(TurnHandle handle, ModelDescriptor model, Authorization authorization,
                        ChatMessage userMessage, String reply, Usage usage, AssembledContext context) {
        String userId = handle.getUserId();
        ConversationTurn userTurn = new ConversationTurn(Role.USER, userMessage.getParts());
        userTurn.setModel(model.getName());
        userTurn.setTokenEstimate(estimator.estimate(userMessage));
        ConversationTurn assistantTurn = new ConversationTurn(Role.ASSISTANT, List.of(ContentPart.text(reply)));
        assistantTurn.setModel(model.getName());
        assistantTurn.setTokenEstimate(estimator.estimate(assistantTurn.getParts()));

        int cost = authorization.getCost();
        int remaining = ledger.deduct(userId, cost);
        try {
            store.appendAll(userId, List.of(userTurn, assistantTurn));
        } catch (RuntimeException e) {
            ledger.refund(userId, cost);
            logError("Failed to record turn for " + userId + ", charge refunded", e);
            throw new GatewayException(ErrorKind.INTERNAL, "Failed to save conversation", e);
        }
        handle.complete(new TurnResult(handle.getRequestId(), userId, model.getName(), reply, usage,
            cost, remaining, context.getEstimatedTokens(), context.getDroppedTurns()));
        log("Turn " + handle.getRequestId() + " for " + userId + " on " + model.getName()
            + " committed (cost " + cost + ", balance " + remaining + ")");
    }

    String resolveModel(UserProfile profile) {
        String preferred = profile.getPreferredModel();
        return preferred != null && !preferred.isBlank() ? preferred : config.getDefaultModel();
    }

    String resolveSystemPrompt(UserProfile profile) {
        String prompt = profile.getSystemPrompt();
        return prompt != null && !prompt.isBlank() ? prompt : config.getDefaultSystemPrompt();
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[ChatPipeline] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[ChatPipeline] " + message);
        }
    }

    private void logError(String message, Throwable t) {
        if (logger != null) {
            logger.error("[ChatPipeline] " + message, t);
        }
    }
}
