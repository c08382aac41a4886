package com.chatgateway.context;

import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayException;
import com.chatgateway.models.ChatMessage;
import com.chatgateway.models.ConversationTurn;
import com.chatgateway.models.Role;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the token-bounded message list for one turn. Trimming keeps a contiguous run of the newest
 * history turns and drops whole turns from the oldest end.
 */
public class ContextAssembler {

    private final TokenEstimator estimator;
    private final int maxTokens;
    private final int maxTurns;

    public ContextAssembler(TokenEstimator estimator, int maxTokens, int maxTurns) {
        if (maxTokens <= 0 || maxTurns <= 0) {
            throw new IllegalArgumentException("maxTokens and maxTurns must be > 0");
        }
        this.estimator = estimator;
        this.maxTokens = maxTokens;
        this.maxTurns = maxTurns;
    }

    /**
     * @throws GatewayException PAYLOAD_TOO_LARGE when the system prompt and new turn alone exceed the budget
     */
    public AssembledContext assemble(String systemPrompt, List<ConversationTurn> history, ChatMessage newTurn) {
        if (newTurn == null || newTurn.getRole() != Role.USER) {
            throw new IllegalArgumentException("New turn must be a user message");
        }
        ChatMessage system = systemPrompt != null && !systemPrompt.isBlank()
            ? ChatMessage.system(systemPrompt)
            : null;
        int fixed = estimator.estimate(newTurn) + (system != null ? estimator.estimate(system) : 0);
        if (fixed > maxTokens) {
            throw new GatewayException(ErrorKind.PAYLOAD_TOO_LARGE,
                "Message is too large: about " + fixed + " tokens, limit is " + maxTokens);
        }

        List<ConversationTurn> turns = history != null ? history : List.of();
        int firstCandidate = Math.max(0, turns.size() - maxTurns);
        int used = fixed;
        int keepFrom = turns.size();
        for (int i = turns.size() - 1; i >= firstCandidate; i--) {
            ConversationTurn turn = turns.get(i);
            if (turn.getRole() == Role.SYSTEM) {
                continue;
            }
            int cost = estimator.estimate(turn);
            if (used + cost > maxTokens) {
                break;
            }
            used += cost;
            keepFrom = i;
        }

        List<ChatMessage> messages = new ArrayList<>();
        if (system != null) {
            messages.add(system);
        }
        int kept = 0;
        for (int i = keepFrom; i < turns.size(); i++) {
            ConversationTurn turn = turns.get(i);
            if (turn.getRole() == Role.SYSTEM) {
                continue;
            }
            messages.add(ChatMessage.of(turn));
            kept++;
        }
        messages.add(newTurn);
        return new AssembledContext(messages, used, kept, keepFrom);
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public int getMaxTurns() {
        return maxTurns;
    }
}
