package com.chatgateway.context;

import com.chatgateway.models.ChatMessage;

import java.util.List;

/**
 * Messages ready for a provider: system prompt first, then the kept history suffix, then the new turn.
 */
public final class AssembledContext {

    private final List<ChatMessage> messages;
    private final int estimatedTokens;
    private final int keptTurns;
    private final int droppedTurns;

    public AssembledContext(List<ChatMessage> messages, int estimatedTokens, int keptTurns, int droppedTurns) {
        this.messages = List.copyOf(messages);
        this.estimatedTokens = estimatedTokens;
        this.keptTurns = keptTurns;
        this.droppedTurns = droppedTurns;
    }

    public List<ChatMessage> getMessages() {
        return messages;
    }

    public int getEstimatedTokens() {
        return estimatedTokens;
    }

    public int getKeptTurns() {
        return keptTurns;
    }

    public int getDroppedTurns() {
        return droppedTurns;
    }
}
