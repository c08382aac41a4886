package com.chatgateway.queue;

import com.chatgateway.providers.chat.Usage;

/**
 * Outcome of a committed turn.
 */
public class TurnResult {

    private final String requestId;
    private final String userId;
    private final String model;
    private final String text;
    private final Usage usage;
    private final int creditCharged;
    private final int remainingCredit;
    private final int contextTokens;
    private final int droppedTurns;

    public TurnResult(String requestId, String userId, String model, String text, Usage usage,
                      int creditCharged, int remainingCredit, int contextTokens, int droppedTurns) {
        this.requestId = requestId;
        this.userId = userId;
        this.model = model;
        this.text = text;
        this.usage = usage;
        this.creditCharged = creditCharged;
        this.remainingCredit = remainingCredit;
        this.contextTokens = contextTokens;
        this.droppedTurns = droppedTurns;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getUserId() {
        return userId;
    }

    public String getModel() {
        return model;
    }

    public String getText() {
        return text;
    }

    public Usage getUsage() {
        return usage;
    }

    public int getCreditCharged() {
        return creditCharged;
    }

    public int getRemainingCredit() {
        return remainingCredit;
    }

    public int getContextTokens() {
        return contextTokens;
    }

    public int getDroppedTurns() {
        return droppedTurns;
    }
}
