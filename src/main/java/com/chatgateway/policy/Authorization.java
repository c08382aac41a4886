package com.chatgateway.policy;

import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayException;

/**
 * Outcome of an access check. An allowed authorization records the cost to charge once the
 * provider call succeeds; nothing is reserved in the store.
 */
public final class Authorization {

    private final boolean allowed;
    private final int cost;
    private final ErrorKind denial;
    private final String reason;

    private Authorization(boolean allowed, int cost, ErrorKind denial, String reason) {
        this.allowed = allowed;
        this.cost = cost;
        this.denial = denial;
        this.reason = reason;
    }

    public static Authorization allow(int cost) {
        return new Authorization(true, cost, null, null);
    }

    public static Authorization deny(ErrorKind kind, String reason) {
        return new Authorization(false, 0, kind, reason);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public int getCost() {
        return cost;
    }

    public ErrorKind getDenial() {
        return denial;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Throws the denial as a {@link GatewayException}; no-op when allowed.
     */
    public Authorization orThrow() {
        if (!allowed) {
            throw new GatewayException(denial, reason);
        }
        return this;
    }

    @Override
    public String toString() {
        return allowed ? "allow(" + cost + ")" : "deny(" + denial + ": " + reason + ")";
    }
}
