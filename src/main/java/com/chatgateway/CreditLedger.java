package com.chatgateway;

import com.chatgateway.storage.ConversationStore;
import com.chatgateway.storage.ProfileUpdate;

import java.util.OptionalInt;

/**
 * Credit balance mutations. Deductions are conditional updates against the store so a balance
 * can never go negative, even if two commits for the same user were to race.
 */
public class CreditLedger {

    private final ConversationStore store;
    private final AppLogger logger = AppLogger.get();

    public CreditLedger(ConversationStore store) {
        this.store = store;
    }

    /**
     * Charges {@code cost} to the user.
     *
     * @return the balance after the charge
     * @throws GatewayException INSUFFICIENT_CREDIT when the balance no longer covers the cost
     */
    public int deduct(String userId, int cost) {
        if (cost <= 0) {
            return store.getProfile(userId).getCredit();
        }
        for (int attempt = 0; attempt < 2; attempt++) {
            OptionalInt result = store.adjustCredit(userId, -cost, cost);
            if (result.isPresent()) {
                log("Deducted " + cost + " from " + userId + " (balance " + result.getAsInt() + ")");
                return result.getAsInt();
            }
            if (store.getProfile(userId).getCredit() < cost) {
                break;
            }
        }
        throw new GatewayException(ErrorKind.INSUFFICIENT_CREDIT,
            "Insufficient credit: " + cost + " required, balance is " + store.getProfile(userId).getCredit());
    }

    /**
     * Returns a charge after a failed commit.
     */
    public int refund(String userId, int amount) {
        if (amount <= 0) {
            return store.getProfile(userId).getCredit();
        }
        OptionalInt result = store.adjustCredit(userId, amount, Integer.MIN_VALUE);
        if (result.isEmpty()) {
            logWarning("Refund of " + amount + " to " + userId + " was rejected");
            return store.getProfile(userId).getCredit();
        }
        log("Refunded " + amount + " to " + userId);
        return result.getAsInt();
    }

    public int addCredit(String userId, int amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        OptionalInt result = store.adjustCredit(userId, amount, Integer.MIN_VALUE);
        if (result.isEmpty()) {
            throw new IllegalArgumentException("Credit balance would overflow");
        }
        log("Added " + amount + " credit to " + userId + " (balance " + result.getAsInt() + ")");
        return result.getAsInt();
    }

    /**
     * Operator deduction. Unlike a turn charge it never retries.
     *
     * @throws GatewayException INSUFFICIENT_CREDIT when the balance is below {@code amount}
     */
    public int deductCredit(String userId, int amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        OptionalInt result = store.adjustCredit(userId, -amount, amount);
        if (result.isEmpty()) {
            throw new GatewayException(ErrorKind.INSUFFICIENT_CREDIT, "Cannot deduct " + amount + " from "
                + userId + ": balance is " + store.getProfile(userId).getCredit());
        }
        log("Operator deducted " + amount + " from " + userId + " (balance " + result.getAsInt() + ")");
        return result.getAsInt();
    }

    public int setCredit(String userId, int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Credit cannot be negative");
        }
        int balance = store.upsertProfile(userId, ProfileUpdate.create().credit(amount)).getCredit();
        log("Set credit for " + userId + " to " + balance);
        return balance;
    }

    public int balance(String userId) {
        return store.getProfile(userId).getCredit();
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[CreditLedger] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[CreditLedger] " + message);
        }
    }
}
