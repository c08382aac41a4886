package com.chatgateway.policy;

import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayException;
import com.chatgateway.models.AccessLevel;
import com.chatgateway.models.ModelDescriptor;
import com.chatgateway.models.UserProfile;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccessPolicyTest {

    private final AccessPolicy policy = new AccessPolicy();

    private static UserProfile user(AccessLevel level, int credit) {
        UserProfile profile = new UserProfile("alice");
        profile.setAccessLevel(level);
        profile.setCredit(credit);
        return profile;
    }

    @Test
    void allowsWhenLevelAndCreditSuffice() {
        Authorization result = policy.authorize(user(AccessLevel.ADVANCED, 10),
            new ModelDescriptor("gpt-4o", "openai", 10, AccessLevel.ADVANCED));
        assertTrue(result.isAllowed());
        assertEquals(10, result.getCost());
        assertNull(result.getDenial());
    }

    @Test
    void deniesBelowRequiredLevelEvenWithCredit() {
        Authorization result = policy.authorize(user(AccessLevel.BASIC, 1000),
            new ModelDescriptor("gpt-4o", "openai", 1, AccessLevel.ADVANCED));
        assertFalse(result.isAllowed());
        assertEquals(ErrorKind.INSUFFICIENT_ACCESS_LEVEL, result.getDenial());
    }

    @Test
    void deniesWhenCreditIsShort() {
        Authorization result = policy.authorize(user(AccessLevel.BASIC, 0),
            new ModelDescriptor("gpt-4o-mini", "openai", 1, AccessLevel.BASIC));
        assertEquals(ErrorKind.INSUFFICIENT_CREDIT, result.getDenial());
        assertTrue(result.getReason().contains("costs 1"));
    }

    @Test
    void freeModelNeedsNoCredit() {
        Authorization result = policy.authorize(user(AccessLevel.BASIC, 0),
            new ModelDescriptor("local", "ollama", 0, AccessLevel.BASIC));
        assertTrue(result.isAllowed());
        assertEquals(0, result.getCost());
    }

    @Test
    void ownerPassesEveryLevelButStillPays() {
        ModelDescriptor model = new ModelDescriptor("claude-sonnet", "anthropic", 20, AccessLevel.ULTIMATE);
        assertTrue(policy.authorize(user(AccessLevel.OWNER, 20), model).isAllowed());
        assertEquals(ErrorKind.INSUFFICIENT_CREDIT, policy.authorize(user(AccessLevel.OWNER, 19), model).getDenial());
    }

    @Test
    void unknownModelIsDenied() {
        Authorization result = policy.authorize(user(AccessLevel.OWNER, 100), null, "ghost");
        assertEquals(ErrorKind.MODEL_UNKNOWN, result.getDenial());
        assertTrue(result.getReason().contains("ghost"));
    }

    @Test
    void orThrowRaisesDenialKind() {
        Authorization denied = Authorization.deny(ErrorKind.INSUFFICIENT_CREDIT, "no money");
        GatewayException error = assertThrows(GatewayException.class, denied::orThrow);
        assertEquals(ErrorKind.INSUFFICIENT_CREDIT, error.getKind());
        assertEquals(3, Authorization.allow(3).orThrow().getCost());
    }
}
