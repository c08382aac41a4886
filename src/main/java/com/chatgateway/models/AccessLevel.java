package com.chatgateway.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Ordered access tiers. Declaration order is the ordering used by the access policy.
 */
public enum AccessLevel {
    BASIC,
    ADVANCED,
    ULTIMATE,
    OWNER;

    public boolean isAtLeast(AccessLevel required) {
        return required == null || this.ordinal() >= required.ordinal();
    }

    public String displayName() {
        String name = name().toLowerCase();
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * Accepts the enum name (any case) or the numeric tier 0-3.
     */
    @JsonCreator
    public static AccessLevel parse(String value) {
        if (value == null) {
            return BASIC;
        }
        String text = value.trim();
        if (text.isEmpty()) {
            return BASIC;
        }
        if (text.chars().allMatch(Character::isDigit)) {
            return fromTier(Integer.parseInt(text));
        }
        try {
            return AccessLevel.valueOf(text.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown access level: " + value);
        }
    }

    public static AccessLevel fromTier(int tier) {
        AccessLevel[] values = values();
        if (tier < 0 || tier >= values.length) {
            throw new IllegalArgumentException("Access level must be 0, 1, 2, or 3");
        }
        return values[tier];
    }
}
