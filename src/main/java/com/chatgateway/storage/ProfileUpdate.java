package com.chatgateway.storage;

import com.chatgateway.models.AccessLevel;

/**
 * Partial profile mutation: only non-null fields are applied. Credit changes go through
 * {@link ConversationStore#adjustCredit} or {@link #credit(int)} for admin overrides.
 */
public class ProfileUpdate {

    private String preferredModel;
    private String systemPrompt;
    private AccessLevel accessLevel;
    private Integer credit;
    private Boolean authorized;
    private boolean clearSystemPrompt;
    private boolean clearPreferredModel;

    public static ProfileUpdate create() {
        return new ProfileUpdate();
    }

    public ProfileUpdate preferredModel(String model) {
        this.preferredModel = model;
        return this;
    }

    /**
     * Falls back to the configured default model.
     */
    public ProfileUpdate clearPreferredModel() {
        this.clearPreferredModel = true;
        this.preferredModel = null;
        return this;
    }

    public ProfileUpdate systemPrompt(String prompt) {
        this.systemPrompt = prompt;
        return this;
    }

    /**
     * Drops the custom prompt so the configured default applies again.
     */
    public ProfileUpdate clearSystemPrompt() {
        this.clearSystemPrompt = true;
        this.systemPrompt = null;
        return this;
    }

    public ProfileUpdate accessLevel(AccessLevel level) {
        this.accessLevel = level;
        return this;
    }

    public ProfileUpdate credit(int credit) {
        if (credit < 0) {
            throw new IllegalArgumentException("Credit cannot be negative");
        }
        this.credit = credit;
        return this;
    }

    public ProfileUpdate authorized(boolean value) {
        this.authorized = value;
        return this;
    }

    public String getPreferredModel() {
        return preferredModel;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public AccessLevel getAccessLevel() {
        return accessLevel;
    }

    public Integer getCredit() {
        return credit;
    }

    public Boolean getAuthorized() {
        return authorized;
    }

    public boolean isClearSystemPrompt() {
        return clearSystemPrompt;
    }

    public boolean isClearPreferredModel() {
        return clearPreferredModel;
    }
}
