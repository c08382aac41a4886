package com.chatgateway.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class UserProfile {

    private String userId;
    private String preferredModel;
    private String systemPrompt;
    private AccessLevel accessLevel = AccessLevel.BASIC;
    private int credit;
    private boolean authorized;
    private long createdAt;
    private long updatedAt;

    public UserProfile() {
    }

    public UserProfile(String userId) {
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getPreferredModel() {
        return preferredModel;
    }

    public void setPreferredModel(String preferredModel) {
        this.preferredModel = preferredModel;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public AccessLevel getAccessLevel() {
        return accessLevel;
    }

    public void setAccessLevel(AccessLevel accessLevel) {
        this.accessLevel = accessLevel != null ? accessLevel : AccessLevel.BASIC;
    }

    public int getCredit() {
        return credit;
    }

    public void setCredit(int credit) {
        this.credit = credit;
    }

    /**
     * On the allowlist. Only consulted when the gateway restricts chat to authorized users.
     */
    public boolean isAuthorized() {
        return authorized;
    }

    public void setAuthorized(boolean authorized) {
        this.authorized = authorized;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    public UserProfile copy() {
        UserProfile copy = new UserProfile(userId);
        copy.setPreferredModel(preferredModel);
        copy.setSystemPrompt(systemPrompt);
        copy.setAccessLevel(accessLevel);
        copy.setCredit(credit);
        copy.setAuthorized(authorized);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
