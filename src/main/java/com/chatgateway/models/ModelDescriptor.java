package com.chatgateway.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelDescriptor {

    private String name;
    private String provider;
    private String upstreamModel;
    private int creditCost;
    private AccessLevel minAccessLevel = AccessLevel.BASIC;
    private long createdAt;

    public ModelDescriptor() {
    }

    public ModelDescriptor(String name, String provider, int creditCost, AccessLevel minAccessLevel) {
        this.name = name;
        this.provider = provider;
        this.creditCost = creditCost;
        this.minAccessLevel = minAccessLevel;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    /**
     * Name sent to the backend; falls back to {@link #getName()}.
     */
    public String getUpstreamModel() {
        return upstreamModel;
    }

    public void setUpstreamModel(String upstreamModel) {
        this.upstreamModel = upstreamModel;
    }

    public String resolveUpstreamModel() {
        return upstreamModel != null && !upstreamModel.isBlank() ? upstreamModel : name;
    }

    public int getCreditCost() {
        return creditCost;
    }

    public void setCreditCost(int creditCost) {
        this.creditCost = creditCost;
    }

    public AccessLevel getMinAccessLevel() {
        return minAccessLevel;
    }

    public void setMinAccessLevel(AccessLevel minAccessLevel) {
        this.minAccessLevel = minAccessLevel != null ? minAccessLevel : AccessLevel.BASIC;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public ModelDescriptor copy() {
        ModelDescriptor copy = new ModelDescriptor(name, provider, creditCost, minAccessLevel);
        copy.setUpstreamModel(upstreamModel);
        copy.setCreatedAt(createdAt);
        return copy;
    }
}
