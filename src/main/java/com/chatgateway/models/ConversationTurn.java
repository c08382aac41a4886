package com.chatgateway.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * A stored message in a user's history. Token estimate is fixed when the turn is written.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversationTurn {

    private long seq;
    private Role role;
    private List<ContentPart> parts = new ArrayList<>();
    private long createdAt;
    private int tokenEstimate;
    private String model;

    public ConversationTurn() {
    }

    public ConversationTurn(Role role, List<ContentPart> parts) {
        this.role = role;
        this.parts = new ArrayList<>(parts);
    }

    public long getSeq() {
        return seq;
    }

    public void setSeq(long seq) {
        this.seq = seq;
    }

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }

    public List<ContentPart> getParts() {
        return parts;
    }

    public void setParts(List<ContentPart> parts) {
        this.parts = parts != null ? parts : new ArrayList<>();
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public int getTokenEstimate() {
        return tokenEstimate;
    }

    public void setTokenEstimate(int tokenEstimate) {
        this.tokenEstimate = tokenEstimate;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    /**
     * Concatenated text parts, images rendered as placeholders.
     */
    @JsonIgnore
    public String plainText() {
        StringBuilder sb = new StringBuilder();
        for (ContentPart part : parts) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(part.toString());
        }
        return sb.toString();
    }

    public ConversationTurn copy() {
        ConversationTurn copy = new ConversationTurn(role, parts);
        copy.setSeq(seq);
        copy.setCreatedAt(createdAt);
        copy.setTokenEstimate(tokenEstimate);
        copy.setModel(model);
        return copy;
    }
}
