package com.chatgateway.providers.chat;

import com.chatgateway.models.ChatMessage;

import java.util.List;
import java.util.Objects;

/**
 * One provider call: the upstream model name and the assembled messages.
 */
public final class ChatRequest {

    private final String model;
    private final List<ChatMessage> messages;

    public ChatRequest(String model, List<ChatMessage> messages) {
        this.model = Objects.requireNonNull(model, "model");
        this.messages = List.copyOf(messages);
    }

    public String getModel() {
        return model;
    }

    public List<ChatMessage> getMessages() {
        return messages;
    }
}
