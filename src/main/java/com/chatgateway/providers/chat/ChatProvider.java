package com.chatgateway.providers.chat;

/**
 * Interface for AI chat providers.
 * Each implementation handles the wire format of one backend family.
 */
public interface ChatProvider {

    /**
     * Provider key this instance was registered under.
     */
    String getProviderName();

    /**
     * Opens a streaming completion. Upstream failures are reported through the stream's terminal
     * {@link StreamEvent}, never thrown.
     */
    ChatStream stream(ChatRequest request);
}
