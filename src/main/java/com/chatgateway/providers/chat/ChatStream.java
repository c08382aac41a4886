package com.chatgateway.providers.chat;

import com.chatgateway.ErrorKind;

/**
 * Forward-only pull sequence of {@link StreamEvent}s. After the terminal event every further call
 * to {@link #next()} returns that same event. Not restartable.
 */
public interface ChatStream extends AutoCloseable {

    /**
     * Blocks until the next event is available.
     */
    StreamEvent next() throws InterruptedException;

    /**
     * Releases the underlying connection. Unblocks a pending {@link #next()}, which then reports
     * {@link ErrorKind#CANCELLED}. Idempotent.
     */
    @Override
    void close();

    static ChatStream failed(ErrorKind kind, String message) {
        return ScriptedChatStream.of(StreamEvent.failed(kind, message));
    }
}
