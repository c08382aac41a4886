package com.chatgateway.queue;

/**
 * Runs one dequeued turn to completion and resolves its handle.
 */
@FunctionalInterface
public interface TurnProcessor {

    void process(TurnHandle handle);
}
