package com.chatgateway.providers.chat;

import com.chatgateway.ErrorKind;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Stream over a fixed list of events. Used for failures detected before any bytes were read.
 */
public class ScriptedChatStream implements ChatStream {

    private final Deque<StreamEvent> events;
    private StreamEvent terminal;
    private volatile boolean closed;

    public ScriptedChatStream(List<StreamEvent> events) {
        this.events = new ArrayDeque<>(events);
    }

    public static ScriptedChatStream of(StreamEvent... events) {
        return new ScriptedChatStream(Arrays.asList(events));
    }

    @Override
    public synchronized StreamEvent next() {
        if (terminal != null) {
            return terminal;
        }
        if (closed) {
            terminal = StreamEvent.failed(ErrorKind.CANCELLED, "Stream closed");
            return terminal;
        }
        StreamEvent event = events.poll();
        if (event == null) {
            terminal = StreamEvent.failed(ErrorKind.INVALID_RESPONSE, "Stream ended without a terminal event");
            return terminal;
        }
        if (event.isTerminal()) {
            terminal = event;
        }
        return event;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
