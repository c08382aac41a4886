package com.chatgateway.providers.chat;

import com.chatgateway.ErrorKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Server-sent-events reader shared by the streaming adapters. Subclasses turn each dispatched
 * event into chunks or a terminal event; this class handles framing, EOF and I/O failures.
 */
public abstract class SseChatStream implements ChatStream {

    protected final ObjectMapper mapper;
    private final InputStream body;
    private final BufferedReader reader;
    private final Deque<StreamEvent> pending = new ArrayDeque<>();
    private final String providerName;
    private StreamEvent terminal;
    private volatile boolean closed;

    protected SseChatStream(InputStream body, ObjectMapper mapper, String providerName) {
        this.body = body;
        this.mapper = mapper;
        this.providerName = providerName;
        this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
    }

    /**
     * Handles one dispatched SSE event.
     *
     * @param eventName value of the {@code event:} field, or null
     * @param data      the {@code data:} lines joined with newlines
     */
    protected abstract void onEvent(String eventName, String data) throws JsonProcessingException;

    /**
     * Called when the body ends before a terminal event. The default treats it as a truncated response.
     */
    protected void onEndOfStream() {
        emitFailure(ErrorKind.INVALID_RESPONSE, providerName + " stream ended before completion");
    }

    @Override
    public synchronized StreamEvent next() throws InterruptedException {
        while (true) {
            if (!pending.isEmpty()) {
                StreamEvent event = pending.poll();
                if (event.isTerminal()) {
                    terminal = event;
                    pending.clear();
                    closeQuietly();
                }
                return event;
            }
            if (terminal != null) {
                return terminal;
            }
            if (closed) {
                return terminate(StreamEvent.failed(ErrorKind.CANCELLED, "Stream closed"));
            }
            if (Thread.interrupted()) {
                closeQuietly();
                throw new InterruptedException("Interrupted while reading " + providerName + " stream");
            }
            readNextEvent();
        }
    }

    private void readNextEvent() {
        String eventName = null;
        StringBuilder data = null;
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    if (data != null) {
                        onEvent(eventName, data.toString());
                        return;
                    }
                    eventName = null;
                    continue;
                }
                if (line.startsWith(":")) {
                    continue;
                }
                int colon = line.indexOf(':');
                String field = colon >= 0 ? line.substring(0, colon) : line;
                String value = colon >= 0 ? line.substring(colon + 1) : "";
                if (value.startsWith(" ")) {
                    value = value.substring(1);
                }
                if ("event".equals(field)) {
                    eventName = value;
                } else if ("data".equals(field)) {
                    if (data == null) {
                        data = new StringBuilder(value);
                    } else {
                        data.append('\n').append(value);
                    }
                }
            }
            if (data != null) {
                onEvent(eventName, data.toString());
                if (!pending.isEmpty()) {
                    return;
                }
            }
            if (closed) {
                emitFailure(ErrorKind.CANCELLED, "Stream closed");
                return;
            }
            onEndOfStream();
            if (pending.isEmpty()) {
                emitFailure(ErrorKind.INVALID_RESPONSE, providerName + " stream ended before completion");
            }
        } catch (JsonProcessingException e) {
            emitFailure(ErrorKind.INVALID_RESPONSE, "Malformed " + providerName + " stream payload: "
                + e.getOriginalMessage());
        } catch (IOException e) {
            if (closed) {
                emitFailure(ErrorKind.CANCELLED, "Stream closed");
            } else {
                emitFailure(ErrorKind.UPSTREAM_UNAVAILABLE, providerName + " stream interrupted: " + e.getMessage());
            }
        }
    }

    protected JsonNode parse(String data) throws JsonProcessingException {
        return mapper.readTree(data);
    }

    protected void emitChunk(String text) {
        if (text != null && !text.isEmpty()) {
            pending.add(StreamEvent.chunk(text));
        }
    }

    protected void emitDone(Usage usage) {
        pending.add(StreamEvent.done(usage));
    }

    protected void emitFailure(ErrorKind kind, String message) {
        pending.add(StreamEvent.failed(kind, message));
    }

    protected String getProviderName() {
        return providerName;
    }

    private StreamEvent terminate(StreamEvent event) {
        terminal = event;
        closeQuietly();
        return event;
    }

    @Override
    public void close() {
        closed = true;
        closeQuietly();
    }

    private void closeQuietly() {
        try {
            body.close();
        } catch (IOException ignored) {
            // connection is being discarded either way
        }
    }
}
