package com.chatgateway.providers.chat;

import com.chatgateway.ErrorKind;

import java.util.Objects;

/**
 * One element of a completion stream: text chunks followed by exactly one terminal event.
 */
public final class StreamEvent {

    public enum Type {
        CHUNK,
        DONE,
        FAILED
    }

    private final Type type;
    private final String text;
    private final Usage usage;
    private final ErrorKind errorKind;
    private final String message;

    private StreamEvent(Type type, String text, Usage usage, ErrorKind errorKind, String message) {
        this.type = type;
        this.text = text;
        this.usage = usage;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static StreamEvent chunk(String text) {
        return new StreamEvent(Type.CHUNK, Objects.requireNonNull(text, "text"), null, null, null);
    }

    public static StreamEvent done(Usage usage) {
        return new StreamEvent(Type.DONE, null, usage != null ? usage : Usage.unknown(), null, null);
    }

    public static StreamEvent failed(ErrorKind kind, String message) {
        return new StreamEvent(Type.FAILED, null, null, Objects.requireNonNull(kind, "kind"), message);
    }

    public Type getType() {
        return type;
    }

    public boolean isTerminal() {
        return type != Type.CHUNK;
    }

    public String getText() {
        return text;
    }

    public Usage getUsage() {
        return usage;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        switch (type) {
            case CHUNK:
                return "CHUNK(" + text + ")";
            case DONE:
                return "DONE(" + usage + ")";
            default:
                return "FAILED(" + errorKind + ": " + message + ")";
        }
    }
}
