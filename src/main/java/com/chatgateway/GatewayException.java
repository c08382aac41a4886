package com.chatgateway;

/**
 * Domain failure carrying an {@link ErrorKind}. Thrown by the policy, assembler, gateway and store
 * layers and delivered to the caller through the turn handle.
 */
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;

    public GatewayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GatewayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static GatewayException of(ErrorKind kind, String message) {
        return new GatewayException(kind, message);
    }
}
