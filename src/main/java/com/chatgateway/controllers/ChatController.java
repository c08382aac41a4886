package com.chatgateway.controllers;

import com.chatgateway.AppLogger;
import com.chatgateway.GatewayException;
import com.chatgateway.queue.AdmissionQueue;
import com.chatgateway.queue.TurnHandle;
import com.chatgateway.queue.TurnRequest;
import com.chatgateway.queue.TurnResult;
import com.chatgateway.providers.chat.StreamEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Controller for chat turns. Streaming responses are newline-delimited JSON, one object per chunk
 * followed by a single {@code done} or {@code error} line, with {@code waiting} lines while idle.
 */
public class ChatController implements Controller {

    private final AdmissionQueue queue;
    private final ObjectMapper objectMapper;
    private final long responseTimeoutMs;
    private final long keepAliveMs;
    private final AppLogger logger = AppLogger.get();

    public ChatController(AdmissionQueue queue, ObjectMapper objectMapper, long responseTimeoutMs, long keepAliveMs) {
        this.queue = queue;
        this.objectMapper = objectMapper;
        this.responseTimeoutMs = responseTimeoutMs;
        this.keepAliveMs = keepAliveMs;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/chat/{userId}", this::chat);
        app.get("/api/chat/{userId}/pending", this::pending);
    }

    private void chat(Context ctx) {
        String userId = ctx.pathParam("userId");
        TurnRequest request;
        boolean stream;
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            if (json == null || !json.isObject()) {
                ctx.status(400).json(Map.of("error", "JSON object body required"));
                return;
            }
            request = objectMapper.treeToValue(json, TurnRequest.class);
            stream = json.path("stream").asBoolean(false);
            request.toParts();
        } catch (GatewayException e) {
            Controller.respondError(ctx, e);
            return;
        } catch (IOException e) {
            ctx.status(400).json(Controller.errorBody(e));
            return;
        }

        TurnHandle handle = queue.submit(userId, request);
        if (stream) {
            streamEvents(ctx, handle);
            return;
        }
        try {
            ctx.json(awaitOutcome(handle));
        } catch (GatewayException e) {
            Controller.respondError(ctx, e);
        } catch (InterruptedException e) {
            handle.cancel();
            Thread.currentThread().interrupt();
            ctx.status(503).json(Controller.errorBody(e));
        }
    }

    /**
     * Waits for the turn. A caller that gives up cancels the turn so nothing is charged or stored
     * for it; a turn already committing is waited for, and its real outcome is reported.
     */
    private TurnResult awaitOutcome(TurnHandle handle) throws InterruptedException {
        try {
            return handle.await(responseTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (GatewayException e) {
            if (handle.cancel()) {
                if (logger != null) {
                    logger.info("[ChatController] No outcome in " + responseTimeoutMs + "ms, cancelled turn "
                        + handle.getRequestId());
                }
                throw e;
            }
            return handle.await(responseTimeoutMs, TimeUnit.MILLISECONDS);
        }
    }

    private void streamEvents(Context ctx, TurnHandle handle) {
        ctx.contentType("application/x-ndjson");
        ctx.header("X-Request-Id", handle.getRequestId());
        try {
            OutputStream out = ctx.outputStream();
            while (true) {
                StreamEvent event = handle.nextEvent(keepAliveMs, TimeUnit.MILLISECONDS);
                if (event == null) {
                    // a write is the only way to notice a client that went away
                    writeLine(out, waitingLine(handle));
                    continue;
                }
                writeLine(out, toLine(handle, event));
                if (event.isTerminal()) {
                    return;
                }
            }
        } catch (IOException e) {
            if (handle.cancel() && logger != null) {
                logger.info("[ChatController] Client disconnected, cancelled turn " + handle.getRequestId());
            }
        } catch (InterruptedException e) {
            handle.cancel();
            Thread.currentThread().interrupt();
        }
    }

    private Map<String, Object> toLine(TurnHandle handle, StreamEvent event) {
        Map<String, Object> line = new LinkedHashMap<>();
        switch (event.getType()) {
            case CHUNK:
                line.put("type", "chunk");
                line.put("text", event.getText());
                break;
            case DONE:
                line.put("type", "done");
                line.put("result", handle.result().getNow(null));
                break;
            default:
                line.put("type", "error");
                line.put("kind", event.getErrorKind().code());
                line.put("error", event.getMessage());
                break;
        }
        return line;
    }

    private Map<String, Object> waitingLine(TurnHandle handle) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("type", "waiting");
        line.put("state", handle.getState().name().toLowerCase());
        return line;
    }

    private void writeLine(OutputStream out, Map<String, Object> line) throws IOException {
        out.write(objectMapper.writeValueAsString(line).getBytes(StandardCharsets.UTF_8));
        out.write('\n');
        out.flush();
    }

    private void pending(Context ctx) {
        ctx.json(Map.of("userId", ctx.pathParam("userId"), "pending", queue.pendingCount(ctx.pathParam("userId"))));
    }
}
