package com.chatgateway.queue;

import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayException;
import com.chatgateway.providers.chat.ChatStream;
import com.chatgateway.providers.chat.StreamEvent;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller's view of a submitted turn. Chunks arrive through {@link #nextEvent}; the outcome through
 * {@link #result()}. Exactly one terminal event is ever published.
 */
public class TurnHandle {

    public enum State {
        QUEUED,
        RUNNING,
        COMMITTING,
        DONE,
        CANCELLED,
        TIMED_OUT,
        FAILED;

        public boolean isTerminal() {
            return this == DONE || this == CANCELLED || this == TIMED_OUT || this == FAILED;
        }
    }

    private final String requestId;
    private final String userId;
    private final TurnRequest request;
    private final long enqueuedAt;
    private final BlockingQueue<StreamEvent> events = new LinkedBlockingQueue<>();
    private final CompletableFuture<TurnResult> result = new CompletableFuture<>();

    private State state = State.QUEUED;
    private ChatStream stream;
    private Thread worker;

    public TurnHandle(String requestId, String userId, TurnRequest request) {
        this.requestId = requestId;
        this.userId = userId;
        this.request = request;
        this.enqueuedAt = System.currentTimeMillis();
    }

    public String getRequestId() {
        return requestId;
    }

    public String getUserId() {
        return userId;
    }

    public TurnRequest getRequest() {
        return request;
    }

    public long getEnqueuedAt() {
        return enqueuedAt;
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized boolean isRunning() {
        return state == State.RUNNING;
    }

    /**
     * QUEUED to RUNNING. False when the turn was cancelled or timed out while waiting.
     */
    synchronized boolean start(Thread workerThread) {
        if (state != State.QUEUED) {
            return false;
        }
        state = State.RUNNING;
        worker = workerThread;
        return true;
    }

    /**
     * Registers the provider stream so cancel and timeout can close it. A stream attached after
     * the turn stopped running is closed immediately.
     */
    public void attach(ChatStream chatStream) {
        boolean closeNow;
        synchronized (this) {
            closeNow = state != State.RUNNING;
            if (!closeNow) {
                stream = chatStream;
            }
        }
        if (closeNow) {
            chatStream.close();
        }
    }

    /**
     * RUNNING to COMMITTING. From here on cancel and timeout have no effect. Must be called on the
     * worker thread.
     */
    public boolean beginCommit() {
        synchronized (this) {
            if (state != State.RUNNING) {
                return false;
            }
            state = State.COMMITTING;
            worker = null;
            stream = null;
        }
        // a cancel that lost the race may have interrupted us just before the transition
        Thread.interrupted();
        return true;
    }

    public void emitChunk(String text) {
        if (isRunning()) {
            events.add(StreamEvent.chunk(text));
        }
    }

    public void complete(TurnResult turnResult) {
        synchronized (this) {
            if (state.isTerminal()) {
                return;
            }
            state = State.DONE;
            worker = null;
        }
        result.complete(turnResult);
        events.add(StreamEvent.done(turnResult.getUsage()));
    }

    public void fail(GatewayException error) {
        synchronized (this) {
            if (state.isTerminal()) {
                return;
            }
            state = State.FAILED;
            worker = null;
        }
        publishFailure(error);
    }

    /**
     * Client-initiated cancel. Ignored once the turn is committing or finished.
     */
    public boolean cancel() {
        return stop(State.CANCELLED, new GatewayException(ErrorKind.CANCELLED, "Turn cancelled"));
    }

    boolean timeout(long timeoutMs) {
        return stop(State.TIMED_OUT, new GatewayException(ErrorKind.TIMEOUT,
            "Turn did not complete within " + timeoutMs + "ms"));
    }

    private boolean stop(State target, GatewayException error) {
        ChatStream toClose;
        Thread toInterrupt;
        synchronized (this) {
            if (state != State.QUEUED && state != State.RUNNING) {
                return false;
            }
            state = target;
            toClose = stream;
            toInterrupt = worker;
            stream = null;
            worker = null;
        }
        if (toClose != null) {
            toClose.close();
        }
        if (toInterrupt != null) {
            toInterrupt.interrupt();
        }
        publishFailure(error);
        return true;
    }

    /**
     * Detaches the worker thread once processing returns, whatever the outcome.
     */
    synchronized void release() {
        worker = null;
        stream = null;
    }

    private void publishFailure(GatewayException error) {
        result.completeExceptionally(error);
        events.add(StreamEvent.failed(error.getKind(), error.getMessage()));
    }

    /**
     * @return the next event, or null if none arrived within the timeout
     */
    public StreamEvent nextEvent(long timeout, TimeUnit unit) throws InterruptedException {
        return events.poll(timeout, unit);
    }

    public CompletableFuture<TurnResult> result() {
        return result;
    }

    /**
     * Blocks for the outcome.
     *
     * @throws GatewayException the failure the turn ended with
     */
    public TurnResult await(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            return result.get(timeout, unit);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GatewayException) {
                throw (GatewayException) cause;
            }
            throw new GatewayException(ErrorKind.INTERNAL, String.valueOf(cause), cause);
        } catch (TimeoutException e) {
            throw new GatewayException(ErrorKind.TIMEOUT, "No result within " + unit.toMillis(timeout) + "ms");
        }
    }
}
