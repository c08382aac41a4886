package com.chatgateway.queue;

import com.chatgateway.AppLogger;
import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-user FIFO admission. Each user with pending work gets one lane drained by one worker, so a
 * user's turns run strictly in submission order while different users proceed independently. A fair
 * semaphore caps how many turns are processed at once across all users.
 */
public class AdmissionQueue {

    private final TurnProcessor processor;
    private final int perUserQueueDepth;
    private final long requestTimeoutMs;
    private final Semaphore permits;
    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final AppLogger logger = AppLogger.get();
    private volatile boolean accepting = true;

    public AdmissionQueue(TurnProcessor processor, int perUserQueueDepth, int globalConcurrencyLimit,
                          long requestTimeoutMs) {
        if (perUserQueueDepth < 0) {
            throw new IllegalArgumentException("perUserQueueDepth must be >= 0");
        }
        if (globalConcurrencyLimit <= 0) {
            throw new IllegalArgumentException("globalConcurrencyLimit must be > 0");
        }
        this.processor = processor;
        this.perUserQueueDepth = perUserQueueDepth;
        this.requestTimeoutMs = requestTimeoutMs;
        this.permits = new Semaphore(globalConcurrencyLimit, true);
        this.workers = Executors.newCachedThreadPool(daemonFactory("turn-worker"));
        this.timer = Executors.newSingleThreadScheduledExecutor(daemonFactory("turn-deadline"));
    }

    /**
     * Returns immediately. When the user's lane is full the handle is already failed with BUSY.
     */
    public TurnHandle submit(String userId, TurnRequest request) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        TurnHandle handle = new TurnHandle(UUID.randomUUID().toString(), userId, request);
        if (!accepting) {
            handle.fail(new GatewayException(ErrorKind.BUSY, "Gateway is shutting down"));
            return handle;
        }
        boolean[] startWorker = {false};
        boolean[] rejected = {false};
        lanes.compute(userId, (key, lane) -> {
            if (lane == null) {
                lane = new Lane();
                startWorker[0] = true;
            } else if (lane.occupancy() > perUserQueueDepth) {
                rejected[0] = true;
                return lane;
            }
            lane.waiting.add(handle);
            return lane;
        });
        if (rejected[0]) {
            log("Rejected turn for " + userId + ": lane is full");
            handle.fail(new GatewayException(ErrorKind.BUSY,
                "A previous message is still being processed, please wait"));
            return handle;
        }
        if (startWorker[0]) {
            workers.execute(() -> drain(userId));
        }
        return handle;
    }

    /**
     * Turns waiting or running for the user.
     */
    public int pendingCount(String userId) {
        int[] count = {0};
        lanes.computeIfPresent(userId, (key, lane) -> {
            count[0] = lane.occupancy();
            return lane;
        });
        return count[0];
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    private void drain(String userId) {
        while (true) {
            TurnHandle next = pollNext(userId);
            if (next == null) {
                return;
            }
            process(next);
        }
    }

    /**
     * Takes the next handle off the lane, removing the lane when it is empty so the next submit
     * starts a fresh worker.
     */
    private TurnHandle pollNext(String userId) {
        TurnHandle[] next = {null};
        lanes.compute(userId, (key, lane) -> {
            if (lane == null) {
                return null;
            }
            lane.running = false;
            TurnHandle handle = lane.waiting.poll();
            if (handle == null) {
                return null;
            }
            lane.running = true;
            next[0] = handle;
            return lane;
        });
        return next[0];
    }

    private void process(TurnHandle handle) {
        if (handle.getState() != TurnHandle.State.QUEUED) {
            return;
        }
        ScheduledFuture<?> deadline = timer.schedule(() -> {
            if (handle.timeout(requestTimeoutMs)) {
                logWarning("Turn " + handle.getRequestId() + " for " + handle.getUserId() + " timed out");
            }
        }, requestTimeoutMs, TimeUnit.MILLISECONDS);
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            deadline.cancel(false);
            handle.cancel();
            Thread.currentThread().interrupt();
            return;
        }
        try {
            if (!handle.start(Thread.currentThread())) {
                return;
            }
            processor.process(handle);
            handle.fail(new GatewayException(ErrorKind.INTERNAL, "Turn ended without an outcome"));
        } catch (GatewayException e) {
            handle.fail(e);
        } catch (RuntimeException e) {
            logError("Turn " + handle.getRequestId() + " failed unexpectedly", e);
            handle.fail(new GatewayException(ErrorKind.INTERNAL, "Internal error: " + e.getMessage(), e));
        } finally {
            handle.release();
            Thread.interrupted();
            permits.release();
            deadline.cancel(false);
        }
    }

    /**
     * Stops accepting work and cancels every turn that has not started yet.
     */
    public void shutdown() {
        accepting = false;
        List<TurnHandle> waiting = new ArrayList<>();
        for (String userId : new ArrayList<>(lanes.keySet())) {
            lanes.computeIfPresent(userId, (key, lane) -> {
                waiting.addAll(lane.waiting);
                lane.waiting.clear();
                return lane;
            });
        }
        for (TurnHandle handle : waiting) {
            handle.cancel();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logWarning("Workers still busy after shutdown grace period");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        timer.shutdownNow();
        log("Admission queue stopped (" + waiting.size() + " waiting turns cancelled)");
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[AdmissionQueue] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[AdmissionQueue] " + message);
        }
    }

    private void logError(String message, Throwable t) {
        if (logger != null) {
            logger.error("[AdmissionQueue] " + message, t);
        }
    }

    private static final class Lane {
        private final Deque<TurnHandle> waiting = new ArrayDeque<>();
        private boolean running;

        /**
         * Occupied slots: the running turn plus those waiting behind it. A waiting turn that was
         * cancelled or timed out no longer holds a slot.
         */
        private int occupancy() {
            int live = 0;
            for (TurnHandle handle : waiting) {
                if (!handle.getState().isTerminal()) {
                    live++;
                }
            }
            return live + (running ? 1 : 0);
        }
    }
}
