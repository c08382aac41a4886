package com.chatgateway.providers;

import com.chatgateway.AppLogger;
import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayConfig.RetrySettings;
import com.chatgateway.models.ChatMessage;
import com.chatgateway.providers.chat.ChatRequest;
import com.chatgateway.providers.chat.ChatStream;
import com.chatgateway.providers.chat.StreamEvent;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Single entry point for provider calls. Retries retryable failures while no output has been
 * produced; once a chunk has been emitted the stream is never restarted.
 */
public class ProviderGateway {

    private final ProviderRegistry registry;
    private final RetrySettings retry;

    public ProviderGateway(ProviderRegistry registry, RetrySettings retry) {
        this.registry = registry;
        this.retry = retry != null ? retry : new RetrySettings();
    }

    /**
     * @throws com.chatgateway.GatewayException MODEL_UNKNOWN when no adapter serves the model
     */
    public ChatStream stream(String modelName, List<ChatMessage> messages) {
        ProviderRegistry.Route route = registry.resolve(modelName);
        ChatRequest request = new ChatRequest(route.getUpstreamModel(), messages);
        return new RetryingStream(route, request);
    }

    long backoffMillis(int failedAttempts) {
        long base = retry.getInitialBackoffMs() << Math.min(10, Math.max(0, failedAttempts - 1));
        long jitter = ThreadLocalRandom.current().nextLong(0, Math.max(1, retry.getInitialBackoffMs() / 2 + 1));
        return Math.min(retry.getMaxBackoffMs(), base + jitter);
    }

    private final class RetryingStream implements ChatStream {

        private final ProviderRegistry.Route route;
        private final ChatRequest request;
        private volatile ChatStream current;
        private int attempts;
        private boolean emitted;
        private StreamEvent terminal;
        private volatile boolean closed;

        private RetryingStream(ProviderRegistry.Route route, ChatRequest request) {
            this.route = route;
            this.request = request;
        }

        @Override
        public StreamEvent next() throws InterruptedException {
            while (true) {
                if (terminal != null) {
                    return terminal;
                }
                if (closed) {
                    terminal = StreamEvent.failed(ErrorKind.CANCELLED, "Stream closed");
                    return terminal;
                }
                if (current == null) {
                    attempts++;
                    current = route.getProvider().stream(request);
                    if (closed) {
                        current.close();
                    }
                }
                StreamEvent event = current.next();
                if (event.getType() == StreamEvent.Type.CHUNK) {
                    emitted = true;
                    return event;
                }
                if (event.getType() == StreamEvent.Type.FAILED && shouldRetry(event)) {
                    current.close();
                    current = null;
                    long delay = backoffMillis(attempts);
                    log(route.getModelName() + " attempt " + attempts + " failed (" + event.getErrorKind()
                        + "), retrying in " + delay + "ms");
                    Thread.sleep(delay);
                    continue;
                }
                if (event.getType() == StreamEvent.Type.FAILED) {
                    logWarning(route.getModelName() + " failed after " + attempts + " attempt(s): "
                        + event.getErrorKind() + " " + event.getMessage());
                }
                terminal = event;
                return event;
            }
        }

        private boolean shouldRetry(StreamEvent event) {
            return !emitted && !closed
                && event.getErrorKind().isRetryable()
                && attempts < retry.getMaxAttempts();
        }

        @Override
        public void close() {
            closed = true;
            ChatStream stream = current;
            if (stream != null) {
                stream.close();
            }
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[ProviderGateway] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[ProviderGateway] " + message);
        }
    }
}
