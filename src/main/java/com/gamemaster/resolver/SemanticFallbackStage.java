package com.gamemaster.resolver;

import com.gamemaster.AppLogger;
import com.gamemaster.models.Scene;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Last resolution stage: asks a {@link SemanticResolver} to pick a choice.
 *
 * <p>The call runs on a worker thread and the wait is capped at {@code timeoutMs}. Timeouts,
 * provider errors and replies that are not one of the offered ids all come back as an empty
 * match. Nothing is retried.
 */
public class SemanticFallbackStage implements ResolutionStage {

    private static final int WORKER_THREADS = 4;

    private final SemanticResolver resolver;
    private final long timeoutMs;
    private final ExecutorService executor;
    private final AppLogger logger;

    public SemanticFallbackStage(SemanticResolver resolver, long timeoutMs) {
        this.resolver = resolver;
        this.timeoutMs = timeoutMs;
        this.executor = Executors.newFixedThreadPool(WORKER_THREADS, daemonThreads());
        this.logger = AppLogger.get();
    }

    @Override
    public String getName() {
        return "semantic";
    }

    @Override
    public Optional<String> match(Scene scene, String utterance) {
        if (scene.getChoiceMap().isEmpty()) {
            return Optional.empty();
        }
        ResolutionRequest request = ResolutionRequest.of(scene, utterance);
        Future<String> pending;
        try {
            pending = executor.submit(() -> resolver.resolve(request));
        } catch (RejectedExecutionException e) {
            logger.warn("Semantic resolver is shut down; leaving '" + utterance + "' unresolved");
            return Optional.empty();
        }
        String reply;
        try {
            reply = pending.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            logger.warn("Semantic resolver timed out after " + timeoutMs + "ms for '" + utterance + "'");
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Semantic resolver failed for '" + utterance + "': " + describe(cause));
            return Optional.empty();
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            logger.warn("Semantic resolution interrupted for '" + utterance + "'");
            return Optional.empty();
        }

        Optional<String> choiceId = acceptReply(scene, reply);
        if (choiceId.isPresent()) {
            logger.info("Semantic resolver mapped '" + utterance + "' to " + choiceId.get());
        } else {
            logger.info("Semantic resolver could not resolve '" + utterance + "' (reply: " + reply + ")");
        }
        return choiceId;
    }

    /**
     * Accepts the reply only if, once cleaned, it names one of the scene's choices.
     */
    static Optional<String> acceptReply(Scene scene, String reply) {
        String token = clean(reply);
        if (token.isEmpty() || token.equalsIgnoreCase(SemanticResolver.NONE)) {
            return Optional.empty();
        }
        for (String choiceId : scene.getChoiceIds()) {
            if (choiceId.equalsIgnoreCase(token)) {
                return Optional.of(choiceId);
            }
        }
        return Optional.empty();
    }

    static String clean(String reply) {
        if (reply == null) {
            return "";
        }
        return reply.trim()
            .toLowerCase(Locale.ROOT)
            .replace("\"", "")
            .replace("'", "")
            .replace("`", "")
            .trim();
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "semantic-resolver-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
