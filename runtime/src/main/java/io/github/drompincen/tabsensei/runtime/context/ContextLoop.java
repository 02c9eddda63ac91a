package io.github.drompincen.tabsensei.runtime.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Cooperative scheduler of one execution context. Handlers posted here run one at a time and to
 * completion; other contexts only ever reach this one by posting.
 */
public final class ContextLoop implements Executor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ContextLoop.class);

    private final String name;
    private final Executor executor;
    private final ExecutorService owned;

    private ContextLoop(String name, Executor executor, ExecutorService owned) {
        this.name = name;
        this.executor = executor;
        this.owned = owned;
    }

    public static ContextLoop create(String name) {
        ExecutorService service = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ctx-" + name);
            t.setDaemon(true);
            return t;
        });
        return new ContextLoop(name, service, service);
    }

    /** Runs handlers on the posting thread. Used where the caller already serializes access. */
    public static ContextLoop direct(String name) {
        return new ContextLoop(name, Runnable::run, null);
    }

    public String name() {
        return name;
    }

    @Override
    public void execute(Runnable command) {
        executor.execute(() -> {
            try {
                command.run();
            } catch (Exception e) {
                log.error("Unhandled error in context {}", name, e);
            }
        });
    }

    /** Posts a handler that itself returns a future; the result completes when that future does. */
    public <T> CompletableFuture<T> post(Supplier<CompletableFuture<T>> handler) {
        return CompletableFuture.supplyAsync(handler, executor).thenCompose(f -> f);
    }

    @Override
    public void close() {
        if (owned != null) owned.shutdownNow();
    }
}
