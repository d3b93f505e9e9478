package com.sassed.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs at most one compile at a time. Paths submitted while a compile is running are collected
 * into a single pending batch, so a burst of changes costs at most one extra compile.
 */
public class CompileScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CompileScheduler.class);

    private final ExecutorService executor;
    private final Consumer<Set<Path>> task;
    private final Duration shutdownTimeout;
    private final Object lock = new Object();
    private Set<Path> pending = new LinkedHashSet<>();
    private boolean running;

    public CompileScheduler(Consumer<Set<Path>> task, Duration shutdownTimeout) {
        this.task = task;
        this.shutdownTimeout = shutdownTimeout;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sassed-compile");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queues {@code path} for the next compile. Paths submitted after {@link #close()} are dropped.
     */
    public void submit(Path path) {
        synchronized (lock) {
            if (executor.isShutdown()) {
                logger.debug("Scheduler closed, dropping {}", path);
                return;
            }
            pending.add(path);
            if (running) {
                return;
            }
            running = true;
            executor.execute(this::drain);
        }
    }

    private void drain() {
        while (true) {
            Set<Path> batch;
            synchronized (lock) {
                if (pending.isEmpty()) {
                    running = false;
                    return;
                }
                batch = pending;
                pending = new LinkedHashSet<>();
            }
            logger.debug("Compiling batch {}", batch);
            try {
                task.accept(batch);
            } catch (RuntimeException e) {
                logger.error("Compile batch {} failed", batch, e);
            }
        }
    }

    /**
     * Stops accepting work and waits, up to the shutdown timeout, for the running compile.
     */
    @Override
    public void close() {
        synchronized (lock) {
            executor.shutdown();
        }
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Compile still running after {}, abandoning it", shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
