package com.sassed.watch;

import com.sassed.SassCompiler;
import com.sassed.config.SassOptions;
import com.sassed.error.SassException;
import com.sassed.error.SassRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Recompiles a folder while its files change. With single-file output every change rebuilds
 * the bundle; otherwise only the changed files are compiled, or the whole folder when a
 * partial changed.
 * <p>
 * Three threads take part: one polls the {@link WatchService}, one compiles through a
 * {@link CompileScheduler}, and one dispatches {@link WatchEvent}s to the listener. Closing
 * the watcher posts {@link WatchEvent.Stop} and joins them.
 */
public class DirectoryWatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryWatcher.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final SassCompiler compiler;
    private final Path input;
    private final Path output;
    private final SassOptions options;
    private final WatchListener listener;
    private final WatchService watchService;
    private final CompileScheduler scheduler;
    private final BlockingQueue<WatchEvent> events = new LinkedBlockingQueue<>();
    private final Thread pollThread;
    private final Thread dispatcherThread;
    private volatile boolean closed;

    private DirectoryWatcher(SassCompiler compiler, Path input, Path output, SassOptions options,
                             WatchListener listener) throws IOException {
        this.compiler = compiler;
        this.input = input;
        this.output = output;
        this.options = options;
        this.listener = listener;
        this.watchService = FileSystems.getDefault().newWatchService();
        input.register(watchService, StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_MODIFY);
        this.scheduler = new CompileScheduler(this::compile, SHUTDOWN_TIMEOUT);
        this.pollThread = new Thread(this::poll, "sassed-watch");
        this.dispatcherThread = new Thread(this::dispatch, "sassed-dispatch");
        pollThread.setDaemon(true);
        dispatcherThread.setDaemon(true);
    }

    public static DirectoryWatcher start(SassCompiler compiler, Path input, Path output, SassOptions options,
                                         WatchListener listener) {
        DirectoryWatcher watcher;
        try {
            watcher = new DirectoryWatcher(compiler, input, output, options, listener);
        } catch (IOException e) {
            throw new SassRuntimeException("Cannot watch directory `" + input + "`", e);
        }
        watcher.pollThread.start();
        watcher.dispatcherThread.start();
        logger.info("Watching {} for changes, writing to {}", input, output);
        return watcher;
    }

    public boolean isClosed() {
        return closed;
    }

    private void poll() {
        while (!closed) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            for (java.nio.file.WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    logger.warn("Missed file events in {}, recompiling everything", input);
                    compileAll();
                    continue;
                }
                Path changed = input.resolve((Path) event.context());
                if (options.extensions().matches(changed.getFileName().toString())) {
                    logger.debug("Changed: {}", changed);
                    scheduler.submit(changed);
                }
            }
            if (!key.reset()) {
                logger.warn("{} is no longer accessible, stopping", input);
                return;
            }
        }
    }

    private void compileAll() {
        for (Path path : SassCompiler.sourcesOf(input, options)) {
            scheduler.submit(path);
        }
    }

    private void compile(Set<Path> changed) {
        if (options.singleFile().enabled()) {
            try {
                compiler.compileFolder(input, output, options);
                events.add(new WatchEvent.Compiled(input, output.resolve(options.singleFile().name() + ".css")));
            } catch (SassException e) {
                events.add(new WatchEvent.Failed(input, e));
            }
            return;
        }
        List<Path> targets = changed.stream().anyMatch(SassCompiler::isPartial)
                ? SassCompiler.sourcesOf(input, options)
                : changed.stream().filter(path -> path.toFile().isFile()).toList();
        for (Path source : targets) {
            Path css = output.resolve(SassCompiler.cssName(source));
            try {
                compiler.compileFile(source, css, options);
                events.add(new WatchEvent.Compiled(source, css));
            } catch (SassException e) {
                events.add(new WatchEvent.Failed(source, e));
            }
        }
    }

    private void dispatch() {
        while (true) {
            WatchEvent event;
            try {
                event = events.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event instanceof WatchEvent.Stop) {
                return;
            }
            if (event instanceof WatchEvent.Compiled compiled) {
                logger.info("Compiled {} to {}", compiled.source(), compiled.output());
                try {
                    listener.onCompiled(compiled.source(), compiled.output());
                } catch (RuntimeException e) {
                    logger.error("Watch listener failed on compiled {}", compiled.source(), e);
                }
            } else if (event instanceof WatchEvent.Failed failed) {
                logger.warn("Failed to compile {}: {}", failed.source(), failed.error().getMessage());
                WatchAction action;
                try {
                    action = listener.onError(failed.source(), failed.error());
                } catch (RuntimeException e) {
                    logger.error("Watch listener failed on error for {}", failed.source(), e);
                    action = WatchAction.CONTINUE;
                }
                if (action == WatchAction.STOP) {
                    shutdown();
                    return;
                }
            }
        }
    }

    /**
     * Stops watching. The compile in progress, if any, is allowed to finish.
     */
    @Override
    public void close() {
        shutdown();
        join(pollThread);
        join(dispatcherThread);
    }

    private void shutdown() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        events.add(new WatchEvent.Stop());
        try {
            watchService.close();
        } catch (IOException e) {
            logger.warn("Failed to close watch service for {}", input, e);
        }
        scheduler.close();
        logger.info("Stopped watching {}", input);
    }

    private static void join(Thread thread) {
        if (thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(SHUTDOWN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
