package com.sassed.watch;

import com.sassed.error.SassException;

import java.nio.file.Path;

/**
 * Success and error handlers of a {@link DirectoryWatcher}. Both run on the watcher's
 * dispatcher thread, one event at a time. A handler that throws is logged and the watch goes on.
 */
public interface WatchListener {

    default void onCompiled(Path source, Path output) {
    }

    /**
     * Called for every failed compile. Returning {@link WatchAction#STOP} closes the watcher.
     */
    default WatchAction onError(Path source, SassException error) {
        return WatchAction.CONTINUE;
    }
}
