package com.sassed.watch;

import com.sassed.error.SassException;

import java.nio.file.Path;

/**
 * Messages from the compile thread to the dispatcher thread. {@link Stop} ends the dispatcher.
 */
public sealed interface WatchEvent {

    record Compiled(Path source, Path output) implements WatchEvent {
    }

    record Failed(Path source, SassException error) implements WatchEvent {
    }

    record Stop() implements WatchEvent {
    }
}
