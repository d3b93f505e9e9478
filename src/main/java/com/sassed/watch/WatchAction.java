package com.sassed.watch;

/**
 * What the watcher does after reporting a failed compile.
 */
public enum WatchAction {
    CONTINUE,
    STOP
}
