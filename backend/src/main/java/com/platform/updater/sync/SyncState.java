package com.platform.updater.sync;

/**
 * Lifecycle of the most recent sync.
 */
public enum SyncState {
    IDLE,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED
}
