package com.platform.updater.engine;

/**
 * Pass of a payload apply a status snapshot was taken in.
 */
public enum ApplyPhase {
    LENIENT,
    DEFERRED,
    DONE
}
