package com.platform.updater.engine;

/**
 * Receives progress of a running payload apply.
 * Called on the engine's thread; implementations must return promptly.
 */
@FunctionalInterface
public interface StatusSink {
    
    StatusSink NONE = snapshot -> { };
    
    void report(EngineStatusSnapshot snapshot);
}
