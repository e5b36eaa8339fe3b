package com.platform.updater.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.updater.engine.EngineStatusSnapshot;
import com.platform.updater.error.ErrorCode;
import com.platform.updater.error.UpdaterException;

import java.time.Instant;

/**
 * Immutable status of the most recent sync, as served by the API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncStatus(
    SyncState state,
    String version,
    Instant startedAt,
    Instant completedAt,
    int total,
    int attempted,
    int succeeded,
    int deferred,
    String currentManifest,
    String errorCode,
    String errorMessage
) {
    
    public static SyncStatus idle() {
        return new SyncStatus(SyncState.IDLE, null, null, null, 0, 0, 0, 0, null, null, null);
    }
    
    public static SyncStatus running(String version, Instant startedAt) {
        return new SyncStatus(SyncState.RUNNING, version, startedAt, null, 0, 0, 0, 0, null, null, null);
    }
    
    /**
     * Copy with the engine's latest progress; the state is left untouched.
     */
    public SyncStatus withProgress(EngineStatusSnapshot snapshot) {
        return new SyncStatus(
            state,
            version,
            startedAt,
            completedAt,
            snapshot.total(),
            snapshot.attempted(),
            snapshot.succeeded(),
            snapshot.deferred(),
            snapshot.currentManifest(),
            errorCode,
            errorMessage
        );
    }
    
    public SyncStatus succeeded(EngineStatusSnapshot snapshot, Instant at) {
        return withProgress(snapshot).finish(SyncState.SUCCEEDED, at, null, null);
    }
    
    public SyncStatus failed(RuntimeException error, Instant at) {
        ErrorCode code = error instanceof UpdaterException
            ? ((UpdaterException) error).getErrorCode()
            : ErrorCode.INTERNAL_ERROR;
        return finish(SyncState.FAILED, at, code.getCode(), error.getMessage());
    }
    
    public SyncStatus cancelled(String reason, Instant at) {
        return finish(SyncState.CANCELLED, at, ErrorCode.SYNC_CANCELLED.getCode(), reason);
    }
    
    private SyncStatus finish(SyncState newState, Instant at, String code, String message) {
        return new SyncStatus(
            newState,
            version,
            startedAt,
            at,
            total,
            attempted,
            succeeded,
            deferred,
            currentManifest,
            code,
            message
        );
    }
}
