package com.platform.updater.engine;

import com.platform.updater.error.ApplyException;
import com.platform.updater.manifest.Manifest;
import com.platform.updater.manifest.ResourceKind;

/**
 * Mutable progress of one payload apply. Owned by the running invocation only;
 * everything outside the engine sees {@link EngineStatusSnapshot}s.
 */
class EngineStatus {
    
    private final String payloadVersion;
    private final int total;
    private ApplyPhase phase = ApplyPhase.LENIENT;
    private int attempted;
    private int succeeded;
    private int deferred;
    private ResourceKind currentKind;
    private String currentManifest;
    private ApplyException lastError;
    
    EngineStatus(String payloadVersion, int total) {
        this.payloadVersion = payloadVersion;
        this.total = total;
    }
    
    void attemptStarted(Manifest manifest) {
        attempted++;
        currentKind = manifest.getKind();
        currentManifest = manifest.describe();
    }
    
    void manifestSucceeded() {
        succeeded++;
    }
    
    void manifestFailed(ApplyException error) {
        lastError = error;
    }
    
    void manifestDeferred() {
        deferred++;
    }
    
    void enterDeferredPass() {
        phase = ApplyPhase.DEFERRED;
    }
    
    void complete() {
        phase = ApplyPhase.DONE;
        currentKind = null;
        currentManifest = null;
    }
    
    int attempted() {
        return attempted;
    }
    
    EngineStatusSnapshot snapshot() {
        return new EngineStatusSnapshot(
            payloadVersion,
            phase,
            total,
            attempted,
            succeeded,
            deferred,
            currentKind,
            currentManifest,
            lastError
        );
    }
}
