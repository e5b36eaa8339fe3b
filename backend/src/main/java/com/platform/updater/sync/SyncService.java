package com.platform.updater.sync;

import com.platform.updater.engine.ApplyEngine;
import com.platform.updater.engine.CancellationToken;
import com.platform.updater.engine.EngineStatusSnapshot;
import com.platform.updater.error.ApplyCancelledException;
import com.platform.updater.error.SyncInProgressException;
import com.platform.updater.error.UpdaterException;
import com.platform.updater.manifest.Payload;
import com.platform.updater.observability.UpdaterMetrics;
import com.platform.updater.payload.DesiredUpdate;
import com.platform.updater.payload.PayloadRetriever;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the apply engine for a desired update, one sync at a time.
 * 
 * Provides the mutual exclusion the engine relies on and keeps the latest
 * {@link SyncStatus} for readers. Engine progress arrives as snapshots only.
 */
@Slf4j
@Service
public class SyncService {
    
    private final ApplyEngine engine;
    private final PayloadRetriever payloadRetriever;
    private final UpdaterMetrics metrics;
    
    private final ReentrantLock syncLock = new ReentrantLock();
    private final AtomicReference<SyncStatus> status = new AtomicReference<>(SyncStatus.idle());
    private final AtomicReference<CancellationToken> runningToken = new AtomicReference<>();
    private final AtomicReference<DesiredUpdate> lastDesired = new AtomicReference<>();
    
    @Value("${updater.sync.resync-enabled:false}")
    private boolean resyncEnabled;
    
    public SyncService(ApplyEngine engine, PayloadRetriever payloadRetriever, UpdaterMetrics metrics) {
        this.engine = engine;
        this.payloadRetriever = payloadRetriever;
        this.metrics = metrics;
    }
    
    /**
     * Apply the payload of the desired update and wait for the outcome.
     *
     * @throws SyncInProgressException if another sync is running
     */
    public SyncStatus sync(DesiredUpdate desired) {
        if (!syncLock.tryLock()) {
            throw new SyncInProgressException(status.get().version());
        }
        
        CancellationToken token = new CancellationToken();
        runningToken.set(token);
        lastDesired.set(desired);
        metrics.setSyncRunning(true);
        status.set(SyncStatus.running(desired.version(), Instant.now()));
        log.info("Starting sync to version {}", desired.version());
        
        try {
            Payload payload = payloadRetriever.retrieve(desired);
            EngineStatusSnapshot result = engine.applyPayload(payload, token, this::onProgress);
            
            SyncStatus done = status.updateAndGet(s -> s.succeeded(result, Instant.now()));
            metrics.recordSyncOutcome(UpdaterMetrics.OUTCOME_SUCCEEDED);
            log.info("Sync to version {} completed", desired.version());
            return done;
            
        } catch (ApplyCancelledException e) {
            status.updateAndGet(s -> s.cancelled(e.getMessage(), Instant.now()));
            metrics.recordSyncOutcome(UpdaterMetrics.OUTCOME_CANCELLED);
            log.warn("Sync to version {} cancelled: {}", desired.version(), e.getMessage());
            throw e;
            
        } catch (RuntimeException e) {
            status.updateAndGet(s -> s.failed(e, Instant.now()));
            metrics.recordSyncOutcome(UpdaterMetrics.OUTCOME_FAILED);
            log.error("Sync to version {} failed: {}", desired.version(), e.getMessage());
            throw e;
            
        } finally {
            runningToken.set(null);
            metrics.setSyncRunning(false);
            syncLock.unlock();
        }
    }
    
    /**
     * Cancel the running sync, if any.
     *
     * @return whether a running sync was signalled
     */
    public boolean cancel(String reason) {
        CancellationToken token = runningToken.get();
        if (token == null) {
            return false;
        }
        token.cancel(reason);
        log.info("Cancellation requested for running sync: {}", reason);
        return true;
    }
    
    public SyncStatus currentStatus() {
        return status.get();
    }
    
    public Optional<DesiredUpdate> lastDesiredUpdate() {
        return Optional.ofNullable(lastDesired.get());
    }
    
    /**
     * Re-apply the last desired update on a timer, when enabled.
     */
    @Scheduled(
        fixedDelayString = "${updater.sync.resync-interval-ms:300000}",
        initialDelayString = "${updater.sync.resync-interval-ms:300000}")
    public void resync() {
        if (!resyncEnabled) {
            return;
        }
        DesiredUpdate desired = lastDesired.get();
        if (desired == null || syncLock.isLocked()) {
            return;
        }
        
        try {
            sync(desired);
        } catch (SyncInProgressException e) {
            log.debug("Skipping resync, {}", e.getMessage());
        } catch (UpdaterException e) {
            log.warn("Resync to version {} did not complete ({}), retrying in next cycle",
                desired.version(), e.getErrorCode().getCode());
        }
    }
    
    void setResyncEnabled(boolean resyncEnabled) {
        this.resyncEnabled = resyncEnabled;
    }
    
    private void onProgress(EngineStatusSnapshot snapshot) {
        status.updateAndGet(s -> s.withProgress(snapshot));
    }
}
