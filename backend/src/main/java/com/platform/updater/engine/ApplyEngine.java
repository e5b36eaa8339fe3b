package com.platform.updater.engine;

import com.platform.updater.error.ApplyException;
import com.platform.updater.manifest.Manifest;
import com.platform.updater.manifest.Payload;
import com.platform.updater.observability.LoggingConfig;
import com.platform.updater.observability.UpdaterMetrics;
import com.platform.updater.requeue.RequeuePolicy;
import com.platform.updater.resourcebuilder.ResourceApplier;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies a release payload to the cluster, manifest by manifest, in payload order.
 * 
 * Lenient pass: every manifest gets the full backoff budget. A manifest whose final
 * error the {@link RequeuePolicy} accepts is deferred and the pass goes on; any other
 * final error aborts the apply and nothing after it is touched.
 * 
 * Deferred pass: deferred manifests, in the order they were deferred, get one more full
 * backoff budget. The first one that still fails aborts the apply.
 * 
 * Single-threaded per invocation and lock-free; callers must not run two applies
 * against the same cluster concurrently.
 */
@Slf4j
public class ApplyEngine {
    
    private final ResourceApplier applier;
    private final RequeuePolicy requeuePolicy;
    private final BackoffPolicy backoffPolicy;
    private final UpdaterMetrics metrics;
    
    public ApplyEngine(
            ResourceApplier applier,
            RequeuePolicy requeuePolicy,
            BackoffPolicy backoffPolicy,
            UpdaterMetrics metrics) {
        this.applier = applier;
        this.requeuePolicy = requeuePolicy;
        this.backoffPolicy = backoffPolicy;
        this.metrics = metrics;
    }
    
    /**
     * Apply every manifest of the payload.
     *
     * @return the final status once every manifest succeeded
     * @throws ApplyException on the first manifest that fails for good, wrapped with its identity
     * @throws com.platform.updater.error.ApplyCancelledException when the token is cancelled
     */
    public EngineStatusSnapshot applyPayload(Payload payload, CancellationToken cancellation, StatusSink sink) {
        EngineStatus status = new EngineStatus(payload.version(), payload.size());
        long started = System.nanoTime();
        
        LoggingConfig.setPayloadContext(payload.sourceId(), payload.version());
        try {
            log.info("Applying payload {} ({} manifests)", payload.version(), payload.size());
            
            List<DeferredManifest> deferred = new ArrayList<>();
            for (Manifest manifest : payload.manifests()) {
                Optional<ApplyException> failure = applyWithBackoff(manifest, status, cancellation, sink);
                if (failure.isEmpty()) {
                    continue;
                }
                
                ApplyException error = failure.get();
                if (!requeuePolicy.shouldRequeue(error, manifest)) {
                    throw abort(manifest, error, status, sink);
                }
                
                deferred.add(new DeferredManifest(manifest, error));
                status.manifestDeferred();
                publish(sink, status);
                metrics.recordManifestOutcome(manifest.getKind().kind(), UpdaterMetrics.OUTCOME_DEFERRED);
                log.info("Deferring {} until the rest of the payload is applied: {}",
                    manifest.describe(), error.getApplyCause());
            }
            
            if (!deferred.isEmpty()) {
                status.enterDeferredPass();
                log.info("Retrying {} deferred manifest(s)", deferred.size());
                
                for (DeferredManifest entry : deferred) {
                    log.debug("Retrying deferred {} (deferred on {})",
                        entry.manifest().describe(), entry.error().getApplyCause());
                    Optional<ApplyException> failure = applyWithBackoff(entry.manifest(), status, cancellation, sink);
                    if (failure.isPresent()) {
                        throw abort(entry.manifest(), failure.get(), status, sink);
                    }
                }
            }
            
            status.complete();
            EngineStatusSnapshot result = status.snapshot();
            publish(sink, status);
            log.info("Payload {} applied: {} manifests in {} attempts",
                payload.version(), result.succeeded(), result.attempted());
            return result;
        } finally {
            metrics.recordPayloadDuration(Duration.ofNanos(System.nanoTime() - started));
            LoggingConfig.clearPayloadContext();
        }
    }
    
    /**
     * Run the bounded backoff loop for one manifest.
     *
     * @return empty on success, otherwise the final error wrapped with the manifest identity
     */
    private Optional<ApplyException> applyWithBackoff(
            Manifest manifest,
            EngineStatus status,
            CancellationToken cancellation,
            StatusSink sink) {
        LoggingConfig.setManifestContext(manifest.describe());
        try {
            ApplyException last = null;
            int maxAttempts = backoffPolicy.maxAttempts();
            
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                cancellation.throwIfCancelled();
                
                status.attemptStarted(manifest);
                publish(sink, status);
                metrics.recordApplyAttempt(manifest.getKind().kind());
                
                try {
                    applier.apply(manifest);
                    
                    status.manifestSucceeded();
                    publish(sink, status);
                    metrics.recordManifestOutcome(manifest.getKind().kind(), UpdaterMetrics.OUTCOME_SUCCEEDED);
                    if (attempt > 1) {
                        log.info("{} applied after {} attempts", manifest.describe(), attempt);
                    }
                    return Optional.empty();
                } catch (ApplyException e) {
                    last = e;
                } catch (RuntimeException e) {
                    last = ApplyException.other(e.getMessage(), e);
                }
                
                log.warn("Applying {} failed (attempt {}/{}): {}",
                    manifest.describe(), attempt, maxAttempts, last.getMessage());
                
                if (attempt < maxAttempts) {
                    Duration delay = backoffPolicy.delayAfter(attempt);
                    log.debug("Retrying {} in {}ms", manifest.describe(), delay.toMillis());
                    cancellation.sleep(delay);
                }
            }
            
            ApplyException error = last.forManifest(manifest, maxAttempts);
            status.manifestFailed(error);
            return Optional.of(error);
        } finally {
            LoggingConfig.clearManifestContext();
        }
    }
    
    private ApplyException abort(Manifest manifest, ApplyException error, EngineStatus status, StatusSink sink) {
        publish(sink, status);
        metrics.recordManifestOutcome(manifest.getKind().kind(), UpdaterMetrics.OUTCOME_FAILED);
        log.error("Aborting payload apply at {} after {} attempts: {}",
            manifest.describe(), status.attempted(), error.getMessage());
        return error;
    }
    
    private void publish(StatusSink sink, EngineStatus status) {
        try {
            sink.report(status.snapshot());
        } catch (RuntimeException e) {
            log.warn("Status sink rejected progress update: {}", e.getMessage());
        }
    }
    
    private record DeferredManifest(Manifest manifest, ApplyException error) {
    }
}
