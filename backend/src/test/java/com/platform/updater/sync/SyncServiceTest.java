package com.platform.updater.sync;

import com.platform.updater.engine.ApplyEngine;
import com.platform.updater.engine.ApplyPhase;
import com.platform.updater.engine.CancellationToken;
import com.platform.updater.engine.EngineStatusSnapshot;
import com.platform.updater.engine.StatusSink;
import com.platform.updater.error.ApplyCancelledException;
import com.platform.updater.error.ApplyException;
import com.platform.updater.error.ErrorCode;
import com.platform.updater.error.PayloadException;
import com.platform.updater.error.SyncInProgressException;
import com.platform.updater.manifest.Payload;
import com.platform.updater.observability.UpdaterMetrics;
import com.platform.updater.payload.DesiredUpdate;
import com.platform.updater.payload.PayloadRetriever;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SyncServiceTest {
    
    private static final Payload PAYLOAD = new Payload("test", "4.15.2", List.of());
    
    private ApplyEngine engine;
    private PayloadRetriever retriever;
    private UpdaterMetrics metrics;
    private SyncService service;
    
    @BeforeEach
    void setUp() {
        engine = mock(ApplyEngine.class);
        retriever = mock(PayloadRetriever.class);
        metrics = new UpdaterMetrics(new SimpleMeterRegistry());
        service = new SyncService(engine, retriever, metrics);
        
        when(retriever.retrieve(any())).thenReturn(PAYLOAD);
    }
    
    @Test
    void startsIdle() {
        assertEquals(SyncState.IDLE, service.currentStatus().state());
        assertTrue(service.lastDesiredUpdate().isEmpty());
        assertFalse(service.cancel("nothing running"));
    }
    
    @Test
    void successfulSyncReportsEngineResult() {
        when(engine.applyPayload(eq(PAYLOAD), any(), any()))
            .thenReturn(snapshot(ApplyPhase.DONE, 3, 4, 3, 1));
        
        SyncStatus status = service.sync(DesiredUpdate.of("4.15.2"));
        
        assertEquals(SyncState.SUCCEEDED, status.state());
        assertEquals("4.15.2", status.version());
        assertEquals(3, status.succeeded());
        assertEquals(4, status.attempted());
        assertEquals(1, status.deferred());
        assertNotNull(status.startedAt());
        assertNotNull(status.completedAt());
        assertNull(status.errorCode());
        assertEquals(status, service.currentStatus());
        assertEquals(1.0, metrics.count("updater.sync.total", "outcome", UpdaterMetrics.OUTCOME_SUCCEEDED));
    }
    
    @Test
    void progressIsVisibleWhileRunning() {
        SyncStatus[] seen = new SyncStatus[1];
        when(engine.applyPayload(eq(PAYLOAD), any(), any())).thenAnswer(invocation -> {
            StatusSink sink = invocation.getArgument(2);
            sink.report(snapshot(ApplyPhase.LENIENT, 3, 1, 0, 0));
            seen[0] = service.currentStatus();
            return snapshot(ApplyPhase.DONE, 3, 3, 3, 0);
        });
        
        service.sync(DesiredUpdate.of("4.15.2"));
        
        assertEquals(SyncState.RUNNING, seen[0].state());
        assertEquals(1, seen[0].attempted());
    }
    
    @Test
    void applyFailureIsRecordedAndRethrown() {
        ApplyException failure = ApplyException.other("boom", null);
        when(engine.applyPayload(eq(PAYLOAD), any(), any())).thenThrow(failure);
        
        ApplyException e = assertThrows(ApplyException.class, () -> service.sync(DesiredUpdate.of("4.15.2")));
        
        assertSame(failure, e);
        SyncStatus status = service.currentStatus();
        assertEquals(SyncState.FAILED, status.state());
        assertEquals(ErrorCode.APPLY_FAILED.getCode(), status.errorCode());
        assertEquals("boom", status.errorMessage());
        assertEquals(1.0, metrics.count("updater.sync.total", "outcome", UpdaterMetrics.OUTCOME_FAILED));
    }
    
    @Test
    void payloadFailureNeverReachesEngine() {
        when(retriever.retrieve(any())).thenThrow(PayloadException.notFound("/payloads/4.15.2"));
        
        assertThrows(PayloadException.class, () -> service.sync(DesiredUpdate.of("4.15.2")));
        
        assertEquals(SyncState.FAILED, service.currentStatus().state());
        assertEquals(ErrorCode.PAYLOAD_NOT_FOUND.getCode(), service.currentStatus().errorCode());
        verifyNoInteractions(engine);
    }
    
    @Test
    void cancelSignalsTheRunningApply() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(engine.applyPayload(eq(PAYLOAD), any(), any())).thenAnswer(invocation -> {
            CancellationToken token = invocation.getArgument(1);
            started.countDown();
            token.sleep(java.time.Duration.ofSeconds(30));
            return snapshot(ApplyPhase.DONE, 0, 0, 0, 0);
        });
        
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SyncStatus> running = executor.submit(() -> service.sync(DesiredUpdate.of("4.15.2")));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            
            assertThrows(SyncInProgressException.class, () -> service.sync(DesiredUpdate.of("4.16.0")));
            assertTrue(service.cancel("operator request"));
            
            Exception e = assertThrows(Exception.class, () -> running.get(5, TimeUnit.SECONDS));
            assertInstanceOf(ApplyCancelledException.class, e.getCause());
        } finally {
            executor.shutdownNow();
        }
        
        assertEquals(SyncState.CANCELLED, service.currentStatus().state());
        assertEquals(ErrorCode.SYNC_CANCELLED.getCode(), service.currentStatus().errorCode());
        assertEquals("4.15.2", service.lastDesiredUpdate().orElseThrow().version());
    }
    
    @Test
    void resyncDoesNothingWhenDisabled() {
        when(engine.applyPayload(eq(PAYLOAD), any(), any())).thenReturn(snapshot(ApplyPhase.DONE, 0, 0, 0, 0));
        service.sync(DesiredUpdate.of("4.15.2"));
        
        service.setResyncEnabled(false);
        service.resync();
        
        verify(engine, times(1)).applyPayload(any(), any(), any());
    }
    
    @Test
    void resyncReappliesLastDesiredUpdate() {
        when(engine.applyPayload(eq(PAYLOAD), any(), any())).thenReturn(snapshot(ApplyPhase.DONE, 0, 0, 0, 0));
        service.setResyncEnabled(true);
        
        service.resync();
        verifyNoInteractions(engine);
        
        service.sync(DesiredUpdate.of("4.15.2"));
        service.resync();
        
        verify(engine, times(2)).applyPayload(any(), any(), any());
    }
    
    @Test
    void resyncSwallowsApplyFailures() {
        when(engine.applyPayload(eq(PAYLOAD), any(), any()))
            .thenReturn(snapshot(ApplyPhase.DONE, 0, 0, 0, 0))
            .thenThrow(ApplyException.other("boom", null));
        service.setResyncEnabled(true);
        service.sync(DesiredUpdate.of("4.15.2"));
        
        assertDoesNotThrow(service::resync);
        assertEquals(SyncState.FAILED, service.currentStatus().state());
    }
    
    private static EngineStatusSnapshot snapshot(ApplyPhase phase, int total, int attempted, int succeeded, int deferred) {
        return new EngineStatusSnapshot("4.15.2", phase, total, attempted, succeeded, deferred, null, null, null);
    }
}
