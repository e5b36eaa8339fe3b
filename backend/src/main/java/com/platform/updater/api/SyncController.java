package com.platform.updater.api;

import com.platform.updater.manifest.ResourceKind;
import com.platform.updater.payload.DesiredUpdate;
import com.platform.updater.resourcebuilder.ResourceBuilderRegistry;
import com.platform.updater.sync.SyncService;
import com.platform.updater.sync.SyncStatus;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * REST API to apply a release payload and follow its progress.
 */
@RestController
@RequestMapping("/api/sync")
public class SyncController {
    
    private final SyncService syncService;
    private final ResourceBuilderRegistry registry;
    
    public SyncController(SyncService syncService, ResourceBuilderRegistry registry) {
        this.syncService = syncService;
        this.registry = registry;
    }
    
    /**
     * Run a sync on the request thread and answer with its final status.
     * Progress is visible through {@code /status} while this call is still open.
     */
    @PostMapping
    public SyncStatus sync(@Valid @RequestBody DesiredUpdate desired) {
        return syncService.sync(desired);
    }
    
    @GetMapping("/status")
    public SyncStatus status() {
        return syncService.currentStatus();
    }
    
    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = syncService.cancel("requested via API");
        return ResponseEntity.accepted().body(Map.of("cancelled", cancelled));
    }
    
    @GetMapping("/resource-kinds")
    public List<String> resourceKinds() {
        return registry.registeredKinds().stream()
            .sorted(Comparator.comparing(ResourceKind::group).thenComparing(ResourceKind::kind))
            .map(ResourceKind::toString)
            .toList();
    }
}
