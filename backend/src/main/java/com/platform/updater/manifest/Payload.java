package com.platform.updater.manifest;

import java.util.List;
import java.util.Objects;

/**
 * Ordered manifests for one desired-state version.
 * Order is significant and is kept exactly as retrieved.
 */
public record Payload(String sourceId, String version, List<Manifest> manifests) {
    
    public Payload {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(version, "version");
        manifests = List.copyOf(manifests);
    }
    
    public int size() {
        return manifests.size();
    }
    
    public boolean isEmpty() {
        return manifests.isEmpty();
    }
}
