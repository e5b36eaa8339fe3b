package com.platform.updater.manifest;

import java.util.Objects;

/**
 * Identifies one API resource type: group, version and kind.
 * The core API group is the empty string.
 */
public record ResourceKind(String group, String version, String kind) {
    
    public ResourceKind {
        Objects.requireNonNull(group, "group");
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version must not be blank");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be blank");
        }
    }
    
    /**
     * Build from a manifest's apiVersion ("group/version" or just "version") and kind.
     */
    public static ResourceKind of(String apiVersion, String kind) {
        if (apiVersion == null || apiVersion.isBlank()) {
            throw new IllegalArgumentException("apiVersion must not be blank");
        }
        int slash = apiVersion.lastIndexOf('/');
        if (slash < 0) {
            return new ResourceKind("", apiVersion, kind);
        }
        return new ResourceKind(apiVersion.substring(0, slash), apiVersion.substring(slash + 1), kind);
    }
    
    public String apiVersion() {
        return group.isEmpty() ? version : group + "/" + version;
    }
    
    public boolean isCoreGroup() {
        return group.isEmpty();
    }
    
    @Override
    public String toString() {
        return apiVersion() + ", Kind=" + kind;
    }
}
