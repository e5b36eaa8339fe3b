package com.platform.updater.resourcebuilder;

import com.platform.updater.manifest.Manifest;

/**
 * Applies a single manifest to the cluster, exactly one cluster-affecting call per invocation.
 */
@FunctionalInterface
public interface ResourceApplier {
    
    /**
     * @throws com.platform.updater.error.ApplyException with a classified cause on failure
     */
    void apply(Manifest manifest);
}
