package com.platform.updater.resourcebuilder;

/**
 * Strategy that applies one manifest to the cluster.
 * 
 * Implementations must be idempotent create-or-update: the engine re-invokes
 * {@link #apply()} on a fresh instance after every failed attempt.
 */
public interface ResourceBuilder {
    
    /**
     * Add a metadata modifier, run in registration order just before submission.
     */
    ResourceBuilder withModifier(MetadataModifier modifier);
    
    /**
     * Perform the single cluster-affecting call for this manifest.
     *
     * @throws com.platform.updater.error.ApplyException when the cluster rejects the object
     */
    void apply();
}
