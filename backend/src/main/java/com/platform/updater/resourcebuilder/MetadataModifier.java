package com.platform.updater.resourcebuilder;

import io.fabric8.kubernetes.api.model.ObjectMeta;

/**
 * Mutates standard object metadata (labels, annotations) before an object is submitted.
 */
@FunctionalInterface
public interface MetadataModifier {
    
    void modify(ObjectMeta metadata);
}
