package com.platform.updater.resourcebuilder;

import com.platform.updater.error.ApplyException;
import com.platform.updater.manifest.Manifest;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;

/**
 * Converts manifest bodies into fabric8 model objects through the client's serialization.
 */
final class ManifestConversion {
    
    /**
     * Serialization for callers without a typed client, configured the way the client configures its own.
     */
    static final KubernetesSerialization DEFAULT_SERIALIZATION = new KubernetesSerialization();
    
    private ManifestConversion() {
    }
    
    static <T extends HasMetadata> T convert(KubernetesSerialization serialization, Manifest manifest, Class<T> type) {
        T resource;
        try {
            resource = serialization.convertValue(manifest.getBody(), type);
        } catch (IllegalArgumentException e) {
            throw ApplyException.other(
                String.format("%s cannot be read as %s: %s",
                    manifest.describe(), type.getSimpleName(), e.getMessage()), e);
        }
        if (resource.getMetadata() == null) {
            resource.setMetadata(new ObjectMeta());
        }
        return resource;
    }
}
