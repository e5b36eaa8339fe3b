package com.platform.updater.resourcebuilder;

import com.platform.updater.manifest.ResourceKind;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;

import java.util.Optional;

/**
 * Schema-agnostic access to any resource type the cluster serves.
 * Every method throws {@link com.platform.updater.error.ApplyException}: NO_MATCH when
 * the kind is not served by the cluster, otherwise whatever the API server reported.
 */
public interface DynamicResourceClient {
    
    Optional<GenericKubernetesResource> get(ResourceKind kind, String namespace, String name);
    
    GenericKubernetesResource create(ResourceKind kind, GenericKubernetesResource resource);
    
    GenericKubernetesResource update(ResourceKind kind, GenericKubernetesResource resource);
    
    /**
     * Serialization used to turn manifests into resources for this client.
     */
    default KubernetesSerialization serialization() {
        return ManifestConversion.DEFAULT_SERIALIZATION;
    }
}
