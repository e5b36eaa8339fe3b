package com.platform.updater.resourcebuilder;

import com.platform.updater.manifest.Manifest;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fallback strategy for kinds without a registered builder.
 * 
 * Reads the live object first: absent objects are created, present ones are updated
 * with the live resourceVersion carried over.
 */
@Slf4j
public class GenericResourceBuilder implements ResourceBuilder {
    
    private final DynamicResourceClient client;
    private final Manifest manifest;
    private final List<MetadataModifier> modifiers = new ArrayList<>();
    
    public GenericResourceBuilder(DynamicResourceClient client, Manifest manifest) {
        this.client = client;
        this.manifest = manifest;
    }
    
    /**
     * Factory that ignores the typed client and goes through the given dynamic client.
     */
    public static ResourceBuilderFactory factory(DynamicResourceClient dynamicClient) {
        return (kubernetesClient, manifest) -> new GenericResourceBuilder(dynamicClient, manifest);
    }
    
    @Override
    public ResourceBuilder withModifier(MetadataModifier modifier) {
        modifiers.add(modifier);
        return this;
    }
    
    @Override
    public void apply() {
        GenericKubernetesResource desired = ManifestConversion.convert(
            client.serialization(), manifest, GenericKubernetesResource.class);
        modifiers.forEach(modifier -> modifier.modify(desired.getMetadata()));
        
        Optional<GenericKubernetesResource> existing =
            client.get(manifest.getKind(), manifest.getNamespace(), manifest.getName());
        if (existing.isEmpty()) {
            log.debug("Creating {}", manifest.describe());
            client.create(manifest.getKind(), desired);
            return;
        }
        
        if (existing.get().getMetadata() != null) {
            desired.getMetadata().setResourceVersion(existing.get().getMetadata().getResourceVersion());
        }
        log.debug("Updating {}", manifest.describe());
        client.update(manifest.getKind(), desired);
    }
}
