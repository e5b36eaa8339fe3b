package com.platform.updater.resourcebuilder;

import com.platform.updater.manifest.Manifest;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.NonDeletingOperation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Strategy for kinds with a fabric8 model class: converts the manifest and issues
 * a create, falling back to update when the object already exists.
 *
 * @param <T> fabric8 model type of the kind
 */
@Slf4j
public class TypedResourceBuilder<T extends HasMetadata> implements ResourceBuilder {
    
    protected final KubernetesClient client;
    protected final Manifest manifest;
    private final Class<T> type;
    private final List<MetadataModifier> modifiers = new ArrayList<>();
    
    public TypedResourceBuilder(KubernetesClient client, Manifest manifest, Class<T> type) {
        this.client = client;
        this.manifest = manifest;
        this.type = type;
    }
    
    public static <T extends HasMetadata> ResourceBuilderFactory factory(Class<T> type) {
        return (client, manifest) -> new TypedResourceBuilder<>(client, manifest, type);
    }
    
    @Override
    public ResourceBuilder withModifier(MetadataModifier modifier) {
        modifiers.add(modifier);
        return this;
    }
    
    @Override
    public void apply() {
        T desired = ManifestConversion.convert(client.getKubernetesSerialization(), manifest, type);
        modifiers.forEach(modifier -> modifier.modify(desired.getMetadata()));
        
        T applied;
        try {
            applied = write(desired);
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.classify(e, manifest.describe());
        }
        log.debug("Applied {}", manifest.describe());
        verify(applied);
    }
    
    protected T write(T desired) {
        return client.resource(desired).createOr(NonDeletingOperation::update);
    }
    
    /**
     * Hook to inspect the object returned by the API server.
     * Throw a RETRY_LATER {@link com.platform.updater.error.ApplyException} to defer.
     */
    protected void verify(T applied) {
    }
}
