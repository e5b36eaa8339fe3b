package com.platform.updater.resourcebuilder;

import com.platform.updater.error.ApplyException;
import com.platform.updater.manifest.Manifest;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Resolves the strategy for a manifest's kind and runs it.
 * 
 * Kinds present in the registry get their kind-specific builder; every other kind
 * goes through the generic factory. Configured modifiers are attached in order.
 */
@Slf4j
public class DispatchingResourceApplier implements ResourceApplier {
    
    private final KubernetesClient client;
    private final ResourceBuilderRegistry registry;
    private final ResourceBuilderFactory genericFactory;
    private final List<MetadataModifier> modifiers;
    
    public DispatchingResourceApplier(
            KubernetesClient client,
            ResourceBuilderRegistry registry,
            ResourceBuilderFactory genericFactory,
            List<MetadataModifier> modifiers) {
        this.client = client;
        this.registry = registry;
        this.genericFactory = genericFactory;
        this.modifiers = List.copyOf(modifiers);
    }
    
    @Override
    public void apply(Manifest manifest) {
        ResourceBuilderFactory factory = registry.lookup(manifest.getKind())
            .orElse(genericFactory);
        
        ResourceBuilder builder = factory.create(client, manifest);
        for (MetadataModifier modifier : modifiers) {
            builder = builder.withModifier(modifier);
        }
        
        try {
            builder.apply();
        } catch (ApplyException e) {
            throw e;
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.classify(e, manifest.describe());
        } catch (RuntimeException e) {
            log.debug("Unclassified failure applying {}", manifest.describe(), e);
            throw ApplyException.other(manifest.describe() + ": " + e.getMessage(), e);
        }
    }
}
