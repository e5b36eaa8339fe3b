package com.platform.updater.resourcebuilder;

import com.platform.updater.manifest.Manifest;
import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * Creates the strategy for one manifest of a registered kind.
 */
@FunctionalInterface
public interface ResourceBuilderFactory {
    
    ResourceBuilder create(KubernetesClient client, Manifest manifest);
}
