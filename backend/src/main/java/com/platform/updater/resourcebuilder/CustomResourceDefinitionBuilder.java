package com.platform.updater.resourcebuilder;

import com.platform.updater.error.ApplyException;
import com.platform.updater.manifest.Manifest;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionCondition;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.List;

/**
 * Applies a CustomResourceDefinition and defers until the API server reports it Established,
 * so that manifests of the new kind are not applied against an unserved type.
 */
public class CustomResourceDefinitionBuilder extends TypedResourceBuilder<CustomResourceDefinition> {
    
    static final String ESTABLISHED = "Established";
    
    public CustomResourceDefinitionBuilder(KubernetesClient client, Manifest manifest) {
        super(client, manifest, CustomResourceDefinition.class);
    }
    
    @Override
    protected void verify(CustomResourceDefinition applied) {
        if (!isEstablished(applied)) {
            throw ApplyException.retryLater(
                String.format("CustomResourceDefinition %s is not established yet", manifest.getName()));
        }
    }
    
    static boolean isEstablished(CustomResourceDefinition crd) {
        if (crd == null || crd.getStatus() == null) {
            return false;
        }
        List<CustomResourceDefinitionCondition> conditions = crd.getStatus().getConditions();
        if (conditions == null) {
            return false;
        }
        return conditions.stream()
            .anyMatch(c -> ESTABLISHED.equals(c.getType()) && "True".equals(c.getStatus()));
    }
}
