package com.platform.updater.resourcebuilder;

import com.platform.updater.manifest.ResourceKind;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.rbac.ClusterRole;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.Role;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;

/**
 * Kind-specific strategies shipped with the updater.
 */
public final class DefaultResourceBuilders {
    
    public static final ResourceKind CUSTOM_RESOURCE_DEFINITION =
        new ResourceKind("apiextensions.k8s.io", "v1", "CustomResourceDefinition");
    
    private DefaultResourceBuilders() {
    }
    
    public static ResourceBuilderRegistry newRegistry() {
        ResourceBuilderRegistry registry = new ResourceBuilderRegistry();
        registerAll(registry);
        return registry;
    }
    
    public static void registerAll(ResourceBuilderRegistry registry) {
        registry.register(new ResourceKind("", "v1", "Namespace"), TypedResourceBuilder.factory(Namespace.class));
        registry.register(new ResourceKind("", "v1", "ConfigMap"), TypedResourceBuilder.factory(ConfigMap.class));
        registry.register(new ResourceKind("", "v1", "Secret"), TypedResourceBuilder.factory(Secret.class));
        registry.register(new ResourceKind("", "v1", "ServiceAccount"), TypedResourceBuilder.factory(ServiceAccount.class));
        registry.register(new ResourceKind("", "v1", "Service"), TypedResourceBuilder.factory(Service.class));
        
        registry.register(new ResourceKind("apps", "v1", "Deployment"), TypedResourceBuilder.factory(Deployment.class));
        registry.register(new ResourceKind("apps", "v1", "DaemonSet"), TypedResourceBuilder.factory(DaemonSet.class));
        
        registry.register(new ResourceKind("rbac.authorization.k8s.io", "v1", "ClusterRole"),
            TypedResourceBuilder.factory(ClusterRole.class));
        registry.register(new ResourceKind("rbac.authorization.k8s.io", "v1", "ClusterRoleBinding"),
            TypedResourceBuilder.factory(ClusterRoleBinding.class));
        registry.register(new ResourceKind("rbac.authorization.k8s.io", "v1", "Role"),
            TypedResourceBuilder.factory(Role.class));
        registry.register(new ResourceKind("rbac.authorization.k8s.io", "v1", "RoleBinding"),
            TypedResourceBuilder.factory(RoleBinding.class));
        
        registry.register(CUSTOM_RESOURCE_DEFINITION, CustomResourceDefinitionBuilder::new);
    }
}
