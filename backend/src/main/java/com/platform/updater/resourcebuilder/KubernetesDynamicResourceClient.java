package com.platform.updater.resourcebuilder;

import com.platform.updater.error.ApplyException;
import com.platform.updater.manifest.ResourceKind;
import io.fabric8.kubernetes.api.model.APIResource;
import io.fabric8.kubernetes.api.model.APIResourceList;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;
import lombok.extern.slf4j.Slf4j;

import java.net.HttpURLConnection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link DynamicResourceClient} backed by the fabric8 generic resource API.
 * 
 * Resource paths are resolved through API discovery. Only successful resolutions are
 * cached, so a kind registered after a NO_MATCH is picked up on the next attempt.
 */
@Slf4j
public class KubernetesDynamicResourceClient implements DynamicResourceClient {
    
    private final KubernetesClient client;
    private final Map<ResourceKind, ResourceDefinitionContext> contexts = new ConcurrentHashMap<>();
    
    public KubernetesDynamicResourceClient(KubernetesClient client) {
        this.client = client;
    }
    
    @Override
    public Optional<GenericKubernetesResource> get(ResourceKind kind, String namespace, String name) {
        try {
            return Optional.ofNullable(resource(kind, namespace, name).get());
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.classify(e, describe(kind, namespace, name));
        }
    }
    
    @Override
    public GenericKubernetesResource create(ResourceKind kind, GenericKubernetesResource resource) {
        String namespace = resource.getMetadata().getNamespace();
        String name = resource.getMetadata().getName();
        try {
            return operation(kind, namespace).resource(resource).create();
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.classify(e, describe(kind, namespace, name));
        }
    }
    
    @Override
    public GenericKubernetesResource update(ResourceKind kind, GenericKubernetesResource resource) {
        String namespace = resource.getMetadata().getNamespace();
        String name = resource.getMetadata().getName();
        try {
            return operation(kind, namespace).resource(resource).update();
        } catch (KubernetesClientException e) {
            throw KubernetesErrors.classify(e, describe(kind, namespace, name));
        }
    }
    
    @Override
    public KubernetesSerialization serialization() {
        return client.getKubernetesSerialization();
    }
    
    private Resource<GenericKubernetesResource> resource(ResourceKind kind, String namespace, String name) {
        return operation(kind, namespace).withName(name);
    }
    
    private NonNamespaceOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> operation(
            ResourceKind kind, String namespace) {
        ResourceDefinitionContext context = resolve(kind);
        MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> operation =
            client.genericKubernetesResources(context);
        if (context.isNamespaceScoped() && namespace != null && !namespace.isEmpty()) {
            return operation.inNamespace(namespace);
        }
        return operation;
    }
    
    /**
     * Resolve plural name and scope of a kind through API discovery.
     */
    ResourceDefinitionContext resolve(ResourceKind kind) {
        ResourceDefinitionContext cached = contexts.get(kind);
        if (cached != null) {
            return cached;
        }
        
        APIResourceList resources;
        try {
            resources = client.getApiResources(kind.apiVersion());
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                throw ApplyException.noMatch(String.format("no matches for %s: group version not served", kind));
            }
            throw KubernetesErrors.classify(e, "discovery of " + kind.apiVersion());
        }
        if (resources == null || resources.getResources() == null) {
            throw ApplyException.noMatch(String.format("no matches for %s: group version not served", kind));
        }
        
        APIResource match = resources.getResources().stream()
            .filter(r -> kind.kind().equals(r.getKind()) && !r.getName().contains("/"))
            .findFirst()
            .orElseThrow(() -> ApplyException.noMatch(String.format("no matches for %s", kind)));
        
        ResourceDefinitionContext context = new ResourceDefinitionContext.Builder()
            .withGroup(kind.group())
            .withVersion(kind.version())
            .withKind(kind.kind())
            .withPlural(match.getName())
            .withNamespaced(Boolean.TRUE.equals(match.getNamespaced()))
            .build();
        contexts.put(kind, context);
        log.debug("Resolved {} to resource {} (namespaced={})", kind, match.getName(), match.getNamespaced());
        return context;
    }
    
    private static String describe(ResourceKind kind, String namespace, String name) {
        String id = namespace == null || namespace.isEmpty() ? name : namespace + "/" + name;
        return kind.kind() + " \"" + id + "\"";
    }
}
