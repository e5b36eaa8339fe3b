package com.platform.updater.manifest;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Objects;

/**
 * One declared desired resource from a release payload.
 * 
 * Immutable: the body is held as a private JSON tree and every read returns a deep copy,
 * so strategies are free to mutate what they receive.
 */
public final class Manifest {
    
    private final ResourceKind kind;
    private final String namespace;
    private final String name;
    private final ObjectNode body;
    private final Map<String, String> annotations;
    
    Manifest(ResourceKind kind, String namespace, String name, ObjectNode body, Map<String, String> annotations) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.namespace = namespace == null ? "" : namespace;
        this.name = Objects.requireNonNull(name, "name");
        this.body = body.deepCopy();
        this.annotations = Map.copyOf(annotations);
    }
    
    public ResourceKind getKind() {
        return kind;
    }
    
    /**
     * Namespace of the object, empty for cluster-scoped resources.
     */
    public String getNamespace() {
        return namespace;
    }
    
    public String getName() {
        return name;
    }
    
    public ObjectNode getBody() {
        return body.deepCopy();
    }
    
    public Map<String, String> getAnnotations() {
        return annotations;
    }
    
    public boolean isNamespaced() {
        return !namespace.isEmpty();
    }
    
    /**
     * Short human-readable identity, e.g. {@code Deployment "openshift-dns/dns" (apps/v1)}.
     */
    public String describe() {
        String id = isNamespaced() ? namespace + "/" + name : name;
        return String.format("%s \"%s\" (%s)", kind.kind(), id, kind.apiVersion());
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Manifest)) {
            return false;
        }
        Manifest other = (Manifest) o;
        return kind.equals(other.kind)
            && namespace.equals(other.namespace)
            && name.equals(other.name)
            && body.equals(other.body);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(kind, namespace, name, body);
    }
    
    @Override
    public String toString() {
        return describe();
    }
}
