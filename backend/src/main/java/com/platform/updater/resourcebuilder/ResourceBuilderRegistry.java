package com.platform.updater.resourcebuilder;

import com.platform.updater.manifest.ResourceKind;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps resource kinds to the factory of their kind-specific strategy.
 * Kinds without an entry are applied through the generic strategy.
 */
@Slf4j
public class ResourceBuilderRegistry {
    
    private final Map<ResourceKind, ResourceBuilderFactory> factories = new ConcurrentHashMap<>();
    
    public void register(ResourceKind kind, ResourceBuilderFactory factory) {
        ResourceBuilderFactory previous = factories.put(kind, factory);
        if (previous != null) {
            log.warn("Replaced resource builder registered for {}", kind);
        } else {
            log.debug("Registered resource builder for {}", kind);
        }
    }
    
    public Optional<ResourceBuilderFactory> lookup(ResourceKind kind) {
        return Optional.ofNullable(factories.get(kind));
    }
    
    public Set<ResourceKind> registeredKinds() {
        return Set.copyOf(factories.keySet());
    }
    
    /**
     * Register every entry of this registry into another, replacing what the target had for the same kind.
     */
    public void copyInto(ResourceBuilderRegistry target) {
        factories.forEach(target::register);
    }
    
    public int size() {
        return factories.size();
    }
}
