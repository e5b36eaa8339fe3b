package com.platform.updater.manifest;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResourceKindTest {
    
    @Test
    void coreGroupApiVersionHasNoGroup() {
        ResourceKind kind = ResourceKind.of("v1", "ConfigMap");
        
        assertEquals("", kind.group());
        assertEquals("v1", kind.version());
        assertTrue(kind.isCoreGroup());
        assertEquals("v1", kind.apiVersion());
    }
    
    @Test
    void groupedApiVersionIsSplitOnSlash() {
        ResourceKind kind = ResourceKind.of("apiextensions.k8s.io/v1", "CustomResourceDefinition");
        
        assertEquals("apiextensions.k8s.io", kind.group());
        assertEquals("v1", kind.version());
        assertFalse(kind.isCoreGroup());
        assertEquals("apiextensions.k8s.io/v1", kind.apiVersion());
        assertEquals("apiextensions.k8s.io/v1, Kind=CustomResourceDefinition", kind.toString());
    }
    
    @Test
    void equalityCoversAllThreeParts() {
        assertEquals(new ResourceKind("apps", "v1", "Deployment"), ResourceKind.of("apps/v1", "Deployment"));
        assertNotEquals(new ResourceKind("apps", "v1", "Deployment"), ResourceKind.of("apps/v1beta1", "Deployment"));
        assertNotEquals(new ResourceKind("apps", "v1", "Deployment"), ResourceKind.of("extensions/v1", "Deployment"));
    }
    
    @Test
    void rejectsBlankParts() {
        assertThrows(IllegalArgumentException.class, () -> ResourceKind.of("", "ConfigMap"));
        assertThrows(IllegalArgumentException.class, () -> ResourceKind.of("v1", " "));
        assertThrows(NullPointerException.class, () -> new ResourceKind(null, "v1", "ConfigMap"));
    }
}
