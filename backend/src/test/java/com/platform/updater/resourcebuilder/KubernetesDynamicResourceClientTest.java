package com.platform.updater.resourcebuilder;

import com.platform.updater.error.ApplyCause;
import com.platform.updater.error.ApplyException;
import com.platform.updater.manifest.ResourceKind;
import io.fabric8.kubernetes.api.model.APIResourceBuilder;
import io.fabric8.kubernetes.api.model.APIResourceList;
import io.fabric8.kubernetes.api.model.APIResourceListBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class KubernetesDynamicResourceClientTest {
    
    private static final ResourceKind TEST_A = new ResourceKind("test.cvo.io", "v1", "TestA");
    
    private KubernetesClient client;
    private KubernetesDynamicResourceClient dynamicClient;
    
    @BeforeEach
    void setUp() {
        client = mock(KubernetesClient.class);
        dynamicClient = new KubernetesDynamicResourceClient(client);
    }
    
    @Test
    void resolvesPluralAndScopeFromDiscovery() {
        when(client.getApiResources("test.cvo.io/v1")).thenReturn(discovery());
        
        ResourceDefinitionContext context = dynamicClient.resolve(TEST_A);
        
        assertEquals("testas", context.getPlural());
        assertEquals("test.cvo.io", context.getGroup());
        assertEquals("v1", context.getVersion());
        assertTrue(context.isNamespaceScoped());
    }
    
    @Test
    void successfulResolutionIsCached() {
        when(client.getApiResources("test.cvo.io/v1")).thenReturn(discovery());
        
        dynamicClient.resolve(TEST_A);
        dynamicClient.resolve(TEST_A);
        
        verify(client, times(1)).getApiResources("test.cvo.io/v1");
    }
    
    @Test
    void unknownKindIsNoMatchAndNotCached() {
        when(client.getApiResources("test.cvo.io/v1")).thenReturn(discovery());
        ResourceKind testB = new ResourceKind("test.cvo.io", "v1", "TestB");
        
        ApplyException e = assertThrows(ApplyException.class, () -> dynamicClient.resolve(testB));
        assertEquals(ApplyCause.NO_MATCH, e.getApplyCause());
        
        assertThrows(ApplyException.class, () -> dynamicClient.resolve(testB));
        verify(client, times(2)).getApiResources("test.cvo.io/v1");
    }
    
    @Test
    void unservedGroupVersionIsNoMatch() {
        when(client.getApiResources("test.cvo.io/v1"))
            .thenThrow(new KubernetesClientException("the server could not find the requested resource", 404, null));
        
        ApplyException e = assertThrows(ApplyException.class, () -> dynamicClient.resolve(TEST_A));
        
        assertEquals(ApplyCause.NO_MATCH, e.getApplyCause());
    }
    
    @Test
    void missingDiscoveryDocumentIsNoMatch() {
        when(client.getApiResources("test.cvo.io/v1")).thenReturn(null);
        
        ApplyException e = assertThrows(ApplyException.class, () -> dynamicClient.resolve(TEST_A));
        
        assertEquals(ApplyCause.NO_MATCH, e.getApplyCause());
    }
    
    @Test
    void discoveryOutageIsOther() {
        when(client.getApiResources("test.cvo.io/v1"))
            .thenThrow(new KubernetesClientException("service unavailable", 503, null));
        
        ApplyException e = assertThrows(ApplyException.class, () -> dynamicClient.resolve(TEST_A));
        
        assertEquals(ApplyCause.OTHER, e.getApplyCause());
    }
    
    private static APIResourceList discovery() {
        return new APIResourceListBuilder()
            .withGroupVersion("test.cvo.io/v1")
            .addToResources(new APIResourceBuilder()
                .withName("testas")
                .withKind("TestA")
                .withNamespaced(true)
                .build())
            .addToResources(new APIResourceBuilder()
                .withName("testas/status")
                .withKind("TestA")
                .withNamespaced(true)
                .build())
            .build();
    }
}
