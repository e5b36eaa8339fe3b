package com.platform.updater.resourcebuilder;

import com.platform.updater.error.ApplyCause;
import com.platform.updater.error.ApplyException;
import com.platform.updater.manifest.Manifest;
import com.platform.updater.manifest.ManifestParser;
import com.platform.updater.manifest.ResourceKind;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class DispatchingResourceApplierTest {
    
    private static final ResourceKind TEST_A = new ResourceKind("test.cvo.io", "v1", "TestA");
    
    private final ManifestParser parser = new ManifestParser();
    private final KubernetesClient client = mock(KubernetesClient.class);
    private final List<String> calls = new ArrayList<>();
    
    @Test
    void registeredKindUsesItsBuilder() {
        ResourceBuilderRegistry registry = new ResourceBuilderRegistry();
        registry.register(TEST_A, builderFactory("specific", null));
        
        applier(registry, List.of()).apply(manifest("TestA"));
        applier(registry, List.of()).apply(manifest("TestB"));
        
        assertEquals(List.of("specific TestA", "generic TestB"), calls);
        verifyNoInteractions(client);
    }
    
    @Test
    void builderReceivesTheConfiguredClient() {
        KubernetesClient[] received = new KubernetesClient[1];
        ResourceBuilderRegistry registry = new ResourceBuilderRegistry();
        registry.register(TEST_A, (c, manifest) -> {
            received[0] = c;
            return new CallRecordingBuilder("specific", manifest, null);
        });
        
        applier(registry, List.of()).apply(manifest("TestA"));
        
        assertSame(client, received[0]);
    }
    
    @Test
    void modifiersAreAttachedInOrder() {
        List<String> seen = new ArrayList<>();
        MetadataModifier first = metadata -> seen.add("first");
        MetadataModifier second = metadata -> seen.add("second");
        
        applier(new ResourceBuilderRegistry(), List.of(first, second)).apply(manifest("TestB"));
        
        assertEquals(List.of("first", "second"), seen);
    }
    
    @Test
    void classifiedErrorsPassThroughUnchanged() {
        ApplyException noMatch = ApplyException.noMatch("no matches for TestA");
        ResourceBuilderRegistry registry = new ResourceBuilderRegistry();
        registry.register(TEST_A, builderFactory("specific", noMatch));
        
        ApplyException e = assertThrows(ApplyException.class, () -> applier(registry, List.of()).apply(manifest("TestA")));
        
        assertSame(noMatch, e);
    }
    
    @Test
    void notFoundResponseIsClassifiedNotFound() {
        ResourceBuilderRegistry registry = new ResourceBuilderRegistry();
        registry.register(TEST_A, builderFactory("specific", new KubernetesClientException("namespaces \"default\" not found", 404, null)));
        
        ApplyException e = assertThrows(ApplyException.class, () -> applier(registry, List.of()).apply(manifest("TestA")));
        
        assertEquals(ApplyCause.NOT_FOUND, e.getApplyCause());
        assertInstanceOf(KubernetesClientException.class, e.getCause());
    }
    
    @Test
    void otherResponsesAreClassifiedOther() {
        ResourceBuilderRegistry registry = new ResourceBuilderRegistry();
        registry.register(TEST_A, builderFactory("specific", new KubernetesClientException("conflict", 409, null)));
        
        ApplyException e = assertThrows(ApplyException.class, () -> applier(registry, List.of()).apply(manifest("TestA")));
        
        assertEquals(ApplyCause.OTHER, e.getApplyCause());
    }
    
    @Test
    void unexpectedFailuresAreClassifiedOther() {
        ResourceBuilderRegistry registry = new ResourceBuilderRegistry();
        registry.register(TEST_A, builderFactory("specific", new IllegalStateException("boom")));
        
        ApplyException e = assertThrows(ApplyException.class, () -> applier(registry, List.of()).apply(manifest("TestA")));
        
        assertEquals(ApplyCause.OTHER, e.getApplyCause());
        assertTrue(e.getMessage().contains("boom"));
    }
    
    private DispatchingResourceApplier applier(ResourceBuilderRegistry registry, List<MetadataModifier> modifiers) {
        return new DispatchingResourceApplier(client, registry, builderFactory("generic", null), modifiers);
    }
    
    private ResourceBuilderFactory builderFactory(String name, RuntimeException failure) {
        return (c, manifest) -> new CallRecordingBuilder(name, manifest, failure);
    }
    
    private Manifest manifest(String kind) {
        return parser.parseJson("{\"apiVersion\":\"test.cvo.io/v1\",\"kind\":\"" + kind + "\","
            + "\"metadata\":{\"namespace\":\"default\",\"name\":\"test\"}}");
    }
    
    private class CallRecordingBuilder implements ResourceBuilder {
        
        private final String name;
        private final Manifest manifest;
        private final RuntimeException failure;
        private final List<MetadataModifier> modifiers = new ArrayList<>();
        
        CallRecordingBuilder(String name, Manifest manifest, RuntimeException failure) {
            this.name = name;
            this.manifest = manifest;
            this.failure = failure;
        }
        
        @Override
        public ResourceBuilder withModifier(MetadataModifier modifier) {
            modifiers.add(modifier);
            return this;
        }
        
        @Override
        public void apply() {
            ObjectMeta metadata = new ObjectMeta();
            modifiers.forEach(m -> m.modify(metadata));
            calls.add(name + " " + manifest.getKind().kind());
            if (failure != null) {
                throw failure;
            }
        }
    }
}
