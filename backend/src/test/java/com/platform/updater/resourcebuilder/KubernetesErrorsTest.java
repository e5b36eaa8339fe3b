package com.platform.updater.resourcebuilder;

import com.platform.updater.error.ApplyCause;
import com.platform.updater.error.ApplyException;
import com.platform.updater.error.ErrorCode;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KubernetesErrorsTest {
    
    @Test
    void notFoundMapsToNotFound() {
        KubernetesClientException cause = new KubernetesClientException("namespaces \"missing\" not found", 404, null);
        
        ApplyException e = KubernetesErrors.classify(cause, "ConfigMap \"missing/settings\"");
        
        assertEquals(ApplyCause.NOT_FOUND, e.getApplyCause());
        assertEquals(ErrorCode.RESOURCE_NOT_FOUND, e.getErrorCode());
        assertSame(cause, e.getCause());
        assertTrue(e.getMessage().startsWith("ConfigMap \"missing/settings\""));
    }
    
    @Test
    void everythingElseMapsToOther() {
        assertEquals(ApplyCause.OTHER,
            KubernetesErrors.classify(new KubernetesClientException("forbidden", 403, null), "x").getApplyCause());
        assertEquals(ApplyCause.OTHER,
            KubernetesErrors.classify(new KubernetesClientException("conflict", 409, null), "x").getApplyCause());
        assertEquals(ApplyCause.OTHER,
            KubernetesErrors.classify(new KubernetesClientException("connection refused"), "x").getApplyCause());
    }
}
