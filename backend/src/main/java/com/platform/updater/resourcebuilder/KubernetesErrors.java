package com.platform.updater.resourcebuilder;

import com.platform.updater.error.ApplyException;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.net.HttpURLConnection;

/**
 * Classifies Kubernetes client failures into apply causes.
 */
public final class KubernetesErrors {
    
    private KubernetesErrors() {
    }
    
    public static ApplyException classify(KubernetesClientException e, String target) {
        if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
            return ApplyException.notFound(
                String.format("%s: not found: %s", target, e.getMessage()), e);
        }
        return ApplyException.other(
            String.format("%s: %s", target, e.getMessage()), e);
    }
}
