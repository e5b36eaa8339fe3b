package com.platform.updater.config;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Kubernetes API client.
 * Falls back to the usual auto-configuration (kubeconfig, in-cluster service account)
 * when no master URL is set.
 */
@Slf4j
@Configuration
public class KubernetesClientConfig {
    
    @Value("${updater.kubernetes.master-url:}")
    private String masterUrl;
    
    @Value("${updater.kubernetes.namespace:}")
    private String namespace;
    
    @Value("${updater.kubernetes.request-timeout-ms:10000}")
    private int requestTimeoutMs;
    
    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        ConfigBuilder builder = new ConfigBuilder(Config.autoConfigure(null))
            .withRequestTimeout(requestTimeoutMs);
        if (!masterUrl.isBlank()) {
            builder.withMasterUrl(masterUrl);
        }
        if (!namespace.isBlank()) {
            builder.withNamespace(namespace);
        }
        Config config = builder.build();
        
        log.info("Kubernetes client targeting {}", config.getMasterUrl());
        return new KubernetesClientBuilder().withConfig(config).build();
    }
}
