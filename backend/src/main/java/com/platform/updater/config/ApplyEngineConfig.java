package com.platform.updater.config;

import com.platform.updater.engine.ApplyEngine;
import com.platform.updater.engine.BackoffPolicy;
import com.platform.updater.manifest.ManifestParser;
import com.platform.updater.observability.UpdaterMetrics;
import com.platform.updater.payload.DirectoryPayloadRetriever;
import com.platform.updater.payload.PayloadRetriever;
import com.platform.updater.requeue.RequeuePolicy;
import com.platform.updater.resourcebuilder.DefaultResourceBuilders;
import com.platform.updater.resourcebuilder.DispatchingResourceApplier;
import com.platform.updater.resourcebuilder.GenericResourceBuilder;
import com.platform.updater.resourcebuilder.KubernetesDynamicResourceClient;
import com.platform.updater.resourcebuilder.MetadataModifier;
import com.platform.updater.resourcebuilder.MetadataModifiers;
import com.platform.updater.resourcebuilder.ResourceApplier;
import com.platform.updater.resourcebuilder.ResourceBuilderRegistry;
import io.fabric8.kubernetes.client.KubernetesClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the apply engine from configuration.
 * Registry, requeue annotation key and backoff are passed in explicitly; nothing is global.
 */
@Slf4j
@Configuration
public class ApplyEngineConfig {
    
    static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    
    @Value("${updater.apply.max-attempts:3}")
    private int maxAttempts;
    
    @Value("${updater.apply.initial-delay-ms:1000}")
    private long initialDelayMs;
    
    @Value("${updater.apply.factor:2.0}")
    private double factor;
    
    @Value("${updater.apply.max-delay-ms:30000}")
    private long maxDelayMs;
    
    @Value("${updater.apply.jitter:0.1}")
    private double jitter;
    
    @Value("${updater.apply.requeue-annotation:" + RequeuePolicy.DEFAULT_ANNOTATION_KEY + "}")
    private String requeueAnnotation;
    
    @Value("${updater.apply.managed-by:cluster-updater}")
    private String managedBy;
    
    @Value("${updater.payload.base-dir:/var/lib/cluster-updater/payloads}")
    private String payloadBaseDir;
    
    @Bean
    public BackoffPolicy backoffPolicy() {
        BackoffPolicy policy = new BackoffPolicy(
            maxAttempts,
            Duration.ofMillis(initialDelayMs),
            factor,
            Duration.ofMillis(maxDelayMs),
            jitter
        );
        log.info("Apply backoff: {}", policy);
        return policy;
    }
    
    @Bean
    public RequeuePolicy requeuePolicy() {
        return new RequeuePolicy(requeueAnnotation);
    }
    
    @Bean
    public ResourceBuilderRegistry resourceBuilderRegistry() {
        ResourceBuilderRegistry registry = DefaultResourceBuilders.newRegistry();
        log.info("Registered {} kind-specific resource builders", registry.size());
        return registry;
    }
    
    @Bean
    public ResourceApplier resourceApplier(KubernetesClient client, ResourceBuilderRegistry registry) {
        List<MetadataModifier> modifiers = new ArrayList<>();
        if (!managedBy.isBlank()) {
            modifiers.add(MetadataModifiers.label(MANAGED_BY_LABEL, managedBy));
        }
        return new DispatchingResourceApplier(
            client,
            registry,
            GenericResourceBuilder.factory(new KubernetesDynamicResourceClient(client)),
            modifiers
        );
    }
    
    @Bean
    public ApplyEngine applyEngine(
            ResourceApplier resourceApplier,
            RequeuePolicy requeuePolicy,
            BackoffPolicy backoffPolicy,
            UpdaterMetrics metrics) {
        return new ApplyEngine(resourceApplier, requeuePolicy, backoffPolicy, metrics);
    }
    
    @Bean
    public ManifestParser manifestParser() {
        return new ManifestParser();
    }
    
    @Bean
    public PayloadRetriever payloadRetriever(ManifestParser manifestParser) {
        return new DirectoryPayloadRetriever(Path.of(payloadBaseDir), manifestParser);
    }
}
