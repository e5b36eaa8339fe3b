package com.platform.updater;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cluster Updater Application
 * 
 * Applies release payloads (ordered Kubernetes manifests) to a live cluster:
 * - Kind-specific strategies with a generic dynamic-client fallback
 * - Bounded per-manifest backoff
 * - One deferred retry pass for manifests opted in through their requeue annotation
 * - Progress and outcome exposed over a small REST API
 */
@SpringBootApplication
@EnableScheduling
public class UpdaterApplication {

    public static void main(String[] args) {
        SpringApplication.run(UpdaterApplication.class, args);
    }
}
