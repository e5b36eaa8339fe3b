package com.platform.updater.requeue;

import com.platform.updater.error.ApplyCause;
import com.platform.updater.error.ApplyException;
import com.platform.updater.manifest.Manifest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a manifest's final apply error defers it to the deferred pass
 * instead of aborting the whole payload.
 * 
 * A manifest opts in per condition through its requeue annotation; a
 * {@link ApplyCause#RETRY_LATER} cause defers regardless of annotations.
 * Anything not explicitly matched is not retryable.
 */
@Slf4j
public class RequeuePolicy {
    
    public static final String DEFAULT_ANNOTATION_KEY =
        "v1.cluster-version-operator.operators.openshift.io/requeue-on-error";
    
    private final String annotationKey;
    
    public RequeuePolicy() {
        this(DEFAULT_ANNOTATION_KEY);
    }
    
    public RequeuePolicy(String annotationKey) {
        if (annotationKey == null || annotationKey.isBlank()) {
            throw new IllegalArgumentException("annotationKey must not be blank");
        }
        this.annotationKey = annotationKey;
    }
    
    /**
     * Whether the error should defer the manifest rather than fail the payload.
     */
    public boolean shouldRequeue(Throwable error, Manifest manifest) {
        if (error == null) {
            return false;
        }
        
        ApplyCause cause = classify(error);
        if (cause == ApplyCause.RETRY_LATER) {
            return true;
        }
        
        RequeueAnnotation annotation = hasRequeueAnnotation(manifest.getAnnotations());
        if (!annotation.present() || annotation.matchers().isEmpty()) {
            return false;
        }
        
        Optional<String> condition = cause.matcherName();
        boolean requeue = condition.isPresent() && annotation.matches(condition.get());
        log.debug("Requeue decision for {}: cause={}, matchers={}, requeue={}",
            manifest.describe(), cause, annotation.matchers(), requeue);
        return requeue;
    }
    
    /**
     * Parse the requeue annotation out of a manifest's annotations.
     */
    public RequeueAnnotation hasRequeueAnnotation(Map<String, String> annotations) {
        if (annotations == null) {
            return RequeueAnnotation.absent();
        }
        String value = annotations.get(annotationKey);
        if (value == null) {
            return RequeueAnnotation.absent();
        }
        
        List<String> matchers = new ArrayList<>();
        for (String part : value.split(",")) {
            String matcher = part.trim();
            if (!matcher.isEmpty()) {
                matchers.add(matcher);
            }
        }
        return new RequeueAnnotation(true, matchers);
    }
    
    /**
     * Cause kind of an error, looking through at most one wrapper.
     */
    static ApplyCause classify(Throwable error) {
        if (error instanceof ApplyException) {
            return ((ApplyException) error).getApplyCause();
        }
        Throwable cause = error.getCause();
        if (cause instanceof ApplyException) {
            return ((ApplyException) cause).getApplyCause();
        }
        return ApplyCause.OTHER;
    }
}
