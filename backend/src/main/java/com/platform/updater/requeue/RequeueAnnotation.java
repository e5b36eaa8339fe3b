package com.platform.updater.requeue;

import java.util.List;

/**
 * Parsed requeue-on-error annotation of one manifest.
 *
 * @param present  whether the manifest carries the annotation key at all
 * @param matchers condition names listed in the annotation, in authored order
 */
public record RequeueAnnotation(boolean present, List<String> matchers) {
    
    private static final RequeueAnnotation ABSENT = new RequeueAnnotation(false, List.of());
    
    public RequeueAnnotation {
        matchers = List.copyOf(matchers);
    }
    
    public static RequeueAnnotation absent() {
        return ABSENT;
    }
    
    public boolean matches(String conditionName) {
        return matchers.contains(conditionName);
    }
}
