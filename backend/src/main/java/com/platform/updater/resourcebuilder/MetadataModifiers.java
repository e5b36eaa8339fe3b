package com.platform.updater.resourcebuilder;

import java.util.HashMap;
import java.util.Map;

/**
 * Common metadata modifiers.
 */
public final class MetadataModifiers {
    
    private MetadataModifiers() {
    }
    
    /**
     * Set a label, keeping any labels the manifest already declares.
     */
    public static MetadataModifier label(String key, String value) {
        return metadata -> {
            Map<String, String> labels = metadata.getLabels() == null
                ? new HashMap<>()
                : new HashMap<>(metadata.getLabels());
            labels.put(key, value);
            metadata.setLabels(labels);
        };
    }
    
    /**
     * Set an annotation, keeping any annotations the manifest already declares.
     */
    public static MetadataModifier annotation(String key, String value) {
        return metadata -> {
            Map<String, String> annotations = metadata.getAnnotations() == null
                ? new HashMap<>()
                : new HashMap<>(metadata.getAnnotations());
            annotations.put(key, value);
            metadata.setAnnotations(annotations);
        };
    }
}
