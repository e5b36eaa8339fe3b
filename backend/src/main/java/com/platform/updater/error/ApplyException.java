package com.platform.updater.error;

import com.platform.updater.manifest.Manifest;
import com.platform.updater.manifest.ResourceKind;

/**
 * Failure to apply one manifest to the cluster.
 * 
 * The {@link ApplyCause} is fixed when the exception is first raised and survives
 * {@link #forManifest(Manifest, int)} wrapping, which adds the manifest identity and
 * the number of attempts spent on it.
 */
public class ApplyException extends UpdaterException {
    
    private final ApplyCause applyCause;
    private final ResourceKind resourceKind;
    private final String namespace;
    private final String name;
    private final int attempts;
    
    public ApplyException(ApplyCause applyCause, String message) {
        this(applyCause, message, null);
    }
    
    public ApplyException(ApplyCause applyCause, String message, Throwable cause) {
        this(applyCause, message, cause, null, null, null, 0);
    }
    
    private ApplyException(
            ApplyCause applyCause,
            String message,
            Throwable cause,
            ResourceKind resourceKind,
            String namespace,
            String name,
            int attempts) {
        super(applyCause.errorCode(), message, cause);
        this.applyCause = applyCause;
        this.resourceKind = resourceKind;
        this.namespace = namespace;
        this.name = name;
        this.attempts = attempts;
    }
    
    public static ApplyException noMatch(String message) {
        return new ApplyException(ApplyCause.NO_MATCH, message);
    }
    
    public static ApplyException notFound(String message, Throwable cause) {
        return new ApplyException(ApplyCause.NOT_FOUND, message, cause);
    }
    
    public static ApplyException retryLater(String message) {
        return new ApplyException(ApplyCause.RETRY_LATER, message);
    }
    
    public static ApplyException other(String message, Throwable cause) {
        return new ApplyException(ApplyCause.OTHER, message, cause);
    }
    
    /**
     * Wrap this failure with the identity of the manifest it belongs to.
     */
    public ApplyException forManifest(Manifest manifest, int attempts) {
        return new ApplyException(
            applyCause,
            String.format("Could not apply %s after %d attempt(s): %s",
                manifest.describe(), attempts, getMessage()),
            this,
            manifest.getKind(),
            manifest.getNamespace(),
            manifest.getName(),
            attempts
        );
    }
    
    public ApplyCause getApplyCause() {
        return applyCause;
    }
    
    /**
     * Kind of the manifest that failed, or null when not yet attributed to a manifest.
     */
    public ResourceKind getResourceKind() {
        return resourceKind;
    }
    
    public String getNamespace() {
        return namespace;
    }
    
    public String getName() {
        return name;
    }
    
    public int getAttempts() {
        return attempts;
    }
    
    public boolean hasManifest() {
        return resourceKind != null;
    }
}
