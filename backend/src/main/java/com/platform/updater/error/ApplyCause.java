package com.platform.updater.error;

import java.util.Optional;

/**
 * Classified cause of a failed manifest apply.
 * Set once, where the cause is known, so that later stages never inspect wrapper chains.
 */
public enum ApplyCause {
    
    /**
     * The addressed API resource type does not exist in the cluster's discovered schema.
     */
    NO_MATCH("NoMatch", ErrorCode.RESOURCE_TYPE_NOT_REGISTERED),
    
    /**
     * The named object or its namespace does not exist.
     */
    NOT_FOUND("NotFound", ErrorCode.RESOURCE_NOT_FOUND),
    
    /**
     * The strategy knows the operation will succeed later; defers regardless of annotations.
     */
    RETRY_LATER(null, ErrorCode.RESOURCE_NOT_READY),
    
    OTHER(null, ErrorCode.APPLY_FAILED);
    
    private final String matcherName;
    private final ErrorCode errorCode;
    
    ApplyCause(String matcherName, ErrorCode errorCode) {
        this.matcherName = matcherName;
        this.errorCode = errorCode;
    }
    
    /**
     * Name used for this condition in the requeue annotation, if it can be opted into.
     */
    public Optional<String> matcherName() {
        return Optional.ofNullable(matcherName);
    }
    
    public ErrorCode errorCode() {
        return errorCode;
    }
}
