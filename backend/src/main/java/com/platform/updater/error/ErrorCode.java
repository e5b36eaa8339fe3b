package com.platform.updater.error;

/**
 * Standardized error codes for the cluster updater.
 * Each error has a unique code that callers can use to take specific actions.
 * 
 * Format: UP-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 2xx: Payload errors
 * - 3xx: Apply errors (per manifest)
 * - 4xx: Sync coordination errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("UP-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("UP-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("UP-102", "Missing required field", ErrorCategory.RECOVERABLE),
    
    // ==================== Payload Errors (2xx) ====================
    
    PAYLOAD_NOT_FOUND("UP-200", "Release payload not found", ErrorCategory.RECOVERABLE),
    PAYLOAD_UNREADABLE("UP-201", "Release payload could not be read", ErrorCategory.FATAL),
    MANIFEST_INVALID("UP-202", "Manifest is malformed", ErrorCategory.FATAL),
    
    // ==================== Apply Errors (3xx) ====================
    
    RESOURCE_TYPE_NOT_REGISTERED("UP-300", "Resource type is not registered with the API", ErrorCategory.RECOVERABLE),
    RESOURCE_NOT_FOUND("UP-301", "Referenced object or namespace does not exist", ErrorCategory.RECOVERABLE),
    RESOURCE_NOT_READY("UP-302", "Resource is not ready yet", ErrorCategory.RECOVERABLE),
    APPLY_FAILED("UP-310", "Manifest could not be applied", ErrorCategory.FATAL),
    
    // ==================== Sync Errors (4xx) ====================
    
    SYNC_IN_PROGRESS("UP-400", "A sync is already running", ErrorCategory.RECOVERABLE),
    SYNC_CANCELLED("UP-401", "Sync was cancelled", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("UP-900", "Internal server error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - a later sync may succeed without intervention.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - the payload or the cluster needs intervention.
         */
        FATAL
    }
}
