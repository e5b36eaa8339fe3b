package com.platform.updater.error;

/**
 * Exception for validation errors.
 */
public class ValidationException extends UpdaterException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.VALIDATION_ERROR, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
