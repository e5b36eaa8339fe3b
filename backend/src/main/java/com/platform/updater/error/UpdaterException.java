package com.platform.updater.error;

/**
 * Base exception for all cluster updater exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class UpdaterException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected UpdaterException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected UpdaterException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected UpdaterException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
