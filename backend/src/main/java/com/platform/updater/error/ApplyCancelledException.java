package com.platform.updater.error;

/**
 * Raised when a payload apply is cancelled by its caller.
 * Deliberately not an {@link ApplyException}: cancellation is never deferred or retried.
 */
public class ApplyCancelledException extends UpdaterException {
    
    public ApplyCancelledException(String message) {
        super(ErrorCode.SYNC_CANCELLED, message);
    }
    
    public ApplyCancelledException(String message, Throwable cause) {
        super(ErrorCode.SYNC_CANCELLED, message, cause);
    }
}
