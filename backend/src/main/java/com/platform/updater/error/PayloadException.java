package com.platform.updater.error;

/**
 * Exception for payload retrieval and manifest parsing errors.
 */
public class PayloadException extends UpdaterException {
    
    private final String source;
    
    public PayloadException(ErrorCode errorCode, String source, String message) {
        super(errorCode, message);
        this.source = source;
    }
    
    public PayloadException(ErrorCode errorCode, String source, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.source = source;
    }
    
    public static PayloadException notFound(String source) {
        return new PayloadException(
            ErrorCode.PAYLOAD_NOT_FOUND,
            source,
            String.format("No release payload at %s", source)
        );
    }
    
    public static PayloadException unreadable(String source, Throwable cause) {
        return new PayloadException(
            ErrorCode.PAYLOAD_UNREADABLE,
            source,
            String.format("Could not read release payload from %s", source),
            cause
        );
    }
    
    public static PayloadException invalidManifest(String source, String reason) {
        return new PayloadException(
            ErrorCode.MANIFEST_INVALID,
            source,
            String.format("Invalid manifest in %s: %s", source, reason)
        );
    }
    
    public String getSource() {
        return source;
    }
}
