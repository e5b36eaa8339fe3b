package com.platform.updater.error;

/**
 * Raised when a sync is requested while another one is still applying.
 */
public class SyncInProgressException extends UpdaterException {
    
    public SyncInProgressException(String runningVersion) {
        super(ErrorCode.SYNC_IN_PROGRESS,
            String.format("Sync to version %s is still running", runningVersion));
    }
}
