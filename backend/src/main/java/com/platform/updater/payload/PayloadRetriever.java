package com.platform.updater.payload;

import com.platform.updater.manifest.Payload;

/**
 * Produces the ordered, parsed manifests for a desired update.
 */
public interface PayloadRetriever {
    
    /**
     * @throws com.platform.updater.error.PayloadException if the payload is missing or malformed
     */
    Payload retrieve(DesiredUpdate update);
}
