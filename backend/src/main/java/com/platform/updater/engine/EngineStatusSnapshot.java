package com.platform.updater.engine;

import com.platform.updater.error.ApplyException;
import com.platform.updater.manifest.ResourceKind;

/**
 * Immutable view of an apply's progress, handed to {@link StatusSink}s.
 *
 * @param payloadVersion  version of the payload being applied
 * @param phase           pass the apply was in
 * @param total           number of manifests in the payload
 * @param attempted       apply attempts so far, failed retries included
 * @param succeeded       manifests that reached terminal success
 * @param deferred        manifests deferred during the lenient pass
 * @param currentKind     kind of the manifest being worked on, if any
 * @param currentManifest identity of the manifest being worked on, if any
 * @param lastError       final error of the most recent manifest that exhausted its attempts
 */
public record EngineStatusSnapshot(
    String payloadVersion,
    ApplyPhase phase,
    int total,
    int attempted,
    int succeeded,
    int deferred,
    ResourceKind currentKind,
    String currentManifest,
    ApplyException lastError
) {
}
