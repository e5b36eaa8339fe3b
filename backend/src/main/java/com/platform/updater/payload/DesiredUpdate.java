package com.platform.updater.payload;

import jakarta.validation.constraints.NotBlank;

/**
 * Desired target of a sync.
 *
 * @param version release version to apply
 * @param source  optional identifier of the release (image pull spec, directory); informational
 */
public record DesiredUpdate(
    @NotBlank String version,
    String source
) {
    
    public static DesiredUpdate of(String version) {
        return new DesiredUpdate(version, null);
    }
}
