package com.sync.pipeline.normalize.microsoft365;

import com.sync.pipeline.normalize.Normalizer;

import java.util.List;

/**
 * Normalizers of the Microsoft 365 integration.
 */
public final class Microsoft365Normalizers {

    public static final String INTEGRATION_TYPE = "microsoft-365";

    private Microsoft365Normalizers() {
    }

    public static List<Normalizer> all() {
        return List.of(
                new Microsoft365IdentityNormalizer(),
                new Microsoft365GroupNormalizer(),
                new Microsoft365RoleNormalizer(),
                new Microsoft365LicenseNormalizer(),
                new Microsoft365PolicyNormalizer());
    }
}
