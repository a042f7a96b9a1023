package com.sync.pipeline.normalize.halopsa;

import com.sync.pipeline.normalize.Normalizer;

import java.util.List;

/**
 * Normalizers of the HaloPSA integration.
 */
public final class HaloPsaNormalizers {

    public static final String INTEGRATION_TYPE = "halopsa";

    private HaloPsaNormalizers() {
    }

    public static List<Normalizer> all() {
        return List.of(new HaloPsaCompanyNormalizer());
    }
}
