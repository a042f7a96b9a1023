package com.sync.pipeline.normalize.halopsa;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.fetch.DataFetchRecord;
import com.sync.pipeline.normalize.NormalizedRecord;
import com.sync.pipeline.normalize.Normalizer;
import com.sync.pipeline.normalize.RawFields;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HaloPSA {@code site} to company. The owning client becomes the parent company.
 */
public class HaloPsaCompanyNormalizer implements Normalizer {

    @Override
    public String integrationType() {
        return HaloPsaNormalizers.INTEGRATION_TYPE;
    }

    @Override
    public EntityType entityType() {
        return EntityType.COMPANIES;
    }

    @Override
    public NormalizedRecord normalize(DataFetchRecord record) {
        Map<String, Object> raw = record.rawData();

        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("externalId", record.externalId());
        normalized.put("externalParentId", RawFields.string(raw, "client_id"));
        normalized.put("name", RawFields.requireString(raw, "name"));
        normalized.put("parentName", RawFields.string(raw, "client_name"));
        normalized.put("type", RawFields.string(raw, "use"));
        return NormalizedRecord.of(normalized);
    }
}
