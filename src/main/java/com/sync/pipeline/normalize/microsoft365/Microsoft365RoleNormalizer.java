package com.sync.pipeline.normalize.microsoft365;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.fetch.DataFetchRecord;
import com.sync.pipeline.normalize.NormalizedRecord;
import com.sync.pipeline.normalize.Normalizer;
import com.sync.pipeline.normalize.RawFields;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Graph {@code directoryRole} to role.
 */
public class Microsoft365RoleNormalizer implements Normalizer {

    @Override
    public String integrationType() {
        return Microsoft365Normalizers.INTEGRATION_TYPE;
    }

    @Override
    public EntityType entityType() {
        return EntityType.ROLES;
    }

    @Override
    public NormalizedRecord normalize(DataFetchRecord record) {
        Map<String, Object> raw = record.rawData();
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("externalId", record.externalId());
        normalized.put("name", RawFields.requireString(raw, "displayName"));
        normalized.put("description", RawFields.string(raw, "description"));
        normalized.put("roleTemplateId", RawFields.string(raw, "roleTemplateId"));
        return NormalizedRecord.of(normalized);
    }
}
