package com.sync.pipeline.normalize.microsoft365;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.fetch.DataFetchRecord;
import com.sync.pipeline.normalize.NormalizedRecord;
import com.sync.pipeline.normalize.Normalizer;
import com.sync.pipeline.normalize.RawFields;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Graph {@code group} to group.
 */
public class Microsoft365GroupNormalizer implements Normalizer {

    @Override
    public String integrationType() {
        return Microsoft365Normalizers.INTEGRATION_TYPE;
    }

    @Override
    public EntityType entityType() {
        return EntityType.GROUPS;
    }

    @Override
    public NormalizedRecord normalize(DataFetchRecord record) {
        Map<String, Object> raw = record.rawData();
        List<String> groupTypes = RawFields.strings(raw, "groupTypes");
        boolean securityEnabled = RawFields.bool(raw, "securityEnabled", false);
        String type;
        if (groupTypes.contains("Unified")) {
            type = "modern";
        } else if (securityEnabled) {
            type = "security";
        } else {
            type = "distribution";
        }

        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("externalId", record.externalId());
        normalized.put("name", RawFields.requireString(raw, "displayName"));
        normalized.put("description", RawFields.string(raw, "description"));
        normalized.put("mail", RawFields.string(raw, "mail"));
        normalized.put("type", type);
        normalized.put("securityEnabled", securityEnabled);
        return NormalizedRecord.of(normalized);
    }
}
