package com.sync.pipeline.normalize.microsoft365;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.fetch.DataFetchRecord;
import com.sync.pipeline.normalize.NormalizedRecord;
import com.sync.pipeline.normalize.Normalizer;
import com.sync.pipeline.normalize.RawFields;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Graph {@code subscribedSku} to license. The sku id is the external id.
 */
public class Microsoft365LicenseNormalizer implements Normalizer {

    @Override
    public String integrationType() {
        return Microsoft365Normalizers.INTEGRATION_TYPE;
    }

    @Override
    public EntityType entityType() {
        return EntityType.LICENSES;
    }

    @Override
    public NormalizedRecord normalize(DataFetchRecord record) {
        Map<String, Object> raw = record.rawData();
        String skuPartNumber = RawFields.requireString(raw, "skuPartNumber");
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("externalId", record.externalId());
        normalized.put("name", skuPartNumber);
        normalized.put("skuPartNumber", skuPartNumber);
        normalized.put("totalUnits", RawFields.number(RawFields.object(raw, "prepaidUnits"), "enabled"));
        normalized.put("consumedUnits", RawFields.number(raw, "consumedUnits"));
        return NormalizedRecord.of(normalized);
    }
}
