package com.sync.pipeline.hash;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sync.pipeline.core.model.EntityType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the content hash of a raw vendor record.
 *
 * <p>The record is stripped of the policy's volatile fields at every depth, serialized as
 * JSON with map keys sorted, prefixed with the policy version and digested with SHA-256.
 * Key order and volatile fields therefore never affect the result; any other change does.</p>
 */
public class DataHasher {

    private final HashPolicy policy;
    private final ObjectMapper canonicalMapper;

    public DataHasher() {
        this(HashPolicies.current());
    }

    public DataHasher(HashPolicy policy) {
        this.policy = policy;
        this.canonicalMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /**
     * @return lower-case hex SHA-256 digest
     * @throws IllegalArgumentException when the record cannot be serialized
     */
    public String hash(EntityType entityType, Map<String, ?> rawData) {
        Object stripped = strip(rawData, policy.volatileFields(entityType));
        String canonical;
        try {
            canonical = canonicalMapper.writeValueAsString(stripped);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record is not serializable: " + e.getOriginalMessage(), e);
        }
        return sha256(policy.version() + ":" + canonical);
    }

    public HashPolicy getPolicy() {
        return policy;
    }

    private static Object strip(Object value, Set<String> fields) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (!fields.contains(key)) {
                    result.put(key, strip(entry.getValue(), fields));
                }
            }
            return result;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            for (Object element : collection) {
                result.add(strip(element, fields));
            }
            return result;
        }
        return value;
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
