package com.graphsync.ir;

import com.graphsync.util.Checksums;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One external record, e.g. a spreadsheet row or a JSON object.
 *
 * The key ({@code <entityKey>-<primary key value>}) is the identity of the record across runs,
 * the checksum is the fingerprint of its content.
 */
@Getter
@ToString
@EqualsAndHashCode
public class IRInstance {

    private final String pkey;
    private final String entityKey;
    private final Map<String, Object> data;
    private final String version;

    @Builder
    public IRInstance(String pkey, String entityKey, Map<String, ?> data, String version) {
        this.pkey = pkey;
        this.entityKey = entityKey;
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
        this.version = version != null ? version : "";
        validate();
    }

    public static String createKey(String entityKey, Object primaryKeyValue) {
        return entityKey + "-" + asText(primaryKeyValue);
    }

    public String getKey() {
        return getCodeValue();
    }

    public String getCodeValue() {
        return createKey(entityKey, get(pkey));
    }

    public String getUserLabel() {
        return asText(get(pkey));
    }

    /**
     * Attribute value, or {@code null} when the attribute is absent.
     */
    public Object get(String attr) {
        return attr == null ? null : data.get(attr);
    }

    public String getString(String attr) {
        Object value = get(attr);
        return value == null ? null : asText(value);
    }

    public String getChecksum() {
        return Checksums.md5OfJson(data);
    }

    private void validate() {
        if (pkey == null || !data.containsKey(pkey)) {
            throw new IllegalArgumentException(pkey + " does not exist on " + entityKey);
        }
    }

    /**
     * Textual form of an attribute value. Integral numbers never carry a fraction, so 7 and 7.0 give the same key.
     */
    static String asText(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
        }
        return String.valueOf(value);
    }
}
