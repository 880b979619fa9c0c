package com.graphsync.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.graphsync.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for locator strings.
 *
 * Format:
 * - JSON object: {"ClassName": "Core:Element", "CodeValue": "Wall"}
 * - Pairs: ClassName=Core:Element; CodeValue=Wall
 *
 * Keys are case-insensitive. {@code ClassName} (or {@code ECClassId}) narrows the lookup to one class.
 * Pair values are always text, so {@code UserLabel=007} keeps its leading zeros.
 */
public class LocatorParser {
    private static final Logger log = LoggerFactory.getLogger(LocatorParser.class);

    private static final Pattern PAIR_PATTERN = Pattern.compile("^([A-Za-z_][A-Za-z0-9_.]*)\\s*=\\s*(.*)$");

    public Locator parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Failed to parse Locator. Locator is empty.");
        }
        String trimmed = raw.trim();
        Map<String, Object> entries = trimmed.startsWith("{") ? parseJson(trimmed) : parsePairs(trimmed);

        Locator.LocatorBuilder builder = Locator.builder();
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            Object value = entry.getValue();
            if (key.equals("classname") || key.equals("ecclassid")) {
                builder.className(String.valueOf(value));
            } else if (value instanceof Number || value instanceof String) {
                builder.constraint(key, value);
            } else {
                throw new IllegalArgumentException("Failed to parse Locator. Unsupported value for " + entry.getKey());
            }
        }
        Locator locator = builder.build();
        if (locator.getConstraints().isEmpty()) {
            throw new IllegalArgumentException("Failed to parse Locator. At least one property constraint is required.");
        }
        log.debug("Parsed locator: class={} constraints={}", locator.getClassName(), locator.getConstraints());
        return locator;
    }

    private Map<String, Object> parseJson(String raw) {
        try {
            return JsonSupport.readMap(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse Locator. Invalid syntax.", e);
        }
    }

    private Map<String, Object> parsePairs(String raw) {
        Map<String, Object> entries = new LinkedHashMap<>();
        for (String part : raw.split(";")) {
            String pair = part.trim();
            if (pair.isEmpty()) {
                continue;
            }
            Matcher matcher = PAIR_PATTERN.matcher(pair);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Failed to parse Locator. Invalid pair: " + pair);
            }
            entries.put(matcher.group(1), parseValue(matcher.group(2).trim()));
        }
        return entries;
    }

    private String parseValue(String value) {
        if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
