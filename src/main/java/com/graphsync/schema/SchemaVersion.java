package com.graphsync.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Schema version {@code read.write.minor}. Only the minor part moves when the dynamic schema evolves.
 */
@Value
public class SchemaVersion implements Comparable<SchemaVersion> {

    public static final SchemaVersion INITIAL = new SchemaVersion(1, 0, 0);

    private static final Pattern VERSION_PATTERN = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)$");

    int read;
    int write;
    int minor;

    @JsonCreator
    public static SchemaVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Schema version is required");
        }
        Matcher matcher = VERSION_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid schema version: " + text);
        }
        return new SchemaVersion(Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)));
    }

    public SchemaVersion nextMinor() {
        return new SchemaVersion(read, write, minor + 1);
    }

    @Override
    public int compareTo(SchemaVersion other) {
        if (read != other.read) {
            return Integer.compare(read, other.read);
        }
        if (write != other.write) {
            return Integer.compare(write, other.write);
        }
        return Integer.compare(minor, other.minor);
    }

    @JsonValue
    @Override
    public String toString() {
        return String.format("%02d.%02d.%02d", read, write, minor);
    }
}
