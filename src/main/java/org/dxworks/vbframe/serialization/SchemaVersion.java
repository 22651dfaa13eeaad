package org.dxworks.vbframe.serialization;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Version tag of the JSON envelope contract (field set and field order).
 */
public final class SchemaVersion {

    public static final SchemaVersion CURRENT = new SchemaVersion("1.0.0");

    private static final Pattern SEMVER = Pattern.compile("\\d+\\.\\d+\\.\\d+(?:-[0-9A-Za-z.-]+)?");

    private final String value;

    private SchemaVersion(String value) {
        this.value = value;
    }

    public static SchemaVersion of(String value) {
        Objects.requireNonNull(value, "value");
        if (!SEMVER.matcher(value).matches()) {
            throw new IllegalArgumentException("Schema version must be a semantic version: " + value);
        }
        return new SchemaVersion(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaVersion)) return false;
        return value.equals(((SchemaVersion) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
