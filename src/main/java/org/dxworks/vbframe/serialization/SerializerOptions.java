package org.dxworks.vbframe.serialization;

import java.util.Objects;

/**
 * Output switches shared by single-file and manifest emission. Part of the determinism contract: the same
 * options over the same input always yield the same bytes.
 */
public final class SerializerOptions {

    public static final SerializerOptions DEFAULT = new SerializerOptions(SchemaVersion.CURRENT, true, true);

    private final SchemaVersion schemaVersion;
    private final boolean prettyPrint;
    private final boolean includeSourceText;

    public SerializerOptions(SchemaVersion schemaVersion, boolean prettyPrint, boolean includeSourceText) {
        this.schemaVersion = Objects.requireNonNull(schemaVersion, "schemaVersion");
        this.prettyPrint = prettyPrint;
        this.includeSourceText = includeSourceText;
    }

    public SchemaVersion getSchemaVersion() {
        return schemaVersion;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    /**
     * Whether every node carries its verbatim {@code text}.
     */
    public boolean isIncludeSourceText() {
        return includeSourceText;
    }
}
