package org.dxworks.vbframe.pipeline;

import java.util.Locale;

/**
 * How converted files are written to the sink.
 */
public enum EmissionMode {
    /** One JSON document per source file. */
    SINGLE("single"),
    /** Per-file documents plus a manifest referencing them. */
    MANIFEST("manifest"),
    /** A single manifest embedding every per-file envelope. */
    MANIFEST_INLINE("manifestInline");

    private final String name;

    EmissionMode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static EmissionMode fromName(String name) {
        for (EmissionMode mode : values()) {
            if (mode.name.toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown emission mode: " + name);
    }
}
