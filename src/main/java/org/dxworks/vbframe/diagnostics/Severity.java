package org.dxworks.vbframe.diagnostics;

/**
 * Diagnostic severity. Declaration order is the sort order: errors come first.
 */
public enum Severity {
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String name;

    Severity(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * True when this severity is at least as severe as {@code minimum}.
     */
    public boolean isAtLeast(Severity minimum) {
        return ordinal() <= minimum.ordinal();
    }
}
