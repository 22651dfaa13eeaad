package org.dxworks.vbframe.diagnostics;

public enum Stage {
    SYNTAX("syntax"),
    SEMANTIC("semantic");

    private final String name;

    Stage(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
