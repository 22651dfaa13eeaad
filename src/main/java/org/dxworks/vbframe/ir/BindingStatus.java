package org.dxworks.vbframe.ir;

public enum BindingStatus {
    BOUND("bound"),
    // source found, but its type is unknown so the event name could not be checked
    UNVERIFIED("unverified"),
    UNMATCHED("unmatched");

    private final String name;

    BindingStatus(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
