package org.dxworks.vbframe;

import java.nio.file.Path;
import java.util.Optional;

public enum ModuleKind {
    STANDARD("standard", ".bas"),
    CLASS("class", ".cls"),
    FORM("form", ".frm");

    private final String name;
    private final String extension;

    ModuleKind(String name, String extension) {
        this.name = name;
        this.extension = extension;
    }

    public String getName() {
        return name;
    }

    public String getExtension() {
        return extension;
    }

    public static Optional<ModuleKind> detect(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase();
        for (ModuleKind kind : values()) {
            if (fileName.endsWith(kind.extension)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
