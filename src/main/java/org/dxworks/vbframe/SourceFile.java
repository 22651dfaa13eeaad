package org.dxworks.vbframe;

import java.util.Objects;

/**
 * Metadata of a loaded source file. Immutable once the file has been read.
 */
public final class SourceFile {

    private final String path;
    private final String checksum;
    private final String encoding;
    private final ModuleKind moduleKind;

    public SourceFile(String path, String checksum, String encoding, ModuleKind moduleKind) {
        this.path = Objects.requireNonNull(path, "path");
        this.checksum = checksum;
        this.encoding = encoding;
        this.moduleKind = Objects.requireNonNull(moduleKind, "moduleKind");
    }

    public String getPath() {
        return path;
    }

    /**
     * SHA-256 of the raw bytes, lower-case hex; null when the file could not be read.
     */
    public String getChecksum() {
        return checksum;
    }

    /**
     * Charset the text was decoded with; null when no supported charset could decode it.
     */
    public String getEncoding() {
        return encoding;
    }

    public ModuleKind getModuleKind() {
        return moduleKind;
    }
}
