package org.dxworks.vbframe.pipeline;

import org.dxworks.vbframe.ModuleKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * A file handed to the converter by discovery: where to read it, the path reported in the output, and its
 * module kind.
 */
public final class SourceDescriptor {

    private final Path file;
    private final byte[] content;
    private final String path;
    private final ModuleKind moduleKind;

    private SourceDescriptor(Path file, byte[] content, String path, ModuleKind moduleKind) {
        this.file = file;
        this.content = content;
        this.path = Objects.requireNonNull(path, "path");
        this.moduleKind = Objects.requireNonNull(moduleKind, "moduleKind");
    }

    /**
     * Descriptor for a file below {@code root}; the reported path is relative to the root with '/' separators.
     */
    public static SourceDescriptor forFile(Path root, Path file) {
        Path relative = root.equals(file) ? file.getFileName() : root.relativize(file);
        String path = relative.toString().replace('\\', '/');
        return new SourceDescriptor(file, null, path, detect(file));
    }

    public static SourceDescriptor inMemory(String path, byte[] content) {
        return new SourceDescriptor(null, content.clone(), path, detect(Paths.get(path)));
    }

    private static ModuleKind detect(Path file) {
        return ModuleKind.detect(file)
                .orElseThrow(() -> new IllegalArgumentException("Not a VB6 module: " + file));
    }

    public byte[] readBytes() throws IOException {
        return content != null ? content.clone() : Files.readAllBytes(file);
    }

    public String getPath() {
        return path;
    }

    public ModuleKind getModuleKind() {
        return moduleKind;
    }

    /**
     * Name of the per-file JSON output, relative to the sink root.
     */
    public String getOutputName() {
        return path + ".json";
    }

    @Override
    public String toString() {
        return path;
    }
}
