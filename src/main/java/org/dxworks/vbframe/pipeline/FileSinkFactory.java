package org.dxworks.vbframe.pipeline;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes outputs below a directory, creating parent directories on demand.
 */
public class FileSinkFactory implements SinkFactory {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path outputDir;

    public FileSinkFactory(Path outputDir) {
        this.outputDir = outputDir.toAbsolutePath().normalize();
    }

    @Override
    public OutputStream open(String name) throws IOException {
        Path target = outputDir.resolve(name).normalize();
        if (!target.startsWith(outputDir)) {
            throw new IOException("Output escapes the output directory: " + name);
        }
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new BufferedOutputStream(Files.newOutputStream(target), BUFFER_SIZE);
    }

    public Path getOutputDir() {
        return outputDir;
    }
}
