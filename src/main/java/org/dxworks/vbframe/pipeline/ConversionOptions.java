package org.dxworks.vbframe.pipeline;

import org.dxworks.vbframe.ingest.SourceDecoder;
import org.dxworks.vbframe.serialization.SchemaVersion;
import org.dxworks.vbframe.serialization.SerializerOptions;

import java.nio.charset.Charset;
import java.util.Objects;

public final class ConversionOptions {

    private final SchemaVersion schemaVersion;
    private final int workers;
    private final EmissionMode emissionMode;
    private final boolean prettyPrint;
    private final boolean includeSourceText;
    private final Charset declaredEncoding;

    public ConversionOptions(SchemaVersion schemaVersion, int workers, EmissionMode emissionMode,
                             boolean prettyPrint, boolean includeSourceText, Charset declaredEncoding) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
        this.schemaVersion = Objects.requireNonNull(schemaVersion, "schemaVersion");
        this.workers = workers;
        this.emissionMode = Objects.requireNonNull(emissionMode, "emissionMode");
        this.prettyPrint = prettyPrint;
        this.includeSourceText = includeSourceText;
        this.declaredEncoding = declaredEncoding == null ? SourceDecoder.DEFAULT_CHARSET : declaredEncoding;
    }

    public static ConversionOptions defaults() {
        return new ConversionOptions(SchemaVersion.CURRENT, Math.max(1, Runtime.getRuntime().availableProcessors()),
                EmissionMode.SINGLE, true, true, SourceDecoder.DEFAULT_CHARSET);
    }

    public ConversionOptions withEmissionMode(EmissionMode mode) {
        return new ConversionOptions(schemaVersion, workers, mode, prettyPrint, includeSourceText, declaredEncoding);
    }

    public ConversionOptions withWorkers(int count) {
        return new ConversionOptions(schemaVersion, count, emissionMode, prettyPrint, includeSourceText,
                declaredEncoding);
    }

    public SerializerOptions toSerializerOptions() {
        return new SerializerOptions(schemaVersion, prettyPrint, includeSourceText);
    }

    public SchemaVersion getSchemaVersion() {
        return schemaVersion;
    }

    public int getWorkers() {
        return workers;
    }

    public EmissionMode getEmissionMode() {
        return emissionMode;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public boolean isIncludeSourceText() {
        return includeSourceText;
    }

    public Charset getDeclaredEncoding() {
        return declaredEncoding;
    }
}
