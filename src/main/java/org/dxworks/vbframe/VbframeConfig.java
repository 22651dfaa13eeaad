package org.dxworks.vbframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.vbframe.ingest.SourceDecoder;
import org.dxworks.vbframe.pipeline.ConversionOptions;
import org.dxworks.vbframe.pipeline.EmissionMode;
import org.dxworks.vbframe.serialization.SchemaVersion;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class VbframeConfig {

    private static final String CONFIG_FILE_NAME = "vbframe-config.yml";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final EmissionMode DEFAULT_EMISSION_MODE = EmissionMode.SINGLE;
    private static final boolean DEFAULT_PRETTY_PRINT = true;
    private static final boolean DEFAULT_INCLUDE_SOURCE_TEXT = true;
    private static final boolean DEFAULT_STRICT = false;

    private final SchemaVersion schemaVersion;
    private final int workers;
    private final EmissionMode emissionMode;
    private final boolean prettyPrint;
    private final boolean includeSourceText;
    private final Charset declaredEncoding;
    private final boolean strict;
    private final int maxFileLines;

    private VbframeConfig(SchemaVersion schemaVersion, int workers, EmissionMode emissionMode, boolean prettyPrint,
                          boolean includeSourceText, Charset declaredEncoding, boolean strict, int maxFileLines) {
        this.schemaVersion = schemaVersion;
        this.workers = workers;
        this.emissionMode = emissionMode;
        this.prettyPrint = prettyPrint;
        this.includeSourceText = includeSourceText;
        this.declaredEncoding = declaredEncoding;
        this.strict = strict;
        this.maxFileLines = maxFileLines;
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

    /**
     * Whether files that could not be converted make the run fail.
     */
    public boolean isStrict() {
        return strict;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public ConversionOptions toConversionOptions() {
        return new ConversionOptions(schemaVersion, workers, emissionMode, prettyPrint, includeSourceText,
                declaredEncoding);
    }

    public static VbframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static VbframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return new VbframeConfig(
                        schemaVersionOrDefault(yamlConfig.schemaVersion),
                        yamlConfig.workers != null && yamlConfig.workers > 0 ? yamlConfig.workers : defaultWorkers(),
                        emissionModeOrDefault(yamlConfig.emissionMode),
                        yamlConfig.prettyPrint != null ? yamlConfig.prettyPrint : DEFAULT_PRETTY_PRINT,
                        yamlConfig.includeSourceText != null
                                ? yamlConfig.includeSourceText
                                : DEFAULT_INCLUDE_SOURCE_TEXT,
                        charsetOrDefault(yamlConfig.declaredEncoding),
                        yamlConfig.strict != null ? yamlConfig.strict : DEFAULT_STRICT,
                        yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0
                                ? yamlConfig.maxFileLines
                                : DEFAULT_MAX_FILE_LINES);
            }
        } catch (IOException e) {
            System.err.println("Warning: ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static VbframeConfig defaults() {
        return new VbframeConfig(SchemaVersion.CURRENT, defaultWorkers(), DEFAULT_EMISSION_MODE, DEFAULT_PRETTY_PRINT,
                DEFAULT_INCLUDE_SOURCE_TEXT, SourceDecoder.DEFAULT_CHARSET, DEFAULT_STRICT, DEFAULT_MAX_FILE_LINES);
    }

    public static VbframeConfig with(int workers, EmissionMode emissionMode, boolean prettyPrint,
                                     boolean includeSourceText, boolean strict, int maxFileLines) {
        return new VbframeConfig(SchemaVersion.CURRENT,
                workers > 0 ? workers : defaultWorkers(),
                emissionMode != null ? emissionMode : DEFAULT_EMISSION_MODE,
                prettyPrint, includeSourceText, SourceDecoder.DEFAULT_CHARSET, strict,
                maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES);
    }

    private static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private static SchemaVersion schemaVersionOrDefault(String value) {
        if (value == null) {
            return SchemaVersion.CURRENT;
        }
        try {
            return SchemaVersion.of(value.trim());
        } catch (IllegalArgumentException e) {
            return SchemaVersion.CURRENT;
        }
    }

    private static EmissionMode emissionModeOrDefault(String value) {
        if (value == null) {
            return DEFAULT_EMISSION_MODE;
        }
        try {
            return EmissionMode.fromName(value.trim());
        } catch (IllegalArgumentException e) {
            return DEFAULT_EMISSION_MODE;
        }
    }

    private static Charset charsetOrDefault(String value) {
        if (value == null) {
            return SourceDecoder.DEFAULT_CHARSET;
        }
        try {
            return Charset.forName(value.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return SourceDecoder.DEFAULT_CHARSET;
        }
    }

    private static class YamlConfig {
        public String schemaVersion;
        public Integer workers;
        public String emissionMode;
        public Boolean prettyPrint;
        public Boolean includeSourceText;
        public String declaredEncoding;
        public Boolean strict;
        public Integer maxFileLines;
    }
}
