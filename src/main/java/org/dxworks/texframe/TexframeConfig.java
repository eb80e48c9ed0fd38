package org.dxworks.texframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.texframe.parser.NewlineMode;
import org.dxworks.texframe.parser.ParserOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class TexframeConfig {

    private static final String CONFIG_FILE_NAME = "texframe-config.yml";
    private static final boolean DEFAULT_TEXT_MERGE = false;
    private static final NewlineMode DEFAULT_NEWLINE_MODE = NewlineMode.DEFAULT;

    private final boolean textMerge;
    private final NewlineMode newlineMode;

    private TexframeConfig(boolean textMerge, NewlineMode newlineMode) {
        this.textMerge = textMerge;
        this.newlineMode = newlineMode;
    }

    public boolean isTextMerge() {
        return textMerge;
    }

    public NewlineMode getNewlineMode() {
        return newlineMode;
    }

    public ParserOptions toParserOptions() {
        return ParserOptions.of(textMerge, newlineMode);
    }

    public static TexframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static TexframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                boolean effectiveTextMerge = (yamlConfig.textMerge != null)
                        ? yamlConfig.textMerge
                        : DEFAULT_TEXT_MERGE;
                NewlineMode effectiveNewlineMode = NewlineMode.fromName(yamlConfig.newlineMode)
                        .orElse(DEFAULT_NEWLINE_MODE);

                return new TexframeConfig(effectiveTextMerge, effectiveNewlineMode);
            }
        } catch (IOException e) {
            // Fall through to default
        }

        return defaults();
    }

    public static TexframeConfig defaults() {
        return new TexframeConfig(DEFAULT_TEXT_MERGE, DEFAULT_NEWLINE_MODE);
    }

    public static TexframeConfig with(boolean textMerge, NewlineMode newlineMode) {
        NewlineMode effectiveNewlineMode = newlineMode != null ? newlineMode : DEFAULT_NEWLINE_MODE;
        return new TexframeConfig(textMerge, effectiveNewlineMode);
    }

    private static class YamlConfig {
        public Boolean textMerge;
        public String newlineMode;
    }
}
