package org.dxworks.styledmark;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.styledmark.converter.ConversionOptions;
import org.dxworks.styledmark.converter.LinkStyle;
import org.dxworks.styledmark.model.CompositeStyle;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class StyledmarkConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "styledmark-config.yml";

    private final int maxFileLines;
    private final ConversionOptions conversionOptions;

    private StyledmarkConfig(int maxFileLines, ConversionOptions conversionOptions) {
        this.maxFileLines = maxFileLines;
        this.conversionOptions = conversionOptions;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public ConversionOptions getConversionOptions() {
        return conversionOptions;
    }

    public static StyledmarkConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static StyledmarkConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                return new StyledmarkConfig(effectiveMaxFileLines, toConversionOptions(yamlConfig));
            }
        } catch (IOException e) {
            System.err.println("Warning: cannot read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static StyledmarkConfig defaults() {
        return new StyledmarkConfig(DEFAULT_MAX_FILE_LINES, ConversionOptions.defaults());
    }

    public static StyledmarkConfig with(int maxFileLines, ConversionOptions conversionOptions) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new StyledmarkConfig(effectiveMaxFileLines, conversionOptions);
    }

    private static ConversionOptions toConversionOptions(YamlConfig yamlConfig) {
        ConversionOptions options = ConversionOptions.defaults();

        // Missing or null entries keep the default of their depth; entries past h6 are ignored
        if (yamlConfig.headerSpacing != null) {
            int depths = Math.min(yamlConfig.headerSpacing.size(), CompositeStyle.MAX_HEADER_DEPTH);
            for (int i = 0; i < depths; i++) {
                Boolean spacing = yamlConfig.headerSpacing.get(i);
                if (spacing != null) {
                    options = options.withHeaderSpacing(i + 1, spacing);
                }
            }
        }

        if (yamlConfig.linksStyle != null) {
            options = options.withLinksStyle(LinkStyle.of(
                    yamlConfig.linksStyle.bold,
                    yamlConfig.linksStyle.italic,
                    yamlConfig.linksStyle.strikeout));
        }
        return options;
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public List<Boolean> headerSpacing;
        public YamlLinksStyle linksStyle;
    }

    private static class YamlLinksStyle {
        public Boolean bold;
        public Boolean italic;
        public Boolean strikeout;
    }
}
