package com.fsmgen.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fsmgen.core.generator.GeneratorConfig;
import com.fsmgen.core.parser.ParserOptions;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Root configuration for fsmgen projects.
 *
 * <p>Loaded from {@code fsmgen.yaml} in the project root. Every section is optional; missing
 * values fall back to the defaults below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "traffic-lights"
 *
 * sources:
 *   include: "diagrams/*.puml"
 *
 * generator:
 *   id: c
 *   extension: inc
 *   comments: true
 *   indent: 2
 *
 * parser:
 *   strictNesting: false
 *
 * output:
 *   directory: "./generated"
 *   settings:
 *     console.showHeaders: "false"
 * }</pre>
 *
 * @param project project metadata
 * @param sources diagram discovery settings
 * @param generator code generator settings
 * @param parser parser settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("sources") SourcesConfig sources,
    @JsonProperty("generator") GeneratorSettings generator,
    @JsonProperty("parser") ParserSettings parser,
    @JsonProperty("output") OutputConfig output
) {
    /** Glob used to discover diagrams when none is configured. */
    public static final String DEFAULT_INCLUDE = "**/*.puml";

    /** Generator used when none is configured. */
    public static final String DEFAULT_GENERATOR = "c";

    /**
     * Compact constructor filling in missing sections.
     */
    public ProjectConfig {
        if (project == null) {
            project = new ProjectInfo("project");
        }
        if (sources == null) {
            sources = new SourcesConfig(DEFAULT_INCLUDE);
        }
        if (generator == null) {
            generator = new GeneratorSettings(DEFAULT_GENERATOR, null, true, GeneratorConfig.DEFAULT_INDENT_WIDTH);
        }
        if (parser == null) {
            parser = new ParserSettings(false);
        }
        if (output == null) {
            output = new OutputConfig(null, null);
        }
    }

    /**
     * Creates a default configuration: all {@code .puml} files, C generator, output next to
     * each diagram.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name, used in the compile summary
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name
    ) {
        public ProjectInfo {
            if (name == null || name.isBlank()) {
                name = "project";
            }
        }
    }

    /**
     * Diagram discovery settings.
     *
     * @param include glob, relative to the project directory, selecting diagram files
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SourcesConfig(
        @JsonProperty("include") String include
    ) {
        public SourcesConfig {
            if (include == null || include.isBlank()) {
                include = DEFAULT_INCLUDE;
            }
        }
    }

    /**
     * Code generator settings.
     *
     * @param id generator id
     * @param extension output file extension; null uses the generator's own
     * @param comments whether to annotate generated code with transition comments
     * @param indent spaces per indentation level of the generated code
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("id") String id,
        @JsonProperty("extension") String extension,
        @JsonProperty("comments") Boolean comments,
        @JsonProperty("indent") Integer indent
    ) {
        public GeneratorSettings {
            if (id == null || id.isBlank()) {
                id = DEFAULT_GENERATOR;
            }
            if (comments == null) {
                comments = Boolean.TRUE;
            }
            if (indent == null) {
                indent = GeneratorConfig.DEFAULT_INDENT_WIDTH;
            }
        }
    }

    /**
     * Parser settings.
     *
     * @param strictNesting reject states reopened under a different parent
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserSettings(
        @JsonProperty("strictNesting") Boolean strictNesting
    ) {
        public ParserSettings {
            if (strictNesting == null) {
                strictNesting = Boolean.FALSE;
            }
        }

        public ParserOptions toOptions() {
            return new ParserOptions(strictNesting);
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory; null writes each file next to its diagram
     * @param settings renderer settings passed on to the output renderer
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("settings") Map<String, String> settings
    ) {
        public OutputConfig {
            settings = settings == null ? Map.of() : settings.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
        }
    }
}
