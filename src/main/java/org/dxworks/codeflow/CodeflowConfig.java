package org.dxworks.codeflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.codeflow.dfg.AssemblyMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CodeflowConfig {

    private static final String CONFIG_FILE_NAME = "codeflow-config.yml";

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_MAX_PATH_DEPTH = 1000;
    private static final int DEFAULT_MAX_PATHS = 10000;
    private static final int DEFAULT_DEF_USE_MAX_DEPTH = 20;
    private static final boolean DEFAULT_SEPARATE_NODE_BLOCKS = false;
    private static final AssemblyMode DEFAULT_ASSEMBLY_MODE = AssemblyMode.SEPARATED;
    private static final boolean DEFAULT_MODEL_SWITCH_FALLTHROUGH = false;
    private static final boolean DEFAULT_FALLBACK_ON_SYNTAX_ERROR = true;

    private final int maxFileLines;
    private final int maxPathDepth;
    private final int maxPaths;
    private final int defUseMaxDepth;
    private final boolean separateNodeBlocks;
    private final AssemblyMode assemblyMode;
    private final boolean modelSwitchFallthrough;
    private final boolean fallbackOnSyntaxError;

    private CodeflowConfig(int maxFileLines, int maxPathDepth, int maxPaths, int defUseMaxDepth,
                           boolean separateNodeBlocks, AssemblyMode assemblyMode,
                           boolean modelSwitchFallthrough, boolean fallbackOnSyntaxError) {
        this.maxFileLines = maxFileLines;
        this.maxPathDepth = maxPathDepth;
        this.maxPaths = maxPaths;
        this.defUseMaxDepth = defUseMaxDepth;
        this.separateNodeBlocks = separateNodeBlocks;
        this.assemblyMode = assemblyMode;
        this.modelSwitchFallthrough = modelSwitchFallthrough;
        this.fallbackOnSyntaxError = fallbackOnSyntaxError;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    /** Maximum number of blocks in one enumerated path. */
    public int getMaxPathDepth() {
        return maxPathDepth;
    }

    /** Maximum number of enumerated paths per procedure. */
    public int getMaxPaths() {
        return maxPaths;
    }

    /** Maximum number of blocks in one definition-to-use path. */
    public int getDefUseMaxDepth() {
        return defUseMaxDepth;
    }

    public boolean isSeparateNodeBlocks() {
        return separateNodeBlocks;
    }

    public AssemblyMode getAssemblyMode() {
        return assemblyMode;
    }

    public boolean isModelSwitchFallthrough() {
        return modelSwitchFallthrough;
    }

    public boolean isFallbackOnSyntaxError() {
        return fallbackOnSyntaxError;
    }

    public static CodeflowConfig defaults() {
        return new CodeflowConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_MAX_PATH_DEPTH, DEFAULT_MAX_PATHS,
                DEFAULT_DEF_USE_MAX_DEPTH, DEFAULT_SEPARATE_NODE_BLOCKS, DEFAULT_ASSEMBLY_MODE,
                DEFAULT_MODEL_SWITCH_FALLTHROUGH, DEFAULT_FALLBACK_ON_SYNTAX_ERROR);
    }

    public static CodeflowConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CodeflowConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return new CodeflowConfig(
                        positiveOr(yamlConfig.maxFileLines, DEFAULT_MAX_FILE_LINES),
                        positiveOr(yamlConfig.maxPathDepth, DEFAULT_MAX_PATH_DEPTH),
                        positiveOr(yamlConfig.maxPaths, DEFAULT_MAX_PATHS),
                        positiveOr(yamlConfig.defUseMaxDepth, DEFAULT_DEF_USE_MAX_DEPTH),
                        yamlConfig.separateNodeBlocks != null ? yamlConfig.separateNodeBlocks : DEFAULT_SEPARATE_NODE_BLOCKS,
                        assemblyModeOr(yamlConfig.assemblyMode),
                        yamlConfig.modelSwitchFallthrough != null ? yamlConfig.modelSwitchFallthrough : DEFAULT_MODEL_SWITCH_FALLTHROUGH,
                        yamlConfig.fallbackOnSyntaxError != null ? yamlConfig.fallbackOnSyntaxError : DEFAULT_FALLBACK_ON_SYNTAX_ERROR);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static CodeflowConfig with(int maxPathDepth, int maxPaths, boolean separateNodeBlocks,
                                      AssemblyMode assemblyMode, boolean modelSwitchFallthrough) {
        return new CodeflowConfig(DEFAULT_MAX_FILE_LINES,
                positiveOr(maxPathDepth, DEFAULT_MAX_PATH_DEPTH),
                positiveOr(maxPaths, DEFAULT_MAX_PATHS),
                DEFAULT_DEF_USE_MAX_DEPTH,
                separateNodeBlocks,
                assemblyMode != null ? assemblyMode : DEFAULT_ASSEMBLY_MODE,
                modelSwitchFallthrough,
                DEFAULT_FALLBACK_ON_SYNTAX_ERROR);
    }

    private static int positiveOr(Integer value, int fallback) {
        return (value != null && value > 0) ? value : fallback;
    }

    private static AssemblyMode assemblyModeOr(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_ASSEMBLY_MODE;
        }
        try {
            return AssemblyMode.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            System.err.println("Warning: unknown assemblyMode '" + value + "', using " + DEFAULT_ASSEMBLY_MODE);
            return DEFAULT_ASSEMBLY_MODE;
        }
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer maxPathDepth;
        public Integer maxPaths;
        public Integer defUseMaxDepth;
        public Boolean separateNodeBlocks;
        public String assemblyMode;
        public Boolean modelSwitchFallthrough;
        public Boolean fallbackOnSyntaxError;
    }
}
