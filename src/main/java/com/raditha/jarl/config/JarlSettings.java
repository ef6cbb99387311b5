package com.raditha.jarl.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.raditha.jarl.cfg.CfgBuilder;
import com.raditha.jarl.model.RVersion;
import com.raditha.jarl.rules.RuleOptions;
import com.raditha.jarl.rules.RuleTable;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads lint configuration from {@code jarl.toml} with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > jarl.toml > defaults
 */
public class JarlSettings {

    private static final Logger logger = LoggerFactory.getLogger(JarlSettings.class);

    public static final String CONFIG_FILE_NAME = "jarl.toml";

    private static final String LINT_TABLE = "lint";
    private static final String UNREACHABLE_CODE_TABLE = "unreachable-code";
    private static final String STOPPING_FUNCTIONS = "stopping-functions";
    private static final String EXTEND_STOPPING_FUNCTIONS = "extend-stopping-functions";

    private static final Set<String> KNOWN_LINT_KEYS = Set.of(
            "select", "extend-select", "ignore", "fixable", "unfixable", "exclude", "default-exclude",
            "min-r-version", UNREACHABLE_CODE_TABLE);

    private final RuleTable table;
    private final TomlMapper mapper = new TomlMapper();

    public JarlSettings(RuleTable table) {
        this.table = table;
    }

    /**
     * Options given on the command line; null means "not given".
     */
    public record Overrides(
            @Nullable List<String> select,
            @Nullable List<String> extendSelect,
            @Nullable List<String> ignore,
            @Nullable String minRVersion,
            @Nullable Boolean defaultExclude) {

        public static Overrides none() {
            return new Overrides(null, null, null, null, null);
        }
    }

    /**
     * Load configuration for a run started in {@code workingDirectory}.
     *
     * @param workingDirectory where the search for jarl.toml and DESCRIPTION starts
     * @param configFile       explicit configuration file, or null to search
     * @param overrides        CLI options
     * @throws ConfigurationException if the configuration is invalid
     * @throws IOException            if a configuration file cannot be read
     */
    public JarlConfig loadConfig(Path workingDirectory, @Nullable Path configFile, Overrides overrides)
            throws IOException {
        Path file = configFile != null ? configFile : findConfigFile(workingDirectory).orElse(null);
        Map<String, Object> lint = Map.of();
        if (file != null) {
            if (!Files.isRegularFile(file)) {
                throw new ConfigurationException("Config file not found: " + file);
            }
            logger.debug("Using configuration from {}", file);
            lint = readLintTable(file);
        }

        List<String> select = overrides.select() != null ? overrides.select() : getListString(lint, "select");
        List<String> extendSelect = new ArrayList<>(getListString(lint, "extend-select"));
        if (overrides.extendSelect() != null) {
            extendSelect.addAll(overrides.extendSelect());
        }
        List<String> ignore = new ArrayList<>(getListString(lint, "ignore"));
        if (overrides.ignore() != null) {
            ignore.addAll(overrides.ignore());
        }

        Set<String> enabled = RuleSelection.enabledRules(table, select, extendSelect, ignore);
        Set<String> fixable = RuleSelection.fixableRules(table, getListString(lint, "fixable"),
                getListString(lint, "unfixable"));

        String versionText = overrides.minRVersion() != null
                ? overrides.minRVersion()
                : getString(lint, "min-r-version", null);
        RVersion version = versionText != null
                ? parseVersion(versionText)
                : DescriptionFile.minimumRVersion(workingDirectory).orElse(null);

        boolean defaultExclude = overrides.defaultExclude() != null
                ? overrides.defaultExclude()
                : getBoolean(lint, "default-exclude", true);

        return new JarlConfig(
                enabled,
                fixable,
                version,
                getListString(lint, "exclude"),
                defaultExclude,
                buildRuleOptions(lint));
    }

    /**
     * Search {@code directory} and its ancestors for jarl.toml.
     */
    public static Optional<Path> findConfigFile(Path directory) {
        Path current = directory.toAbsolutePath().normalize();
        while (current != null) {
            Path candidate = current.resolve(CONFIG_FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    private Map<String, Object> readLintTable(Path file) throws IOException {
        Map<String, Object> document;
        try {
            document = mapper.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid " + file.getFileName() + ": " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            return Map.of();
        }
        Object lint = document.get(LINT_TABLE);
        if (lint == null) {
            return Map.of();
        }
        if (!(lint instanceof Map)) {
            throw new ConfigurationException("`[" + LINT_TABLE + "]` in " + file.getFileName() + " must be a table");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) lint;
        for (String key : config.keySet()) {
            if (!KNOWN_LINT_KEYS.contains(key)) {
                logger.warn("Unknown key `{}` in [{}] of {}", key, LINT_TABLE, file);
            }
        }
        return config;
    }

    private static RuleOptions buildRuleOptions(Map<String, Object> lint) {
        Object section = lint.get(UNREACHABLE_CODE_TABLE);
        if (!(section instanceof Map)) {
            return RuleOptions.defaults();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> options = (Map<String, Object>) section;
        boolean replace = options.containsKey(STOPPING_FUNCTIONS);
        boolean extend = options.containsKey(EXTEND_STOPPING_FUNCTIONS);
        if (replace && extend) {
            throw new ConfigurationException("Cannot specify both `" + STOPPING_FUNCTIONS + "` and `"
                    + EXTEND_STOPPING_FUNCTIONS + "` in [lint." + UNREACHABLE_CODE_TABLE + "]");
        }
        if (replace) {
            return new RuleOptions(getListString(options, STOPPING_FUNCTIONS));
        }
        if (extend) {
            Set<String> functions = new LinkedHashSet<>(CfgBuilder.DEFAULT_STOPPING_FUNCTIONS);
            functions.addAll(getListString(options, EXTEND_STOPPING_FUNCTIONS));
            return new RuleOptions(List.copyOf(functions));
        }
        return RuleOptions.defaults();
    }

    private static RVersion parseVersion(String text) {
        try {
            return RVersion.parse(text);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value != null) {
            throw new ConfigurationException("`" + key + "` must be true or false");
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException("`" + key + "` must be an array of strings");
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            result.add(String.valueOf(item));
        }
        return result;
    }
}
