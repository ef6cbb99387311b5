package com.raditha.jarl.config;

import com.raditha.jarl.model.RVersion;
import com.raditha.jarl.rules.RuleOptions;
import com.raditha.jarl.rules.RuleTable;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolved settings for a lint run. Immutable, shared by all workers.
 *
 * @param enabledRules     rules to run, meta-rules included
 * @param fixableRules     rules whose fixes may be applied
 * @param minimumRVersion  oldest R version the code must support, null when unknown
 * @param excludePatterns  user exclusion globs, relative to the project root
 * @param defaultExclude   also apply {@link #DEFAULT_EXCLUDES}
 * @param ruleOptions      per-rule settings
 */
public record JarlConfig(
        Set<String> enabledRules,
        Set<String> fixableRules,
        @Nullable RVersion minimumRVersion,
        List<String> excludePatterns,
        boolean defaultExclude,
        RuleOptions ruleOptions) {

    /**
     * Paths never linted unless default exclusion is turned off.
     */
    public static final List<String> DEFAULT_EXCLUDES = List.of(
            ".git/",
            "renv/",
            "revdep/",
            "cpp11.R",
            "RcppExports.R",
            "extendr-wrappers.R",
            "import-standalone-*.R");

    /**
     * Validate configuration.
     */
    public JarlConfig {
        if (enabledRules == null || fixableRules == null) {
            throw new IllegalArgumentException("rule sets cannot be null");
        }
        if (ruleOptions == null) {
            throw new IllegalArgumentException("ruleOptions cannot be null");
        }
        enabledRules = Set.copyOf(enabledRules);
        fixableRules = Set.copyOf(fixableRules);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    /**
     * Every rule enabled by default, all fixable, no version.
     */
    public static JarlConfig defaults(RuleTable table) {
        return new JarlConfig(
                RuleSelection.enabledRules(table, List.of(), List.of(), List.of()),
                Set.copyOf(table.names()),
                null,
                List.of(),
                true,
                RuleOptions.defaults());
    }

    /**
     * All patterns in effect.
     */
    public List<String> effectiveExcludes() {
        List<String> patterns = new ArrayList<>(excludePatterns);
        if (defaultExclude) {
            patterns.addAll(DEFAULT_EXCLUDES);
        }
        return patterns;
    }

    /**
     * Check if a file path, relative to the project root and using
     * {@code /} as separator, matches any exclusion pattern.
     */
    public boolean shouldExclude(String relativePath) {
        String path = relativePath.replace('\\', '/');
        for (String pattern : effectiveExcludes()) {
            if (matchesGlobPattern(path, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Glob matching with {@code **} and {@code *}. A pattern ending in
     * {@code /} names a directory anywhere in the path; a pattern without
     * {@code /} names a file in any directory.
     */
    static boolean matchesGlobPattern(String path, String pattern) {
        if (pattern.endsWith("/")) {
            String directory = toRegex(pattern.substring(0, pattern.length() - 1));
            return path.matches("(.*/)?" + directory + "/.*");
        }
        if (!pattern.contains("/")) {
            return path.matches("(.*/)?" + toRegex(pattern));
        }
        return path.matches(toRegex(pattern.startsWith("/") ? pattern.substring(1) : pattern));
    }

    private static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*' && i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                regex.append(".*");
                i += 2;
                if (i < glob.length() && glob.charAt(i) == '/') {
                    // **/ also matches no directory at all
                    regex.setLength(regex.length() - 2);
                    regex.append("(.*/)?");
                    i++;
                }
                continue;
            }
            if (c == '*') {
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return regex.toString();
    }
}
