package com.raditha.jarl.fix;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for fix previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT = 3;

    /**
     * Generate a unified diff between the original and the fixed source.
     *
     * @param fileName  name shown in the diff headers
     * @param original  source before fixing
     * @param fixed     source after fixing
     * @return unified diff, empty when the texts are equal
     */
    public String generateUnifiedDiff(String fileName, String original, String fixed) {
        return generateUnifiedDiff(fileName, original, fixed, DEFAULT_CONTEXT);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String fileName, String original, String fixed, int contextLines) {
        if (original.equals(fixed)) {
            return "";
        }
        List<String> before = lines(original);
        List<String> after = lines(fixed);

        Patch<String> patch = DiffUtils.diff(before, after);

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                before,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\r?\n", -1));
    }
}
