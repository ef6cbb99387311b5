package com.raditha.jarl.rules;

/**
 * Names of the rules known to the engine.
 */
public final class RuleNames {

    public static final String ANY_DUPLICATED = "any_duplicated";
    public static final String ANY_IS_NA = "any_is_na";
    public static final String BROWSER = "browser";
    public static final String CLASS_EQUALS = "class_equals";
    public static final String DUPLICATED_ARGUMENTS = "duplicated_arguments";
    public static final String EQUALS_NA = "equals_na";
    public static final String GREPV = "grepv";
    public static final String NUMERIC_LEADING_ZERO = "numeric_leading_zero";
    public static final String TRUE_FALSE_SYMBOL = "true_false_symbol";
    public static final String UNREACHABLE_CODE = "unreachable_code";

    // Emitted by the suppression resolver
    public static final String BLANKET_SUPPRESSION = "blanket_suppression";
    public static final String MISNAMED_SUPPRESSION = "misnamed_suppression";
    public static final String MISPLACED_SUPPRESSION = "misplaced_suppression";
    public static final String MISPLACED_FILE_SUPPRESSION = "misplaced_file_suppression";
    public static final String UNEXPLAINED_SUPPRESSION = "unexplained_suppression";
    public static final String UNMATCHED_RANGE_SUPPRESSION = "unmatched_range_suppression";
    public static final String OUTDATED_SUPPRESSION = "outdated_suppression";
    public static final String INVALID_CHUNK_SUPPRESSION = "invalid_chunk_suppression";

    /** Synthetic rule of files that could not be parsed. */
    public static final String PARSE_ERROR = "parse_error";

    /** Synthetic rule of files that could not be read. */
    public static final String IO_ERROR = "io_error";

    private RuleNames() {
    }
}
