package com.raditha.jarl.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An R version such as {@code 4.1} or {@code 4.3.2}.
 */
public record RVersion(int major, int minor, int patch) implements Comparable<RVersion> {

    private static final Pattern VERSION = Pattern.compile("^(\\d+)\\.(\\d+)(?:\\.(\\d+))?$");

    public RVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must be non-negative");
        }
    }

    /**
     * Parse {@code major.minor} or {@code major.minor.patch}.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static RVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("R version cannot be null");
        }
        Matcher matcher = VERSION.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                    "Invalid R version: " + text + ". Expected <major>.<minor> or <major>.<minor>.<patch>");
        }
        int patch = matcher.group(3) == null ? 0 : Integer.parseInt(matcher.group(3));
        return new RVersion(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)), patch);
    }

    public boolean isAtLeast(RVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(RVersion other) {
        int cmp = Integer.compare(major, other.major);
        if (cmp == 0) {
            cmp = Integer.compare(minor, other.minor);
        }
        if (cmp == 0) {
            cmp = Integer.compare(patch, other.patch);
        }
        return cmp;
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
