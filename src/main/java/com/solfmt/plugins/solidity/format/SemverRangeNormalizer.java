package com.solfmt.plugins.solidity.format;

import com.github.zafarkhaja.semver.ParseException;
import com.github.zafarkhaja.semver.Version;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes npm-style semantic version ranges as accepted by {@code pragma solidity}.
 *
 * <p>Alternatives are separated by {@code ||}. Each alternative is a hyphen range
 * ({@code 0.8.0 - 0.8.9}) or a list of comparators separated by whitespace or commas. The
 * canonical form glues each operator to its version, drops a leading {@code v}, separates
 * comparators with one space and alternatives with {@code " || "}. Commas are never emitted since
 * the compiler rejects them.
 *
 * <p>Versions are validated with java-semver. Partial versions and x-ranges ({@code 0.8},
 * {@code 0.8.x}) are checked with the missing or wildcard parts read as zero, and written back as
 * they were.
 */
public final class SemverRangeNormalizer implements VersionNormalizer {
    private static final Pattern HYPHEN_RANGE = Pattern.compile("(\\S+)\\s+-\\s+(\\S+)");
    private static final String[] OPERATORS = {">=", "<=", ">", "<", "=", "^", "~"};
    private static final Set<String> WILDCARDS = Set.of("x", "X", "*");

    @Override
    public Optional<String> normalize(String literal) {
        String range = literal.strip();
        if (range.isEmpty()) {
            return Optional.empty();
        }

        List<String> alternatives = new ArrayList<>();
        for (String alternative : range.split("\\|\\|", -1)) {
            Optional<String> normalized = normalizeAlternative(alternative.strip());
            if (normalized.isEmpty()) {
                return Optional.empty();
            }
            alternatives.add(normalized.get());
        }
        return Optional.of(String.join(" || ", alternatives));
    }

    private Optional<String> normalizeAlternative(String alternative) {
        if (alternative.isEmpty()) {
            return Optional.empty();
        }

        Matcher hyphen = HYPHEN_RANGE.matcher(alternative);
        if (hyphen.matches()) {
            Optional<String> lower = version(hyphen.group(1));
            Optional<String> upper = version(hyphen.group(2));
            if (lower.isEmpty() || upper.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(lower.get() + " - " + upper.get());
        }

        List<String> comparators = new ArrayList<>();
        int pos = _skipSeparators(alternative, 0);
        while (pos < alternative.length()) {
            String operator = _operatorAt(alternative, pos);
            pos = _skipWhitespace(alternative, pos + operator.length());

            int end = _versionEnd(alternative, pos);
            Optional<String> version = version(alternative.substring(pos, end));
            if (version.isEmpty()) {
                return Optional.empty();
            }
            comparators.add(operator + version.get());
            pos = _skipSeparators(alternative, end);
        }

        return comparators.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", comparators));
    }

    /**
     * Validates one version of a comparator and returns it without a leading {@code v}.
     */
    static Optional<String> version(String text) {
        String version = text.startsWith("v") ? text.substring(1) : text;
        if (version.isEmpty()) {
            return Optional.empty();
        }

        int suffix = _suffixStart(version);
        String[] parts = version.substring(0, suffix).split("\\.", -1);
        if (parts.length > 3) {
            return Optional.empty();
        }

        boolean wildcard = false;
        StringBuilder candidate = new StringBuilder();
        for (int i = 0; i < 3; i++) {
            String part = i < parts.length ? parts[i] : "0";
            if (WILDCARDS.contains(part)) {
                wildcard = true;
                part = "0";
            }
            candidate.append(i == 0 ? "" : ".").append(part);
        }
        if (wildcard && suffix != version.length()) {
            return Optional.empty();
        }

        try {
            Version.valueOf(candidate + version.substring(suffix));
            return Optional.of(version);
        } catch (ParseException e) {
            return Optional.empty();
        }
    }

    private static int _suffixStart(String version) {
        for (int i = 0; i < version.length(); i++) {
            if (version.charAt(i) == '-' || version.charAt(i) == '+') {
                return i;
            }
        }
        return version.length();
    }

    private static String _operatorAt(String s, int pos) {
        for (String operator : OPERATORS) {
            if (s.startsWith(operator, pos)) {
                return operator;
            }
        }
        return "";
    }

    /** A version runs up to the next separator or operator character. */
    private static int _versionEnd(String s, int pos) {
        while (pos < s.length()) {
            char c = s.charAt(pos);
            if (Character.isWhitespace(c) || c == ',' || "<>=^~".indexOf(c) >= 0) {
                break;
            }
            pos++;
        }
        return pos;
    }

    private static int _skipWhitespace(String s, int pos) {
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static int _skipSeparators(String s, int pos) {
        while (pos < s.length() && (Character.isWhitespace(s.charAt(pos)) || s.charAt(pos) == ',')) {
            pos++;
        }
        return pos;
    }
}
