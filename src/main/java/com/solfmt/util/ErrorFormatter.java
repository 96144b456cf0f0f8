package com.solfmt.util;

import com.solfmt.api.error.FormatterError;
import com.solfmt.api.error.Severity;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders formatter errors for the terminal, with optional ANSI colors.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * @param useColors whether to use colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats an error as {@code SEVERITY: message (Line l, Column c)} plus an optional suggestion.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(": ");
        sb.append(error.getMessage());
        sb.append(" (Line ").append(error.getLine()).append(", Column ").append(error.getColumn()).append(")");

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Creates a summary of errors per file followed by the totals.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Error Summary:")).append("\n");

        int[] totals = new int[Severity.values().length];

        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            int[] counts = new int[Severity.values().length];
            for (FormatterError error : errors) {
                counts[error.getSeverity().ordinal()]++;
                totals[error.getSeverity().ordinal()]++;
            }

            sb.append(entry.getKey()).append(": ").append(_describeCounts(counts)).append("\n");
        }

        sb.append("\nTotal: ").append(_describeCounts(totals));
        return sb.toString();
    }

    private String _describeCounts(int[] counts) {
        StringBuilder sb = new StringBuilder();
        _appendCount(sb, counts[Severity.FATAL.ordinal()], " fatal", ANSI_RED);
        _appendCount(sb, counts[Severity.ERROR.ordinal()], " errors", ANSI_RED);
        _appendCount(sb, counts[Severity.WARNING.ordinal()], " warnings", ANSI_YELLOW);
        _appendCount(sb, counts[Severity.INFO.ordinal()], " info", ANSI_BLUE);
        return sb.length() == 0 ? "none" : sb.toString();
    }

    private void _appendCount(StringBuilder sb, int count, String label, String color) {
        if (count == 0) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(", ");
        }
        sb.append(colorize(color, count + label));
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
