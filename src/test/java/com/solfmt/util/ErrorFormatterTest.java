package com.solfmt.util;

import static com.google.common.truth.Truth.assertThat;

import com.solfmt.api.error.FormatterError;
import com.solfmt.api.error.Severity;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ErrorFormatter}. */
@RunWith(JUnit4.class)
public final class ErrorFormatterTest {
    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    public void formatsErrorWithSuggestion() {
        FormatterError error = new FormatterError(Severity.FATAL, "Unexpected token", 3, 7, "Check the syntax");

        assertThat(plain.formatError(error))
                .isEqualTo("FATAL: Unexpected token (Line 3, Column 7)\n  Suggestion: Check the syntax");
    }

    @Test
    public void summarizesCountsPerFile() {
        Map<Path, List<FormatterError>> errors = new LinkedHashMap<>();
        errors.put(Paths.get("A.sol"), List.of(
                new FormatterError(Severity.FATAL, "bad", 1, 1),
                new FormatterError(Severity.WARNING, "meh", 2, 1)));
        errors.put(Paths.get("B.sol"), Collections.emptyList());

        assertThat(plain.formatErrorSummary(errors))
                .isEqualTo("Error Summary:\nA.sol: 1 fatal, 1 warnings\n\nTotal: 1 fatal, 1 warnings");
    }

    @Test
    public void colorsOnlyWhenEnabled() {
        assertThat(plain.colorize(ErrorFormatter.ANSI_RED, "x")).isEqualTo("x");
        assertThat(new ErrorFormatter(true).colorize(ErrorFormatter.ANSI_RED, "x"))
                .isEqualTo(ErrorFormatter.ANSI_RED + "x" + ErrorFormatter.ANSI_RESET);
    }
}
