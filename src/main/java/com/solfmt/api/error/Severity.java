package com.solfmt.api.error;

public enum Severity {
    FATAL,   // The file could not be parsed or written; no output is produced
    ERROR,   // Formatting finished but the result must not be used
    WARNING, // Formatting succeeded with a caveat, such as a literal kept verbatim
    INFO     // Informational messages about formatting
}
