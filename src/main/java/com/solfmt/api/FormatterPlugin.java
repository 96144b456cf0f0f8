package com.solfmt.api;

import java.nio.file.Path;

import com.solfmt.config.FormatterConfig;

/**
 * A language-specific formatter. Implementations must be safe to call from several threads once
 * initialized.
 */
public interface FormatterPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(FormatterConfig config);

    /**
     * Format the provided source code. Failures are reported in the result, never thrown.
     */
    FormatterResult format(Path filePath, String sourceCode);
}
