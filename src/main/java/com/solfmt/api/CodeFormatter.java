package com.solfmt.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Entry point for formatting single files or whole directory trees.
 */
public interface CodeFormatter {
    FormatterResult formatFile(Path filePath, String sourceCode);
    Map<Path, FormatterResult> formatDirectory(Path directory) throws IOException;
}
