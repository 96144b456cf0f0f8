package com.solfmt.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.solfmt.api.CodeFormatter;
import com.solfmt.api.FormatterPlugin;
import com.solfmt.api.FormatterResult;
import com.solfmt.api.error.FormatterError;
import com.solfmt.api.error.Severity;
import com.solfmt.config.FormatterConfig;
import com.solfmt.plugins.FileType;
import com.solfmt.util.LoggerUtil;

/**
 * Thread-safe formatting engine. Delegates each file to the plugin registered for its
 * {@link FileType} and formats directory trees on a fixed thread pool.
 */
public class FormatterEngine implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(FormatterEngine.class);
    private static final long DIRECTORY_TIMEOUT_MINUTES = 30;

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;
    private final List<PathMatcher> ignoreMatchers;
    private volatile List<PathMatcher> includeMatchers = Collections.emptyList();

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public FormatterEngine(FormatterConfig config) {
        this.config = config;
        this.ignoreMatchers = _compileGlobs(config.getIgnoreFiles());
        logger.fine("Formatter engine created, " + ignoreMatchers.size() + " ignore patterns");
    }

    /**
     * Registers and initializes a plugin for a specific file type.
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugins.put(fileType, plugin);
        plugin.initialize(config);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    /**
     * Restricts directory runs to files whose path relative to the directory matches one of
     * {@code globs}. An empty list includes everything.
     */
    public void setIncludePatterns(List<String> globs) {
        this.includeMatchers = _compileGlobs(globs);
    }

    /**
     * Formats a single file using the appropriate plugin.
     */
    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.failure(new FormatterError(
                    Severity.ERROR,
                    "No plugin registered for file type: " + fileType,
                    1, 1));
        }

        try {
            processedFileCount.incrementAndGet();
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Formatted: " + filePath + (result.isChanged() ? " (changed)" : ""));
            } else {
                errorCount.incrementAndGet();
                logger.fine("Failed to format: " + filePath + " - " +
                        result.getErrors().stream()
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }

            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);
            return FormatterResult.failure(new FormatterError(
                    Severity.FATAL,
                    "Unexpected error: " + e.getMessage(),
                    1, 1));
        }
    }

    /**
     * Reads and formats one file from disk.
     */
    public FormatterResult formatPath(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return formatFile(file, content);
        } catch (IOException e) {
            errorCount.incrementAndGet();
            logger.log(Level.FINE, "Failed to read " + file, e);
            return FormatterResult.failure(new FormatterError(
                    Severity.FATAL,
                    "Failed to read file: " + e,
                    1, 1,
                    "Check that the file exists and is UTF-8 encoded"));
        }
    }

    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) throws IOException {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Formats every supported, non-ignored file under {@code directory} with {@code threadCount}
     * workers. Results are keyed by file path and iterate in path order.
     *
     * @throws IOException if {@code directory} is not a directory or cannot be walked
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) throws IOException {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be at least 1: " + threadCount);
        }

        List<Path> filesToProcess = collectFiles(directory);

        logger.fine("Found " + filesToProcess.size() + " files to process in " + directory);

        Map<Path, FormatterResult> results = new ConcurrentHashMap<>();
        if (filesToProcess.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threadCount, filesToProcess.size()));
        try {
            for (Path file : filesToProcess) {
                executor.submit(() -> results.put(file, formatPath(file)));
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(DIRECTORY_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                    logger.warning("Timeout waiting for file processing to complete");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Processing interrupted", e);
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }

        logger.fine("Processed " + results.size() + " files");
        return new TreeMap<>(results);
    }

    /**
     * Lists the files under {@code directory} that a directory run would format, in path order.
     *
     * @throws IOException if the tree cannot be walked
     */
    public List<Path> collectFiles(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a directory: " + directory);
        }

        List<Path> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.filter(Files::isRegularFile)
                    .sorted()
                    .forEach(path -> {
                        Path relative = directory.relativize(path);
                        if (isIgnored(relative)) {
                            logger.fine("Ignoring " + path);
                        } else if (_isIncluded(relative) && plugins.containsKey(FileType.detect(path))) {
                            files.add(path);
                        }
                    });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return files;
    }

    /**
     * Whether {@code path} matches one of the configured {@code ignoreFiles} globs. Both the path
     * and its file name are tested, so {@code *.t.sol} ignores test files at any depth.
     */
    public boolean isIgnored(Path path) {
        return _matchesAny(ignoreMatchers, path);
    }

    private boolean _isIncluded(Path relative) {
        List<PathMatcher> matchers = includeMatchers;
        return matchers.isEmpty() || _matchesAny(matchers, relative);
    }

    private static boolean _matchesAny(List<PathMatcher> matchers, Path path) {
        Path fileName = path.getFileName();
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(path) || (fileName != null && matcher.matches(fileName))) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> _compileGlobs(List<String> globs) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String glob : globs) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }
        return matchers;
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    /**
     * Gets the number of files that could not be read or formatted.
     */
    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    /**
     * Closes all plugins and releases resources.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;

        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            FormatterPlugin plugin = entry.getValue();
            if (plugin instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                    // Keep the first failure but close the remaining plugins
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }

        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }
}
