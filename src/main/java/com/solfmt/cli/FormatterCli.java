package com.solfmt.cli;

import com.solfmt.api.FormatterResult;
import com.solfmt.api.error.FormatterError;
import com.solfmt.config.ConfigurationLoader;
import com.solfmt.config.FormatterConfig;
import com.solfmt.core.FormatterEngine;
import com.solfmt.plugins.FileType;
import com.solfmt.plugins.solidity.SolidityFormatter;
import com.solfmt.util.ErrorFormatter;
import com.solfmt.util.LoggerUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line interface of the Solidity formatter.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private final PrintStream out;
    private final Path workingDirectory;
    private ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public FormatterCli(PrintStream out, Path workingDirectory) {
        this.out = out;
        this.workingDirectory = workingDirectory;
    }

    public static void main(String[] args) {
        int exitCode = new FormatterCli(System.out, Paths.get("")).run(args);
        LoggerUtil.shutdown();
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(String[] args) {
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color") && !_hasOption(args, "--ci"));

        if (args.length < 1) {
            _printUsage();
            return EXIT_FAILURE;
        }

        LoggerUtil.setConsoleLevel(_hasOption(args, "--verbose") ? Level.FINE : Level.WARNING);

        try {
            String command = args[0];
            switch (command) {
                case "format":
                    return _formatFiles(args, true);
                case "check":
                    return _formatFiles(args, false);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    _printVersion();
                    return EXIT_OK;
                case "--help":
                case "-h":
                    _printUsage();
                    return EXIT_OK;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return EXIT_FAILURE;
            }
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_hasOption(args, "--verbose")) {
                _printInfo("Use --verbose for details");
            }
            return EXIT_FAILURE;
        }
    }

    private void _printVersion() {
        out.println("solfmt version " + VERSION);
    }

    private void _printUsage() {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "solfmt v" + VERSION));
        out.println("Usage:");
        out.println("  solfmt init [--force]      - Write " + ConfigurationLoader.CONFIG_FILE_NAME + " with the defaults");
        out.println("  solfmt format <path>       - Format Solidity files in path");
        out.println("  solfmt check <path>        - Report files that are not formatted");
        out.println("  solfmt --help|-h           - Show this help");
        out.println("  solfmt --version|-v        - Show version information");
        out.println();
        out.println("Options:");
        out.println("  --config=<file>            - Use specific config file (default: nearest " + ConfigurationLoader.CONFIG_FILE_NAME + ")");
        out.println("  --verbose                  - Show detailed output");
        out.println("  --ci                       - CI friendly output (plain, one summary line)");
        out.println("  --no-color                 - Disable colored output");
        out.println("  --include=<glob>           - Only include files matching pattern (repeatable)");
        out.println("  --threads=<num>            - Number of threads to use (default: available processors)");
        out.println("  --force                    - Overwrite an existing config file (with init)");
    }

    /**
     * Runs {@code format} (when {@code write} is set) or {@code check}.
     */
    private int _formatFiles(String[] args, boolean write) throws Exception {
        String command = write ? "format" : "check";
        String target = _firstPositional(args);
        if (target == null) {
            _printError("Error: Missing path argument");
            _printUsage();
            return EXIT_FAILURE;
        }

        Path path = workingDirectory.resolve(target).normalize();
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + target);
            return EXIT_FAILURE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        int threads = _threadCount(args);

        FormatterConfig config = _loadConfig(args, Files.isDirectory(path) ? path : path.toAbsolutePath().getParent());

        try (FormatterEngine engine = _createEngine(config)) {
            engine.setIncludePatterns(_getOptionValues(args, "--include"));

            Instant start = Instant.now();
            Map<Path, FormatterResult> results;
            if (Files.isDirectory(path)) {
                try {
                    results = engine.formatDirectory(path, threads);
                } catch (IOException e) {
                    logger.log(Level.FINE, "Failed to scan " + path, e);
                    _printError("Failed to scan directory: " + path + " (" + e.getMessage() + ")");
                    return EXIT_FAILURE;
                }
            } else {
                results = new TreeMap<>();
                results.put(path, engine.formatPath(path));
            }

            int changedCount = 0;
            int failedCount = 0;
            Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();

            for (Map.Entry<Path, FormatterResult> entry : results.entrySet()) {
                Path file = entry.getKey();
                FormatterResult result = entry.getValue();

                if (!result.isSuccessful()) {
                    failedCount++;
                    errorsByFile.put(file, result.getErrors());
                    _printError("Failed to " + command + ": " + file);
                    result.getErrors().forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                } else if (result.isChanged()) {
                    changedCount++;
                    if (write) {
                        try {
                            Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                            _printSuccess("Formatted: " + file);
                        } catch (IOException e) {
                            failedCount++;
                            logger.log(Level.FINE, "Failed to write " + file, e);
                            _printError("Failed to write: " + file + " (" + e.getMessage() + ")");
                        }
                    } else {
                        _printWarning("File needs formatting: " + file);
                    }
                } else if (verbose) {
                    _printInfo("  Already formatted: " + file);
                }
            }

            Duration duration = Duration.between(start, Instant.now());

            if (ciMode) {
                out.println("RESULT:files=" + results.size() +
                        ";changed=" + changedCount +
                        ";errors=" + failedCount);
            } else {
                out.println();
                out.println((write ? "Formatting" : "Check") + " complete in " + _formatDuration(duration) + ":");
                out.println("  Processed files: " + results.size());
                out.println("  " + (write ? "Reformatted files: " : "Files needing formatting: ") + changedCount);
                out.println("  Files with errors: " + failedCount);
                if (!errorsByFile.isEmpty()) {
                    out.println();
                    out.println(errorFormatter.formatErrorSummary(errorsByFile));
                }
            }

            if (failedCount > 0 || (!write && changedCount > 0)) {
                return EXIT_FAILURE;
            }
            return EXIT_OK;
        }
    }

    private int _initializeConfig(String[] args) throws IOException {
        String configOption = _getOptionValue(args, "--config");
        Path configPath = configOption != null
                ? workingDirectory.resolve(configOption)
                : workingDirectory.resolve(ConfigurationLoader.CONFIG_FILE_NAME);

        if (Files.exists(configPath) && !_hasOption(args, "--force")) {
            _printWarning("Configuration file already exists: " + configPath);
            out.println("Use --force to overwrite it or specify a different path with --config");
            return EXIT_FAILURE;
        }

        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    private FormatterConfig _loadConfig(String[] args, Path searchStart) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(workingDirectory.resolve(configFile));
        }
        Optional<Path> found = ConfigurationLoader.findConfig(searchStart);
        return ConfigurationLoader.loadConfig(found.orElse(null));
    }

    private FormatterEngine _createEngine(FormatterConfig config) {
        FormatterEngine engine = new FormatterEngine(config);
        engine.registerPlugin(FileType.SOLIDITY, new SolidityFormatter());
        return engine;
    }

    private int _threadCount(String[] args) {
        int threads = Runtime.getRuntime().availableProcessors();
        String threadsStr = _getOptionValue(args, "--threads");
        if (threadsStr != null) {
            try {
                int parsed = Integer.parseInt(threadsStr);
                if (parsed >= 1) {
                    return parsed;
                }
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            }
        }
        return threads;
    }

    private static String _firstPositional(String[] args) {
        for (int i = 1; i < args.length; i++) {
            if (!args[i].startsWith("--")) {
                return args[i];
            }
        }
        return null;
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        List<String> values = _getOptionValues(args, option);
        return values.isEmpty() ? null : values.get(0);
    }

    private static List<String> _getOptionValues(String[] args, String option) {
        String prefix = option + "=";
        List<String> values = new ArrayList<>();
        for (String arg : args) {
            if (arg.startsWith(prefix)) {
                values.add(arg.substring(prefix.length()));
            }
        }
        return values;
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        } else {
            long minutes = seconds / 60;
            seconds = seconds % 60;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    private void _printSuccess(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private void _printInfo(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
