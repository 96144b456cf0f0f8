package com.solfmt.plugins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import com.solfmt.util.LoggerUtil;

/**
 * Supported file types. Detection goes by extension first; files without an extension are sniffed
 * for a {@code pragma solidity} directive.
 */
public enum FileType {
    SOLIDITY("sol"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private final String extension;

    // Cache for file type detection
    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int SNIFF_BYTES = 4096;

    private static final Pattern SOLIDITY_PATTERN = Pattern.compile(
            "(?m)^\\s*pragma\\s+solidity\\b");

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Detects the file type of {@code filePath}. Results are cached per path.
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType detectedType = detectByExtension(filePath);
        if (detectedType == UNKNOWN && !_hasExtension(filePath)) {
            detectedType = detectByContent(filePath);
        }
        typeCache.put(filePath, detectedType);
        return detectedType;
    }

    private static boolean _hasExtension(Path filePath) {
        Path fileName = filePath.getFileName();
        return fileName != null && fileName.toString().lastIndexOf('.') > 0;
    }

    private static FileType detectByExtension(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return UNKNOWN;
        }
        String name = fileName.toString().toLowerCase();
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return UNKNOWN;
        }

        return switch (name.substring(dot + 1)) {
            case "sol" -> SOLIDITY;
            default -> UNKNOWN;
        };
    }

    /**
     * Reads at most the first few kilobytes of the file looking for a Solidity version pragma.
     */
    private static FileType detectByContent(Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }
        try (InputStream in = Files.newInputStream(filePath)) {
            byte[] head = in.readNBytes(SNIFF_BYTES);
            String content = new String(head, StandardCharsets.UTF_8);
            return SOLIDITY_PATTERN.matcher(content).find() ? SOLIDITY : UNKNOWN;
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    /**
     * Clear the file type detection cache.
     */
    public static void clearCache() {
        typeCache.clear();
        logger.fine("File type detection cache cleared");
    }

    public static int getCacheSize() {
        return typeCache.size();
    }

    /**
     * Get a human-readable description of the file type.
     */
    public String getDescription() {
        return switch (this) {
            case SOLIDITY -> "Solidity source file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
