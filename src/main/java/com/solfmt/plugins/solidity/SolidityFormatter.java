package com.solfmt.plugins.solidity;

import com.solfmt.api.FormatterPlugin;
import com.solfmt.api.FormatterResult;
import com.solfmt.api.error.FormatterError;
import com.solfmt.api.error.Severity;
import com.solfmt.config.FormatterConfig;
import com.solfmt.plugins.solidity.ast.SourceText;
import com.solfmt.plugins.solidity.ast.SourceUnit;
import com.solfmt.plugins.solidity.format.SolidityStyle;
import com.solfmt.plugins.solidity.format.SourceFormatter;
import com.solfmt.plugins.solidity.parser.ParseException;
import com.solfmt.plugins.solidity.parser.SolidityParser;
import com.solfmt.util.LoggerUtil;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Solidity formatter plugin. Parsed trees are cached by path and content so that a {@code check}
 * followed by a {@code format} of the same file parses it once.
 */
public class SolidityFormatter implements FormatterPlugin, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(SolidityFormatter.class);
    private static final int CACHE_SIZE = 100;

    private volatile SolidityStyle style = SolidityStyle.DEFAULT;

    private final Map<String, ParsedSource> astCache = new LinkedHashMap<String, ParsedSource>(CACHE_SIZE, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, ParsedSource> eldest) {
            return size() > CACHE_SIZE;
        }
    };

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = cacheLock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = cacheLock.writeLock();

    @Override
    public void initialize(FormatterConfig config) {
        this.style = SolidityStyle.fromConfig(config);
        logger.fine("Solidity formatter initialized: " + style);
    }

    public SolidityStyle getStyle() {
        return style;
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        String normalized = _normalizeLineEndings(sourceCode);
        String cacheKey = filePath + ":" + normalized.hashCode();

        ParsedSource parsed;
        // The access-ordered map is mutated by get(), so lookups need the write lock too.
        writeLock.lock();
        try {
            parsed = astCache.get(cacheKey);
        } finally {
            writeLock.unlock();
        }

        // Hash collisions must not hand back another file's tree.
        if (parsed == null || !parsed.content.equals(normalized)) {
            SourceText source = SourceText.of(normalized);
            try {
                parsed = new ParsedSource(normalized, source, SolidityParser.parse(source));
            } catch (ParseException e) {
                logger.fine("Failed to parse " + filePath + ": " + e.getMessage());
                return handleParseError(e);
            }

            writeLock.lock();
            try {
                astCache.put(cacheKey, parsed);
            } finally {
                writeLock.unlock();
            }
        }

        return _format(parsed.unit, parsed.source, sourceCode.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Formats raw bytes. Unlike {@link #format(Path, String)}, invalid UTF-8 is tolerated by the
     * parser and only reported when an affected range has to be copied to the output.
     */
    public FormatterResult format(byte[] sourceBytes) {
        SourceText source = SourceText.of(_normalizeLineEndings(sourceBytes));
        SourceUnit unit;
        try {
            unit = SolidityParser.parse(source);
        } catch (ParseException e) {
            return handleParseError(e);
        }
        return _format(unit, source, sourceBytes);
    }

    /**
     * @param original the input exactly as it was read, before line ending normalization
     */
    private FormatterResult _format(SourceUnit unit, SourceText source, byte[] original) {
        String formatted;
        try {
            formatted = SourceFormatter.format(unit, source, style);
        } catch (CharacterCodingException e) {
            return FormatterResult.failure(new FormatterError(
                    Severity.FATAL,
                    "Source contains invalid UTF-8 in a range that must be copied verbatim",
                    1, 1,
                    "Re-save the file with UTF-8 encoding"));
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to write formatted output", e);
            return FormatterResult.failure(new FormatterError(
                    Severity.FATAL, "Failed to write formatted output: " + e.getMessage(), 1, 1));
        }

        boolean changed = !Arrays.equals(formatted.getBytes(StandardCharsets.UTF_8), original);

        return FormatterResult.builder()
                .successful(true)
                .formattedCode(formatted)
                .changed(changed)
                .build();
    }

    private FormatterResult handleParseError(ParseException e) {
        return FormatterResult.failure(new FormatterError(
                Severity.FATAL,
                "Failed to parse Solidity source: " + e.getReason(),
                e.getLine(), e.getColumn()));
    }

    static String _normalizeLineEndings(String sourceCode) {
        return sourceCode.indexOf('\r') < 0 ? sourceCode : sourceCode.replace("\r\n", "\n");
    }

    /**
     * Drops the CR of every CRLF pair. A multi-byte UTF-8 sequence never contains CR or LF bytes,
     * so this is safe on undecoded input.
     */
    static byte[] _normalizeLineEndings(byte[] bytes) {
        byte[] out = new byte[bytes.length];
        int length = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\r' && i + 1 < bytes.length && bytes[i + 1] == '\n') {
                continue;
            }
            out[length++] = bytes[i];
        }
        if (length == bytes.length) {
            return bytes;
        }
        byte[] trimmed = new byte[length];
        System.arraycopy(out, 0, trimmed, 0, length);
        return trimmed;
    }

    int getCacheSize() {
        readLock.lock();
        try {
            return astCache.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Drops all cached trees.
     */
    @Override
    public void close() {
        writeLock.lock();
        try {
            astCache.clear();
        } finally {
            writeLock.unlock();
        }
    }

    private static final class ParsedSource {
        final String content;
        final SourceText source;
        final SourceUnit unit;

        ParsedSource(String content, SourceText source, SourceUnit unit) {
            this.content = content;
            this.source = source;
            this.unit = unit;
        }
    }
}
