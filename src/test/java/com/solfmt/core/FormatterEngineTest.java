package com.solfmt.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.junit.Assume.assumeFalse;
import static org.junit.Assume.assumeTrue;

import com.solfmt.api.FormatterPlugin;
import com.solfmt.api.FormatterResult;
import com.solfmt.api.error.Severity;
import com.solfmt.config.FormatterConfig;
import com.solfmt.plugins.FileType;
import com.solfmt.plugins.solidity.SolidityFormatter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FormatterEngine}. */
@RunWith(JUnit4.class)
public final class FormatterEngineTest {
    @Rule public final TemporaryFolder tmp = new TemporaryFolder();

    private Path root;
    private FormatterEngine engine;

    @Before
    public void setUp() {
        root = tmp.getRoot().toPath();
        FileType.clearCache();
        engine = newEngine();
    }

    @After
    public void tearDown() throws Exception {
        engine.close();
    }

    private static FormatterEngine newEngine(String... ignoreFiles) {
        Map<String, Object> general = new HashMap<>();
        general.put("ignoreFiles", new ArrayList<>(Arrays.asList(ignoreFiles)));
        FormatterEngine engine = new FormatterEngine(new FormatterConfig(general, new HashMap<>()));
        engine.registerPlugin(FileType.SOLIDITY, new SolidityFormatter());
        return engine;
    }

    private Path write(String relative, String content) throws Exception {
        Path path = root.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return path;
    }

    @Test
    public void formatsSingleFile() {
        FormatterResult result = engine.formatFile(Paths.get("A.sol"), "contract   A {}");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo("contract A {}\n");
        assertThat(engine.getProcessedFileCount()).isEqualTo(1);
        assertThat(engine.getSuccessCount()).isEqualTo(1);
    }

    @Test
    public void unsupportedFileTypeIsAnError() {
        FormatterResult result = engine.formatFile(Paths.get("notes.txt"), "hello");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getErrors().get(0).getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(engine.getProcessedFileCount()).isEqualTo(0);
    }

    @Test
    public void pluginExceptionsBecomeFatalResults() {
        engine.registerPlugin(FileType.SOLIDITY, new FormatterPlugin() {
            @Override
            public void initialize(FormatterConfig config) {
            }

            @Override
            public FormatterResult format(Path filePath, String sourceCode) {
                throw new IllegalStateException("boom");
            }
        });

        FormatterResult result = engine.formatFile(Paths.get("A.sol"), "contract A {}");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getErrors().get(0).getSeverity()).isEqualTo(Severity.FATAL);
        assertThat(result.getErrors().get(0).getMessage()).contains("boom");
        assertThat(engine.getErrorCount()).isEqualTo(1);
    }

    @Test
    public void formatsDirectoryInParallel() throws Exception {
        Path a = write("A.sol", "contract A {}\n");
        Path b = write("nested/B.sol", "contract   B {}");
        Path broken = write("nested/deeper/C.sol", "contract {");
        write("README.md", "# not solidity");

        Map<Path, FormatterResult> results = engine.formatDirectory(root, 3);

        assertThat(results.keySet()).containsExactly(a, b, broken).inOrder();
        assertThat(results.get(a).isChanged()).isFalse();
        assertThat(results.get(b).isChanged()).isTrue();
        assertThat(results.get(broken).isSuccessful()).isFalse();
        assertThat(engine.getProcessedFileCount()).isEqualTo(3);
        assertThat(engine.getSuccessCount()).isEqualTo(2);
        assertThat(engine.getErrorCount()).isEqualTo(1);
    }

    @Test
    public void ignoredAndExcludedFilesAreSkipped() throws Exception {
        engine.close();
        engine = newEngine("lib/**", "*.t.sol");
        Path kept = write("src/Token.sol", "contract T {}\n");
        write("src/Token.t.sol", "contract TTest {}\n");
        write("lib/forge-std/Test.sol", "contract Test {}\n");

        assertThat(engine.collectFiles(root)).containsExactly(kept);

        engine.setIncludePatterns(List.of("test/**"));
        assertThat(engine.collectFiles(root)).isEmpty();
    }

    @Test
    public void fileWithoutExtensionIsDetectedByContent() throws Exception {
        Path script = write("Deploy", "pragma solidity ^0.8.0;\ncontract D {}\n");
        write("Makefile", "all:\n\techo hi\n");

        assertThat(engine.collectFiles(root)).containsExactly(script);
    }

    @Test
    public void unreadableFileIsFatal() throws Exception {
        Path bad = root.resolve("Bad.sol");
        Files.write(bad, new byte[] {'c', (byte) 0xff, ';'});

        FormatterResult result = engine.formatPath(bad);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getErrors().get(0).getSeverity()).isEqualTo(Severity.FATAL);
        assertThat(engine.getErrorCount()).isEqualTo(1);
    }

    @Test
    public void emptyOrMissingDirectory() throws Exception {
        assertThat(engine.formatDirectory(root, 2)).isEmpty();
        IOException e = assertThrows(IOException.class, () -> engine.formatDirectory(root.resolve("missing"), 2));
        assertThat(e).hasMessageThat().contains("Not a directory");
        assertThrows(IllegalArgumentException.class, () -> engine.formatDirectory(root, 0));
    }

    @Test
    public void closeClosesPlugins() throws Exception {
        boolean[] closed = {false};
        class ClosingPlugin extends SolidityFormatter {
            @Override
            public void close() {
                closed[0] = true;
            }
        }
        engine.registerPlugin(FileType.SOLIDITY, new ClosingPlugin());

        engine.close();

        assertThat(closed[0]).isTrue();
        assertThat(engine.hasPluginFor(FileType.SOLIDITY)).isFalse();
    }

    @Test
    public void unreadableSubdirectoryFailsTheWalk() throws Exception {
        Path locked = Files.createDirectories(root.resolve("locked"));
        Files.writeString(locked.resolve("A.sol"), "contract A {}\n", StandardCharsets.UTF_8);
        assumeTrue(locked.toFile().setReadable(false));
        try {
            assumeFalse(Files.isReadable(locked));

            assertThrows(IOException.class, () -> engine.formatDirectory(root, 2));
        } finally {
            locked.toFile().setReadable(true);
        }
    }
}
