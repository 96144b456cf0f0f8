package com.solfmt.plugins;

import static com.google.common.truth.Truth.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FileType}. */
@RunWith(JUnit4.class)
public final class FileTypeTest {
    @Rule public final TemporaryFolder tmp = new TemporaryFolder();

    @Before
    public void setUp() {
        FileType.clearCache();
    }

    @Test
    public void detectsByExtension() {
        assertThat(FileType.detect(Paths.get("contracts/Token.sol"))).isEqualTo(FileType.SOLIDITY);
        assertThat(FileType.detect(Paths.get("Token.SOL"))).isEqualTo(FileType.SOLIDITY);
        assertThat(FileType.detect(Paths.get("README.md"))).isEqualTo(FileType.UNKNOWN);
        assertThat(FileType.getCacheSize()).isEqualTo(3);
    }

    @Test
    public void sniffsFilesWithoutExtension() throws Exception {
        Path script = tmp.newFile("Deploy").toPath();
        Files.writeString(script, "// deploy\n  pragma solidity >=0.8.0;\n", StandardCharsets.UTF_8);
        Path other = tmp.newFile("Makefile").toPath();
        Files.writeString(other, "# pragma solidity is not here\n", StandardCharsets.UTF_8);

        assertThat(FileType.detect(script)).isEqualTo(FileType.SOLIDITY);
        assertThat(FileType.detect(other)).isEqualTo(FileType.UNKNOWN);
    }

    @Test
    public void extensionWinsOverContent() throws Exception {
        Path text = tmp.newFile("notes.txt").toPath();
        Files.writeString(text, "pragma solidity ^0.8.0;\n", StandardCharsets.UTF_8);

        assertThat(FileType.detect(text)).isEqualTo(FileType.UNKNOWN);
    }

    @Test
    public void missingFileWithoutExtensionIsUnknown() {
        assertThat(FileType.detect(tmp.getRoot().toPath().resolve("absent"))).isEqualTo(FileType.UNKNOWN);
    }
}
