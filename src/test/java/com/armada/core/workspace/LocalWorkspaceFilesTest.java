package com.armada.core.workspace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalWorkspaceFilesTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("write creates parent directories and read returns the content")
    void writeAndRead() throws IOException {
        var files = new LocalWorkspaceFiles(root);

        files.write("src/deep/a.ts", "export const a = 1;");

        assertTrue(files.exists("src/deep/a.ts"));
        assertEquals("export const a = 1;", files.read("src/deep/a.ts").orElseThrow());
        assertEquals("export const a = 1;", Files.readString(root.resolve("src/deep/a.ts")));
    }

    @Test
    @DisplayName("missing files read as empty and delete is a no-op")
    void missingFile() {
        var files = new LocalWorkspaceFiles(root);

        assertTrue(files.read("nope.txt").isEmpty());
        assertFalse(files.exists("nope.txt"));
        assertDoesNotThrow(() -> files.delete("nope.txt"));
    }

    @Test
    @DisplayName("directories are not files")
    void directoryIsNotAFile() throws IOException {
        Files.createDirectories(root.resolve("src"));
        var files = new LocalWorkspaceFiles(root);

        assertFalse(files.exists("src"));
        assertTrue(files.read("src").isEmpty());
    }

    @Test
    @DisplayName("paths escaping the root are rejected")
    void escapeRejected() {
        var files = new LocalWorkspaceFiles(root);

        assertThrows(IllegalArgumentException.class, () -> files.read("../outside.txt"));
        assertThrows(IllegalArgumentException.class, () -> files.write("a/../../x", "x"));
    }
}
