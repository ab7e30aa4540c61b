package com.vidnyan.pde.scanner;

import com.vidnyan.pde.config.DetectionProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectScannerTest {

    @TempDir
    Path tempDir;

    private Path createFile(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "class X {}");
        return file;
    }

    @Test
    void scanSourceFiles_ShouldFindSupportedFilesInOrder() throws IOException {
        // Arrange
        DetectionProperties properties = new DetectionProperties();
        properties.setExcludePatterns(List.of("/target/"));
        ProjectScanner scanner = new ProjectScanner(properties);

        createFile("src/main/java/com/example/Zebra.java");
        createFile("src/main/java/com/example/Alpha.java");
        createFile("trees/Config.ast.json");
        createFile("src/main/java/com/example/readme.txt");
        createFile("src/test/java/com/example/AlphaTest.java");
        createFile("target/generated/Generated.java");

        // Act
        List<Path> results = scanner.scanSourceFiles(tempDir);

        // Assert
        assertEquals(3, results.size());
        assertTrue(results.get(0).endsWith("src/main/java/com/example/Alpha.java"));
        assertTrue(results.get(1).endsWith("src/main/java/com/example/Zebra.java"));
        assertTrue(results.get(2).endsWith("trees/Config.ast.json"));
    }

    @Test
    void scanSourceFiles_IncludeTests_ShouldPickUpTestSources() throws IOException {
        ProjectScanner scanner = new ProjectScanner(List.of(".java"), List.of(), true);
        createFile("src/main/java/Service.java");
        createFile("src/test/java/ServiceTest.java");

        List<Path> results = scanner.scanSourceFiles(tempDir);

        assertEquals(2, results.size());
    }

    @Test
    void scanSourceFiles_SingleFile_ShouldBeReturnedWhenAccepted() throws IOException {
        ProjectScanner scanner = new ProjectScanner(List.of(".java"), List.of(), false);
        Path file = createFile("Widget.java");
        Path notes = createFile("notes.md");

        assertEquals(List.of(file), scanner.scanSourceFiles(file));
        assertTrue(scanner.scanSourceFiles(notes).isEmpty());
    }

    @Test
    void scanSourceFiles_MissingRoot_ShouldReturnEmpty() {
        ProjectScanner scanner = new ProjectScanner(List.of(".java"), List.of(), false);

        assertTrue(scanner.scanSourceFiles(tempDir.resolve("missing")).isEmpty());
    }
}
