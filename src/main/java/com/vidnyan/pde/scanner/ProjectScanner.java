package com.vidnyan.pde.scanner;

import com.vidnyan.pde.config.DetectionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Scans a project directory for source files the detector can parse.
 * Results are sorted so scans of the same directory are reproducible.
 */
@Slf4j
@Component
public class ProjectScanner {

    private final List<String> fileSuffixes;
    private final List<String> excludePatterns;
    private final boolean includeTests;

    @Autowired
    public ProjectScanner(DetectionProperties properties) {
        this(properties.getFileSuffixes(), properties.getExcludePatterns(), properties.isIncludeTests());
    }

    public ProjectScanner(List<String> fileSuffixes, List<String> excludePatterns, boolean includeTests) {
        this.fileSuffixes = List.copyOf(fileSuffixes);
        this.excludePatterns = List.copyOf(excludePatterns);
        this.includeTests = includeTests;
    }

    /**
     * Scan and return all matching source files below the root.
     * A single file is returned as is when it matches.
     */
    public List<Path> scanSourceFiles(Path root) {
        if (Files.isRegularFile(root)) {
            return accepts(root) ? List.of(root) : List.of();
        }
        if (!Files.isDirectory(root)) {
            log.warn("Project path does not exist: {}", root);
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(this::accepts)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Failed to walk directory: {}", root, e);
            return List.of();
        }
    }

    boolean accepts(Path path) {
        String pathStr = path.toString();
        return hasSupportedSuffix(pathStr)
                && (includeTests || !isTestFile(pathStr))
                && excludePatterns.stream().noneMatch(pathStr::contains);
    }

    private boolean hasSupportedSuffix(String pathStr) {
        return fileSuffixes.stream().anyMatch(pathStr::endsWith);
    }

    private boolean isTestFile(String pathStr) {
        return pathStr.contains("/test/") || pathStr.contains("\\test\\")
                || pathStr.endsWith("Test.java") || pathStr.endsWith("Tests.java");
    }
}
