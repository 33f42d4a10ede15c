package com.vidnyan.rpax.scanner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void scan_ShouldFindWorkflowsSortedByRelativePath() throws IOException {
        // Arrange
        WorkflowScanner scanner = new WorkflowScanner();
        Files.createDirectories(tempDir.resolve("Flows/Sub"));
        Files.writeString(tempDir.resolve("Main.xaml"), "<Activity/>");
        Files.writeString(tempDir.resolve("Flows/Login.XAML"), "<Activity/>");
        Files.writeString(tempDir.resolve("Flows/Sub/Close.xaml"), "<Activity/>");
        Files.writeString(tempDir.resolve("project.json"), "{}");
        Files.writeString(tempDir.resolve("Flows/notes.txt"), "docs");

        // Act
        WorkflowScanner.ScanResult result = scanner.scan(tempDir, List.of());

        // Assert
        List<String> relative = result.workflows().stream()
                .map(p -> WorkflowScanner.relativePath(tempDir, p))
                .toList();
        assertEquals(List.of("Flows/Login.XAML", "Flows/Sub/Close.xaml", "Main.xaml"), relative);
        assertTrue(result.excludedFiles().isEmpty());
    }

    @Test
    void scan_ShouldApplyExcludeGlobs() throws IOException {
        // Arrange
        WorkflowScanner scanner = new WorkflowScanner();
        Files.createDirectories(tempDir.resolve(".local/cache"));
        Files.createDirectories(tempDir.resolve("TestResults"));
        Files.writeString(tempDir.resolve("Main.xaml"), "<Activity/>");
        Files.writeString(tempDir.resolve(".local/cache/Copy.xaml"), "<Activity/>");
        Files.writeString(tempDir.resolve("TestResults/Run.xaml"), "<Activity/>");

        // Act
        WorkflowScanner.ScanResult result = scanner.scan(tempDir, List.of(".local/**", "TestResults/**"));

        // Assert
        assertEquals(1, result.workflows().size());
        assertTrue(result.workflows().get(0).endsWith("Main.xaml"));
        assertEquals(List.of(".local/cache/Copy.xaml", "TestResults/Run.xaml"), result.excludedFiles());
    }
}
