package com.vidnyan.rpax.adapter.out.project;

import com.vidnyan.rpax.application.port.out.ProjectDescriptorReader.ProjectDescriptorException;
import com.vidnyan.rpax.config.RpaxConfiguration;
import com.vidnyan.rpax.domain.model.ProjectDescriptor;
import com.vidnyan.rpax.domain.xaml.ContentHasher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonProjectDescriptorReaderTest {

    private static final String PROJECT = """
            {
              "name": "Invoice Processing (Finance)",
              "projectId": "0f1e2d3c",
              "description": "Reads invoices",
              "main": "Main.xaml",
              "expressionLanguage": "VisualBasic",
              "schemaVersion": "4.0",
              "studioVersion": "23.10.0",
              "dependencies": { "UiPath.System.Activities": "[23.10.2]", "UiPath.Excel.Activities": "2.22.3" },
              "entryPoints": [
                { "filePath": "Main.xaml", "uniqueId": "a1" },
                { "filePath": "Tests\\\\Smoke.xaml", "uniqueId": "b2" }
              ],
              "designOptions": { "outputType": "Process" },
              "unknownSection": { "ignored": true }
            }
            """;

    @TempDir
    Path tempDir;

    private final JsonProjectDescriptorReader reader =
            new JsonProjectDescriptorReader(new RpaxConfiguration().objectMapper());

    @Test
    void read_ShouldMapProjectFile() throws IOException {
        // Arrange
        Files.writeString(tempDir.resolve("project.json"), PROJECT);

        // Act
        ProjectDescriptor project = reader.read(tempDir);

        // Assert
        assertEquals("Invoice Processing (Finance)", project.name());
        assertEquals("0f1e2d3c", project.effectiveProjectId());
        assertEquals("Main.xaml", project.main());
        assertEquals("Process", project.outputType());
        assertFalse(project.isLibrary());
        assertEquals("[23.10.2]", project.dependencies().get("UiPath.System.Activities"));
        assertEquals(List.of("Main.xaml", "Tests/Smoke.xaml"), project.entryPointPaths());
        assertTrue(project.slug().startsWith("invoice-processing-f-"), project.slug());
    }

    @Test
    void read_ShouldDeriveSlugFromContentNotFormatting() throws IOException {
        // Arrange
        Path other = Files.createDirectories(tempDir.resolve("copy"));
        Files.writeString(tempDir.resolve("project.json"), PROJECT);
        Files.writeString(other.resolve("project.json"), PROJECT.replace("\n", "").replace("  ", ""));

        // Act
        String first = reader.read(tempDir).slug();
        String second = reader.read(other).slug();

        // Assert
        assertEquals(first, second);
    }

    @Test
    void slug_ShouldKebabCaseAndTruncateName() {
        assertEquals("my-robot-" + ContentHasher.shortHash("{}", 10),
                JsonProjectDescriptorReader.slug("  My  Robot!! ", "{}"));
        assertTrue(JsonProjectDescriptorReader.slug("***", "{}").startsWith("unnamed-"));
        String longSlug = JsonProjectDescriptorReader.slug("A very long project name indeed", "{}");
        assertEquals("a-very-long-project", longSlug.substring(0, longSlug.lastIndexOf('-')));
    }

    @Test
    void read_ShouldDefaultOutputTypeToProcess() throws IOException {
        Files.writeString(tempDir.resolve("project.json"), "{\"name\":\"Lib\"}");

        ProjectDescriptor project = reader.read(tempDir);

        assertEquals("process", project.outputType());
        assertEquals("project-lib", project.effectiveProjectId());
        assertTrue(project.entryPointPaths().isEmpty());
    }

    @Test
    void read_ShouldRejectMissingFile() {
        ProjectDescriptorException error = assertThrows(ProjectDescriptorException.class, () -> reader.read(tempDir));

        assertTrue(error.getMessage().contains("project.json"));
    }

    @Test
    void read_ShouldRejectInvalidJson() throws IOException {
        Files.writeString(tempDir.resolve("project.json"), "{ \"name\": ");

        assertThrows(ProjectDescriptorException.class, () -> reader.read(tempDir));
    }

    @Test
    void read_ShouldRejectNonObjectJson() throws IOException {
        Files.writeString(tempDir.resolve("project.json"), "[1, 2]");

        assertThrows(ProjectDescriptorException.class, () -> reader.read(tempDir));
    }
}
