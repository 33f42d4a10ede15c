package com.vidnyan.rpax.adapter.out.project;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.rpax.application.port.out.ProjectDescriptorReader;
import com.vidnyan.rpax.domain.model.ProjectDescriptor;
import com.vidnyan.rpax.domain.xaml.ContentHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads {@code project.json} with Jackson and derives the project slug.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonProjectDescriptorReader implements ProjectDescriptorReader {

    public static final String PROJECT_FILE = "project.json";
    static final int SLUG_NAME_LENGTH = 20;
    static final int SLUG_HASH_LENGTH = 10;

    private final ObjectMapper objectMapper;

    @Override
    public ProjectDescriptor read(Path projectRoot) {
        Path file = projectRoot.resolve(PROJECT_FILE);
        if (!Files.isRegularFile(file)) {
            throw new ProjectDescriptorException("No " + PROJECT_FILE + " in " + projectRoot);
        }

        JsonNode tree;
        ProjectDto dto;
        try {
            tree = objectMapper.readTree(file.toFile());
            if (tree == null || !tree.isObject()) {
                throw new ProjectDescriptorException(PROJECT_FILE + " is not a JSON object: " + file);
            }
            dto = objectMapper.treeToValue(tree, ProjectDto.class);
        } catch (IOException e) {
            throw new ProjectDescriptorException("Invalid " + PROJECT_FILE + " at " + file + ": " + e.getMessage(), e);
        }

        String slug = slug(dto.name, canonicalJson(tree));
        ProjectDescriptor descriptor = mapToDescriptor(dto, slug);
        log.info("Loaded project {} ({}), {} entry points", descriptor.name(), slug,
                descriptor.entryPointPaths().size());
        return descriptor;
    }

    /**
     * Kebab-cased name prefix plus a short hash of the canonical project file.
     */
    static String slug(String name, String canonicalJson) {
        String base = name == null ? "" : name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("-{2,}", "-")
                .replaceAll("^-+|-+$", "");
        if (base.length() > SLUG_NAME_LENGTH) {
            base = base.substring(0, SLUG_NAME_LENGTH).replaceAll("-+$", "");
        }
        if (base.isEmpty()) {
            base = "unnamed";
        }
        return base + "-" + ContentHasher.shortHash(canonicalJson, SLUG_HASH_LENGTH);
    }

    /**
     * Compact JSON with object keys sorted at every level.
     */
    String canonicalJson(JsonNode tree) {
        try {
            return objectMapper.writer()
                    .without(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(sorted(tree));
        } catch (JsonProcessingException e) {
            throw new ProjectDescriptorException("Cannot canonicalize " + PROJECT_FILE + ": " + e.getMessage(), e);
        }
    }

    private Object sorted(JsonNode node) {
        if (node.isObject()) {
            Map<String, Object> map = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), sorted(field.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>();
            node.forEach(item -> list.add(sorted(item)));
            return list;
        }
        return node;
    }

    private ProjectDescriptor mapToDescriptor(ProjectDto dto, String slug) {
        Map<String, String> dependencies = new LinkedHashMap<>();
        if (dto.dependencies != null) {
            dto.dependencies.forEach((name, version) -> dependencies.put(name, String.valueOf(version)));
        }
        List<ProjectDescriptor.EntryPoint> entryPoints = new ArrayList<>();
        if (dto.entryPoints != null) {
            for (EntryPointDto entryPoint : dto.entryPoints) {
                entryPoints.add(new ProjectDescriptor.EntryPoint(entryPoint.filePath, entryPoint.uniqueId));
            }
        }
        return new ProjectDescriptor(
                dto.name,
                dto.projectId,
                slug,
                dto.description,
                dto.main,
                dto.expressionLanguage,
                dto.designOptions != null && dto.designOptions.outputType != null
                        ? dto.designOptions.outputType : "process",
                dto.schemaVersion,
                dependencies,
                entryPoints);
    }

    // DTO classes for JSON deserialization
    static class ProjectDto {
        public String name;
        public String projectId;
        public String description;
        public String main;
        public String expressionLanguage;
        public String schemaVersion;
        public String studioVersion;
        public String projectVersion;
        public Map<String, Object> dependencies;
        public List<EntryPointDto> entryPoints;
        public DesignOptionsDto designOptions;
    }

    static class EntryPointDto {
        public String filePath;
        public String uniqueId;
    }

    static class DesignOptionsDto {
        public String outputType;
    }
}
