package com.example.report.docgen.service;

import com.example.report.docgen.config.DocgenProperties;
import com.example.report.docgen.exception.ReportDefinitionLoadingException;
import com.example.report.docgen.model.ReportDefinition;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads report definitions from YAML or JSON.
 *
 * Supported locations:
 * - "classpath:reports/course-project.yml" - explicit classpath resource
 * - "file:/tmp/report.yml" or an absolute/relative path to an existing file
 * - "course-project" - bare name, looked up under the configured base path
 *   with .yml, .yaml and .json extensions in that order
 */
@Slf4j
@Component
public class ReportDefinitionLoader {

    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final String FILE_PREFIX = "file:";
    private static final List<String> EXTENSIONS = List.of(".yml", ".yaml", ".json");

    private final ObjectMapper jsonMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final DocgenProperties properties;

    public ReportDefinitionLoader(DocgenProperties properties) {
        this.properties = properties;
    }

    @Cacheable(value = "reportDefinitions", key = "#location")
    public ReportDefinition load(String location) {
        if (location == null || location.isBlank()) {
            throw new ReportDefinitionLoadingException(ReportDefinitionLoadingException.DEFINITION_NOT_FOUND,
                    "Report definition location is empty");
        }
        log.info("Loading report definition: {}", location);

        if (location.startsWith(CLASSPATH_PREFIX)) {
            return loadClasspath(location.substring(CLASSPATH_PREFIX.length()), location);
        }
        if (location.startsWith(FILE_PREFIX)) {
            return loadFile(Paths.get(location.substring(FILE_PREFIX.length())), location);
        }

        Path path = Paths.get(location);
        if (Files.isRegularFile(path)) {
            return loadFile(path, location);
        }

        String basePath = properties.getDefinitions().getBasePath();
        for (String candidate : candidates(basePath, location)) {
            if (new ClassPathResource(candidate).exists()) {
                return loadClasspath(candidate, location);
            }
        }
        throw new ReportDefinitionLoadingException(ReportDefinitionLoadingException.DEFINITION_NOT_FOUND,
                "Report definition not found: " + location);
    }

    /**
     * Parse a definition from raw content. The format is picked from the name's extension.
     */
    public ReportDefinition parse(InputStream content, String name) {
        ObjectMapper mapper = name.toLowerCase().endsWith(".json") ? jsonMapper : yamlMapper;
        try {
            ReportDefinition definition = mapper.readValue(content, ReportDefinition.class);
            if (definition == null) {
                throw new ReportDefinitionLoadingException(ReportDefinitionLoadingException.INVALID_DEFINITION,
                        "Report definition is empty: " + name);
            }
            if (definition.getBody() == null) {
                definition.setBody(new ArrayList<>());
            }
            log.debug("Parsed report definition {} with {} body blocks", name, definition.getBody().size());
            return definition;
        } catch (IOException e) {
            throw new ReportDefinitionLoadingException(ReportDefinitionLoadingException.INVALID_DEFINITION,
                    "Failed to parse report definition " + name + ": " + e.getMessage(), e);
        }
    }

    private ReportDefinition loadClasspath(String resourcePath, String location) {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            throw new ReportDefinitionLoadingException(ReportDefinitionLoadingException.DEFINITION_NOT_FOUND,
                    "Report definition not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return parse(in, resourcePath);
        } catch (IOException e) {
            throw new ReportDefinitionLoadingException(ReportDefinitionLoadingException.DEFINITION_NOT_FOUND,
                    "Failed to read report definition " + location, e);
        }
    }

    private ReportDefinition loadFile(Path path, String location) {
        if (!Files.isRegularFile(path)) {
            throw new ReportDefinitionLoadingException(ReportDefinitionLoadingException.DEFINITION_NOT_FOUND,
                    "Report definition not found: " + location);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.getFileName().toString());
        } catch (IOException e) {
            throw new ReportDefinitionLoadingException(ReportDefinitionLoadingException.DEFINITION_NOT_FOUND,
                    "Failed to read report definition " + location, e);
        }
    }

    private List<String> candidates(String basePath, String name) {
        String prefix = basePath == null || basePath.isEmpty() || basePath.endsWith("/") ? nullToEmpty(basePath) : basePath + "/";
        boolean hasExtension = EXTENSIONS.stream().anyMatch(name::endsWith);
        if (hasExtension) {
            return List.of(prefix + name);
        }
        return EXTENSIONS.stream().map(ext -> prefix + name + ext).collect(Collectors.toList());
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
