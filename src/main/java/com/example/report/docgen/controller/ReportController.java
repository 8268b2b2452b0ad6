package com.example.report.docgen.controller;

import com.example.report.docgen.exception.DocgenException;
import com.example.report.docgen.exception.MalformedTableShapeException;
import com.example.report.docgen.exception.ReportDefinitionLoadingException;
import com.example.report.docgen.model.ReportDefinition;
import com.example.report.docgen.service.ReportDefinitionLoader;
import com.example.report.docgen.service.ReportGenerationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * REST API for report generation
 */
@Slf4j
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    public static final MediaType DOCX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document");

    private final ReportGenerationService generationService;
    private final ReportDefinitionLoader definitionLoader;

    /**
     * Generate a report from a definition posted as JSON
     *
     * POST /api/reports/generate
     * {
     *   "metadata": { "studentName": "...", "group": "...", "year": "2025" },
     *   "tableOfContents": { "entries": [ { "title": "ВВЕДЕНИЕ", "page": "3" } ] },
     *   "body": [
     *     { "type": "heading", "level": 1, "text": "Введение" },
     *     { "type": "paragraph", "text": "..." }
     *   ]
     * }
     *
     * @return the .docx package
     */
    @PostMapping("/generate")
    public ResponseEntity<byte[]> generate(@RequestBody ReportDefinition definition) {
        log.info("Received report generation request with {} body blocks",
                definition.getBody() != null ? definition.getBody().size() : 0);
        return docx(generationService.generate(definition), "report.docx");
    }

    /**
     * Generate a report from a bundled definition, e.g. GET /api/reports/generate/course-project
     */
    @GetMapping("/generate/{name}")
    public ResponseEntity<byte[]> generateBundled(@PathVariable String name) {
        log.info("Received report generation request for bundled definition: {}", name);
        ReportDefinition definition = definitionLoader.load(name);
        return docx(generationService.generate(definition), name + ".docx");
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Report generation service is running");
    }

    @ExceptionHandler(DocgenException.class)
    public ResponseEntity<Map<String, String>> handleDocgenException(DocgenException e) {
        Map<String, String> body = new HashMap<>();
        body.put("code", e.getCode());
        body.put("description", e.getDescription());

        if (ReportDefinitionLoadingException.DEFINITION_NOT_FOUND.equals(e.getCode())) {
            return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
        } else if (ReportDefinitionLoadingException.INVALID_DEFINITION.equals(e.getCode())
                || MalformedTableShapeException.MALFORMED_TABLE_SHAPE.equals(e.getCode())) {
            return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
        }
        log.error("Report generation error", e);
        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<byte[]> docx(byte[] bytes, String filename) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(DOCX);
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(filename, StandardCharsets.UTF_8)
                .build());
        headers.setContentLength(bytes.length);
        return new ResponseEntity<>(bytes, headers, HttpStatus.OK);
    }
}
