package com.example.report.docgen.config;

import com.example.report.docgen.model.PageNumbering;
import com.example.report.docgen.model.SectionGeometry;
import com.example.report.docgen.style.StyleConfiguration;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Application configuration for report generation.
 *
 * Every group defaults to GOST 7.32, so an empty configuration produces a
 * conforming document. Example application.yml:
 *
 * docgen:
 *   style:
 *     font-family: "Times New Roman"
 *     font-size-pt: 14
 *     line-spacing-multiple: 1.5
 *   geometry:
 *     left-margin-cm: 3.0
 *     right-margin-cm: 1.5
 *   page-numbering:
 *     enabled: true
 *     numbering:
 *       region: FOOTER
 *       alignment: CENTER
 *       suppress-on-first-page: true
 *   definitions:
 *     base-path: reports/
 *   export:
 *     enabled: false
 *     definition: course-project
 *     output-path: target/course-project.docx
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "docgen")
public class DocgenProperties {

    private StyleConfiguration style = StyleConfiguration.gost();

    private SectionGeometry geometry = SectionGeometry.gost();

    private PageNumberingProperties pageNumbering = new PageNumberingProperties();

    private Definitions definitions = new Definitions();

    private Export export = new Export();

    /**
     * Page numbering plus an on/off switch; the numbering itself stays GOST by default
     */
    @Data
    @NoArgsConstructor
    public static class PageNumberingProperties {
        private boolean enabled = true;
        private PageNumbering numbering = PageNumbering.gost();

        public PageNumbering resolve() {
            return enabled ? numbering : null;
        }
    }

    @Data
    @NoArgsConstructor
    public static class Definitions {
        /**
         * Classpath folder searched for bare definition names
         */
        private String basePath = "reports/";
    }

    @Data
    @NoArgsConstructor
    public static class Export {
        /**
         * Write a report to disk once the application is ready
         */
        private boolean enabled = false;
        private String definition = "course-project";
        private String outputPath = "Пояснительная_записка.docx";
    }
}
