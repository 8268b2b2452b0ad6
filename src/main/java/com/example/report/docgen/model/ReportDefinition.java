package com.example.report.docgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Complete input for one report: metadata, literal title page, table of contents
 * and bibliography data, plus the ordered body blocks.
 * Any part except the body may be omitted, in which case it is not rendered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportDefinition {
    private ReportMetadata metadata;
    private TitlePageDefinition titlePage;
    private TableOfContentsDefinition tableOfContents;

    @Builder.Default
    private List<Block> body = new ArrayList<>();

    private ReferencesDefinition references;
}
