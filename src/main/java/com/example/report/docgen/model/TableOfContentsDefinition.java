package com.example.report.docgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableOfContentsDefinition {

    @Builder.Default
    private String title = "СОДЕРЖАНИЕ";

    @Builder.Default
    private List<TocItem> entries = new ArrayList<>();
}
