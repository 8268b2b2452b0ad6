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
public class ReferencesDefinition {

    @Builder.Default
    private String title = "СПИСОК ИСПОЛЬЗОВАННЫХ ИСТОЧНИКОВ";

    /**
     * Source descriptions; numbering is added when rendered
     */
    @Builder.Default
    private List<String> entries = new ArrayList<>();
}
