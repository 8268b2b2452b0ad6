package com.example.report.docgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Literal title-page lines around the {@link ReportMetadata} values
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TitlePageDefinition {

    /**
     * Ministry and institution lines at the top of the page
     */
    @Builder.Default
    private List<String> institutionLines = new ArrayList<>();

    /**
     * e.g. "КУРСОВОЙ ПРОЕКТ"
     */
    private String workType;

    @Builder.Default
    private String topicCaption = "по теме:";

    /**
     * Course, direction and programme lines printed under the topic
     */
    @Builder.Default
    private List<String> courseLines = new ArrayList<>();

    @Builder.Default
    private String studentLabel = "Студент:";

    @Builder.Default
    private String teacherLabel = "Преподаватель:";

    private String city;

    @Builder.Default
    private int blankLinesAfterInstitution = 5;

    @Builder.Default
    private int blankLinesBeforeSignatures = 4;

    @Builder.Default
    private int blankLinesBeforeCity = 8;
}
