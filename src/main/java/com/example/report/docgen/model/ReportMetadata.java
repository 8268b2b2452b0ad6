package com.example.report.docgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Personal and topic data printed on the title page
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportMetadata {
    private String studentName;
    private String group;
    private String teacherName;
    private String topicTitle;
    private String year;
}
