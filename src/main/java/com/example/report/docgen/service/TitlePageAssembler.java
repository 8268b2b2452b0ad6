package com.example.report.docgen.service;

import com.example.report.docgen.model.ReportMetadata;
import com.example.report.docgen.model.TitlePageDefinition;
import com.example.report.docgen.style.Alignment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Lays out the title page from literal lines and the report metadata.
 * Signature lines are left aligned and pushed right with tabs; everything else
 * is centered.
 */
@Slf4j
@Component
public class TitlePageAssembler {

    static final String STUDENT_TABS = "\t".repeat(9);
    static final String TEACHER_TABS = "\t".repeat(8);

    public void assemble(DocumentComposer composer, ReportMetadata metadata, TitlePageDefinition titlePage) {
        for (String line : titlePage.getInstitutionLines()) {
            centered(composer, line, false);
        }
        blankLines(composer, titlePage.getBlankLinesAfterInstitution());

        if (titlePage.getWorkType() != null) {
            centered(composer, titlePage.getWorkType(), false);
        }
        if (titlePage.getTopicCaption() != null) {
            centered(composer, titlePage.getTopicCaption(), false);
        }
        centered(composer, nullToEmpty(metadata.getTopicTitle()), true);
        composer.appendBlankLine();

        for (String line : titlePage.getCourseLines()) {
            centered(composer, line, false);
        }
        blankLines(composer, titlePage.getBlankLinesBeforeSignatures());

        composer.appendParagraph(titlePage.getStudentLabel() + STUDENT_TABS
                + nullToEmpty(metadata.getStudentName()) + ", " + nullToEmpty(metadata.getGroup()),
                false, false, Alignment.LEFT);
        composer.appendBlankLine();
        composer.appendParagraph(titlePage.getTeacherLabel() + TEACHER_TABS + nullToEmpty(metadata.getTeacherName()),
                false, false, Alignment.LEFT);
        blankLines(composer, titlePage.getBlankLinesBeforeCity());

        String city = titlePage.getCity() != null ? titlePage.getCity() + " " : "";
        centered(composer, city + nullToEmpty(metadata.getYear()), false);
        log.debug("Title page assembled for topic '{}'", metadata.getTopicTitle());
    }

    private void centered(DocumentComposer composer, String text, boolean bold) {
        composer.appendParagraph(text, bold, false, Alignment.CENTER);
    }

    private void blankLines(DocumentComposer composer, int count) {
        for (int i = 0; i < count; i++) {
            composer.appendBlankLine();
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
