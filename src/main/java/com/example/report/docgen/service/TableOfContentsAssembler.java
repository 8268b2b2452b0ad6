package com.example.report.docgen.service;

import com.example.report.docgen.model.TableOfContentsDefinition;
import com.example.report.docgen.model.TocItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Appends the table of contents: a chapter heading followed by one row per entry.
 * Page numbers are the literal strings from the definition.
 */
@Slf4j
@Component
public class TableOfContentsAssembler {

    public void assemble(DocumentComposer composer, TableOfContentsDefinition toc) {
        composer.appendHeading(1, toc.getTitle());
        for (TocItem item : toc.getEntries()) {
            composer.appendTocEntry(item.getTitle(), item.getPage());
        }
        log.debug("Table of contents assembled with {} entries", toc.getEntries().size());
    }
}
