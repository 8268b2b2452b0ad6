package com.example.report.docgen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Root of the document tree: the ordered block list plus the section geometry.
 * Append-only; once finalized every mutator fails.
 */
public class ReportDocument {

    private final List<Block> blocks = new ArrayList<>();
    private SectionGeometry geometry = SectionGeometry.gost();
    private PageNumbering pageNumbering;
    private boolean finalized;

    public void append(Block block) {
        Objects.requireNonNull(block, "block");
        checkMutable();
        blocks.add(block);
    }

    public void setGeometry(SectionGeometry geometry) {
        Objects.requireNonNull(geometry, "geometry");
        checkMutable();
        this.geometry = geometry.toBuilder().build();
    }

    public void setPageNumbering(PageNumbering pageNumbering) {
        checkMutable();
        this.pageNumbering = pageNumbering != null ? pageNumbering.toBuilder().build() : null;
    }

    public List<Block> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public SectionGeometry getGeometry() {
        return geometry.toBuilder().build();
    }

    public PageNumbering getPageNumbering() {
        return pageNumbering != null ? pageNumbering.toBuilder().build() : null;
    }

    public int size() {
        return blocks.size();
    }

    public void markFinalized() {
        this.finalized = true;
    }

    public boolean isFinalized() {
        return finalized;
    }

    private void checkMutable() {
        if (finalized) {
            throw new IllegalStateException("Document has already been serialized and is read-only");
        }
    }
}
