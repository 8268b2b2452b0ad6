package com.example.report.docgen.style;

import lombok.Builder;
import lombok.Value;

/**
 * Per-block modifiers that, together with {@link BlockKind}, select a style.
 * Flags a kind does not use are ignored by the engine.
 */
@Value
@Builder
public class StyleFlags {

    public static final StyleFlags NONE = StyleFlags.builder().build();

    boolean bold;

    @Builder.Default
    boolean indented = true;

    /**
     * Alignment override, only honoured for plain paragraphs. Null keeps the kind default.
     */
    Alignment alignment;

    /**
     * List ordinal or reference number. Null means an unnumbered item.
     */
    Integer ordinal;

    public static StyleFlags paragraph(boolean bold, boolean indented) {
        return StyleFlags.builder().bold(bold).indented(indented).build();
    }

    public static StyleFlags numbered(Integer ordinal) {
        return StyleFlags.builder().ordinal(ordinal).build();
    }
}
