package com.example.report.docgen.field;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.impl.xb.xmlschema.SpaceAttribute;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STFldCharType;

import java.util.Objects;

/**
 * Splices field nodes into the markup of a single run.
 *
 * <p>Word only recognises a field when begin, instruction and end sit next to
 * each other in that order, so the node sequence is checked before anything
 * is written to the run.
 */
@Slf4j
public class PageNumberFieldInjector {

    private final PageNumberFieldBuilder fieldBuilder;

    public PageNumberFieldInjector(PageNumberFieldBuilder fieldBuilder) {
        this.fieldBuilder = fieldBuilder;
    }

    public PageNumberFieldInjector() {
        this(new PageNumberFieldBuilder());
    }

    /**
     * Attach a live page-number field to the run
     */
    public void injectPageNumberField(XWPFRun run) {
        inject(run, fieldBuilder.buildPageNumberField());
    }

    public void inject(XWPFRun run, FieldNodes nodes) {
        Objects.requireNonNull(run, "run");
        validate(nodes);

        CTR ctr = run.getCTR();
        for (FieldNode node : nodes) {
            switch (node.getType()) {
                case BEGIN:
                    ctr.addNewFldChar().setFldCharType(STFldCharType.BEGIN);
                    break;
                case INSTRUCTION:
                    CTText instrText = ctr.addNewInstrText();
                    instrText.setSpace(SpaceAttribute.Space.PRESERVE);
                    instrText.setStringValue(((FieldInstruction) node).getInstruction());
                    break;
                case END:
                    ctr.addNewFldChar().setFldCharType(STFldCharType.END);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported field node: " + node);
            }
        }
        log.debug("Injected field {} into run", nodes);
    }

    private void validate(FieldNodes nodes) {
        Objects.requireNonNull(nodes, "nodes");
        if (nodes.size() != 3
                || nodes.get(0).getType() != FieldNode.Type.BEGIN
                || nodes.get(1).getType() != FieldNode.Type.INSTRUCTION
                || nodes.get(2).getType() != FieldNode.Type.END) {
            throw new IllegalArgumentException("Field nodes must be begin, instruction, end: " + nodes);
        }
    }
}
