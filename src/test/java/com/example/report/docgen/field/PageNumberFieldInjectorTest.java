package com.example.report.docgen.field;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.XmlCursor;
import org.junit.jupiter.api.Test;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STFldCharType;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PageNumberFieldInjectorTest {

    private final PageNumberFieldInjector injector = new PageNumberFieldInjector();

    @Test
    public void testTripletIsWrittenContiguouslyIntoOneRun() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFRun run = document.createParagraph().createRun();
            run.setFontFamily("Times New Roman");

            injector.injectPageNumberField(run);

            CTR ctr = run.getCTR();
            assertEquals(List.of("rPr", "fldChar", "instrText", "fldChar"), childNames(ctr));
            assertEquals(STFldCharType.BEGIN, ctr.getFldCharArray(0).getFldCharType());
            assertEquals("PAGE", ctr.getInstrTextArray(0).getStringValue());
            assertEquals(STFldCharType.END, ctr.getFldCharArray(1).getFldCharType());
        }
    }

    @Test
    public void testInjectingTwiceAppendsTwoCompleteFields() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFRun first = document.createParagraph().createRun();
            XWPFRun second = document.createParagraph().createRun();

            injector.injectPageNumberField(first);
            injector.injectPageNumberField(second);

            assertEquals(List.of("fldChar", "instrText", "fldChar"), childNames(first.getCTR()));
            assertEquals(List.of("fldChar", "instrText", "fldChar"), childNames(second.getCTR()));
        }
    }

    @Test
    public void testOutOfOrderNodesAreRejected() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFRun run = document.createParagraph().createRun();
            FieldNodes reversed = new FieldNodes(new FieldEnd(), new FieldInstruction("PAGE"), new FieldBegin());

            assertThrows(IllegalArgumentException.class, () -> injector.inject(run, reversed));
            assertEquals(0, run.getCTR().sizeOfFldCharArray());
        }
    }

    private List<String> childNames(CTR ctr) {
        List<String> names = new ArrayList<>();
        XmlCursor cursor = ctr.newCursor();
        try {
            if (cursor.toFirstChild()) {
                do {
                    names.add(cursor.getName().getLocalPart());
                } while (cursor.toNextSibling());
            }
        } finally {
            cursor.dispose();
        }
        return names;
    }
}
