package com.example.report.docgen.renderer;

import java.math.BigInteger;

/**
 * Length conversions into WordprocessingML units (twentieths of a point)
 */
public final class DocxUnits {

    public static final double TWIPS_PER_INCH = 1440.0;
    public static final double CM_PER_INCH = 2.54;
    public static final int TWIPS_PER_POINT = 20;

    private DocxUnits() {
    }

    public static int cmToTwips(double cm) {
        return (int) Math.round(cm * TWIPS_PER_INCH / CM_PER_INCH);
    }

    public static BigInteger cmToTwipsBig(double cm) {
        return BigInteger.valueOf(cmToTwips(cm));
    }

    public static int ptToTwips(double pt) {
        return (int) Math.round(pt * TWIPS_PER_POINT);
    }
}
