package com.powerwatch.backup.etl.source;

import javax.annotation.Nullable;
import java.math.BigDecimal;

public final class CellValues {

    private CellValues() {
    }

    /**
     * Text form of a raw cell for the free-text fields. Missing cells become the empty string;
     * integral numbers lose their trailing {@code .0}.
     */
    public static String asText(@Nullable Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d) {
            if (!d.isInfinite() && !d.isNaN() && d == Math.rint(d)) {
                return BigDecimal.valueOf(d).toBigInteger().toString();
            }
            return d.toString();
        }
        return value.toString();
    }
}
