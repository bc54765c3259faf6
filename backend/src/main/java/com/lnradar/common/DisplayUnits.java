package com.lnradar.common;

/**
 * Milli-unit to whole display-unit conversion (msat to sat). Truncates toward zero; remainders are dropped,
 * never rounded.
 */
public final class DisplayUnits {

    public static final long MILLI_PER_UNIT = 1_000L;

    private DisplayUnits() {
    }

    /**
     * Whole units of the absolute value: -1999 becomes 1.
     */
    public static long magnitudeOf(long milliUnits) {
        return Math.abs(milliUnits / MILLI_PER_UNIT);
    }

    /**
     * Signed whole units, truncated toward zero.
     */
    public static long toWholeUnits(long milliUnits) {
        return milliUnits / MILLI_PER_UNIT;
    }
}
