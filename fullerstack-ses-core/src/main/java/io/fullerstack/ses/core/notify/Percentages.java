package io.fullerstack.ses.core.notify;

import java.util.Locale;

/**
 * Display formatting of 0-100 scale percentages.
 */
public final class Percentages {

    private Percentages() {
    }

    /** {@code 150.0 -> "150%"} */
    public static String whole(double percent) {
        return String.format(Locale.ROOT, "%.0f%%", percent);
    }

    /** {@code 3.0 -> "3.00%"} */
    public static String twoDecimals(double percent) {
        return String.format(Locale.ROOT, "%.2f%%", percent);
    }
}
