package com.demoBank.advisor.response.util;

import java.util.Locale;

/**
 * Display formats for fact values. Thousands are separated by commas, decimals by a dot.
 */
public class ValueFormats {

    private ValueFormats() {}

    /**
     * Money with thousands separators; two decimals unless the rounded value is integral.
     */
    public static String money(double value) {
        double rounded = Math.round(value * 100.0) / 100.0;
        if (Math.abs(rounded - Math.rint(rounded)) < 0.01) {
            return String.format(Locale.US, "%,d", Math.round(rounded));
        }
        return String.format(Locale.US, "%,.2f", rounded);
    }

    /**
     * Money with an explicit sign; zero is shown as "+0".
     */
    public static String signedMoney(double value) {
        return (value < 0 ? "-" : "+") + money(Math.abs(value));
    }

    /**
     * Percentage with two decimals. Ratios in [-1, 1] are scaled by 100, larger values are already percentages.
     */
    public static String percent(double value) {
        if (Math.abs(value) > 1.0) {
            return String.format(Locale.US, "%.2f%%", value);
        }
        return String.format(Locale.US, "%.2f%%", value * 100.0);
    }

    public static String decimal(double value) {
        return String.format(Locale.US, "%.2f", value);
    }
}
