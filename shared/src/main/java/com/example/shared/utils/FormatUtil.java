package com.example.shared.utils;

import java.util.Locale;

public final class FormatUtil {

    private FormatUtil() {
    }

    /**
     * Значение с отметкой: ✅ если не больше порога (p-value), ⚠️ иначе
     */
    public static String color(Double value, double threshold) {
        if (value == null || value.isNaN()) return "N/A";
        return value < threshold ? String.format(Locale.US, "%.5f ✅", value) : String.format(Locale.US, "%.5f ⚠️", value);
    }

    public static String number(double value) {
        if (Double.isNaN(value)) return "N/A";
        return String.format(Locale.US, "%.2f", value);
    }

    public static String percent(double fraction) {
        if (Double.isNaN(fraction)) return "N/A";
        return String.format(Locale.US, "%.2f%%", fraction * 100.0);
    }

    public static String usd(double value) {
        if (Double.isNaN(value)) return "N/A";
        return String.format(Locale.US, "%.2f USD", value);
    }
}
