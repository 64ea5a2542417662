package de.levingamer8.greaterlauncher.settings;

import java.util.Locale;

public enum AutosaveFrequency {
    FIVE_YEAR, YEARLY, HALFYEAR, MONTHLY;

    public static AutosaveFrequency fromString(String s) {
        if (s == null) return YEARLY;
        return switch (s.trim().toUpperCase(Locale.ROOT)) {
            case "FIVE_YEAR" -> FIVE_YEAR;
            case "HALFYEAR" -> HALFYEAR;
            case "MONTHLY" -> MONTHLY;
            default -> YEARLY;
        };
    }
}
