package de.levingamer8.greaterlauncher.settings;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A settings value normalized into one of three kinds at read time.
 * {@code yes/no/true/false} are booleans, whole numbers are integers, everything else is a string
 * (surrounding quotes removed). Decimal text like {@code 50.000000} stays a string but can be read
 * through {@link #asDouble()}.
 *
 * @param kind semantic kind
 * @param raw  the value as written in the file, trimmed (quotes kept)
 * @param text the value without surrounding quotes
 */
public record SettingValue(Kind kind, String raw, String text) {

    public enum Kind { BOOLEAN, INTEGER, STRING }

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d{1,18}");

    public static SettingValue parse(String raw) {
        String trimmed = raw == null ? "" : raw.strip();
        String text = unquote(trimmed);
        if (isQuoted(trimmed)) return new SettingValue(Kind.STRING, trimmed, text);

        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("yes") || lower.equals("no") || lower.equals("true") || lower.equals("false")) {
            return new SettingValue(Kind.BOOLEAN, trimmed, text);
        }
        if (INTEGER.matcher(text).matches()) return new SettingValue(Kind.INTEGER, trimmed, text);
        return new SettingValue(Kind.STRING, trimmed, text);
    }

    public boolean asBoolean() {
        switch (text.toLowerCase(Locale.ROOT)) {
            case "yes", "true", "1" -> { return true; }
            case "no", "false", "0" -> { return false; }
            default -> throw new IllegalStateException("Not a boolean value: '" + text + "'");
        }
    }

    /** Lenient flag reading: {@code 1}, {@code "1"}, {@code yes}, {@code true} are true, anything else false. */
    public boolean isTruthy() {
        String t = text.strip().toLowerCase(Locale.ROOT);
        if (t.equals("yes") || t.equals("true")) return true;
        try {
            return Double.parseDouble(t) == 1.0d;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public int asInt() {
        if (kind == Kind.INTEGER) {
            long l = Long.parseLong(text.startsWith("+") ? text.substring(1) : text);
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return (int) l;
            throw new IllegalStateException("Integer out of range: '" + text + "'");
        }
        double d = asDouble();
        if (d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) return (int) d;
        throw new IllegalStateException("Not an integer value: '" + text + "'");
    }

    public double asDouble() {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Not a numeric value: '" + text + "'", e);
        }
    }

    public String asString() { return text; }

    public boolean quoted() { return isQuoted(raw); }

    static boolean isQuoted(String s) {
        return s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"");
    }

    static String unquote(String s) {
        return isQuoted(s) ? s.substring(1, s.length() - 1) : s;
    }

    @Override
    public String toString() { return text; }
}
