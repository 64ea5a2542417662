package de.levingamer8.greaterlauncher.settings;

public class InvalidSettingsKeyException extends IllegalArgumentException {

    private final String key;

    public InvalidSettingsKeyException(String key, String reason) {
        super("Invalid settings key '" + printable(key) + "': " + reason);
        this.key = key;
    }

    public String key() { return key; }

    /** Renders control and non-ASCII characters as {@code \\uXXXX} so they show up in messages. */
    static String printable(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            if (c >= 0x20 && c < 0x7F) sb.append(c);
            else sb.append(String.format("\\u%04X", (int) c));
        }
        return sb.toString();
    }
}
