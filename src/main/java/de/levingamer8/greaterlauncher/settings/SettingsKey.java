package de.levingamer8.greaterlauncher.settings;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validated settings key. Either a plain identifier ({@code update_time}), which matches the first
 * line with that key anywhere in the file, or a namespaced path ({@code graphics.size.x}), which
 * matches the key inside the named {@code { }} sections.
 */
public final class SettingsKey {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String name;
    private final List<String> segments;

    private SettingsKey(String name, List<String> segments) {
        this.name = name;
        this.segments = segments;
    }

    public static SettingsKey of(String name) {
        if (name == null || name.isEmpty()) throw new InvalidSettingsKeyException(name, "key is empty");
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c < 0x21 || c > 0x7E) {
                throw new InvalidSettingsKeyException(name, "non-printable or non-ASCII character at index " + i);
            }
        }
        List<String> segments = Arrays.asList(name.split("\\.", -1));
        for (String s : segments) {
            if (!SEGMENT.matcher(s).matches()) {
                throw new InvalidSettingsKeyException(name, "'" + s + "' is not an identifier");
            }
        }
        return new SettingsKey(name, List.copyOf(segments));
    }

    static boolean isIdentifier(String s) {
        return SEGMENT.matcher(s).matches();
    }

    public String name() { return name; }

    public String leaf() { return segments.get(segments.size() - 1); }

    public List<String> sections() { return segments.subList(0, segments.size() - 1); }

    public boolean isNamespaced() { return segments.size() > 1; }

    @Override
    public boolean equals(Object o) {
        return o instanceof SettingsKey k && k.name.equals(name);
    }

    @Override
    public int hashCode() { return name.hashCode(); }

    @Override
    public String toString() { return name; }
}
