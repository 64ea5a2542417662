package de.levingamer8.greaterlauncher.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Immutable view of a flat {@code key=value} settings file.
 * <p>
 * The document keeps every raw line together with its line terminator. Recognized keys are indexed
 * lazily on first lookup. {@link #patch(SettingsKey, String)} only rewrites the value part of the one
 * matching line, so comments, unknown keys, indentation, brace blocks and line endings survive a
 * read-modify-write cycle unchanged.
 */
public final class SettingsDocument {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsDocument.class);

    private final List<String> lines;
    private volatile Index index;

    private SettingsDocument(List<String> lines) {
        this.lines = List.copyOf(lines);
    }

    public static SettingsDocument empty() {
        return new SettingsDocument(List.of());
    }

    /** Splits {@code content} into lines, keeping {@code \n}, {@code \r\n} or {@code \r} on each line. */
    public static SettingsDocument parse(String content) {
        List<String> out = new ArrayList<>();
        int start = 0;
        int n = content.length();
        for (int i = 0; i < n; i++) {
            char c = content.charAt(i);
            if (c == '\n') {
                out.add(content.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                if (i + 1 < n && content.charAt(i + 1) == '\n') i++;
                out.add(content.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < n) out.add(content.substring(start));
        return new SettingsDocument(out);
    }

    public String content() {
        return String.join("", lines);
    }

    public List<String> lines() {
        return lines.stream().map(SettingsDocument::body).toList();
    }

    public int lineCount() { return lines.size(); }

    public boolean contains(SettingsKey key) {
        return lookup(key) != null;
    }

    public Optional<SettingValue> find(SettingsKey key) {
        Entry e = lookup(key);
        return e == null ? Optional.empty() : Optional.of(SettingValue.parse(e.keyLine.value()));
    }

    public SettingValue get(SettingsKey key) {
        return find(key).orElseThrow(() -> new SettingNotFoundException(key));
    }

    /** Recognized keys (namespaced form) mapped to their first value, in file order. */
    public Map<String, SettingValue> asMap() {
        Map<String, SettingValue> out = new LinkedHashMap<>();
        for (Entry e : index().entries) {
            out.putIfAbsent(e.qualifiedName(), SettingValue.parse(e.keyLine.value()));
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Returns a copy where the value of the first line matching {@code key} is replaced by {@code value}.
     * A missing plain key is appended at the end; a missing namespaced key is inserted before the
     * closing brace of its section.
     *
     * @throws SettingNotFoundException when a namespaced key's section does not exist
     * @throws IllegalArgumentException  for multi-line values and values with a {@code "} inside
     */
    public SettingsDocument patch(SettingsKey key, String value) {
        Objects.requireNonNull(key, "key");
        if (value == null || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Value for '" + key + "' must be a single line");
        }
        String inner = SettingValue.isQuoted(value) ? value.substring(1, value.length() - 1) : value;
        if (inner.indexOf('"') >= 0) {
            throw new IllegalArgumentException("Value for '" + key + "' must not contain '\"'");
        }

        List<String> out = new ArrayList<>(lines);
        Entry e = lookup(key);
        if (e != null) {
            String line = lines.get(e.line);
            String body = body(line);
            KeyLine kl = e.keyLine;
            String rendered = render(value, SettingValue.isQuoted(kl.value()));
            out.set(e.line, body.substring(0, kl.valueStart()) + rendered + body.substring(kl.valueEnd()) + terminator(line));
            return new SettingsDocument(out);
        }

        String rendered = render(value, false);
        String eol = defaultTerminator();

        if (!key.isNamespaced()) {
            if (!out.isEmpty()) {
                int last = out.size() - 1;
                if (terminator(out.get(last)).isEmpty()) out.set(last, out.get(last) + eol);
            }
            out.add(key.leaf() + "=" + rendered + eol);
            return new SettingsDocument(out);
        }

        String section = String.join(".", key.sections());
        Integer close = index().sectionClose.get(section);
        if (close == null) {
            throw new SettingNotFoundException(key, "Section '" + section + "' not found for key " + key.name());
        }
        String indent = indentForSection(key.sections(), close);
        String closingLine = lines.get(close);
        String lineEol = terminator(closingLine).isEmpty() ? eol : terminator(closingLine);
        out.add(close, indent + key.leaf() + "=" + rendered + lineEol);
        return new SettingsDocument(out);
    }

    // '#' would start a comment and braces would open a block unless quoted
    private static String render(String value, boolean keepQuotes) {
        if (SettingValue.isQuoted(value)) return value;
        boolean quote = keepQuotes || value.indexOf('#') >= 0 || value.indexOf('{') >= 0 || value.indexOf('}') >= 0;
        return quote ? "\"" + value + "\"" : value;
    }

    private String indentForSection(List<String> sections, int closeLine) {
        Entry lastInSection = null;
        for (Entry e : index().entries) {
            if (e.line < closeLine && e.path.equals(sections)) lastInSection = e;
        }
        if (lastInSection != null) return leadingWhitespace(body(lines.get(lastInSection.line)));
        return leadingWhitespace(body(lines.get(closeLine))) + "\t";
    }

    private String defaultTerminator() {
        for (String l : lines) {
            String t = terminator(l);
            if (!t.isEmpty()) return t;
        }
        return "\n";
    }

    private Entry lookup(SettingsKey key) {
        for (Entry e : index().entries) {
            if (!e.key.equals(key.leaf())) continue;
            if (!key.isNamespaced() || e.path.equals(key.sections())) return e;
        }
        return null;
    }

    private Index index() {
        Index i = index;
        if (i == null) {
            i = buildIndex();
            index = i;
        }
        return i;
    }

    private Index buildIndex() {
        List<Entry> entries = new ArrayList<>();
        Map<String, Integer> sectionClose = new HashMap<>();
        List<String> stack = new ArrayList<>();
        String pending = null;

        for (int idx = 0; idx < lines.size(); idx++) {
            String body = body(lines.get(idx));
            KeyLine kl = KeyLine.parse(body);
            if (kl != null) {
                entries.add(new Entry(idx, List.copyOf(stack), kl.key(), kl));
                if (kl.value().isEmpty()) {
                    pending = kl.key();
                    continue;
                }
                pending = null;
                applyBraces(kl.value(), kl.key(), idx, stack, sectionClose);
            } else {
                String code = stripComment(body).strip();
                if (code.isEmpty()) continue;
                applyBraces(code, pending, idx, stack, sectionClose);
                pending = null;
            }
        }
        if (!stack.isEmpty()) {
            LOG.warn("Settings: {} unclosed section(s) at end of file: {}", stack.size(), stack);
        }
        return new Index(List.copyOf(entries), Map.copyOf(sectionClose));
    }

    private static void applyBraces(String text, String openName, int line, List<String> stack, Map<String, Integer> sectionClose) {
        boolean inQuotes = false;
        String name = openName;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') inQuotes = !inQuotes;
            if (inQuotes) continue;
            if (c == '{') {
                stack.add(name != null ? name : "");
                name = null;
            } else if (c == '}') {
                if (stack.isEmpty()) {
                    LOG.warn("Settings: unmatched '}' on line {}, keeping it as plain text", line + 1);
                    continue;
                }
                sectionClose.putIfAbsent(String.join(".", stack), line);
                stack.remove(stack.size() - 1);
            }
        }
    }

    static String stripComment(String s) {
        boolean inQuotes = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') inQuotes = !inQuotes;
            else if (c == '#' && !inQuotes) return s.substring(0, i);
        }
        return s;
    }

    static String body(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) end--;
        return line.substring(0, end);
    }

    static String terminator(String line) {
        return line.substring(body(line).length());
    }

    private static String leadingWhitespace(String s) {
        int i = 0;
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) i++;
        return s.substring(0, i);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SettingsDocument d && d.lines.equals(lines);
    }

    @Override
    public int hashCode() { return lines.hashCode(); }

    private record Index(List<Entry> entries, Map<String, Integer> sectionClose) {}

    private record Entry(int line, List<String> path, String key, KeyLine keyLine) {
        String qualifiedName() {
            if (path.isEmpty()) return key;
            return String.join(".", path) + "." + key;
        }
    }

    /**
     * A line of the form {@code <indent>key<ws>=<ws>value<trailing>}.
     * {@code valueStart}/{@code valueEnd} index into the line body; everything outside that range
     * (indent, spacing, trailing comment) is kept when the value is replaced.
     */
    record KeyLine(String key, int valueStart, int valueEnd, String value) {

        static KeyLine parse(String body) {
            int i = 0;
            while (i < body.length() && (body.charAt(i) == ' ' || body.charAt(i) == '\t')) i++;
            int eq = body.indexOf('=', i);
            if (eq < 0) return null;
            String key = body.substring(i, eq).stripTrailing();
            if (!SettingsKey.isIdentifier(key)) return null;

            int vs = eq + 1;
            while (vs < body.length() && (body.charAt(vs) == ' ' || body.charAt(vs) == '\t')) vs++;
            String rest = stripComment(body.substring(vs));
            int ve = vs + rest.stripTrailing().length();
            return new KeyLine(key, vs, ve, body.substring(vs, ve));
        }
    }
}
