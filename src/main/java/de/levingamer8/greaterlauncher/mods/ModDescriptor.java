package de.levingamer8.greaterlauncher.mods;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed {@code .mod} descriptor.
 * <pre>
 * name = "Historical Project Mod"
 * path = "mod/HPM"
 * user_dir = "HPM"
 * dependencies = { "Base Mod" "Other" }
 * </pre>
 */
public record ModDescriptor(
        String name,
        String path,
        String userDir,
        List<String> dependencies,
        String github,
        String version
) {

    private static final Pattern TOKEN = Pattern.compile("\"([^\"]*)\"|([^\\s,\"{}]+)");

    public ModDescriptor {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static ModDescriptor parse(String content) {
        String name = null, path = null, userDir = null, github = null, version = null;
        List<String> deps = List.of();

        String[] lines = content.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String s = stripComment(lines[i]).strip();
            if (s.isEmpty()) continue;
            int eq = s.indexOf('=');
            if (eq < 0) continue;

            String key = s.substring(0, eq).strip();
            StringBuilder value = new StringBuilder(s.substring(eq + 1).strip());

            // Block-Werte können über mehrere Zeilen gehen
            int depth = braceDepth(value);
            while (depth > 0 && i + 1 < lines.length) {
                String next = stripComment(lines[++i]);
                value.append(' ').append(next.strip());
                depth = braceDepth(value);
            }

            String v = value.toString();
            switch (key) {
                case "name" -> name = unquote(v);
                case "path" -> path = unquote(v);
                case "user_dir" -> userDir = unquote(v);
                case "github" -> github = unquote(v);
                case "version" -> version = unquote(v);
                case "dependencies" -> deps = tokens(v);
                default -> { }
            }
        }
        return new ModDescriptor(blankToNull(name), blankToNull(path), userDir == null ? "" : userDir.strip(),
                deps, blankToNull(github), blankToNull(version));
    }

    static List<String> tokens(String block) {
        String inner = block.strip();
        if (inner.startsWith("{")) inner = inner.substring(1);
        if (inner.endsWith("}")) inner = inner.substring(0, inner.length() - 1);
        List<String> out = new ArrayList<>();
        Matcher m = TOKEN.matcher(inner);
        while (m.find()) {
            String t = (m.group(1) != null ? m.group(1) : m.group(2)).strip();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static int braceDepth(CharSequence s) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') quoted = !quoted;
            else if (!quoted && c == '{') depth++;
            else if (!quoted && c == '}') depth--;
        }
        return depth;
    }

    private static String stripComment(String line) {
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') quoted = !quoted;
            if (quoted) continue;
            if (c == '#') return line.substring(0, i);
            if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/'
                    && (i == 0 || Character.isWhitespace(line.charAt(i - 1)))) {
                return line.substring(0, i);
            }
        }
        return line;
    }

    private static String unquote(String v) {
        String s = v.strip();
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) s = s.substring(1, s.length() - 1);
        return s.strip();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    /** Folder name from a descriptor path like {@code mod/HPM} or {@code mod\HPM\}. */
    public String folderName() {
        if (path == null) return null;
        String p = path.replace('\\', '/');
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        int slash = p.lastIndexOf('/');
        return slash >= 0 ? p.substring(slash + 1) : p;
    }
}
