package de.levingamer8.greaterlauncher.merge;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code event_modifiers.txt}-style fragments: a sequence of {@code name = value} entries,
 * {@code #} comments, values spanning lines while their braces are open.
 * <pre>
 * my_modifier = {
 *     icon = 2
 *     local_rgo_output = 0.1
 * }
 * </pre>
 */
public final class FragmentParser {

    private FragmentParser() {}

    public static List<FragmentBlock> parse(String content, String source) throws FragmentSyntaxException {
        String[] lines = content.split("\r\n|\r|\n", -1);
        List<FragmentBlock> blocks = new ArrayList<>();

        for (int i = 0; i < lines.length; i++) {
            String raw = lines[i];
            String code = stripComment(raw).strip();
            if (code.isEmpty()) continue;

            int startLine = i + 1;
            int eq = code.indexOf('=');
            if (eq < 0) {
                throw new FragmentSyntaxException(source, startLine, "expected 'name = value', got '" + abbreviate(code) + "'");
            }
            String id = code.substring(0, eq).strip();
            if (id.isEmpty() || !isIdentifier(id)) {
                throw new FragmentSyntaxException(source, startLine, "invalid block name '" + abbreviate(id) + "'");
            }

            String afterEq = raw.substring(raw.indexOf('=') + 1).strip();
            StringBuilder value = new StringBuilder(afterEq);
            int depth = braceDelta(code.substring(eq + 1));

            if (stripComment(afterEq).isBlank()) {
                // Wert steht erst in der nächsten Zeile: "name =" gefolgt von "{"
                int j = nextCodeLine(lines, i + 1);
                if (j < 0 || !stripComment(lines[j]).strip().startsWith("{")) {
                    throw new FragmentSyntaxException(source, startLine, "block '" + id + "' has no value");
                }
                for (int k = i + 1; k <= j; k++) appendLine(value, lines[k]);
                depth = braceDelta(stripComment(lines[j]));
                i = j;
            }

            while (depth > 0) {
                if (++i >= lines.length) {
                    throw new FragmentSyntaxException(source, startLine, "unclosed '{' in block '" + id + "'");
                }
                appendLine(value, lines[i]);
                depth += braceDelta(stripComment(lines[i]));
            }
            if (depth < 0) {
                throw new FragmentSyntaxException(source, i + 1, "unbalanced '}' in block '" + id + "'");
            }
            blocks.add(new FragmentBlock(id, value.toString().strip(), startLine));
        }
        return blocks;
    }

    private static void appendLine(StringBuilder sb, String line) {
        if (!sb.isEmpty()) sb.append('\n');
        sb.append(line.stripTrailing());
    }

    private static int nextCodeLine(String[] lines, int from) {
        for (int j = from; j < lines.length; j++) {
            if (!stripComment(lines[j]).isBlank()) return j;
        }
        return -1;
    }

    private static boolean isIdentifier(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '{' || c == '}' || c == '"') return false;
        }
        return true;
    }

    static int braceDelta(String code) {
        int d = 0;
        boolean quoted = false;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '"') quoted = !quoted;
            else if (!quoted && c == '{') d++;
            else if (!quoted && c == '}') d--;
        }
        return d;
    }

    static String stripComment(String s) {
        boolean quoted = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') quoted = !quoted;
            else if (c == '#' && !quoted) return s.substring(0, i);
        }
        return s;
    }

    private static String abbreviate(String s) {
        return s.length() <= 40 ? s : s.substring(0, 37) + "...";
    }
}
