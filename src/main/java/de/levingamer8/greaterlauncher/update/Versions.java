package de.levingamer8.greaterlauncher.update;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Versions {
    private Versions() {}

    private static final Pattern LEADING_DIGITS = Pattern.compile("^(\\d+)");

    /** Dotted numeric comparison; a leading {@code v} is ignored, missing parts count as 0. */
    public static int compare(String a, String b) {
        String[] A = stripV(a).split("\\.");
        String[] B = stripV(b).split("\\.");
        int n = Math.max(A.length, B.length);
        for (int i = 0; i < n; i++) {
            long ai = i < A.length ? parse(A[i]) : 0;
            long bi = i < B.length ? parse(B[i]) : 0;
            if (ai != bi) return Long.compare(ai, bi);
        }
        return 0;
    }

    public static boolean isNewer(String remote, String current) {
        return compare(remote, current) > 0;
    }

    private static String stripV(String s) {
        if (s == null) return "";
        s = s.trim();
        return s.startsWith("v") || s.startsWith("V") ? s.substring(1) : s;
    }

    // "2-beta" -> 2, "rc1" -> 0
    private static long parse(String s) {
        Matcher m = LEADING_DIGITS.matcher(s.trim());
        if (!m.find()) return 0;
        String digits = m.group(1);
        return digits.length() > 18 ? Long.MAX_VALUE : Long.parseLong(digits);
    }
}
