package de.levingamer8.greaterlauncher.merge;

public class FragmentSyntaxException extends Exception {

    private final String source;
    private final int line;
    private final String reason;

    public FragmentSyntaxException(String source, int line, String reason) {
        super(source + ":" + line + ": " + reason);
        this.source = source;
        this.line = line;
        this.reason = reason;
    }

    public String source() { return source; }

    public int line() { return line; }

    public String reason() { return reason; }
}
