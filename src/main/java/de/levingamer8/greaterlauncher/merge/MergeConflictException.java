package de.levingamer8.greaterlauncher.merge;

import java.nio.file.Path;

/**
 * An enabled mod's fragment could not be merged. The launch must not go ahead with a partial artifact.
 */
public class MergeConflictException extends Exception {

    private final String modId;
    private final Path file;
    private final int line;

    public MergeConflictException(String modId, Path file, int line, String reason, Throwable cause) {
        super("Mod '" + modId + "': cannot merge " + file + (line > 0 ? " (line " + line + ")" : "") + ": " + reason, cause);
        this.modId = modId;
        this.file = file;
        this.line = line;
    }

    public String modId() { return modId; }

    public Path file() { return file; }

    // 0 when the file could not be read at all
    public int line() { return line; }
}
