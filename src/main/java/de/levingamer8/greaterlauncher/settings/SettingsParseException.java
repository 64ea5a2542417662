package de.levingamer8.greaterlauncher.settings;

import java.io.IOException;
import java.nio.file.Path;

public class SettingsParseException extends IOException {

    private final Path file;

    public SettingsParseException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path file() { return file; }
}
