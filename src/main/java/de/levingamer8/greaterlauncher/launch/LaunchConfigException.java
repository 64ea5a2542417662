package de.levingamer8.greaterlauncher.launch;

import java.nio.file.Path;

public class LaunchConfigException extends Exception {

    private final Path path;

    public LaunchConfigException(String message, Path path) {
        this(message, path, null);
    }

    public LaunchConfigException(String message, Path path, Throwable cause) {
        super(path == null ? message : message + ": " + path, cause);
        this.path = path;
    }

    public Path path() { return path; }
}
