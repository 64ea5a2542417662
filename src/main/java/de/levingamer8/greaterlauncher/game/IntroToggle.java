package de.levingamer8.greaterlauncher.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Skips the intro videos by renaming {@code movies} to {@code moviesdisabled} (and back). */
public final class IntroToggle {

    private static final Logger LOG = LoggerFactory.getLogger(IntroToggle.class);

    private IntroToggle() {}

    public static boolean apply(GamePaths paths, boolean skip) throws IOException {
        Path from = skip ? paths.moviesDir() : paths.disabledMoviesDir();
        Path to = skip ? paths.disabledMoviesDir() : paths.moviesDir();
        if (!Files.isDirectory(from)) return false;
        if (Files.exists(to)) {
            LOG.warn("Both {} and {} exist, leaving intro videos as they are", from, to);
            return false;
        }
        Files.move(from, to);
        LOG.info("Intro videos {}", skip ? "disabled" : "enabled");
        return true;
    }

    public static boolean isSkipped(GamePaths paths) {
        return !Files.isDirectory(paths.moviesDir()) && Files.isDirectory(paths.disabledMoviesDir());
    }
}
