package de.levingamer8.greaterlauncher.game;

import de.levingamer8.greaterlauncher.core.LauncherConfig;
import de.levingamer8.greaterlauncher.core.LauncherConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Finds the game installation. The chosen root is remembered in a small config next to the launcher
 * (same format as {@code launcher_configs.json}, only {@code game_root} is used).
 */
public class GameLocator {

    private static final Logger LOG = LoggerFactory.getLogger(GameLocator.class);

    static final List<String> STORE_FOLDERS = List.of(
            "Program Files (x86)/Steam/steamapps/common/Victoria 2",
            "Program Files/Steam/steamapps/common/Victoria 2",
            "SteamLibrary/steamapps/common/Victoria 2",
            "Steam/steamapps/common/Victoria 2",
            "GOG Games/Victoria II",
            "Program Files (x86)/GOG Galaxy/Games/Victoria II"
    );

    private final LauncherConfigStore bootstrap;
    private final List<Path> driveRoots;

    public GameLocator(Path appDir) {
        this(new LauncherConfigStore(appDir.resolve(GamePaths.LAUNCHER_CONFIG)),
                Arrays.stream(File.listRoots()).map(File::toPath).toList());
    }

    public GameLocator(LauncherConfigStore bootstrap, List<Path> driveRoots) {
        this.bootstrap = bootstrap;
        this.driveRoots = List.copyOf(driveRoots);
    }

    public static boolean hasExecutable(Path root) {
        return root != null && Files.isRegularFile(root.resolve(GamePaths.EXECUTABLE));
    }

    /** App dir, its parent, then the usual Steam and GOG folders on every drive, without duplicates. */
    public List<Path> candidateRoots(Path appDir) {
        Set<Path> out = new LinkedHashSet<>();
        Path app = appDir.toAbsolutePath().normalize();
        out.add(app);
        if (app.getParent() != null) out.add(app.getParent());
        for (Path drive : driveRoots) {
            for (String f : STORE_FOLDERS) out.add(drive.resolve(f).normalize());
        }
        return new ArrayList<>(out);
    }

    /** The remembered root if it is still valid, else the first candidate that has the executable. */
    public Optional<Path> locate(Path appDir) throws IOException {
        String remembered = bootstrap.load().gameRoot();
        if (remembered != null && !remembered.isBlank()) {
            Path p = Path.of(remembered);
            if (hasExecutable(p)) return Optional.of(p);
            LOG.warn("Remembered game root {} has no {}", p, GamePaths.EXECUTABLE);
        }
        for (Path c : candidateRoots(appDir)) {
            if (hasExecutable(c)) {
                LOG.info("Game found at {}", c);
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public void remember(Path root) throws IOException {
        if (!hasExecutable(root)) {
            throw new IllegalArgumentException(GamePaths.EXECUTABLE + " not found in " + root);
        }
        String value = root.toAbsolutePath().normalize().toString();
        if (bootstrap.exists()) {
            bootstrap.update(cfg -> cfg.withGameRoot(value));
        } else {
            bootstrap.save(LauncherConfig.defaults(value));
        }
    }
}
