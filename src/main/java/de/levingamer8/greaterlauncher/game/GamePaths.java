package de.levingamer8.greaterlauncher.game;

import java.nio.file.Path;

/**
 * Where things live for one game installation.
 *
 * @param gameRoot      folder containing {@code v2game.exe}
 * @param documentsRoot {@code Documents/Paradox Interactive/Victoria II}, parent of the per-mod user dirs
 */
public record GamePaths(Path gameRoot, Path documentsRoot) {

    public static final String EXECUTABLE = "v2game.exe";
    public static final String LAUNCHER_CONFIG = "launcher_configs.json";
    public static final String LOAD_ORDER = "launcher_load_order.json";

    public static GamePaths forCurrentUser(Path gameRoot) {
        Path docs = Path.of(System.getProperty("user.home"), "Documents", "Paradox Interactive", "Victoria II");
        return new GamePaths(gameRoot, docs);
    }

    public Path executable() { return gameRoot.resolve(EXECUTABLE); }

    public Path modsRoot() { return gameRoot.resolve("mod"); }

    public Path launcherConfigFile() { return modsRoot().resolve(LAUNCHER_CONFIG); }

    public Path loadOrderFile() { return modsRoot().resolve(LOAD_ORDER); }

    public Path mergedArtifact() {
        return MergeModInstaller.eventModifiersFile(modsRoot());
    }

    public Path userDocsDir(String userDir) {
        return userDir == null || userDir.isBlank() ? documentsRoot : documentsRoot.resolve(userDir);
    }

    public Path settingsFile(String userDir) { return userDocsDir(userDir).resolve("settings.txt"); }

    public Path saveGamesDir(String userDir) { return userDocsDir(userDir).resolve("save games"); }

    public Path moviesDir() { return gameRoot.resolve("movies"); }

    public Path disabledMoviesDir() { return gameRoot.resolve("moviesdisabled"); }
}
