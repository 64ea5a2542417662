package de.levingamer8.greaterlauncher;

import de.levingamer8.greaterlauncher.mods.Mod;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Builds small game installations on disk for tests. */
public final class ModFixtures {

    private ModFixtures() {}

    /** Writes {@code mod/<id>.mod} pointing at {@code mod/<id>/} and creates the folder. */
    public static Path writeMod(Path modsRoot, String id, String name, String... extraLines) throws IOException {
        Files.createDirectories(modsRoot.resolve(id));
        StringBuilder sb = new StringBuilder()
                .append("name = \"").append(name).append("\"\n")
                .append("path = \"mod/").append(id).append("\"\n");
        for (String l : extraLines) sb.append(l).append('\n');
        Path descriptor = modsRoot.resolve(id + ".mod");
        Files.writeString(descriptor, sb.toString(), StandardCharsets.UTF_8);
        return descriptor;
    }

    public static Path writeFragment(Path modFolder, String content) throws IOException {
        Path f = modFolder.resolve("common").resolve(Mod.EVENT_MODIFIERS_FILE);
        Files.createDirectories(f.getParent());
        Files.writeString(f, content, StandardCharsets.UTF_8);
        return f;
    }

    /** A mod value that only exists in memory (folder may or may not exist). */
    public static Mod mod(Path modsRoot, String id) {
        return mod(modsRoot, id, "", List.of());
    }

    public static Mod mod(Path modsRoot, String id, String userDir, List<String> dependencies) {
        return new Mod(id, id, modsRoot.resolve(id + ".mod"), "mod/" + id + ".mod", modsRoot.resolve(id),
                userDir, dependencies, null, null);
    }

    public static Path createGameRoot(Path root) throws IOException {
        Files.createDirectories(root.resolve("mod"));
        Files.writeString(root.resolve("v2game.exe"), "");
        return root;
    }
}
