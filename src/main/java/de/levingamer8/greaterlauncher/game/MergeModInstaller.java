package de.levingamer8.greaterlauncher.game;

import de.levingamer8.greaterlauncher.mods.Mod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Sets up the hidden {@code z_launcher} mod that carries the merged event modifiers.
 * The game loads it last so its {@code common/event_modifiers.txt} wins over the individual mods.
 */
public final class MergeModInstaller {

    private static final Logger LOG = LoggerFactory.getLogger(MergeModInstaller.class);

    public static final String ID = "z_launcher";

    private MergeModInstaller() {}

    public static Path eventModifiersFile(Path modsRoot) {
        return modsRoot.resolve(ID).resolve("common").resolve(Mod.EVENT_MODIFIERS_FILE);
    }

    /** Idempotent: existing files are left alone. */
    public static Mod ensureInstalled(Path modsRoot) throws IOException {
        Path dir = modsRoot.resolve(ID);
        Files.createDirectories(dir.resolve("common"));

        Path descriptor = modsRoot.resolve(ID + ".mod");
        if (!Files.exists(descriptor)) {
            Files.writeString(descriptor,
                    "name = \"" + ID + "\"\n" +
                    "path = \"mod/" + ID + "\"\n",
                    StandardCharsets.UTF_8);
            LOG.info("Created merge mod descriptor {}", descriptor);
        }
        Path em = eventModifiersFile(modsRoot);
        if (!Files.exists(em)) Files.writeString(em, "", StandardCharsets.UTF_8);

        Path readme = dir.resolve("readme.txt");
        if (!Files.exists(readme)) {
            Files.writeString(readme,
                    "This folder and mod is used to fix conflicts with event_modifiers and is hidden by default.\n",
                    StandardCharsets.UTF_8);
        }
        return new Mod(ID, ID, descriptor, "mod/" + ID + ".mod", dir, "", List.of(), null, null);
    }
}
