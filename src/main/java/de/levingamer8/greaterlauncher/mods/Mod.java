package de.levingamer8.greaterlauncher.mods;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * A mod found by a catalog scan.
 *
 * @param id             stable id, the descriptor file name without {@code .mod}
 *                       (or the folder name for {@code <folder>/descriptor.mod})
 * @param name           display name from the descriptor
 * @param descriptorFile absolute path of the {@code .mod} file
 * @param descriptorRef  descriptor path relative to the game root, as passed to {@code -mod=}
 * @param path           the mod's content folder
 * @param userDir        {@code user_dir} from the descriptor, empty if none
 * @param dependencies   names of mods this one wants loaded before it (hints only)
 * @param github         GitHub repository for update checks, may be null
 * @param version        installed version for update checks, may be null
 */
public record Mod(
        String id,
        String name,
        Path descriptorFile,
        String descriptorRef,
        Path path,
        String userDir,
        List<String> dependencies,
        String github,
        String version
) {

    public static final String EVENT_MODIFIERS_FILE = "event_modifiers.txt";

    public Mod {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (userDir == null) userDir = "";
    }

    public Path eventModifiersFile() {
        return path.resolve("common").resolve(EVENT_MODIFIERS_FILE);
    }

    public boolean hasEventModifiers() {
        return Files.exists(eventModifiersFile());
    }

    public Optional<String> userDirOpt() {
        return userDir.isBlank() ? Optional.empty() : Optional.of(userDir);
    }

    public String launchArgument() {
        return "-mod=" + descriptorRef;
    }
}
