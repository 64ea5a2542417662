package de.levingamer8.greaterlauncher.launch;

import de.levingamer8.greaterlauncher.core.LauncherConfig;
import de.levingamer8.greaterlauncher.game.GamePaths;
import de.levingamer8.greaterlauncher.mods.Mod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class LaunchCommandBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(LaunchCommandBuilder.class);

    /**
     * @param settings    launcher config, only the {@code realtime} flag is read
     * @param enabledMods mods to pass to the game, in load order (the merge mod last, if used)
     * @param gameRoot    folder containing the executable
     * @param userDir     the game's documents folder for this mod set; created if missing
     * @throws LaunchConfigException if the executable is missing or {@code userDir} cannot be created
     */
    public LaunchCommand build(LauncherConfig settings, List<Mod> enabledMods, Path gameRoot, Path userDir)
            throws LaunchConfigException {
        Path root = gameRoot.toAbsolutePath();
        Path exe = root.resolve(GamePaths.EXECUTABLE);
        if (!Files.isRegularFile(exe)) throw new LaunchConfigException("Game executable not found", exe);

        if (!Files.isDirectory(userDir)) {
            try {
                Files.createDirectories(userDir);
                LOG.info("Created user dir {}", userDir);
            } catch (IOException e) {
                throw new LaunchConfigException("Cannot create user dir", userDir, e);
            }
        }

        List<String> args = new ArrayList<>();
        for (Mod m : enabledMods) args.add(m.launchArgument());

        ProcessPriority prio = ProcessPriority.fromRealtimeFlag(settings.realtime());
        LaunchCommand cmd = new LaunchCommand(exe, root, args, prio);
        LOG.info("Launch command: {} (priority {})", String.join(" ", cmd.command()), prio);
        return cmd;
    }
}
