package de.levingamer8.greaterlauncher.launch;

import de.levingamer8.greaterlauncher.core.LauncherConfig;
import de.levingamer8.greaterlauncher.core.LauncherConfigStore;
import de.levingamer8.greaterlauncher.game.GamePaths;
import de.levingamer8.greaterlauncher.game.MergeModInstaller;
import de.levingamer8.greaterlauncher.merge.EventModifierMerger;
import de.levingamer8.greaterlauncher.merge.MergeConflictException;
import de.levingamer8.greaterlauncher.merge.MergeReport;
import de.levingamer8.greaterlauncher.mods.Mod;
import de.levingamer8.greaterlauncher.mods.ModCatalog;
import de.levingamer8.greaterlauncher.order.LoadOrderList;
import de.levingamer8.greaterlauncher.order.LoadOrderStore;
import de.levingamer8.greaterlauncher.settings.GameSettings;
import de.levingamer8.greaterlauncher.settings.SettingsDocument;
import de.levingamer8.greaterlauncher.settings.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Start-game flow: merge, build the command, patch settings, persist state, start the process.
 * A failed merge or an unusable configuration stops the launch before anything is started.
 */
public class GameLauncherService {

    private static final Logger LOG = LoggerFactory.getLogger(GameLauncherService.class);

    static final int MIN_MERGE_CONTRIBUTORS = 2;

    public record LaunchResult(LaunchCommand command, MergeReport mergeReport, Process process) {}

    private final GamePaths paths;
    private final LauncherConfigStore configStore;
    private final LoadOrderStore loadOrderStore;
    private final SettingsStore settingsStore;
    private final EventModifierMerger merger;
    private final LaunchCommandBuilder builder;
    private final ProcessWatcher watcher;
    private final boolean windows;

    public GameLauncherService(GamePaths paths, LauncherConfigStore configStore, ProcessWatcher watcher) {
        this(paths, configStore, new LoadOrderStore(), new SettingsStore(), new EventModifierMerger(),
                new LaunchCommandBuilder(), watcher, isWindows());
    }

    public GameLauncherService(GamePaths paths,
                               LauncherConfigStore configStore,
                               LoadOrderStore loadOrderStore,
                               SettingsStore settingsStore,
                               EventModifierMerger merger,
                               LaunchCommandBuilder builder,
                               ProcessWatcher watcher,
                               boolean windows) {
        this.paths = paths;
        this.configStore = configStore;
        this.loadOrderStore = loadOrderStore;
        this.settingsStore = settingsStore;
        this.merger = merger;
        this.builder = builder;
        this.watcher = watcher;
        this.windows = windows;
    }

    public ProcessWatcher watcher() { return watcher; }

    /**
     * @param log receives progress messages and the game's output lines, may be null
     * @throws MergeConflictException if an enabled mod's event modifiers cannot be merged
     * @throws LaunchConfigException  if the game cannot be started with this configuration
     * @throws IOException            if settings or launcher state cannot be written
     */
    public LaunchResult launch(ModCatalog catalog, LoadOrderList order, Consumer<String> log)
            throws IOException, MergeConflictException, LaunchConfigException {
        Consumer<String> L = safeLog(log);

        List<Mod> enabled = order.enabledInOrder(catalog);
        LauncherConfig config = configStore.load();
        String userDir = order.userDir(catalog).orElse("");
        Path userDocs = paths.userDocsDir(userDir);

        List<Mod> launchMods = new ArrayList<>(enabled);
        MergeReport report = null;
        if (config.mergeEnabled()) {
            Mod mergeMod = MergeModInstaller.ensureInstalled(paths.modsRoot());
            report = merger.merge(enabled, paths.mergedArtifact());
            if (report.contributingMods().size() >= MIN_MERGE_CONTRIBUTORS) {
                launchMods.add(mergeMod);
                L.accept("[MERGE] event_modifiers from " + String.join(", ", report.contributingMods()));
            }
        }

        LaunchCommand cmd = builder.build(config, launchMods, paths.gameRoot(), userDocs);

        Path settingsFile = paths.settingsFile(userDir);
        SettingsDocument doc = settingsStore.loadOrCreateDefault(settingsFile);
        SettingsDocument patched = GameSettings.withUpdateTime(doc, config.updateTimeOrDefault());
        if (!patched.equals(doc)) settingsStore.write(patched, settingsFile);

        configStore.save(config.withCheckedMods(order.enabledIds()));
        loadOrderStore.persist(order, paths.loadOrderFile());

        L.accept("[LAUNCH] " + String.join(" ", cmd.command()));
        ProcessWatcher.Listener forward = new ProcessWatcher.Listener() {
            @Override
            public void onOutput(String line) { L.accept("[GAME] " + line); }

            @Override
            public void onExited(Process process, Instant startedAt, Instant endedAt, int exitCode) {
                if (exitCode != 0) L.accept("[LAUNCH] Game exited with code " + exitCode);
                watcher.removeListener(this);
            }
        };
        watcher.addListener(forward);
        Process p;
        try {
            p = watcher.start(cmd.toProcessBuilder(windows));
        } catch (IOException e) {
            watcher.removeListener(forward);
            throw new LaunchConfigException("Cannot start game", cmd.executable(), e);
        }
        LOG.info("Game started with {} mods, user dir '{}'", enabled.size(), userDir);
        return new LaunchResult(cmd, report, p);
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }

    private static Consumer<String> safeLog(Consumer<String> log) {
        return log != null ? log : (s -> {});
    }
}
