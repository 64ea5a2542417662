package de.levingamer8.greaterlauncher.service;

import de.levingamer8.greaterlauncher.core.LauncherConfig;
import de.levingamer8.greaterlauncher.core.LauncherConfigStore;
import de.levingamer8.greaterlauncher.game.CacheCleaner;
import de.levingamer8.greaterlauncher.game.GamePaths;
import de.levingamer8.greaterlauncher.game.IntroToggle;
import de.levingamer8.greaterlauncher.launch.GameLauncherService;
import de.levingamer8.greaterlauncher.launch.LaunchConfigException;
import de.levingamer8.greaterlauncher.launch.ProcessWatcher;
import de.levingamer8.greaterlauncher.merge.MergeConflictException;
import de.levingamer8.greaterlauncher.mods.ModCatalog;
import de.levingamer8.greaterlauncher.mods.ModScanner;
import de.levingamer8.greaterlauncher.mods.ScanResult;
import de.levingamer8.greaterlauncher.order.DependencyOrder;
import de.levingamer8.greaterlauncher.order.LoadOrderList;
import de.levingamer8.greaterlauncher.order.LoadOrderStore;
import de.levingamer8.greaterlauncher.preset.PresetManager;
import de.levingamer8.greaterlauncher.settings.GameSettings;
import de.levingamer8.greaterlauncher.settings.SettingsDocument;
import de.levingamer8.greaterlauncher.settings.SettingsStore;
import de.levingamer8.greaterlauncher.update.ModUpdateChecker;
import de.levingamer8.greaterlauncher.update.UpdateCheckResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Entry point for a UI. Holds the current catalog and load order for one game installation;
 * every change goes through here and is reported to the {@link LauncherListener}.
 * Not thread-safe, call from one thread.
 */
public class LauncherService {

    private static final Logger LOG = LoggerFactory.getLogger(LauncherService.class);

    private final GamePaths paths;
    private final ModScanner scanner;
    private final LauncherConfigStore configStore;
    private final LoadOrderStore loadOrderStore;
    private final SettingsStore settingsStore;
    private final PresetManager presets;
    private final GameLauncherService launcher;
    private final ModUpdateChecker updateChecker;

    private LauncherListener listener = new LauncherListener() {};
    private ModCatalog catalog = ModCatalog.empty();
    private LoadOrderList order = LoadOrderList.empty();

    public LauncherService(GamePaths paths, ModUpdateChecker updateChecker) {
        this(paths, new LauncherConfigStore(paths.launcherConfigFile()), updateChecker, new ProcessWatcher());
    }

    private LauncherService(GamePaths paths, LauncherConfigStore configStore, ModUpdateChecker updateChecker,
                            ProcessWatcher watcher) {
        this(paths, new ModScanner(), configStore, new LoadOrderStore(), new SettingsStore(),
                new PresetManager(configStore), new GameLauncherService(paths, configStore, watcher), updateChecker);
    }

    public LauncherService(GamePaths paths,
                           ModScanner scanner,
                           LauncherConfigStore configStore,
                           LoadOrderStore loadOrderStore,
                           SettingsStore settingsStore,
                           PresetManager presets,
                           GameLauncherService launcher,
                           ModUpdateChecker updateChecker) {
        this.paths = paths;
        this.scanner = scanner;
        this.configStore = configStore;
        this.loadOrderStore = loadOrderStore;
        this.settingsStore = settingsStore;
        this.presets = presets;
        this.launcher = launcher;
        this.updateChecker = updateChecker;
    }

    public void setListener(LauncherListener l) {
        this.listener = Objects.requireNonNull(l);
    }

    public GamePaths paths() { return paths; }

    public ModCatalog catalog() { return catalog; }

    public LoadOrderList loadOrder() { return order; }

    // ---------------- catalog / load order ----------------

    /**
     * Rescans the mod folder and rebuilds the load order from the stored one. Without a stored load order
     * the {@code checked_mods} of the launcher config are used.
     */
    public ScanResult refresh() throws IOException {
        LauncherConfig cfg = configStore.ensureExists(paths.gameRoot().toString());
        ScanResult scan = scanner.scan(paths.modsRoot());
        catalog = scan.catalog();

        LoadOrderList stored = loadOrderStore.restore(paths.loadOrderFile());
        order = stored.isEmpty()
                ? LoadOrderList.fromCheckedIds(catalog, cfg.checkedMods())
                : LoadOrderList.fromCatalog(catalog, stored);

        LOG.info("{} mods found, {} enabled", catalog.size(), order.enabledIds().size());
        listener.onCatalogChanged(scan);
        listener.onLoadOrderChanged(order);
        return scan;
    }

    public LoadOrderList setEnabled(String modId, boolean enabled) {
        return changed(order.setEnabled(modId, enabled));
    }

    public LoadOrderList moveTo(String modId, int position) {
        return changed(order.moveTo(modId, position));
    }

    public LoadOrderList sortByDependencies() {
        return changed(DependencyOrder.sort(order, catalog));
    }

    private LoadOrderList changed(LoadOrderList next) {
        if (next.equals(order)) return order;
        order = next;
        listener.onLoadOrderChanged(order);
        return order;
    }

    public void persist() throws IOException {
        configStore.update(cfg -> cfg.withCheckedMods(order.enabledIds()));
        loadOrderStore.persist(order, paths.loadOrderFile());
    }

    // ---------------- presets ----------------

    public void savePreset(String name) throws IOException {
        presets.save(name, order);
        listener.onPresetsChanged(presets.list());
    }

    public List<String> presetNames() throws IOException {
        return presets.list();
    }

    public LoadOrderList applyPreset(String name) throws IOException {
        changed(presets.apply(name, catalog));
        persist();
        return order;
    }

    public void deletePreset(String name) throws IOException {
        presets.delete(name);
        listener.onPresetsChanged(presets.list());
    }

    // ---------------- settings ----------------

    public String userDir() {
        return order.userDir(catalog).orElse("");
    }

    public GameSettings gameSettings() throws IOException {
        return GameSettings.from(settingsStore.loadOrCreateDefault(paths.settingsFile(userDir())));
    }

    public void saveGameSettings(GameSettings s) throws IOException {
        Path file = paths.settingsFile(userDir());
        SettingsDocument doc = settingsStore.loadOrCreateDefault(file);
        settingsStore.write(s.applyTo(doc), file);
        LOG.info("Game settings saved to {}", file);
    }

    public LauncherOptions options() throws IOException {
        return LauncherOptions.of(configStore.load());
    }

    public LauncherOptions saveOptions(LauncherOptions o) throws IOException {
        LauncherConfig before = configStore.load();
        configStore.update(cfg -> cfg.withOptions(o.updateTime(), o.realtime(), o.skipIntro(), o.mergeEventModifiers()));
        IntroToggle.apply(paths, o.skipIntro());
        if (before.updateTimeOrDefault() != o.updateTime()) listener.onTimeChanged(o.updateTime());
        listener.onOptionsChanged(o);
        return o;
    }

    public Path saveGamesDir() throws IOException {
        return Files.createDirectories(paths.saveGamesDir(userDir()));
    }

    public List<Path> clearCache() throws IOException {
        return CacheCleaner.clear(paths.userDocsDir(userDir()));
    }

    // ---------------- launch / updates ----------------

    public GameLauncherService.LaunchResult launch() throws IOException, MergeConflictException, LaunchConfigException {
        Consumer<String> log = line -> listener.onLog(line);
        return launcher.launch(catalog, order, log);
    }

    public CompletableFuture<List<UpdateCheckResult>> checkForUpdates() {
        return updateChecker.checkAll(catalog);
    }

    public void shutdown() throws IOException {
        try {
            persist();
        } finally {
            updateChecker.close();
        }
    }
}
