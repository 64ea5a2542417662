package de.levingamer8.greaterlauncher.preset;

import de.levingamer8.greaterlauncher.core.LauncherConfig;
import de.levingamer8.greaterlauncher.core.LauncherConfigStore;
import de.levingamer8.greaterlauncher.core.NotFoundException;
import de.levingamer8.greaterlauncher.mods.ModCatalog;
import de.levingamer8.greaterlauncher.order.LoadOrderList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Presets live in the {@code presets} object of {@code launcher_configs.json}, name to ordered mod ids.
 * Only the enabled ids are stored.
 */
public class PresetManager {

    private static final Logger LOG = LoggerFactory.getLogger(PresetManager.class);

    private final LauncherConfigStore store;

    public PresetManager(LauncherConfigStore store) {
        this.store = store;
    }

    public Preset save(String name, LoadOrderList list) throws IOException {
        Preset p = new Preset(normalize(name), list.enabledIds());
        store.update(cfg -> {
            Map<String, List<String>> presets = new TreeMap<>(cfg.presets());
            if (presets.put(p.name(), p.modIds()) != null) LOG.info("Preset '{}' overwritten", p.name());
            return cfg.withPresets(presets);
        });
        LOG.info("Preset '{}' saved with {} mods", p.name(), p.modIds().size());
        return p;
    }

    // case-insensitive alphabetical
    public List<String> list() throws IOException {
        List<String> names = new ArrayList<>(store.load().presets().keySet());
        names.sort(ModCatalog.ID_ORDER);
        return names;
    }

    public Optional<Preset> find(String name) throws IOException {
        String n = normalize(name);
        List<String> ids = store.load().presets().get(n);
        return ids == null ? Optional.empty() : Optional.of(new Preset(n, ids));
    }

    /**
     * Builds a load order from a preset. Entries are matched by id, then by display name (the older
     * launcher stored names). Entries no longer installed are dropped; the remaining catalog mods follow, disabled.
     *
     * @throws NotFoundException if there is no preset with that name
     */
    public LoadOrderList apply(String name, ModCatalog catalog) throws IOException {
        Preset p = find(name).orElseThrow(() -> new NotFoundException(NotFoundException.Kind.PRESET, name));
        for (String ref : p.modIds()) {
            if (catalog.resolve(ref).isEmpty()) LOG.debug("Preset '{}': mod {} is no longer installed", p.name(), ref);
        }
        return LoadOrderList.fromCheckedIds(catalog, p.modIds());
    }

    public void delete(String name) throws IOException {
        String n = normalize(name);
        LauncherConfig cfg = store.load();
        if (!cfg.presets().containsKey(n)) throw new NotFoundException(NotFoundException.Kind.PRESET, n);
        Map<String, List<String>> presets = new TreeMap<>(cfg.presets());
        presets.remove(n);
        store.save(cfg.withPresets(presets));
        LOG.info("Preset '{}' deleted", n);
    }

    private static String normalize(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Preset name must not be blank");
        return name.trim();
    }
}
