package de.levingamer8.greaterlauncher.order;

import de.levingamer8.greaterlauncher.mods.Mod;
import de.levingamer8.greaterlauncher.mods.ModCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Reorders enabled mods so each one loads after the enabled mods it lists under {@code dependencies}.
 * The sort is stable: mods without a constraint between them keep their current relative order.
 * Disabled entries keep their slots.
 */
public final class DependencyOrder {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyOrder.class);

    private DependencyOrder() {}

    /** @return the sorted list, or {@code list} itself when the dependencies form a cycle */
    public static LoadOrderList sort(LoadOrderList list, ModCatalog catalog) {
        List<String> enabled = list.enabledIds();
        Set<String> enabledSet = new HashSet<>(enabled);

        Map<String, Set<String>> before = new HashMap<>();
        for (String id : enabled) {
            Set<String> deps = new LinkedHashSet<>();
            Mod mod = catalog.find(id).orElse(null);
            if (mod != null) {
                for (String dep : mod.dependencies()) {
                    catalog.resolve(dep)
                            .map(Mod::id)
                            .filter(enabledSet::contains)
                            .filter(d -> !d.equals(id))
                            .ifPresent(deps::add);
                }
            }
            before.put(id, deps);
        }

        List<String> sorted = new ArrayList<>(enabled.size());
        Set<String> placed = new HashSet<>();
        while (sorted.size() < enabled.size()) {
            String next = null;
            for (String id : enabled) {
                if (!placed.contains(id) && placed.containsAll(before.get(id))) {
                    next = id;
                    break;
                }
            }
            if (next == null) {
                List<String> stuck = enabled.stream().filter(id -> !placed.contains(id)).toList();
                LOG.warn("Dependency cycle between {}, keeping current load order", stuck);
                return list;
            }
            sorted.add(next);
            placed.add(next);
        }
        if (sorted.equals(enabled)) return list;

        Map<String, LoadOrderEntry> byId = new HashMap<>();
        for (LoadOrderEntry e : list.entries()) byId.put(e.modId(), e);

        Iterator<String> it = sorted.iterator();
        List<LoadOrderEntry> out = new ArrayList<>(list.size());
        for (LoadOrderEntry e : list.entries()) {
            out.add(e.enabled() ? byId.get(it.next()).at(e.position()) : e);
        }
        LOG.info("Load order sorted by dependencies: {}", sorted);
        return LoadOrderList.of(out);
    }
}
