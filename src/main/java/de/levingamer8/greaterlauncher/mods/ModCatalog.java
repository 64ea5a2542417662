package de.levingamer8.greaterlauncher.mods;

import de.levingamer8.greaterlauncher.core.NotFoundException;

import java.util.*;

/**
 * Immutable set of mods from one scan, ordered by id (case-insensitive, then exact).
 */
public final class ModCatalog {

    public static final Comparator<String> ID_ORDER =
            String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    private static final ModCatalog EMPTY = new ModCatalog(List.of());

    private final Map<String, Mod> byId;

    private ModCatalog(Collection<Mod> mods) {
        Map<String, Mod> m = new TreeMap<>(ID_ORDER);
        for (Mod mod : mods) {
            if (m.putIfAbsent(mod.id(), mod) != null) {
                throw new IllegalArgumentException("Duplicate mod id: " + mod.id());
            }
        }
        this.byId = Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    public static ModCatalog of(Collection<Mod> mods) {
        return new ModCatalog(mods);
    }

    public static ModCatalog empty() { return EMPTY; }

    public List<Mod> all() { return List.copyOf(byId.values()); }

    public List<String> ids() { return List.copyOf(byId.keySet()); }

    public int size() { return byId.size(); }

    public boolean isEmpty() { return byId.isEmpty(); }

    public boolean contains(String id) { return byId.containsKey(id); }

    public Optional<Mod> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Mod require(String id) {
        Mod m = byId.get(id);
        if (m == null) throw new NotFoundException(NotFoundException.Kind.MOD, id);
        return m;
    }

    public Optional<Mod> findByName(String name) {
        return byId.values().stream().filter(m -> m.name().equals(name)).findFirst();
    }

    /** Looks up by id first, then by display name; older launcher configs stored names. */
    public Optional<Mod> resolve(String idOrName) {
        Optional<Mod> m = find(idOrName);
        return m.isPresent() ? m : findByName(idOrName);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ModCatalog c && c.byId.equals(byId);
    }

    @Override
    public int hashCode() { return byId.hashCode(); }

    @Override
    public String toString() { return "ModCatalog" + byId.keySet(); }
}
