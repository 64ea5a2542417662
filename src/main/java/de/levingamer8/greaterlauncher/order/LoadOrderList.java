package de.levingamer8.greaterlauncher.order;

import de.levingamer8.greaterlauncher.core.NotFoundException;
import de.levingamer8.greaterlauncher.mods.Mod;
import de.levingamer8.greaterlauncher.mods.ModCatalog;

import java.util.*;

/**
 * Ordered, enableable list of mods. Immutable: every change returns a new list.
 * <p>
 * Positions of all entries are always the dense range {@code 0..size-1}. Disabled entries keep their
 * slot so the UI can show them where the user put them; only enabled entries take part in merge
 * and launch, in position order.
 */
public final class LoadOrderList {

    private static final LoadOrderList EMPTY = new LoadOrderList(List.of());

    private final List<LoadOrderEntry> entries;

    private LoadOrderList(List<LoadOrderEntry> ordered) {
        List<LoadOrderEntry> out = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) out.add(ordered.get(i).at(i));
        this.entries = List.copyOf(out);
    }

    public static LoadOrderList empty() { return EMPTY; }

    /**
     * Builds a list from arbitrary entries: sorted by their stored position (ties keep input order),
     * duplicate ids dropped after the first, positions renumbered.
     */
    public static LoadOrderList of(Collection<LoadOrderEntry> entries) {
        List<LoadOrderEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingInt(LoadOrderEntry::position));
        Set<String> seen = new HashSet<>();
        List<LoadOrderEntry> unique = new ArrayList<>();
        for (LoadOrderEntry e : sorted) {
            if (seen.add(e.modId())) unique.add(e);
        }
        return new LoadOrderList(unique);
    }

    /**
     * Merges a fresh catalog with previously persisted state. Known mods keep their flag and relative
     * order, new mods are appended disabled in catalog order, vanished mods are dropped.
     */
    public static LoadOrderList fromCatalog(ModCatalog catalog, LoadOrderList previous) {
        List<LoadOrderEntry> out = new ArrayList<>();
        Set<String> kept = new HashSet<>();
        if (previous != null) {
            for (LoadOrderEntry e : previous.entries) {
                if (catalog.contains(e.modId()) && kept.add(e.modId())) out.add(e);
            }
        }
        for (String id : catalog.ids()) {
            if (!kept.contains(id)) out.add(new LoadOrderEntry(id, false, out.size()));
        }
        return new LoadOrderList(out);
    }

    /**
     * Builds a list from a snapshot of enabled ids (launcher_configs.json {@code checked_mods}, presets).
     * Ids are resolved against the catalog by id or display name; unknown ones are skipped.
     * The remaining catalog mods follow, disabled.
     */
    public static LoadOrderList fromCheckedIds(ModCatalog catalog, List<String> enabledIds) {
        List<LoadOrderEntry> out = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (String ref : enabledIds) {
            catalog.resolve(ref)
                    .filter(m -> used.add(m.id()))
                    .ifPresent(m -> out.add(new LoadOrderEntry(m.id(), true, out.size())));
        }
        for (String id : catalog.ids()) {
            if (used.add(id)) out.add(new LoadOrderEntry(id, false, out.size()));
        }
        return new LoadOrderList(out);
    }

    public List<LoadOrderEntry> entries() { return entries; }

    public int size() { return entries.size(); }

    public boolean isEmpty() { return entries.isEmpty(); }

    public boolean contains(String id) { return indexOf(id) >= 0; }

    public Optional<LoadOrderEntry> find(String id) {
        int i = indexOf(id);
        return i < 0 ? Optional.empty() : Optional.of(entries.get(i));
    }

    public LoadOrderList setEnabled(String id, boolean enabled) {
        int i = require(id);
        LoadOrderEntry e = entries.get(i);
        if (e.enabled() == enabled) return this;
        List<LoadOrderEntry> out = new ArrayList<>(entries);
        out.set(i, e.withEnabled(enabled));
        return new LoadOrderList(out);
    }

    /** Moves {@code id} to {@code newPosition}, clamped to {@code [0, size-1]}. */
    public LoadOrderList moveTo(String id, int newPosition) {
        int from = require(id);
        int to = Math.max(0, Math.min(newPosition, entries.size() - 1));
        if (from == to) return this;
        List<LoadOrderEntry> out = new ArrayList<>(entries);
        LoadOrderEntry e = out.remove(from);
        out.add(to, e);
        return new LoadOrderList(out);
    }

    public List<String> enabledIds() {
        return entries.stream().filter(LoadOrderEntry::enabled).map(LoadOrderEntry::modId).toList();
    }

    public List<LoadOrderEntry> enabledEntries() {
        return entries.stream().filter(LoadOrderEntry::enabled).toList();
    }

    /**
     * The canonical order consumed by the merge engine and the launch builder.
     *
     * @throws NotFoundException if an enabled id is no longer in the catalog
     */
    public List<Mod> enabledInOrder(ModCatalog catalog) {
        return enabledIds().stream().map(catalog::require).toList();
    }

    /** {@code user_dir} of the last enabled mod that declares one (later mods win, like load order). */
    public Optional<String> userDir(ModCatalog catalog) {
        String dir = null;
        for (String id : enabledIds()) {
            Optional<String> d = catalog.find(id).flatMap(Mod::userDirOpt);
            if (d.isPresent()) dir = d.get();
        }
        return Optional.ofNullable(dir);
    }

    private int indexOf(String id) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).modId().equals(id)) return i;
        }
        return -1;
    }

    private int require(String id) {
        int i = indexOf(id);
        if (i < 0) throw new NotFoundException(NotFoundException.Kind.MOD, id);
        return i;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LoadOrderList l && l.entries.equals(entries);
    }

    @Override
    public int hashCode() { return entries.hashCode(); }

    @Override
    public String toString() { return "LoadOrderList" + entries; }
}
