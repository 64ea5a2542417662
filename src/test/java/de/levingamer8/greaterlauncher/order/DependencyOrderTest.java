package de.levingamer8.greaterlauncher.order;

import de.levingamer8.greaterlauncher.mods.ModCatalog;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static de.levingamer8.greaterlauncher.ModFixtures.mod;
import static org.junit.jupiter.api.Assertions.*;

class DependencyOrderTest {

    private final Path root = Path.of("mod");

    @Test
    void sort_shouldLoadDependenciesFirst() {
        ModCatalog catalog = ModCatalog.of(List.of(
                mod(root, "Sub", "", List.of("Base")),
                mod(root, "Base"),
                mod(root, "Other")));
        LoadOrderList list = LoadOrderList.fromCheckedIds(catalog, List.of("Sub", "Other", "Base"));

        LoadOrderList sorted = DependencyOrder.sort(list, catalog);

        assertEquals(List.of("Other", "Base", "Sub"), sorted.enabledIds());
    }

    @Test
    void sort_shouldKeepDisabledSlots() {
        ModCatalog catalog = ModCatalog.of(List.of(
                mod(root, "Sub", "", List.of("Base")),
                mod(root, "Base"),
                mod(root, "Off")));
        LoadOrderList list = LoadOrderList.of(List.of(
                new LoadOrderEntry("Sub", true, 0),
                new LoadOrderEntry("Off", false, 1),
                new LoadOrderEntry("Base", true, 2)));

        LoadOrderList sorted = DependencyOrder.sort(list, catalog);

        assertEquals(List.of("Base", "Off", "Sub"), sorted.entries().stream().map(LoadOrderEntry::modId).toList());
    }

    @Test
    void sort_shouldKeepOrderOnCycle() {
        ModCatalog catalog = ModCatalog.of(List.of(
                mod(root, "A", "", List.of("B")),
                mod(root, "B", "", List.of("A"))));
        LoadOrderList list = LoadOrderList.fromCheckedIds(catalog, List.of("A", "B"));

        assertSame(list, DependencyOrder.sort(list, catalog));
    }

    @Test
    void sort_shouldIgnoreDisabledOrUnknownDependencies() {
        ModCatalog catalog = ModCatalog.of(List.of(
                mod(root, "A", "", List.of("B", "Missing")),
                mod(root, "B")));
        LoadOrderList list = LoadOrderList.fromCheckedIds(catalog, List.of("A"));

        assertSame(list, DependencyOrder.sort(list, catalog));
    }
}
