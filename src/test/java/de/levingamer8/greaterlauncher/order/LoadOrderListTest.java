package de.levingamer8.greaterlauncher.order;

import de.levingamer8.greaterlauncher.core.NotFoundException;
import de.levingamer8.greaterlauncher.mods.Mod;
import de.levingamer8.greaterlauncher.mods.ModCatalog;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static de.levingamer8.greaterlauncher.ModFixtures.mod;
import static org.junit.jupiter.api.Assertions.*;

class LoadOrderListTest {

    private final Path root = Path.of("mod");
    private final ModCatalog catalog = ModCatalog.of(List.of(
            mod(root, "A"), mod(root, "B", "B_dir", List.of()), mod(root, "C"), mod(root, "D", "D_dir", List.of())));

    @Test
    void fromCatalog_shouldAppendNewModsDisabled() {
        LoadOrderList previous = LoadOrderList.of(List.of(
                new LoadOrderEntry("C", true, 0),
                new LoadOrderEntry("gone", true, 1),
                new LoadOrderEntry("A", false, 2)));

        LoadOrderList list = LoadOrderList.fromCatalog(catalog, previous);

        assertEquals(List.of("C", "A", "B", "D"), list.entries().stream().map(LoadOrderEntry::modId).toList());
        assertEquals(List.of("C"), list.enabledIds());
        assertEquals(List.of(0, 1, 2, 3), list.entries().stream().map(LoadOrderEntry::position).toList());
    }

    @Test
    void fromCheckedIds_shouldResolveNamesAndSkipUnknown() {
        LoadOrderList list = LoadOrderList.fromCheckedIds(catalog, List.of("D", "unknown", "B", "D"));

        assertEquals(List.of("D", "B"), list.enabledIds());
        assertEquals(4, list.size());
    }

    @Test
    void setEnabled_shouldReturnNewList() {
        LoadOrderList list = LoadOrderList.fromCatalog(catalog, null);

        LoadOrderList enabled = list.setEnabled("B", true);

        assertNotSame(list, enabled);
        assertTrue(list.enabledIds().isEmpty());
        assertEquals(List.of("B"), enabled.enabledIds());
        assertSame(enabled, enabled.setEnabled("B", true));
    }

    @Test
    void moveTo_shouldClampPosition() {
        LoadOrderList list = LoadOrderList.fromCatalog(catalog, null);

        assertEquals("A", list.moveTo("A", 99).entries().get(3).modId());
        assertEquals("D", list.moveTo("D", -5).entries().get(0).modId());
        assertEquals(List.of("A", "C", "B", "D"),
                list.moveTo("C", 1).entries().stream().map(LoadOrderEntry::modId).toList());
    }

    @Test
    void unknownId_shouldThrowNotFound() {
        LoadOrderList list = LoadOrderList.fromCatalog(catalog, null);

        assertThrows(NotFoundException.class, () -> list.setEnabled("X", true));
        assertThrows(NotFoundException.class, () -> list.moveTo("X", 0));
    }

    @Test
    void of_shouldDropDuplicateIds() {
        LoadOrderList list = LoadOrderList.of(List.of(
                new LoadOrderEntry("A", true, 0),
                new LoadOrderEntry("A", false, 1)));

        assertEquals(1, list.size());
        assertTrue(list.find("A").orElseThrow().enabled());
    }

    @Test
    void enabledInOrder_shouldContainExactlyEnabledEntriesInIncreasingPosition() {
        Random rnd = new Random(42);
        LoadOrderList list = LoadOrderList.fromCatalog(catalog, null);
        for (int round = 0; round < 200; round++) {
            String id = catalog.ids().get(rnd.nextInt(catalog.size()));
            list = rnd.nextBoolean() ? list.setEnabled(id, rnd.nextBoolean()) : list.moveTo(id, rnd.nextInt(6) - 1);

            List<Mod> mods = list.enabledInOrder(catalog);
            List<LoadOrderEntry> enabled = list.enabledEntries();
            assertEquals(enabled.size(), mods.size());
            for (int i = 0; i < mods.size(); i++) {
                assertEquals(enabled.get(i).modId(), mods.get(i).id());
                if (i > 0) assertTrue(enabled.get(i).position() > enabled.get(i - 1).position());
            }
            assertEquals(list.entries().stream().filter(LoadOrderEntry::enabled).count(), mods.size());
        }
    }

    @Test
    void enabledInOrder_shouldFailForVanishedMod() {
        LoadOrderList list = LoadOrderList.of(List.of(new LoadOrderEntry("gone", true, 0)));

        assertThrows(NotFoundException.class, () -> list.enabledInOrder(catalog));
    }

    @Test
    void userDir_shouldComeFromLastEnabledModThatHasOne() {
        LoadOrderList list = LoadOrderList.fromCheckedIds(catalog, List.of("D", "A", "B", "C"));

        assertEquals("B_dir", list.userDir(catalog).orElseThrow());
        assertTrue(LoadOrderList.fromCheckedIds(catalog, List.of("A")).userDir(catalog).isEmpty());
    }
}
