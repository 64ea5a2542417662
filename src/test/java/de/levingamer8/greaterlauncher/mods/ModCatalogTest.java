package de.levingamer8.greaterlauncher.mods;

import de.levingamer8.greaterlauncher.core.NotFoundException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static de.levingamer8.greaterlauncher.ModFixtures.mod;
import static org.junit.jupiter.api.Assertions.*;

class ModCatalogTest {

    private final Path root = Path.of("mod");

    @Test
    void of_shouldRejectDuplicateIds() {
        assertThrows(IllegalArgumentException.class, () -> ModCatalog.of(List.of(mod(root, "A"), mod(root, "A"))));
    }

    @Test
    void require_shouldThrowNotFoundForUnknownId() {
        ModCatalog c = ModCatalog.of(List.of(mod(root, "A")));

        NotFoundException e = assertThrows(NotFoundException.class, () -> c.require("B"));
        assertEquals(NotFoundException.Kind.MOD, e.kind());
        assertEquals("B", e.reference());
    }

    @Test
    void resolve_shouldFallBackToDisplayName() {
        Mod hpm = new Mod("HPM", "Historical Project Mod", root.resolve("HPM.mod"), "mod/HPM.mod",
                root.resolve("HPM"), "", List.of(), null, null);
        ModCatalog c = ModCatalog.of(List.of(hpm));

        assertEquals(hpm, c.resolve("HPM").orElseThrow());
        assertEquals(hpm, c.resolve("Historical Project Mod").orElseThrow());
        assertTrue(c.resolve("nope").isEmpty());
    }
}
