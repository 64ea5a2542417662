package de.levingamer8.greaterlauncher.game;

import de.levingamer8.greaterlauncher.core.LauncherConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static de.levingamer8.greaterlauncher.ModFixtures.createGameRoot;
import static org.junit.jupiter.api.Assertions.*;

class GameLocatorTest {

    @TempDir
    Path tmp;

    private Path appDir;
    private Path drive;
    private LauncherConfigStore bootstrap;
    private GameLocator locator;

    @BeforeEach
    void setUp() throws IOException {
        appDir = Files.createDirectories(tmp.resolve("launcher").resolve("app"));
        drive = Files.createDirectories(tmp.resolve("C"));
        bootstrap = new LauncherConfigStore(appDir.resolve("launcher_configs.json"));
        locator = new GameLocator(bootstrap, List.of(drive));
    }

    @Test
    void candidateRoots_shouldStartWithAppDirAndParentWithoutDuplicates() {
        GameLocator twoDrives = new GameLocator(bootstrap, List.of(drive, drive));

        List<Path> roots = twoDrives.candidateRoots(appDir);

        assertEquals(appDir, roots.get(0));
        assertEquals(appDir.getParent(), roots.get(1));
        assertEquals(2 + GameLocator.STORE_FOLDERS.size(), roots.size());
        assertEquals(roots.size(), roots.stream().distinct().count());
    }

    @Test
    void locate_shouldFindSteamInstall() throws IOException {
        Path steam = createGameRoot(drive.resolve("Program Files (x86)/Steam/steamapps/common/Victoria 2"));

        assertEquals(steam.normalize(), locator.locate(appDir).orElseThrow());
    }

    @Test
    void locate_shouldPreferAppDirParent() throws IOException {
        createGameRoot(appDir.getParent());
        createGameRoot(drive.resolve("GOG Games/Victoria II"));

        assertEquals(appDir.getParent(), locator.locate(appDir).orElseThrow());
    }

    @Test
    void locate_shouldReturnEmptyWhenNothingFound() throws IOException {
        assertTrue(locator.locate(appDir).isEmpty());
    }

    @Test
    void remember_shouldBeUsedOnNextLocate() throws IOException {
        Path custom = createGameRoot(tmp.resolve("Games").resolve("V2"));

        locator.remember(custom);

        assertEquals(custom.toString(), bootstrap.load().gameRoot());
        assertEquals(custom, locator.locate(appDir).orElseThrow());
    }

    @Test
    void remember_shouldRejectFolderWithoutGame() {
        assertThrows(IllegalArgumentException.class, () -> locator.remember(tmp));
        assertFalse(bootstrap.exists());
    }
}
