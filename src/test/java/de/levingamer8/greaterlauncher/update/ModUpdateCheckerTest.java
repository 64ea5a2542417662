package de.levingamer8.greaterlauncher.update;

import de.levingamer8.greaterlauncher.core.HttpClientEx;
import de.levingamer8.greaterlauncher.mods.Mod;
import de.levingamer8.greaterlauncher.mods.ModCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ModUpdateCheckerTest {

    private final UpdateService updates = mock(UpdateService.class);
    private final ModUpdateChecker checker = new ModUpdateChecker(updates);

    @AfterEach
    void tearDown() {
        checker.close();
    }

    @Test
    void checkAll_shouldReportPerModAndKeepGoingAfterFailures() throws Exception {
        when(updates.fetchLatest(new GitHubRepo("a", "hpm"))).thenReturn(new UpdateInfo("0.5.0", "https://x/hpm.zip"));
        when(updates.fetchLatest(new GitHubRepo("b", "pdm"))).thenThrow(new IOException("HTTP 403"));
        ModCatalog catalog = ModCatalog.of(List.of(
                mod("HPM", "a/hpm", "0.4.6"),
                mod("PDM", "b/pdm", "1.0"),
                mod("Local", null, "1.0"),
                mod("Bad", "not a repo", "1.0")));

        List<UpdateCheckResult> results = checker.checkAll(catalog).get(5, TimeUnit.SECONDS);

        assertEquals(3, results.size());
        UpdateCheckResult bad = results.get(0);
        assertEquals("Bad", bad.modId());
        assertTrue(bad.failed());

        UpdateCheckResult hpm = results.get(1);
        assertTrue(hpm.updateAvailable());
        assertEquals("0.5.0", hpm.remoteVersion());
        assertEquals("https://x/hpm.zip", hpm.downloadUrl());

        UpdateCheckResult pdm = results.get(2);
        assertEquals("HTTP 403", pdm.error());
        assertFalse(pdm.updateAvailable());
    }

    @Test
    void checkAll_shouldReportMalformedReleaseWithoutLosingOtherMods() throws Exception {
        HttpClientEx http = mock(HttpClientEx.class);
        when(http.getText(eq(new GitHubRepo("a", "hpm").latestReleaseUrl()), anyMap()))
                .thenReturn("{\"tag_name\": \"v0.5.0\", \"assets\": [{\"size\": 12}]}");
        when(http.getText(eq(new GitHubRepo("b", "pdm").latestReleaseUrl()), anyMap()))
                .thenReturn("{\"tag_name\": [\"broken\"]}");
        when(http.getText(eq(new GitHubRepo("c", "gfm").latestReleaseUrl()), anyMap()))
                .thenReturn("{\"tag_name\": \"v2.0\", \"zipball_url\": \"https://x/gfm\"}");

        try (ModUpdateChecker real = new ModUpdateChecker(new UpdateService(http))) {
            List<UpdateCheckResult> results = real.checkAll(ModCatalog.of(List.of(
                    mod("GFM", "c/gfm", "1.0"),
                    mod("HPM", "a/hpm", "0.4.6"),
                    mod("PDM", "b/pdm", "1.0")))).get(5, TimeUnit.SECONDS);

            assertEquals(List.of("GFM", "HPM", "PDM"), results.stream().map(UpdateCheckResult::modId).toList());
            assertTrue(results.get(0).updateAvailable());
            assertEquals("https://x/gfm", results.get(0).downloadUrl());
            assertTrue(results.get(1).updateAvailable());
            assertNull(results.get(1).downloadUrl());
            assertTrue(results.get(2).failed());
            assertTrue(results.get(2).error().contains("tag_name"));
        }
    }

    @Test
    void check_withoutVersionShouldCompareReleaseDateWithDescriptor(@TempDir Path dir) throws Exception {
        Path descriptor = Files.writeString(dir.resolve("HPM.mod"), "name = \"HPM\"\n");
        Files.setLastModifiedTime(descriptor, FileTime.from(Instant.parse("2024-01-01T00:00:00Z")));
        Mod hpm = new Mod("HPM", "HPM", descriptor, "mod/HPM.mod", dir.resolve("HPM"), "", List.of(), "a/hpm", null);

        when(updates.fetchLatest(new GitHubRepo("a", "hpm")))
                .thenReturn(new UpdateInfo("0.5", "https://x/hpm.zip", Instant.parse("2024-02-01T00:00:00Z")));
        UpdateCheckResult newer = checker.check(hpm);
        assertFalse(newer.failed());
        assertNull(newer.currentVersion());
        assertTrue(newer.updateAvailable());

        when(updates.fetchLatest(new GitHubRepo("a", "hpm")))
                .thenReturn(new UpdateInfo("0.5", "https://x/hpm.zip", Instant.parse("2023-12-01T00:00:00Z")));
        assertFalse(checker.check(hpm).updateAvailable());
    }

    @Test
    void checkAll_shouldCompleteEmptyForCatalogWithoutRepos() throws Exception {
        assertTrue(checker.checkAll(ModCatalog.empty()).get(5, TimeUnit.SECONDS).isEmpty());
        verifyNoInteractions(updates);
    }

    private static Mod mod(String id, String github, String version) {
        return new Mod(id, id, Path.of("mod", id + ".mod"), "mod/" + id + ".mod", Path.of("mod", id), "",
                List.of(), github, version);
    }
}
