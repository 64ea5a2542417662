package de.levingamer8.greaterlauncher.update;

import de.levingamer8.greaterlauncher.mods.Mod;
import de.levingamer8.greaterlauncher.mods.ModCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Checks every mod that names a GitHub repository for a newer release. Mods with a {@code version}
 * are compared by version; mods without one by the release date against the descriptor's modification time.
 * Runs on its own daemon thread; callers get a future and are never blocked.
 */
public class ModUpdateChecker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ModUpdateChecker.class);

    private final UpdateService updates;
    private final ExecutorService es = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "mod-update-check");
        t.setDaemon(true);
        return t;
    });

    public ModUpdateChecker(UpdateService updates) {
        this.updates = updates;
    }

    public CompletableFuture<List<UpdateCheckResult>> checkAll(ModCatalog catalog) {
        List<Mod> mods = catalog.all().stream()
                .filter(m -> m.github() != null && !m.github().isBlank())
                .toList();
        return CompletableFuture.supplyAsync(() -> {
            List<UpdateCheckResult> out = new ArrayList<>(mods.size());
            for (Mod m : mods) out.add(check(m));
            return out;
        }, es);
    }

    UpdateCheckResult check(Mod m) {
        Optional<GitHubRepo> repo = GitHubRepo.parse(m.github());
        if (repo.isEmpty()) return UpdateCheckResult.failed(m.id(), m.version(), "invalid github entry: " + m.github());
        try {
            UpdateInfo info = updates.fetchLatest(repo.get());
            UpdateCheckResult r = hasVersion(m)
                    ? UpdateCheckResult.ok(m.id(), m.version(), info)
                    : UpdateCheckResult.byReleaseDate(m.id(), info, installedAt(m));
            if (r.updateAvailable()) LOG.info("Update for {}: {} -> {}", m.id(), m.version(), r.remoteVersion());
            return r;
        } catch (IOException e) {
            LOG.warn("Update check for {} ({}) failed: {}", m.id(), repo.get(), e.getMessage());
            return UpdateCheckResult.failed(m.id(), m.version(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UpdateCheckResult.failed(m.id(), m.version(), "interrupted");
        } catch (RuntimeException e) {
            // one broken release must not cost the results of the other mods
            LOG.warn("Update check for {} ({}) failed", m.id(), repo.get(), e);
            return UpdateCheckResult.failed(m.id(), m.version(), e.toString());
        }
    }

    private static boolean hasVersion(Mod m) {
        return m.version() != null && !m.version().isBlank();
    }

    private static Instant installedAt(Mod m) throws IOException {
        return Files.getLastModifiedTime(m.descriptorFile()).toInstant();
    }

    @Override
    public void close() {
        es.shutdownNow();
    }
}
