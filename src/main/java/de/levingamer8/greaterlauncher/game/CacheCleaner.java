package de.levingamer8.greaterlauncher.game;

import de.levingamer8.greaterlauncher.core.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Deletes the game's generated caches in a user dir; the game rebuilds them on next start. */
public final class CacheCleaner {

    private static final Logger LOG = LoggerFactory.getLogger(CacheCleaner.class);

    public static final List<String> CACHE_FOLDERS = List.of("map", "gfx", "music");

    private CacheCleaner() {}

    public static List<Path> clear(Path userDocsDir) throws IOException {
        List<Path> removed = new ArrayList<>();
        for (String name : CACHE_FOLDERS) {
            Path dir = userDocsDir.resolve(name);
            if (!Files.isDirectory(dir)) continue;
            FileUtil.deleteRecursive(dir);
            removed.add(dir);
            LOG.info("Cache cleared: {}", dir);
        }
        return removed;
    }
}
