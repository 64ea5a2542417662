package de.levingamer8.greaterlauncher.merge;

import java.nio.file.Path;
import java.util.List;

// contributingMods in load order; overrides lists every block a later mod replaced
public record MergeReport(Path output, int blockCount, List<String> contributingMods, List<BlockOverride> overrides) {

    public record BlockOverride(String blockId, String fromMod, String toMod, boolean identical) {}

    public MergeReport {
        contributingMods = List.copyOf(contributingMods);
        overrides = List.copyOf(overrides);
    }
}
