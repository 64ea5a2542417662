package de.levingamer8.greaterlauncher.mods;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a catalog scan. Broken descriptors do not fail the scan; they end up in {@code warnings}.
 */
public record ScanResult(ModCatalog catalog, List<Warning> warnings) {

    public record Warning(Path file, String reason) {
        @Override
        public String toString() {
            return file.getFileName() + ": " + reason;
        }
    }

    public ScanResult {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
