package de.levingamer8.greaterlauncher.update;

import java.time.Instant;

/**
 * Outcome of one mod's update check. Exactly one of {@code remoteVersion} and {@code error} is set.
 * {@code currentVersion} is null for mods without a {@code version} entry.
 */
public record UpdateCheckResult(String modId, String currentVersion, String remoteVersion, String downloadUrl,
                                boolean updateAvailable, String error) {

    public static UpdateCheckResult ok(String modId, String current, UpdateInfo info) {
        return new UpdateCheckResult(modId, current, info.version(), info.downloadUrl(),
                Versions.isNewer(info.version(), current), null);
    }

    /** For mods without a version: a release published after the descriptor was last written counts as newer. */
    public static UpdateCheckResult byReleaseDate(String modId, UpdateInfo info, Instant installedAt) {
        boolean newer = info.publishedAt() != null && info.publishedAt().isAfter(installedAt);
        return new UpdateCheckResult(modId, null, info.version(), info.downloadUrl(), newer, null);
    }

    public static UpdateCheckResult failed(String modId, String current, String error) {
        return new UpdateCheckResult(modId, current, null, null, false, error);
    }

    public boolean failed() {
        return error != null;
    }
}
