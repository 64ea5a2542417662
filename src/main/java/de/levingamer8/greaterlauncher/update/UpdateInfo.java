package de.levingamer8.greaterlauncher.update;

import java.time.Instant;

// downloadUrl and publishedAt may be null
public record UpdateInfo(String version, String downloadUrl, Instant publishedAt) {

    public UpdateInfo(String version, String downloadUrl) {
        this(version, downloadUrl, null);
    }
}
