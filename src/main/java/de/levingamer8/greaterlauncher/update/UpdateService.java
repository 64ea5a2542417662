package de.levingamer8.greaterlauncher.update;

import com.google.gson.*;
import de.levingamer8.greaterlauncher.core.HttpClientEx;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

public final class UpdateService {

    private static final Map<String, String> HEADERS = Map.of("Accept", "application/vnd.github+json");

    private final HttpClientEx http;

    public UpdateService() {
        this(new HttpClientEx());
    }

    public UpdateService(HttpClientEx http) {
        this.http = http;
    }

    public UpdateInfo fetchLatest(GitHubRepo repo) throws IOException, InterruptedException {
        String body = http.getText(repo.latestReleaseUrl(), HEADERS);

        JsonObject root;
        try {
            JsonElement parsed = JsonParser.parseString(body);
            if (!parsed.isJsonObject()) throw new IOException("Unexpected release JSON from " + repo + ": not an object");
            root = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Unexpected release JSON from " + repo + ": " + e.getMessage(), e);
        }
        String tag = string(root, "tag_name");          // e.g. v1.0.1
        if (tag == null) throw new IOException("Release of " + repo + " has no tag_name");
        String version = tag.startsWith("v") ? tag.substring(1) : tag;

        String zipUrl = null;
        JsonElement assets = root.get("assets");
        if (assets != null && assets.isJsonArray()) {
            for (JsonElement e : assets.getAsJsonArray()) {
                if (!e.isJsonObject()) continue;
                String name = string(e.getAsJsonObject(), "name");
                String url = string(e.getAsJsonObject(), "browser_download_url");
                if (name != null && url != null && name.toLowerCase().endsWith(".zip")) {
                    zipUrl = url;
                    break;
                }
            }
        }
        if (zipUrl == null) zipUrl = string(root, "zipball_url");
        return new UpdateInfo(version, zipUrl, publishedAt(root, repo));
    }

    private static Instant publishedAt(JsonObject root, GitHubRepo repo) throws IOException {
        String s = string(root, "published_at");
        if (s == null) return null;
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            throw new IOException("Release of " + repo + " has an unreadable published_at: " + s, e);
        }
    }

    // null unless the member is a JSON string
    private static String string(JsonObject o, String key) {
        JsonElement e = o.get(key);
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isString() ? e.getAsString() : null;
    }
}
