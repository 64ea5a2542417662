package de.levingamer8.greaterlauncher.update;

import java.util.Optional;

public record GitHubRepo(String owner, String repo) {

    public GitHubRepo {
        if (owner == null || owner.isBlank() || repo == null || repo.isBlank()) {
            throw new IllegalArgumentException("owner and repo must not be blank");
        }
    }

    /** Accepts {@code owner/repo} and {@code https://github.com/owner/repo[.git]}. */
    public static Optional<GitHubRepo> parse(String s) {
        if (s == null) return Optional.empty();
        String t = s.trim();
        for (String prefix : new String[]{"https://github.com/", "http://github.com/", "github.com/"}) {
            if (t.regionMatches(true, 0, prefix, 0, prefix.length())) {
                t = t.substring(prefix.length());
                break;
            }
        }
        if (t.endsWith("/")) t = t.substring(0, t.length() - 1);
        if (t.endsWith(".git")) t = t.substring(0, t.length() - 4);

        String[] parts = t.split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) return Optional.empty();
        return Optional.of(new GitHubRepo(parts[0], parts[1]));
    }

    public String latestReleaseUrl() {
        return "https://api.github.com/repos/" + owner + "/" + repo + "/releases/latest";
    }

    @Override
    public String toString() { return owner + "/" + repo; }
}
