package de.levingamer8.greaterlauncher.update;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GitHubRepoTest {

    @Test
    void parse_shouldAcceptSlugAndUrls() {
        GitHubRepo expected = new GitHubRepo("someone", "hpm");

        assertEquals(expected, GitHubRepo.parse("someone/hpm").orElseThrow());
        assertEquals(expected, GitHubRepo.parse("https://github.com/someone/hpm").orElseThrow());
        assertEquals(expected, GitHubRepo.parse("https://github.com/someone/hpm.git/").orElseThrow());
    }

    @Test
    void parse_shouldRejectOtherShapes() {
        assertTrue(GitHubRepo.parse("noslash").isEmpty());
        assertTrue(GitHubRepo.parse("a/b/c").isEmpty());
        assertTrue(GitHubRepo.parse("/repo").isEmpty());
        assertTrue(GitHubRepo.parse(null).isEmpty());
    }

    @Test
    void latestReleaseUrl_shouldPointAtGitHubApi() {
        assertEquals("https://api.github.com/repos/someone/hpm/releases/latest",
                new GitHubRepo("someone", "hpm").latestReleaseUrl());
    }
}
