package work.lcod.taskgen.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class GitRepositoryTest {
    @Test
    void parsesHttpsUrls() {
        var git = GitRepository.parse("https://user@github.com/acme/demo.git");
        assertEquals("github.com", git.host());
        assertEquals("acme", git.organisation());
        assertEquals("demo", git.name());
        assertEquals("https://github.com/acme/demo.git", git.httpsUrl());
    }

    @Test
    void parsesSshUrls() {
        var git = GitRepository.parse("git@gitlab.example.com:platform/tools/builder.git");
        assertEquals("gitlab.example.com", git.host());
        assertEquals("platform/tools", git.organisation());
        assertEquals("builder", git.name());
    }

    @Test
    void rejectsUrlsWithoutOrganisation() {
        assertThrows(IllegalArgumentException.class, () -> GitRepository.parse("https://github.com/demo"));
        assertThrows(IllegalArgumentException.class, () -> GitRepository.parse("demo"));
    }
}
