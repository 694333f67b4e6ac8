package work.upft.tokens.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import work.upft.tokens.support.TokenTestSupport;

class MainTest {
    @Test
    void resolvesManifestFromCommandLine() {
        var manifest = TokenTestSupport.projectDir("theme").resolve("manifest.json").toString();
        assertEquals(0, Main.execute("--manifest", manifest, "--input", "{\"theme\":\"light\"}", "--no-resolve-references"));
    }

    @Test
    void invalidInputExitsWithFailure() {
        var manifest = TokenTestSupport.projectDir("theme").resolve("manifest.json").toString();
        assertEquals(1, Main.execute("--manifest", manifest, "--input", "{\"colors\":[\"yellow\"]}"));
    }

    @Test
    void unknownLogLevelIsAUsageError() {
        var manifest = TokenTestSupport.projectDir("theme").resolve("manifest.json").toString();
        assertEquals(2, Main.execute("--manifest", manifest, "--log-level", "chatty"));
    }
}
