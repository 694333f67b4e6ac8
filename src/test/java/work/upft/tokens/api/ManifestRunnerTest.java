package work.upft.tokens.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.upft.tokens.manifest.ManifestException;
import work.upft.tokens.support.TokenTestSupport;

class ManifestRunnerTest {
    @AfterEach
    void restoreLogging() {
        Configurator.setRootLevel(Level.WARN);
    }

    @Test
    void resolvesSinglePermutationFromDisk() {
        var config = RunConfiguration.builder()
            .manifestPath(TokenTestSupport.projectDir("theme").resolve("manifest.json"))
            .inputPayload("{\"theme\":\"dark\"}")
            .build();

        var result = new ManifestRunner().run(config);

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(1, result.count());
        assertEquals(List.of("theme-dark"), result.permutationIds());
        assertEquals(Optional.of("theme"), result.name());
        assertTrue(result.permutations().get(0).resolvedTokens().isPresent());
        assertTrue(result.toPrettyJson().contains("\"ids\" : [ \"theme-dark\" ]"));
    }

    @Test
    void overridesResolutionAndGeneratesAll() {
        var config = RunConfiguration.builder()
            .manifestPath(TokenTestSupport.projectDir("theme").resolve("manifest-generate.yaml"))
            .generateAll(true)
            .resolveReferences(Optional.of(false))
            .build();

        var result = new ManifestRunner().run(config);

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(List.of("theme-light", "theme-dark"), result.permutationIds());
        var first = result.permutations().get(0);
        assertTrue(first.resolvedTokens().isEmpty());
        assertEquals(Optional.of("dist/tokens-light.json"), first.output());
    }

    @Test
    void failuresKeepTheirProblems() {
        var config = RunConfiguration.builder()
            .manifestPath(TokenTestSupport.projectDir("theme").resolve("manifest.json"))
            .inputPayload("{\"theme\":\"sepia\"}")
            .build();

        var result = new ManifestRunner().run(config);

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertTrue(result.failure().orElseThrow() instanceof ManifestException);
        assertEquals(Optional.of("Invalid input"), result.error());
        assertEquals(1, result.problems().size());
        assertTrue(result.problems().get(0).startsWith("theme: "));
        assertTrue(result.permutations().isEmpty());
        assertTrue(result.toPrettyJson().contains("\"status\" : \"failure\""));
    }

    @Test
    void configuredLogLevelIsAppliedForTheRun() {
        var config = RunConfiguration.builder()
            .manifestPath(TokenTestSupport.projectDir("theme").resolve("manifest.json"))
            .logLevel(LogLevel.parse("debug"))
            .build();

        new ManifestRunner().run(config);

        assertEquals(Level.DEBUG, LogManager.getRootLogger().getLevel());
    }

    @Test
    void unknownLogLevelsAreRejected() {
        assertEquals(Optional.empty(), LogLevel.parse(" "));
        var ex = assertThrows(IllegalArgumentException.class, () -> LogLevel.parse("chatty"));
        assertTrue(ex.getMessage().endsWith("expected trace|debug|info|warn|error|off"));
    }
}
