package com.composeops.docker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DockerCliProcessRunnerTest {

    @Test
    void prefixesArgumentsWithTheComposeCommand() {
        var runner = new DockerCliProcessRunner(new DockerProperties());

        assertEquals(List.of("docker", "compose", "ps", "--all"), runner.buildCommand(List.of("ps", "--all")));
    }

    @Test
    void supportsLegacyStandaloneBinary() {
        var properties = new DockerProperties();
        properties.setComposeCommand("  docker-compose ");

        assertEquals(List.of("docker-compose", "logs"), new DockerCliProcessRunner(properties).buildCommand(List.of("logs")));
    }

    @Test
    void configuredHostWins() {
        var properties = new DockerProperties();
        properties.setHost("tcp://docker:2375");

        assertEquals("tcp://docker:2375", properties.resolveHost());
    }

    @Test
    void missingExecutableIsAFailedResult() {
        var properties = new DockerProperties();
        properties.setComposeCommand("composeops-no-such-binary-xyz");

        CommandResult result = new DockerCliProcessRunner(properties).run(Path.of("."), List.of("ps"));

        assertFalse(result.success());
        assertNotNull(result.error());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void capturesOutputOfASuccessfulCommand(@TempDir Path dir) {
        var properties = new DockerProperties();
        properties.setComposeCommand("echo");

        CommandResult result = new DockerCliProcessRunner(properties).run(dir, List.of("hello", "compose"));

        assertTrue(result.success());
        assertEquals("hello compose", result.output());
        assertNull(result.error());
        assertEquals(0, result.exitCode());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void hungCommandIsKilledAtTheTimeout(@TempDir Path dir) {
        var properties = new DockerProperties();
        properties.setComposeCommand("sleep");
        properties.setCommandTimeout(Duration.ofMillis(300));
        var runner = new DockerCliProcessRunner(properties);

        long started = System.nanoTime();
        CommandResult result = assertTimeoutPreemptively(Duration.ofSeconds(3),
                () -> runner.run(dir, List.of("10")));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertFalse(result.success());
        assertTrue(result.error().contains("timed out"), result.error());
        assertTrue(elapsedMillis < 3_000, "returned after " + elapsedMillis + "ms");
    }
}
