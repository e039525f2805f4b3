package com.composeops.docker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "composeops.docker")
public class DockerProperties {

    static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    /** Docker daemon endpoint. Falls back to DOCKER_HOST, then the local socket. */
    private String host;

    /** Command prefix used for compose invocations. */
    private String composeCommand = "docker compose";

    /** Limit for one-shot compose commands such as {@code ps} or non-following {@code logs}. */
    private Duration commandTimeout = Duration.ofMinutes(5);

    public String resolveHost() {
        if (host != null && !host.isBlank()) {
            return host;
        }
        return System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
    }

    /**
     * Compose command split into process arguments, e.g. {@code [docker, compose]}.
     */
    public List<String> composeCommandParts() {
        return Arrays.stream(composeCommand.trim().split("\\s+"))
                .filter(part -> !part.isEmpty())
                .toList();
    }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public String getComposeCommand() { return composeCommand; }
    public void setComposeCommand(String composeCommand) { this.composeCommand = composeCommand; }
    public Duration getCommandTimeout() { return commandTimeout; }
    public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
}
