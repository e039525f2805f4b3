package com.composeops.docker;

import com.composeops.core.streaming.LogSource;
import com.composeops.core.streaming.StreamingProperties;
import org.springframework.stereotype.Component;

/**
 * Builds docker-backed log sources with the configured defaults applied.
 */
@Component
public class DockerLogSources {

    private final ProcessRunner processRunner;
    private final ContainerLogReader containerLogReader;
    private final StreamingProperties properties;

    public DockerLogSources(ProcessRunner processRunner, ContainerLogReader containerLogReader,
                            StreamingProperties properties) {
        this.processRunner = processRunner;
        this.containerLogReader = containerLogReader;
        this.properties = properties;
    }

    /**
     * @param follow overrides {@code composeops.streaming.follow-compose-logs} when non-null
     */
    public LogSource compose(String projectPath, String serviceName, Integer tail, Boolean follow) {
        boolean effectiveFollow = follow != null ? follow : properties.isFollowComposeLogs();
        return new ComposeLogSource(processRunner, projectPath, serviceName, tail, effectiveFollow);
    }

    public LogSource container(String containerId, Integer tail, boolean follow) {
        int effectiveTail = tail != null ? tail : properties.getDefaultTail();
        return new ContainerLogSource(containerLogReader, containerId, effectiveTail, true, follow);
    }
}
