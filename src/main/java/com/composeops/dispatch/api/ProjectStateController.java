package com.composeops.dispatch.api;

import com.composeops.core.model.ServiceState;
import com.composeops.core.state.StateAggregator;
import com.composeops.docker.ComposeStatusService;
import com.composeops.docker.ProjectStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Aggregate state of compose projects.
 */
@RestController
@RequestMapping("/api/v1")
public class ProjectStateController {

    private final ComposeStatusService composeStatusService;

    public ProjectStateController(ComposeStatusService composeStatusService) {
        this.composeStatusService = composeStatusService;
    }

    /**
     * POST /api/v1/state/aggregate: Aggregate caller-supplied service states.
     */
    @PostMapping("/state/aggregate")
    public Map<String, String> aggregate(@RequestBody List<ServiceStateBody> services) {
        List<ServiceState> states = services.stream()
                .map(s -> new ServiceState(s.name(), s.state()))
                .toList();
        return Map.of("state", StateAggregator.toStateString(StateAggregator.aggregate(states)));
    }

    /**
     * GET /api/v1/projects/state?path=: Read and aggregate a project's service states.
     */
    @GetMapping("/projects/state")
    public ProjectStateResponse projectState(@RequestParam String path) {
        ProjectStatus status = composeStatusService.status(path);
        return new ProjectStateResponse(
                status.projectPath(),
                StateAggregator.toStateString(status.state()),
                status.services().stream()
                        .map(s -> new ServiceStateBody(s.name(), s.rawState()))
                        .toList());
    }

    public record ServiceStateBody(String name, String state) {}

    public record ProjectStateResponse(
        @JsonProperty("project_path") String projectPath,
        String state,
        List<ServiceStateBody> services
    ) {}
}
