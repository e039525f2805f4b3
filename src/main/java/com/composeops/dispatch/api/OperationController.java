package com.composeops.dispatch.api;

import com.composeops.core.model.Operation;
import com.composeops.core.model.OperationFilter;
import com.composeops.core.model.OperationStatus;
import com.composeops.core.operations.InvalidOperationArgumentException;
import com.composeops.core.operations.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST controller for operation lifecycle and log reporting.
 */
@RestController
@RequestMapping("/api/v1/operations")
public class OperationController {

    private static final Logger log = LoggerFactory.getLogger(OperationController.class);

    private final OperationRegistry registry;

    public OperationController(OperationRegistry registry) {
        this.registry = registry;
    }

    /**
     * POST /api/v1/operations: Register a new pending operation.
     */
    @PostMapping
    public ResponseEntity<OperationDetail> create(@RequestBody CreateOperationRequest request, Principal principal) {
        if (request.type() == null || request.type().isBlank()) {
            throw new InvalidOperationArgumentException("Operation type is required");
        }
        String initiatedBy = principal != null ? principal.getName() : request.initiatedBy();
        Operation operation = registry.create(request.type(), request.projectPath(), request.projectName(), initiatedBy);
        return ResponseEntity.status(HttpStatus.CREATED).body(OperationDetail.from(operation));
    }

    /**
     * GET /api/v1/operations: List operations, newest first.
     */
    @GetMapping
    public List<OperationSummary> list(
            @RequestParam(required = false) String status,
            @RequestParam(name = "initiated_by", required = false) String initiatedBy,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) Integer limit) {
        OperationStatus statusFilter = status != null ? parseStatus(status) : null;
        var filter = new OperationFilter(statusFilter, initiatedBy, from, to, limit);
        return registry.list(filter).stream()
                .map(OperationSummary::from)
                .toList();
    }

    /**
     * GET /api/v1/operations/active-count: Number of pending or running operations.
     */
    @GetMapping("/active-count")
    public Map<String, Long> activeCount() {
        return Map.of("active", registry.activeCount());
    }

    @GetMapping("/{id}")
    public OperationDetail get(@PathVariable String id) {
        return OperationDetail.from(registry.get(id));
    }

    /**
     * PUT /api/v1/operations/{id}/status: Report a status or progress change.
     */
    @PutMapping("/{id}/status")
    public OperationSummary updateStatus(@PathVariable String id, @RequestBody UpdateOperationStatusRequest request) {
        if (request.status() == null) {
            throw new InvalidOperationArgumentException("Status is required");
        }
        Operation operation = registry.transition(id, parseStatus(request.status()),
                request.progress(), request.errorMessage());
        return OperationSummary.from(operation);
    }

    /**
     * POST /api/v1/operations/{id}/logs: Append log output.
     */
    @PostMapping("/{id}/logs")
    public ResponseEntity<Void> appendLogs(@PathVariable String id, @RequestBody AppendLogsRequest request) {
        if (request.text() == null && (request.lines() == null || request.lines().isEmpty())) {
            // still validates the id
            registry.get(id);
            return ResponseEntity.noContent().build();
        }
        if (request.text() != null) {
            registry.appendLog(id, request.text());
        }
        if (request.lines() != null) {
            request.lines().forEach(line -> registry.appendLog(id, line));
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/cancel")
    public OperationSummary cancel(@PathVariable String id) {
        log.info("Cancel requested for operation {}", id);
        return OperationSummary.from(registry.cancel(id));
    }

    private static OperationStatus parseStatus(String value) {
        return OperationStatus.fromValue(value)
                .orElseThrow(() -> new InvalidOperationArgumentException("Unknown status: " + value));
    }
}
