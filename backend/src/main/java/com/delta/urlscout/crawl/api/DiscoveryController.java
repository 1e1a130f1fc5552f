package com.delta.urlscout.crawl.api;

import com.delta.urlscout.crawl.model.DiscoveryRequest;
import com.delta.urlscout.crawl.model.DiscoveryResult;
import com.delta.urlscout.crawl.model.DiscoveryRunStatus;
import com.delta.urlscout.crawl.service.DiscoveryConfigurationException;
import com.delta.urlscout.crawl.service.DiscoveryRunService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.ACCEPTED;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/discovery")
public class DiscoveryController {
    private final DiscoveryRunService discoveryRunService;

    public DiscoveryController(DiscoveryRunService discoveryRunService) {
        this.discoveryRunService = discoveryRunService;
    }

    @PostMapping("/runs")
    public ResponseEntity<DiscoveryRunStatus> startRun(@RequestBody(required = false) DiscoveryApiRunRequest request) {
        if (request == null || request.baseUrl() == null || request.baseUrl().isBlank()) {
            throw new DiscoveryConfigurationException("baseUrl is required");
        }
        DiscoveryRunStatus status = discoveryRunService.startAsync(
            new DiscoveryRequest(request.baseUrl().trim(), request.maxPages(), request.phases())
        );
        return ResponseEntity.status(ACCEPTED).body(status);
    }

    @GetMapping("/runs/{runId}")
    public DiscoveryRunStatus getRun(@PathVariable("runId") String runId) {
        DiscoveryRunStatus status = discoveryRunService.getStatus(runId);
        if (status == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown discovery run " + runId);
        }
        return status;
    }

    @GetMapping("/runs/{runId}/result")
    public DiscoveryResult getResult(@PathVariable("runId") String runId) {
        DiscoveryResult result = discoveryRunService.getResult(runId);
        if (result == null) {
            throw new ResponseStatusException(NOT_FOUND, "No result for discovery run " + runId);
        }
        return result;
    }

    @PostMapping("/runs/{runId}/cancel")
    public DiscoveryRunStatus cancelRun(@PathVariable("runId") String runId) {
        DiscoveryRunStatus status = discoveryRunService.cancel(runId);
        if (status == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown discovery run " + runId);
        }
        return status;
    }
}
