package com.dive.orchestrator.api;

import com.dive.orchestrator.api.dto.DependencyLevelsResponse;
import com.dive.orchestrator.phase.ServicesPhaseHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /dependencies: the configured service graph as startup levels.
 */
@RestController
public class DependencyController {

    private final ServicesPhaseHandler services;

    public DependencyController(ServicesPhaseHandler services) {
        this.services = services;
    }

    @GetMapping("/dependencies")
    public DependencyLevelsResponse levels() {
        return DependencyLevelsResponse.from(services.graph());
    }
}
