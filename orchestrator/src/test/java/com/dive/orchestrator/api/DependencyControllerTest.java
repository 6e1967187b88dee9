package com.dive.orchestrator.api;

import com.dive.orchestrator.phase.ServicesPhaseHandler;
import com.dive.orchestrator.scheduler.DependencyGraph;
import com.dive.orchestrator.scheduler.DependencyScheduler;
import com.dive.orchestrator.scheduler.ServiceNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DependencyController.class)
class DependencyControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean ServicesPhaseHandler services;

    @Test
    void levels_groupsServicesByStartupWave() throws Exception {
        // graph construction touches none of the scheduler's collaborators
        DependencyScheduler scheduler = new DependencyScheduler(null, null, null, Clock.systemUTC(),
                1.5, 50, Duration.ofSeconds(1), Duration.ofSeconds(10));
        DependencyGraph graph = scheduler.buildGraph(List.of(
                ServiceNode.of("postgres"),
                ServiceNode.of("mongodb"),
                ServiceNode.of("keycloak", "postgres"),
                ServiceNode.of("backend", "keycloak", "mongodb")));
        when(services.graph()).thenReturn(graph);

        mockMvc.perform(get("/dependencies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxLevel").value(2))
                .andExpect(jsonPath("$.levels[0].level").value(0))
                .andExpect(jsonPath("$.levels[0].services[0]").value("mongodb"))
                .andExpect(jsonPath("$.levels[0].services[1]").value("postgres"))
                .andExpect(jsonPath("$.levels[1].services[0]").value("keycloak"))
                .andExpect(jsonPath("$.levels[2].services[0]").value("backend"));
    }
}
