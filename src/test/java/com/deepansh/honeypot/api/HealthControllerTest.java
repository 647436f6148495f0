package com.deepansh.honeypot.api;

import com.deepansh.honeypot.intel.ScamIntelligenceStore;
import com.deepansh.honeypot.observability.HoneypotMetrics;
import com.deepansh.honeypot.session.ActiveSessionStore;
import com.deepansh.honeypot.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class HealthControllerTest {

    private MutableClock clock;
    private HoneypotMetrics metrics;
    private ActiveSessionStore activeStore;
    private ScamIntelligenceStore scamStore;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-04-01T00:00:00Z");
        metrics = new HoneypotMetrics(new SimpleMeterRegistry(), clock);
        activeStore = mock(ActiveSessionStore.class);
        scamStore = mock(ScamIntelligenceStore.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(metrics, activeStore, scamStore)).build();
    }

    @Test
    void health_isHealthy() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void ping_isPong() throws Exception {
        mockMvc.perform(get("/ping"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pong"));
    }

    @Test
    void metrics_reportsCountersAndUptime() throws Exception {
        metrics.recordRequest();
        metrics.recordRequest();
        metrics.recordFlaggedTurn();
        clock.advance(Duration.ofSeconds(90));
        when(activeStore.countActive()).thenReturn(3L);
        when(scamStore.countPending()).thenReturn(1L);

        mockMvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requestsReceived").value(2))
                .andExpect(jsonPath("$.scamsDetected").value(1))
                .andExpect(jsonPath("$.activeSessions").value(3))
                .andExpect(jsonPath("$.pendingReports").value(1))
                .andExpect(jsonPath("$.uptimeSeconds").value(90));
    }
}
