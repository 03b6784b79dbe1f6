package com.sentinel.core.health;

import com.sentinel.core.config.SentinelProperties;
import com.sentinel.core.probe.AvailabilityProbe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path root;

    private SentinelProperties props;
    private AvailabilityProbe probe;

    @BeforeEach
    void setUp() {
        props = new SentinelProperties();
        props.setProjectRoot(root.toString());
        probe = mock(AvailabilityProbe.class);
    }

    private static HealthStatus find(List<HealthStatus> results, String component) {
        return results.stream().filter(s -> component.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns local-tier, cloud-tier, audit-dir components")
    void checkAllReturnsAllComponents() {
        var components = new HealthCheckService(props, probe).checkAll().stream()
                .map(HealthStatus::component).toList();
        assertEquals(List.of("local-tier", "cloud-tier", "audit-dir"), components);
    }

    @Test
    @DisplayName("Unreachable local tier -> DEGRADED, reachable -> UP")
    void localTier() {
        var service = new HealthCheckService(props, probe);
        when(probe.isAvailable()).thenReturn(false);
        assertEquals(HealthStatus.Status.DEGRADED, service.checkLocalTier().status());

        when(probe.isAvailable()).thenReturn(true);
        assertEquals(HealthStatus.Status.UP, service.checkLocalTier().status());
    }

    @Test
    @DisplayName("Missing cloud API key -> DOWN")
    void cloudTier() {
        var service = new HealthCheckService(props, probe);
        assertEquals(HealthStatus.Status.DOWN, find(service.checkAll(), "cloud-tier").status());

        props.getTiers().getCloud().setApiKey("sk-test");
        assertEquals(HealthStatus.Status.UP, find(service.checkAll(), "cloud-tier").status());
    }

    @Test
    @DisplayName("Writable audit directory -> UP")
    void auditDir() {
        var status = find(new HealthCheckService(props, probe).checkAll(), "audit-dir");
        assertEquals(HealthStatus.Status.UP, status.status());
        assertTrue(root.resolve(".sentinel/runs").toFile().isDirectory());
    }

    @Test
    @DisplayName("Actuator indicator maps DEGRADED through")
    void indicator() {
        when(probe.isAvailable()).thenReturn(false);
        Health health = new LocalTierHealthIndicator(new HealthCheckService(props, probe)).health();
        assertEquals(new Status("DEGRADED"), health.getStatus());
        assertEquals("http://localhost:1234", health.getDetails().get("baseUrl"));
    }
}
