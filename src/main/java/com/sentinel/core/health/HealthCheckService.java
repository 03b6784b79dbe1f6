package com.sentinel.core.health;

import com.sentinel.core.config.SentinelProperties;
import com.sentinel.core.probe.AvailabilityProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SentinelProperties properties;
    private final AvailabilityProbe probe;

    public HealthCheckService(SentinelProperties properties, AvailabilityProbe probe) {
        this.properties = properties;
        this.probe = probe;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkLocalTier());
        results.add(checkCloudTier());
        results.add(checkAuditDir());
        return results;
    }

    /**
     * A down local tier only costs the escalation to the cloud tier, so it reads as DEGRADED.
     */
    public HealthStatus checkLocalTier() {
        var local = properties.getTiers().getLocal();
        var metadata = Map.of("baseUrl", local.getBaseUrl(), "model", local.getModel());
        if (probe.isAvailable()) {
            return HealthStatus.up("local-tier",
                    "Local model endpoint reachable", metadata);
        }
        return HealthStatus.degraded("local-tier",
                "Local model endpoint unreachable; runs escalate to the cloud tier", metadata);
    }

    private HealthStatus checkCloudTier() {
        var cloud = properties.getTiers().getCloud();
        var metadata = Map.of("baseUrl", cloud.getBaseUrl(), "model", cloud.getModel(),
                "budgetUsd", String.valueOf(cloud.getBudgetUsd()));
        if (!cloud.hasApiKey()) {
            return HealthStatus.down("cloud-tier",
                    "No API key configured (sentinel.tiers.cloud.api-key)", metadata);
        }
        return HealthStatus.up("cloud-tier",
                "Cloud model configured (" + cloud.getModel() + ")", metadata);
    }

    private HealthStatus checkAuditDir() {
        Path dir = properties.auditDirPath();
        var metadata = Map.of("path", dir.toString());
        try {
            Files.createDirectories(dir);
            Path probeFile = Files.createTempFile(dir, ".health", ".tmp");
            Files.delete(probeFile);
            return HealthStatus.up("audit-dir",
                    "Audit directory writable", metadata);
        } catch (IOException e) {
            log.warn("Audit directory health check failed: {}", e.getMessage());
            return HealthStatus.down("audit-dir",
                    "Audit directory not writable: " + e.getMessage(), metadata);
        }
    }
}
