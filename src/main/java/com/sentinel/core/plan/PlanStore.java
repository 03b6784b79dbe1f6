package com.sentinel.core.plan;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sentinel.core.model.ExecutionPlan;
import com.sentinel.core.runner.SentinelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the orchestrator's JSON execution plan.
 *
 * <pre>
 * { "waves": [ { "number": 1, "fileLocks": ["src/Foo.java"],
 *                "tasks": [ { "id": "TASK-001", "agentRole": "CODER", "dependencies": [] } ] } ] }
 * </pre>
 */
@Component
public class PlanStore {

    private static final Logger log = LoggerFactory.getLogger(PlanStore.class);

    private final ObjectMapper mapper;

    public PlanStore() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ExecutionPlan read(Path planFile) {
        try {
            ExecutionPlan plan = mapper.readValue(planFile.toFile(), ExecutionPlan.class);
            log.info("Loaded plan {}: {} wave(s), {} task(s)",
                    planFile.getFileName(), plan.waves().size(), plan.tasks().size());
            return plan;
        } catch (IOException e) {
            throw new SentinelException("Failed to read plan " + planFile + ": " + e.getMessage(), e);
        }
    }

    public void write(Path planFile, ExecutionPlan plan) {
        try {
            Files.writeString(planFile, mapper.writeValueAsString(plan));
            log.info("Wrote plan {} ({} task(s))", planFile.getFileName(), plan.tasks().size());
        } catch (IOException e) {
            throw new SentinelException("Failed to write plan " + planFile + ": " + e.getMessage(), e);
        }
    }
}
