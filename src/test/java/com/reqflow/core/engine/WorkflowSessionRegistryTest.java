package com.reqflow.core.engine;

import com.reqflow.core.config.WorkflowConfig;
import com.reqflow.core.model.WorkflowPhase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowSessionRegistryTest {

    private static final WorkflowConfig CONFIG = new WorkflowConfig(Map.of(), Duration.ofSeconds(5), 1,
            Duration.ofSeconds(5), 0.7, Duration.ZERO, 1, 2, 0.85, 5);

    private static WorkflowRun run(String id) {
        return new WorkflowRun(id, CONFIG, Instant.now());
    }

    @Test
    @DisplayName("rejects a second active run with the same id")
    void rejectsDuplicate() {
        var registry = new WorkflowSessionRegistry(10);
        registry.register(run("RF-1"));

        var e = assertThrows(DuplicateRunException.class, () -> registry.register(run("RF-1")));
        assertEquals("RF-1", e.getCorrelationId());
        assertEquals(1, registry.activeCount());
    }

    @Test
    @DisplayName("archived runs free the id and stay queryable")
    void archiveFreesId() {
        var registry = new WorkflowSessionRegistry(10);
        var first = run("RF-1");
        registry.register(first);
        first.enter(WorkflowPhase.COMPLETED, Instant.now(), (prev, next) -> { });

        registry.archive(first, first.snapshot());

        assertTrue(registry.active("RF-1").isEmpty());
        assertTrue(registry.isKnown("RF-1"));
        assertEquals(WorkflowPhase.COMPLETED, registry.snapshot("RF-1").orElseThrow().phase());
        registry.register(run("RF-1"));
        assertEquals(WorkflowPhase.PENDING, registry.snapshot("RF-1").orElseThrow().phase());
    }

    @Test
    @DisplayName("archive is bounded and evicts the oldest run")
    void boundedArchive() {
        var registry = new WorkflowSessionRegistry(2);
        Optional<String> evicted = Optional.empty();
        for (String id : new String[] {"RF-1", "RF-2", "RF-3"}) {
            var r = run(id);
            registry.register(r);
            evicted = registry.archive(r, r.snapshot());
        }

        assertEquals(Optional.of("RF-1"), evicted);
        assertFalse(registry.isKnown("RF-1"));
        assertEquals(2, registry.snapshots().size());
        assertEquals("RF-2", registry.snapshots().get(0).correlationId());
    }

    @Test
    @DisplayName("unknown ids have no snapshot")
    void unknown() {
        var registry = new WorkflowSessionRegistry(2);
        assertTrue(registry.snapshot("nope").isEmpty());
        assertFalse(registry.isKnown("nope"));
    }
}
