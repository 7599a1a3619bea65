package com.reqflow.core.engine;

import com.reqflow.core.config.ReqflowProperties;
import com.reqflow.core.model.WorkflowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks workflow runs by correlation id: at most one active run per id, plus a bounded
 * archive of finished runs for status queries.
 * <p>
 * Lifecycle: a run is registered on submission, moved to the archive when it reaches a
 * terminal phase, and dropped once newer runs push it out of the archive.
 */
@Component
public class WorkflowSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkflowSessionRegistry.class);

    private final ConcurrentHashMap<String, WorkflowRun> active = new ConcurrentHashMap<>();
    private final LinkedHashMap<String, WorkflowSnapshot> archive = new LinkedHashMap<>();
    private final int archiveSize;

    @Autowired
    public WorkflowSessionRegistry(ReqflowProperties properties) {
        this(properties.getWorkflow().getArchiveSize());
    }

    public WorkflowSessionRegistry(int archiveSize) {
        if (archiveSize < 1) {
            throw new IllegalArgumentException("archiveSize must be at least 1: " + archiveSize);
        }
        this.archiveSize = archiveSize;
    }

    /**
     * @throws DuplicateRunException if a run with the same id is active
     */
    public void register(WorkflowRun run) {
        if (active.putIfAbsent(run.correlationId(), run) != null) {
            throw new DuplicateRunException(run.correlationId());
        }
        log.debug("Registered workflow {}", run.correlationId());
    }

    public Optional<WorkflowRun> active(String correlationId) {
        return Optional.ofNullable(active.get(correlationId));
    }

    /**
     * Moves a finished run into the archive.
     *
     * @return the id pushed out of the archive to make room, if any
     */
    public Optional<String> archive(WorkflowRun run, WorkflowSnapshot snapshot) {
        String evicted = null;
        synchronized (archive) {
            archive.remove(run.correlationId());
            archive.put(run.correlationId(), snapshot);
            if (archive.size() > archiveSize) {
                var eldest = archive.keySet().iterator().next();
                archive.remove(eldest);
                evicted = eldest;
            }
        }
        active.remove(run.correlationId(), run);
        return Optional.ofNullable(evicted);
    }

    /**
     * Live snapshot of an active run, otherwise the archived one.
     */
    public Optional<WorkflowSnapshot> snapshot(String correlationId) {
        WorkflowRun run = active.get(correlationId);
        if (run != null) {
            return Optional.of(run.snapshot());
        }
        synchronized (archive) {
            return Optional.ofNullable(archive.get(correlationId));
        }
    }

    public boolean isKnown(String correlationId) {
        if (active.containsKey(correlationId)) {
            return true;
        }
        synchronized (archive) {
            return archive.containsKey(correlationId);
        }
    }

    public int activeCount() {
        return active.size();
    }

    /**
     * Snapshots of every known run, archived ones first, oldest first.
     */
    public List<WorkflowSnapshot> snapshots() {
        var all = new LinkedHashMap<String, WorkflowSnapshot>();
        synchronized (archive) {
            all.putAll(archive);
        }
        active.forEach((id, run) -> all.put(id, run.snapshot()));
        return new ArrayList<>(all.values());
    }
}
