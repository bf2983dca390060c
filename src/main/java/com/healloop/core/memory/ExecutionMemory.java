package com.healloop.core.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Rolling window of {@link MemorySnapshot}s. Advisory context for contract building only;
 * nothing here is ever treated as authoritative.
 */
public class ExecutionMemory {

    private static final Logger log = LoggerFactory.getLogger(ExecutionMemory.class);

    private final BoundedHistory<MemorySnapshot> snapshots;

    public ExecutionMemory(int capacity) {
        this.snapshots = new BoundedHistory<>(capacity);
    }

    public void remember(MemorySnapshot snapshot) {
        snapshots.append(snapshot);
        log.debug("Remembered {} execution of {} ({} held)", snapshot.status(), snapshot.tool(), snapshots.size());
    }

    public List<MemorySnapshot> recent(int limit) {
        return snapshots.latest(limit);
    }
}
