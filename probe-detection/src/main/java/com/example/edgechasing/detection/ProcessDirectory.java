package com.example.edgechasing.detection;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/** Read-only id to process lookup shared by every process of one simulation. */
public final class ProcessDirectory {
    private final Map<Integer, ProcessNode> processes;

    public ProcessDirectory(Map<Integer, ProcessNode> processes) {
        this.processes = Map.copyOf(Objects.requireNonNull(processes, "processes"));
    }

    public ProcessNode lookup(int processId) {
        ProcessNode process = processes.get(processId);
        if (process == null) {
            throw new IllegalArgumentException("unknown process id " + processId);
        }
        return process;
    }

    /** Puts the probe on the receiver's mailbox. */
    public void deliver(ProbeMessage message) {
        lookup(message.receiver()).enqueue(message);
    }

    Collection<ProcessNode> all() {
        return processes.values();
    }

    int size() {
        return processes.size();
    }
}
