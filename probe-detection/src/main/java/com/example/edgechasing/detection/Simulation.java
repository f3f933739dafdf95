package com.example.edgechasing.detection;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the resource pool and the processes, wires the shared directory, runs one thread per
 * process and waits for all of them.
 */
public final class Simulation {
    private static final Logger log = LoggerFactory.getLogger(Simulation.class);

    /** Outcome of a run. */
    public record Report(int processes, int resources, List<Integer> harakiriProcessIds,
                         List<Integer> failedProcessIds, int roundsStarted, int roundsConfirmed,
                         int probesSent, long elapsedMillis) {}

    private final List<Resource> resources;
    private final List<ProcessNode> processes;
    private final DetectionCoordinator coordinator;
    private final Clock clock;

    private Simulation(List<Resource> resources, List<ProcessNode> processes,
                       DetectionCoordinator coordinator, Clock clock) {
        this.resources = resources;
        this.processes = processes;
        this.coordinator = coordinator;
        this.clock = clock;
    }

    /** Resources 1..numResources and processes 1..numProcesses, each with its own random source. */
    public static Simulation create(int numProcesses, int numResources, SimulationSettings settings) {
        return create(numProcesses, numResources, settings, Clock.systemUTC(),
                id -> new RandomResourceSelector(new Random()));
    }

    public static Simulation create(int numProcesses, int numResources, SimulationSettings settings,
                                    Clock clock, IntFunction<ResourceSelector> selectorForProcess) {
        if (numProcesses <= 0) throw new IllegalArgumentException("numProcesses must be positive: " + numProcesses);
        if (numResources <= 0) throw new IllegalArgumentException("numResources must be positive: " + numResources);
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(selectorForProcess, "selectorForProcess");

        List<Resource> resources = new ArrayList<>(numResources);
        for (int i = 1; i <= numResources; i++) {
            resources.add(new Resource(i));
        }
        log.info("created {} resources: {}", numResources, resources);

        DetectionCoordinator coordinator = new DetectionCoordinator();
        List<ProcessNode> processes = new ArrayList<>(numProcesses);
        Map<Integer, ProcessNode> byId = new LinkedHashMap<>();
        for (int i = 1; i <= numProcesses; i++) {
            ProcessNode process = new ProcessNode(i, resources, selectorForProcess.apply(i), coordinator, settings, clock);
            processes.add(process);
            byId.put(i, process);
        }
        ProcessDirectory directory = new ProcessDirectory(byId);
        for (ProcessNode process : processes) {
            process.bind(directory);
        }
        log.info("created {} processes: {}", numProcesses, processes);

        return new Simulation(Collections.unmodifiableList(resources), Collections.unmodifiableList(processes),
                coordinator, clock);
    }

    /** Starts every process and blocks until all of them have finished. */
    public Report run() throws InterruptedException {
        long started = clock.millis();
        Set<Integer> failed = ConcurrentHashMap.newKeySet();
        List<Thread> threads = new ArrayList<>(processes.size());
        for (ProcessNode process : processes) {
            Thread t = new Thread(process, "process-" + process.id());
            t.setUncaughtExceptionHandler((thread, e) -> {
                log.error("{} failed", process, e);
                failed.add(process.id());
            });
            threads.add(t);
        }
        for (Thread t : threads) {
            t.start();
        }
        try {
            for (Thread t : threads) {
                t.join();
            }
        } catch (InterruptedException e) {
            for (Thread t : threads) {
                t.interrupt();
            }
            Thread.currentThread().interrupt();
            throw e;
        }
        return report(failed, clock.millis() - started);
    }

    private Report report(Set<Integer> failed, long elapsedMillis) {
        List<Integer> harakiri = new ArrayList<>();
        int probes = 0;
        for (ProcessNode process : processes) {
            if (process.performedHarakiri()) harakiri.add(process.id());
            probes += process.probesSent();
        }
        List<Integer> failedIds = new ArrayList<>(failed);
        Collections.sort(failedIds);
        Report report = new Report(processes.size(), resources.size(), List.copyOf(harakiri), List.copyOf(failedIds),
                coordinator.roundsStarted(), coordinator.roundsConfirmed(), probes, elapsedMillis);
        log.info("simulation finished: {}", report);
        return report;
    }

    public List<Resource> resources() {
        return resources;
    }

    public List<ProcessNode> processes() {
        return processes;
    }

    public DetectionCoordinator coordinator() {
        return coordinator;
    }
}
