package com.example.edgechasing.detection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One process of the simulated distributed system.
 *
 * <p>Each pass the process asks for resources when it has none outstanding, handles at most one
 * probe from its mailbox, tries to acquire what it asked for and either starts a detection round
 * (some wait went stale) or gives back resources it has used long enough.
 *
 * <p>The request list is touched only by the thread running this process. Other processes reach
 * it only through {@link #enqueue(ProbeMessage)}.
 */
public final class ProcessNode implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ProcessNode.class);

    private final int id;
    private final List<Resource> pool;
    private final ResourceSelector selector;
    private final DetectionCoordinator coordinator;
    private final SimulationSettings settings;
    private final Clock clock;

    private final BlockingQueue<ProbeMessage> mailbox = new LinkedBlockingQueue<>();
    private final List<ResourceRequest> requests = new ArrayList<>();
    private final AtomicInteger probesSent = new AtomicInteger();

    private volatile ProcessDirectory directory;
    private volatile boolean terminated;
    private volatile boolean performedHarakiri;

    public ProcessNode(int id, List<Resource> pool, ResourceSelector selector,
                       DetectionCoordinator coordinator, SimulationSettings settings, Clock clock) {
        this.id = id;
        this.pool = List.copyOf(pool);
        this.selector = Objects.requireNonNull(selector, "selector");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Gives this process its view of the other processes. Allowed once. */
    public void bind(ProcessDirectory directory) {
        Objects.requireNonNull(directory, "directory");
        if (this.directory != null) {
            throw new IllegalStateException(this + " is already bound to a directory");
        }
        this.directory = directory;
    }

    /** Safe to call from any thread. */
    public void enqueue(ProbeMessage message) {
        mailbox.add(message);
    }

    @Override
    public void run() {
        Instant start = clock.instant();
        log.debug("starting process {}", id);
        while (Duration.between(start, clock.instant()).compareTo(settings.runBudget()) < 0) {
            if (!runPass()) {
                return;
            }
            try {
                Thread.sleep(settings.passInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted, stopping", this);
                return;
            }
        }
        log.debug("{} ran out of time", this);
    }

    /**
     * Executes one pass of the loop without sleeping.
     *
     * @return false once this process has terminated
     */
    public boolean runPass() {
        if (terminated) {
            return false;
        }
        requestResourcesIfIdle();

        if (handleProbeMessage()) {
            harakiri();
            return false;
        }

        boolean initiateDetection = false;
        Instant now = clock.instant();
        for (ResourceRequest request : requests) {
            Resource resource = request.resource();
            if (resource.isOwnedBy(this) || resource.acquireIfFree(this)) {
                continue;
            }
            if (request.hasExceeded(settings.requestTimeout(), now)) {
                log.debug("{}'s request for {} has timed out", this, resource);
                initiateDetection = true;
                break;
            }
        }

        if (initiateDetection) {
            initiateDeadlockDetection();
        } else {
            releaseResources(false);
        }
        return true;
    }

    private void requestResourcesIfIdle() {
        if (!requests.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        for (Resource resource : selector.select(pool)) {
            log.debug("{} has requested resource {}", this, resource);
            requests.add(new ResourceRequest(resource, now));
        }
    }

    /**
     * Takes at most one probe off the mailbox.
     *
     * @return true when the probe came back to its initiator, i.e. this process sits on a cycle
     */
    private boolean handleProbeMessage() {
        ProbeMessage probe = mailbox.poll();
        if (probe == null) {
            return false;
        }
        log.debug("{} has received probe {}", this, probe);
        if (probe.initiatedBy(id)) {
            log.info("deadlock detected by process {}", id);
            coordinator.confirmRound();
            return true;
        }
        sendProbesToNeighbours(holder -> probe.forward(id, holder));
        return false;
    }

    private void initiateDeadlockDetection() {
        if (!coordinator.tryBeginRound()) {
            log.debug("{} skips detection, a round is already running", this);
            return;
        }
        log.info("process {} initiating deadlock detection", id);
        sendProbesToNeighbours(holder -> new ProbeMessage(id, id, holder));
    }

    /** Neighbours are the current holders of resources this process has waited on for too long. */
    private void sendProbesToNeighbours(IntFunction<ProbeMessage> probeForHolder) {
        Instant now = clock.instant();
        for (ResourceRequest request : requests) {
            if (!request.hasExceeded(settings.requestTimeout(), now)) {
                continue;
            }
            Optional<ProcessNode> holder = request.resource().currentOwner();
            if (holder.isEmpty() || holder.get() == this) {
                continue;
            }
            ProbeMessage probe = probeForHolder.apply(holder.get().id());
            log.debug("{} sending probe {} to {}", this, probe, holder.get());
            directory().deliver(probe);
            probesSent.incrementAndGet();
        }
    }

    /** Breaks the cycle by dropping every request and giving back everything held. */
    private void harakiri() {
        log.info("process {} performing harakiri to break the deadlock", id);
        releaseResources(true);
        performedHarakiri = true;
        terminated = true;
    }

    /**
     * Gives back held resources whose usage time is over. With {@code force} every request is
     * dropped regardless of age; resources owned by other processes are never touched.
     */
    private void releaseResources(boolean force) {
        Instant now = clock.instant();
        Iterator<ResourceRequest> it = requests.iterator();
        while (it.hasNext()) {
            ResourceRequest request = it.next();
            Resource resource = request.resource();
            if (force) {
                if (resource.releaseIfOwnedBy(this)) {
                    log.debug("{} has released resource {}", this, resource);
                } else {
                    log.debug("{} has dropped its request for {}", this, resource);
                }
                it.remove();
            } else if (resource.isOwnedBy(this) && request.hasExceeded(settings.usageTime(), now)) {
                resource.releaseIfOwnedBy(this);
                log.debug("{} has released resource {}", this, resource);
                it.remove();
            }
        }
    }

    private ProcessDirectory directory() {
        ProcessDirectory d = directory;
        if (d == null) {
            throw new IllegalStateException(this + " has no directory bound");
        }
        return d;
    }

    public int id() {
        return id;
    }

    public boolean isTerminated() {
        return terminated;
    }

    public boolean performedHarakiri() {
        return performedHarakiri;
    }

    public int probesSent() {
        return probesSent.get();
    }

    public int pendingProbeCount() {
        return mailbox.size();
    }

    /** Snapshot of the mailbox in arrival order. */
    List<ProbeMessage> queuedProbes() {
        return List.copyOf(mailbox);
    }

    /** Resources this process currently owns. Call from the owning thread or after it finished. */
    public List<Resource> heldResources() {
        List<Resource> held = new ArrayList<>();
        for (ResourceRequest request : requests) {
            if (request.resource().isOwnedBy(this)) held.add(request.resource());
        }
        return held;
    }

    /** Resources with an outstanding request, granted or not. Same threading rule as {@link #heldResources()}. */
    public List<Resource> requestedResources() {
        List<Resource> requested = new ArrayList<>(requests.size());
        for (ResourceRequest request : requests) requested.add(request.resource());
        return requested;
    }

    @Override
    public String toString() {
        return "(Process " + id + ")";
    }
}
