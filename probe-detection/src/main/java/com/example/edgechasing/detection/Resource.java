package com.example.edgechasing.detection;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An exclusive unit of contention. Ownership changes only under the resource's own lock,
 * so at any instant a resource is free or owned by exactly one process.
 */
public final class Resource {
    private static final Logger log = LoggerFactory.getLogger(Resource.class);

    private final int id;
    private final ReentrantLock lock = new ReentrantLock();
    private ProcessNode owner;

    public Resource(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    /** Assigns this resource to {@code process} if nobody owns it; returns whether it was granted. */
    public boolean acquireIfFree(ProcessNode process) {
        lock.lock();
        try {
            if (owner != null) return false;
            log.debug("assigning resource {} to process {}", this, process);
            owner = process;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Snapshot of the current owner. */
    public Optional<ProcessNode> currentOwner() {
        lock.lock();
        try {
            return Optional.ofNullable(owner);
        } finally {
            lock.unlock();
        }
    }

    /** Clears the owner unconditionally. Releasing a free resource is a no-op. */
    public void release() {
        lock.lock();
        try {
            owner = null;
        } finally {
            lock.unlock();
        }
    }

    /** Clears the owner only when it is {@code process}; returns whether anything was released. */
    boolean releaseIfOwnedBy(ProcessNode process) {
        lock.lock();
        try {
            if (owner != process) return false;
            owner = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean isOwnedBy(ProcessNode process) {
        lock.lock();
        try {
            return owner == process;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "(Resource " + id + ")";
    }
}
