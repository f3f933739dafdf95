package com.example.edgechasing.detection;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A process's claim on a resource, pending or granted. The creation instant is never reset:
 * it drives both the stale-wait check and the voluntary release check.
 */
public final class ResourceRequest {
    private final Resource resource;
    private final Instant createdAt;

    public ResourceRequest(Resource resource, Instant createdAt) {
        this.resource = Objects.requireNonNull(resource, "resource");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public Resource resource() {
        return resource;
    }

    /** True when strictly more than {@code threshold} has passed between creation and {@code now}. */
    public boolean hasExceeded(Duration threshold, Instant now) {
        return Duration.between(createdAt, now).compareTo(threshold) > 0;
    }

    @Override
    public String toString() {
        return "request for " + resource + " at " + createdAt;
    }
}
