package com.geevly.eventsourcing;

/**
 * The caller's expected version is stale. Reload and retry.
 */
public class VersionConflictException extends DomainException {

    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String aggregateId, long expectedVersion, long actualVersion) {
        super("version conflict on " + aggregateId + ": expected " + expectedVersion + " but was " + actualVersion);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public VersionConflictException(String aggregateId, long expectedVersion, Throwable cause) {
        super("version conflict on " + aggregateId + ": version " + expectedVersion + " already stored", cause);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = -1;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
