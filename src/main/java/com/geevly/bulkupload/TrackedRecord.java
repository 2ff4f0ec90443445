package com.geevly.bulkupload;

import java.util.List;

public record TrackedRecord(String recordId, RecordType type, List<RecordAction> actions) {

    public TrackedRecord {
        actions = List.copyOf(actions);
    }

    public RecordActionReason lastReason() {
        return actions.isEmpty() ? null : actions.get(actions.size() - 1).reason();
    }

    public boolean wasProcessed() {
        return actions.stream().anyMatch(a -> a.reason() == RecordActionReason.PROCESSING);
    }
}
