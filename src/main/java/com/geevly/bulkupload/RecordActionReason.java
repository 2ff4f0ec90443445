package com.geevly.bulkupload;

public enum RecordActionReason {
    /** Queued for processing. */
    PENDING,
    /** Written downstream; an undo has to reverse it. */
    PROCESSING,
    /** Reversed by an undo. */
    INVALIDATED
}
