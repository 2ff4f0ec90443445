package com.geevly.bulkupload;

import java.time.Instant;

/**
 * One entry of a record's action log. {@code eventVersion} is the upload version that recorded it.
 */
public record RecordAction(long eventVersion, RecordType type, RecordActionReason reason, Instant timestamp) {}
