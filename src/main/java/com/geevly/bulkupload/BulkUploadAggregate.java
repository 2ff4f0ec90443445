package com.geevly.bulkupload;

import com.geevly.bulkupload.BulkUploadEvents.Created;
import com.geevly.bulkupload.BulkUploadEvents.RecordsTracked;
import com.geevly.bulkupload.BulkUploadEvents.StatusSet;
import com.geevly.bulkupload.BulkUploadEvents.ValidationErrorsAdded;
import com.geevly.eventsourcing.AggregateRoot;
import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.Event;
import com.geevly.eventsourcing.EventRouter;
import com.geevly.eventsourcing.PayloadCodec;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A batch import and the trail it leaves downstream.
 *
 * <p>Besides its status, an upload keeps an append-only action log per downstream record
 * (queued, processed, invalidated). Undo works from that log: only records whose latest action is
 * {@link RecordActionReason#PROCESSING} still need reversing.
 */
public class BulkUploadAggregate extends AggregateRoot<BulkUploadAggregate> {

    public static final String STREAM = "bulk_upload";

    public static final String SCHOOL_ID = "school_id";
    public static final String SCHOOL_YEAR = "school_year";
    public static final String GRADING_PERIOD = "grading_period";
    public static final String EFFECTIVE_DATE = "effective_date";

    private static final Pattern SCHOOL_YEAR_FORMAT = Pattern.compile("^\\d{4}-\\d{4}$");
    private static final Pattern NUMERIC = Pattern.compile("^\\d+$");

    private static final EventRouter<BulkUploadAggregate> ROUTER = EventRouter
        .<BulkUploadAggregate, BulkUploadEventType>builder(STREAM, BulkUploadEventType.class)
        .creation(BulkUploadEventType.CREATED, Created.class, BulkUploadAggregate::onCreated)
        .on(BulkUploadEventType.STATUS_SET, StatusSet.class, (b, p, e) -> b.moveTo(p.status(), p.at()))
        .on(BulkUploadEventType.VALIDATION_ERRORS_ADDED, ValidationErrorsAdded.class, (b, p, e) -> {
            b.validationErrors.addAll(p.errors());
            b.moveTo(BulkUploadStatus.VALIDATION_FAILED, p.at());
        })
        .on(BulkUploadEventType.RECORDS_ADDED, RecordsTracked.class,
            (b, p, e) -> b.track(p, RecordActionReason.PENDING, e.version()))
        .on(BulkUploadEventType.RECORDS_PROCESSED, RecordsTracked.class,
            (b, p, e) -> b.track(p, RecordActionReason.PROCESSING, e.version()))
        .on(BulkUploadEventType.RECORDS_INVALIDATED, RecordsTracked.class,
            (b, p, e) -> b.track(p, RecordActionReason.INVALIDATED, e.version()))
        .build();

    private boolean created;
    private TargetDomain targetDomain;
    private String fileId;
    private Map<String, String> uploadMetadata = Map.of();
    private Instant initiatedAt;
    private BulkUploadStatus status = BulkUploadStatus.UNKNOWN;
    private final List<StatusChange> statusHistory = new ArrayList<>();
    private final List<ValidationError> validationErrors = new ArrayList<>();
    private final Map<String, RecordType> recordTypes = new LinkedHashMap<>();
    private final Map<String, List<RecordAction>> recordActions = new LinkedHashMap<>();

    public BulkUploadAggregate(String id, PayloadCodec codec) {
        super(id, codec);
    }

    public BulkUploadAggregate(String id, PayloadCodec codec, Clock clock) {
        super(id, codec, clock);
    }

    @Override
    protected EventRouter<BulkUploadAggregate> router() {
        return ROUTER;
    }

    @Override
    protected BulkUploadAggregate self() {
        return this;
    }

    @Override
    public boolean exists() {
        return created;
    }

    // commands

    public Event create(CreateBulkUpload cmd, Instant now, LocalDate today, BulkUploadAntiCorruptionLayer acl) {
        requireCreatable();
        if (cmd.targetDomain() == null) {
            throw new CommandValidationException("target domain is required");
        }
        if (cmd.fileId() == null || cmd.fileId().isBlank()) {
            throw new CommandValidationException("file id is required");
        }
        validateMetadata(cmd.targetDomain(), cmd.uploadMetadata(), today);
        acl.validateFileId(cmd.fileId());
        return raise(BulkUploadEventType.CREATED,
            new Created(cmd.targetDomain(), cmd.fileId(), cmd.uploadMetadata(), now), now);
    }

    public Event setStatus(BulkUploadStatus next, Instant now) {
        requireExists();
        requireTransition(next);
        return raise(BulkUploadEventType.STATUS_SET, new StatusSet(next, now), now);
    }

    public Event addValidationErrors(List<ValidationError> errors, Instant now) {
        requireExists();
        if (errors == null || errors.isEmpty()) {
            throw new CommandValidationException("no validation errors to record");
        }
        requireTransition(BulkUploadStatus.VALIDATION_FAILED);
        return raise(BulkUploadEventType.VALIDATION_ERRORS_ADDED, new ValidationErrorsAdded(List.copyOf(errors), now), now);
    }

    public Event addRecordsToProcess(List<String> recordIds, RecordType type, Instant now) {
        requireExists();
        requireStatus(BulkUploadStatus.PROCESSING);
        List<String> ids = distinct(recordIds);
        List<String> known = ids.stream().filter(recordActions::containsKey).toList();
        if (!known.isEmpty()) {
            throw new CommandValidationException("records already tracked by upload " + getId() + ": " + known);
        }
        return raise(BulkUploadEventType.RECORDS_ADDED, new RecordsTracked(ids, type, now), now);
    }

    public Event markRecordsProcessed(List<String> recordIds, RecordType type, Instant now) {
        requireExists();
        requireStatus(BulkUploadStatus.PROCESSING);
        List<String> ids = distinct(recordIds);
        List<String> unknown = ids.stream().filter(id -> !recordActions.containsKey(id)).toList();
        if (!unknown.isEmpty()) {
            throw new CommandValidationException("records not queued by upload " + getId() + ": " + unknown);
        }
        return raise(BulkUploadEventType.RECORDS_PROCESSED, new RecordsTracked(ids, type, now), now);
    }

    public Event markRecordsInvalidated(List<String> recordIds, RecordType type, Instant now) {
        requireExists();
        requireStatus(BulkUploadStatus.INVALIDATING);
        List<String> ids = distinct(recordIds);
        List<String> notProcessed = ids.stream()
            .filter(id -> lastReason(id).filter(r -> r == RecordActionReason.PROCESSING).isEmpty())
            .toList();
        if (!notProcessed.isEmpty()) {
            throw new CommandValidationException("records with nothing to undo in upload " + getId() + ": " + notProcessed);
        }
        return raise(BulkUploadEventType.RECORDS_INVALIDATED, new RecordsTracked(ids, type, now), now);
    }

    // event handlers

    private void onCreated(Created p, Event e) {
        created = true;
        targetDomain = p.targetDomain();
        fileId = p.fileId();
        uploadMetadata = p.uploadMetadata() == null ? Map.of() : Map.copyOf(p.uploadMetadata());
        initiatedAt = p.initiatedAt();
        moveTo(BulkUploadStatus.PENDING, p.initiatedAt());
    }

    private void moveTo(BulkUploadStatus next, Instant at) {
        status = next;
        statusHistory.add(new StatusChange(next, at));
    }

    private void track(RecordsTracked p, RecordActionReason reason, long version) {
        for (String id : p.recordIds()) {
            recordTypes.putIfAbsent(id, p.recordType());
            recordActions.computeIfAbsent(id, k -> new ArrayList<>())
                .add(new RecordAction(version, p.recordType(), reason, p.at()));
        }
    }

    // state

    public TargetDomain getTargetDomain() {
        return targetDomain;
    }

    public String getFileId() {
        return fileId;
    }

    public Map<String, String> getUploadMetadata() {
        return uploadMetadata;
    }

    public Optional<String> metadata(String key) {
        return Optional.ofNullable(uploadMetadata.get(key));
    }

    public Instant getInitiatedAt() {
        return initiatedAt;
    }

    public BulkUploadStatus getStatus() {
        return status;
    }

    public List<StatusChange> getStatusHistory() {
        return List.copyOf(statusHistory);
    }

    public Optional<Instant> lastEntered(BulkUploadStatus target) {
        Instant at = null;
        for (StatusChange change : statusHistory) {
            if (change.status() == target) {
                at = change.at();
            }
        }
        return Optional.ofNullable(at);
    }

    public Optional<Instant> firstEntered(BulkUploadStatus target) {
        return statusHistory.stream().filter(c -> c.status() == target).map(StatusChange::at).findFirst();
    }

    public List<ValidationError> getValidationErrors() {
        return List.copyOf(validationErrors);
    }

    public List<TrackedRecord> getRecords() {
        return recordActions.entrySet().stream()
            .map(e -> new TrackedRecord(e.getKey(), recordTypes.get(e.getKey()), e.getValue()))
            .toList();
    }

    public Optional<RecordActionReason> lastReason(String recordId) {
        List<RecordAction> actions = recordActions.get(recordId);
        return actions == null || actions.isEmpty()
            ? Optional.empty()
            : Optional.of(actions.get(actions.size() - 1).reason());
    }

    /**
     * Records whose latest action is {@link RecordActionReason#PROCESSING}, in the order they were first tracked.
     */
    public List<TrackedRecord> recordsToUndo() {
        return getRecords().stream()
            .filter(r -> r.lastReason() == RecordActionReason.PROCESSING)
            .collect(Collectors.toList());
    }

    // validation

    private void requireTransition(BulkUploadStatus next) {
        if (!status.canMoveTo(next)) {
            throw new CommandValidationException("bulk upload " + getId() + " cannot move from " + status.getValue()
                + " to " + next.getValue());
        }
    }

    private void requireStatus(BulkUploadStatus expected) {
        if (status != expected) {
            throw new CommandValidationException("bulk upload " + getId() + " is " + status.getValue()
                + ", expected " + expected.getValue());
        }
    }

    private static void validateMetadata(TargetDomain domain, Map<String, String> metadata, LocalDate today) {
        String schoolId = metadata.get(SCHOOL_ID);
        if (schoolId == null) {
            throw new CommandValidationException(SCHOOL_ID + " is required for " + domain.getValue() + " uploads");
        }
        if (domain != TargetDomain.GRADES) {
            return;
        }
        if (!NUMERIC.matcher(schoolId).matches()) {
            throw new CommandValidationException(SCHOOL_ID + " must be numeric");
        }
        String schoolYear = metadata.get(SCHOOL_YEAR);
        if (schoolYear == null || !SCHOOL_YEAR_FORMAT.matcher(schoolYear).matches()) {
            throw new CommandValidationException(SCHOOL_YEAR + " must look like YYYY-YYYY");
        }
        String gradingPeriod = metadata.get(GRADING_PERIOD);
        if (gradingPeriod == null || !NUMERIC.matcher(gradingPeriod).matches()) {
            throw new CommandValidationException(GRADING_PERIOD + " must be numeric");
        }
        String effectiveDate = metadata.get(EFFECTIVE_DATE);
        if (effectiveDate == null) {
            throw new CommandValidationException(EFFECTIVE_DATE + " is required for grade uploads");
        }
        LocalDate date;
        try {
            date = LocalDate.parse(effectiveDate);
        } catch (DateTimeParseException ex) {
            throw new CommandValidationException(EFFECTIVE_DATE + " must be a yyyy-MM-dd date");
        }
        if (date.isAfter(today)) {
            throw new CommandValidationException(EFFECTIVE_DATE + " cannot be in the future");
        }
    }

    private static List<String> distinct(List<String> recordIds) {
        if (recordIds == null || recordIds.isEmpty()) {
            throw new CommandValidationException("no record ids given");
        }
        Set<String> ids = new LinkedHashSet<>(recordIds);
        return List.copyOf(ids);
    }
}
