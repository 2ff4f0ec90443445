package com.geevly.bulkupload.processing;

import com.geevly.bulkupload.BulkUploadAggregate;
import com.geevly.bulkupload.ValidationError;
import com.geevly.eventsourcing.CommandValidationException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Row-by-row CSV handling shared by the processors. Subclasses turn a {@link CsvTable.Row} into a
 * typed row {@code R}, then optionally check the rows against each other and the live data.
 */
public abstract class AbstractCsvProcessor<R> implements BulkUploadProcessor {

    protected abstract List<String> columns();

    /**
     * Parses one row. Problems go into {@code errors}; returns {@code null} when the row is unusable.
     */
    protected abstract R parseRow(CsvTable.Row row, List<ValidationError> errors);

    protected void validateRows(BulkUploadAggregate upload, List<R> rows, List<ValidationError> errors) {
    }

    @Override
    public List<ValidationError> validate(BulkUploadAggregate upload, byte[] content) {
        CsvTable table = CsvTable.parse(content);
        List<ValidationError> errors = new ArrayList<>(table.missingColumns(columns()));
        if (!errors.isEmpty()) {
            return errors;
        }
        if (table.rows().isEmpty()) {
            return List.of(ValidationError.ofFile("upload file has no data rows"));
        }
        List<R> rows = parseAll(table, errors);
        if (errors.isEmpty()) {
            validateRows(upload, rows, errors);
        }
        return errors;
    }

    /**
     * Parses the file again for processing. A file that has stopped validating is rejected whole.
     */
    protected List<R> rows(BulkUploadAggregate upload, byte[] content) {
        List<ValidationError> errors = validate(upload, content);
        if (!errors.isEmpty()) {
            ValidationError first = errors.get(0);
            throw new CommandValidationException("upload " + upload.getId() + " no longer validates: row "
                + first.row() + ": " + first.message());
        }
        return parseAll(CsvTable.parse(content), new ArrayList<>());
    }

    private List<R> parseAll(CsvTable table, List<ValidationError> errors) {
        List<R> rows = new ArrayList<>();
        for (CsvTable.Row row : table.rows()) {
            R parsed = parseRow(row, errors);
            if (parsed != null) {
                rows.add(parsed);
            }
        }
        return rows;
    }

    // cell helpers

    protected static String required(CsvTable.Row row, String column, List<ValidationError> errors) {
        String value = row.get(column);
        if (value == null) {
            errors.add(new ValidationError(row.number(), column, column + " is required"));
        }
        return value;
    }

    protected static LocalDate date(CsvTable.Row row, String column, List<ValidationError> errors) {
        String value = required(row, column, errors);
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ex) {
            errors.add(new ValidationError(row.number(), column, column + " must be a yyyy-MM-dd date: " + value));
            return null;
        }
    }

    protected static Double positiveNumber(CsvTable.Row row, String column, List<ValidationError> errors) {
        String value = required(row, column, errors);
        if (value == null) {
            return null;
        }
        try {
            double number = Double.parseDouble(value);
            if (!(number > 0) || Double.isInfinite(number)) {
                errors.add(new ValidationError(row.number(), column, column + " must be positive: " + value));
                return null;
            }
            return number;
        } catch (NumberFormatException ex) {
            errors.add(new ValidationError(row.number(), column, column + " must be a number: " + value));
            return null;
        }
    }

    protected static Integer integer(CsvTable.Row row, String column, int min, int max, List<ValidationError> errors) {
        String value = required(row, column, errors);
        if (value == null) {
            return null;
        }
        try {
            int number = Integer.parseInt(value);
            if (number < min || number > max) {
                errors.add(new ValidationError(row.number(), column,
                    column + " must be between " + min + " and " + max + ": " + value));
                return null;
            }
            return number;
        } catch (NumberFormatException ex) {
            errors.add(new ValidationError(row.number(), column, column + " must be a whole number: " + value));
            return null;
        }
    }

    protected static String schoolId(BulkUploadAggregate upload) {
        return upload.metadata(BulkUploadAggregate.SCHOOL_ID)
            .orElseThrow(() -> new CommandValidationException("upload " + upload.getId() + " has no school_id"));
    }
}
