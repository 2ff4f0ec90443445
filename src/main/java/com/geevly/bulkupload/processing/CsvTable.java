package com.geevly.bulkupload.processing;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.geevly.bulkupload.ValidationError;
import com.geevly.eventsourcing.CommandValidationException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A CSV file with a header line. Column names are matched case-insensitively; data rows are
 * numbered from 1.
 */
public final class CsvTable {

    private static final CsvMapper MAPPER = CsvMapper.builder()
        .enable(CsvParser.Feature.WRAP_AS_ARRAY)
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .enable(CsvParser.Feature.TRIM_SPACES)
        .build();

    private final List<String> headers;
    private final List<Row> rows;

    private CsvTable(List<String> headers, List<Row> rows) {
        this.headers = headers;
        this.rows = rows;
    }

    public static CsvTable parse(byte[] content) {
        if (content == null || content.length == 0) {
            throw new CommandValidationException("upload file is empty");
        }
        List<String[]> lines;
        try (MappingIterator<String[]> it = MAPPER.readerFor(String[].class).readValues(content)) {
            lines = it.readAll();
        } catch (IOException | RuntimeException ex) {
            throw new CommandValidationException("upload file is not valid CSV: " + ex.getMessage());
        }
        if (lines.isEmpty()) {
            throw new CommandValidationException("upload file has no header line");
        }
        List<String> headers = new ArrayList<>();
        for (String header : lines.get(0)) {
            headers.add(normalize(header));
        }
        List<Row> rows = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String[] cells = lines.get(i);
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < headers.size() && c < cells.length; c++) {
                String cell = cells[c] == null ? null : cells[c].trim();
                values.put(headers.get(c), cell == null || cell.isEmpty() ? null : cell);
            }
            rows.add(new Row(i, values));
        }
        return new CsvTable(List.copyOf(headers), List.copyOf(rows));
    }

    public List<String> headers() {
        return headers;
    }

    public List<Row> rows() {
        return rows;
    }

    public List<ValidationError> missingColumns(List<String> required) {
        List<ValidationError> errors = new ArrayList<>();
        for (String column : required) {
            if (!headers.contains(column)) {
                errors.add(new ValidationError(0, column, "missing column " + column));
            }
        }
        return errors;
    }

    private static String normalize(String header) {
        String h = header == null ? "" : header.trim();
        if (h.startsWith("\uFEFF")) {
            h = h.substring(1);
        }
        return h.toLowerCase(Locale.ROOT);
    }

    public record Row(int number, Map<String, String> values) {

        public String get(String column) {
            return values.get(column);
        }
    }
}
