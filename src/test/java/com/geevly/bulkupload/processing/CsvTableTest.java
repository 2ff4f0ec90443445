package com.geevly.bulkupload.processing;

import com.geevly.bulkupload.ValidationError;
import com.geevly.eventsourcing.CommandValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvTableTest {

    private static byte[] csv(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("headers are matched case-insensitively and a byte order mark is ignored")
    void normalisesHeaders() {
        CsvTable table = CsvTable.parse(csv("\uFEFFLRN, Height_CM ,weight_kg\n1001,140,30\n"));
        assertEquals(List.of("lrn", "height_cm", "weight_kg"), table.headers());
        assertEquals("140", table.rows().get(0).get("height_cm"));
    }

    @Test
    @DisplayName("rows are numbered from 1, blank cells read as null and empty lines are skipped")
    void rows() {
        CsvTable table = CsvTable.parse(csv("lrn,grade\n1001,90\n\n1002,\n"));
        assertEquals(2, table.rows().size());
        assertEquals(1, table.rows().get(0).number());
        assertNull(table.rows().get(1).get("grade"));
    }

    @Test
    @DisplayName("quoted cells may contain separators")
    void quotedCells() {
        CsvTable table = CsvTable.parse(csv("first_name,last_name\n\"Ma, Luisa\",Reyes\n"));
        assertEquals("Ma, Luisa", table.rows().get(0).get("first_name"));
    }

    @Test
    @DisplayName("missing columns are reported against row 0")
    void missingColumns() {
        CsvTable table = CsvTable.parse(csv("lrn\n1001\n"));
        List<ValidationError> errors = table.missingColumns(List.of("lrn", "grade"));
        assertEquals(1, errors.size());
        assertEquals(0, errors.get(0).row());
        assertEquals("grade", errors.get(0).field());
    }

    @Test
    @DisplayName("empty content is rejected")
    void emptyContent() {
        assertThrows(CommandValidationException.class, () -> CsvTable.parse(new byte[0]));
    }
}
