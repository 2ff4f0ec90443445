package com.geevly.school;

import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.PayloadCodec;
import com.geevly.eventsourcing.VersionConflictException;
import com.geevly.school.SchoolCommands.CreateSchool;
import com.geevly.school.SchoolCommands.SetActive;
import com.geevly.school.SchoolCommands.UpdateSchool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchoolAggregateTest {

    private final SchoolAggregate school = new SchoolAggregate("3", PayloadCodec.defaultCodec());

    @Test
    @DisplayName("new school is active with trimmed details")
    void create() {
        school.create(new CreateSchool("  San Isidro ES ", " Mrs. Dela Cruz", null));
        assertTrue(school.isActive());
        assertEquals("San Isidro ES", school.getName());
        assertEquals("Mrs. Dela Cruz", school.getPrincipal());
        assertEquals(1, school.getVersion());
    }

    @Test
    @DisplayName("blank name is rejected")
    void blankName() {
        assertThrows(CommandValidationException.class, () -> school.create(new CreateSchool(" ", null, null)));
        assertFalse(school.exists());
    }

    @Test
    @DisplayName("activation toggles only when the state changes")
    void setActive() {
        school.create(new CreateSchool("San Isidro ES", null, null));
        school.setActive(new SetActive(1, false));
        assertFalse(school.isActive());
        assertThrows(CommandValidationException.class, () -> school.setActive(new SetActive(2, false)));
    }

    @Test
    @DisplayName("update with a stale version is a conflict")
    void staleUpdate() {
        school.create(new CreateSchool("San Isidro ES", null, null));
        school.update(new UpdateSchool(1, "San Isidro Elementary", null, "0917"));
        assertThrows(VersionConflictException.class,
            () -> school.update(new UpdateSchool(1, "Other", null, null)));
        assertEquals("San Isidro Elementary", school.getName());
    }
}
