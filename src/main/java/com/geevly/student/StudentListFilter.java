package com.geevly.student;

import java.time.LocalDate;
import java.util.List;

/**
 * Optional narrowing of a student listing. Null and empty values do not filter.
 */
public record StudentListFilter(
    boolean activeOnly,
    boolean eligibleForSponsorshipOnly,
    List<String> schoolIds,
    LocalDate minDateOfBirth,
    LocalDate maxDateOfBirth,
    String nameSearch
) {

    public StudentListFilter {
        schoolIds = schoolIds == null ? List.of() : List.copyOf(schoolIds);
    }

    public static StudentListFilter none() {
        return new StudentListFilter(false, false, List.of(), null, null, null);
    }

    public static StudentListFilter forSchool(String schoolId) {
        return new StudentListFilter(false, false, List.of(schoolId), null, null, null);
    }
}
