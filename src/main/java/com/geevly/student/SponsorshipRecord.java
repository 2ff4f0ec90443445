package com.geevly.student;

import java.time.LocalDate;

public record SponsorshipRecord(String sponsorId, LocalDate startDate, LocalDate endDate) {

    public boolean isActiveOn(LocalDate date) {
        return !startDate.isAfter(date) && (endDate == null || !endDate.isBefore(date));
    }
}
