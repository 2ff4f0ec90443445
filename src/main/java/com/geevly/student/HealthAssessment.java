package com.geevly.student;

import java.time.LocalDate;
import java.time.Period;
import java.util.Optional;

public record HealthAssessment(LocalDate assessmentDate, String bulkUploadId, double heightCm, double weightKg) {

    /**
     * Body mass index in kg/m².
     */
    public double bmi() {
        double heightM = heightCm / 100.0;
        return weightKg / (heightM * heightM);
    }

    /**
     * Classification at the student's age on the assessment date, empty when the student's sex or
     * age falls outside the reference tables.
     */
    public Optional<NutritionalStatus> nutritionalStatus(Sex sex, LocalDate dateOfBirth) {
        if (dateOfBirth == null || sex == null || sex == Sex.UNSPECIFIED) {
            return Optional.empty();
        }
        int age = Period.between(dateOfBirth, assessmentDate).getYears();
        if (age < NutritionalStatusCalculator.MIN_AGE || age > NutritionalStatusCalculator.MAX_AGE) {
            return Optional.empty();
        }
        return Optional.of(NutritionalStatusCalculator.calculate(sex, age, bmi()));
    }
}
