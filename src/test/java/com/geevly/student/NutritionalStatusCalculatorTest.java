package com.geevly.student;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class NutritionalStatusCalculatorTest {

    @Test
    @DisplayName("girl aged 10 is classified against the age-10 row")
    void femaleAgeTen() {
        assertEquals(NutritionalStatus.SEVERELY_WASTED, NutritionalStatusCalculator.calculate(Sex.FEMALE, 10, 13.1));
        assertEquals(NutritionalStatus.WASTED, NutritionalStatusCalculator.calculate(Sex.FEMALE, 10, 13.5));
        assertEquals(NutritionalStatus.NORMAL, NutritionalStatusCalculator.calculate(Sex.FEMALE, 10, 14.5));
    }

    @Test
    @DisplayName("cut-off values themselves fall in the better band")
    void boundaries() {
        assertEquals(NutritionalStatus.WASTED, NutritionalStatusCalculator.calculate(Sex.FEMALE, 10, 13.2));
        assertEquals(NutritionalStatus.NORMAL, NutritionalStatusCalculator.calculate(Sex.FEMALE, 10, 14.0));
    }

    @Test
    @DisplayName("normal range is bounded on both sides")
    void normalRange() {
        assertTrue(NutritionalStatusCalculator.isBmiInNormalRange(Sex.MALE, 12, 18.0));
        assertFalse(NutritionalStatusCalculator.isBmiInNormalRange(Sex.MALE, 12, 21.0));
        assertFalse(NutritionalStatusCalculator.isBmiInNormalRange(Sex.MALE, 12, 14.0));
    }

    @Test
    @DisplayName("age outside 5 to 19, non-positive bmi and unspecified sex are rejected")
    void invalidInput() {
        assertThrows(IllegalArgumentException.class, () -> NutritionalStatusCalculator.calculate(Sex.FEMALE, 4, 15));
        assertThrows(IllegalArgumentException.class, () -> NutritionalStatusCalculator.calculate(Sex.FEMALE, 20, 15));
        assertThrows(IllegalArgumentException.class, () -> NutritionalStatusCalculator.calculate(Sex.MALE, 10, 0));
        assertThrows(IllegalArgumentException.class,
            () -> NutritionalStatusCalculator.calculate(Sex.UNSPECIFIED, 10, 15));
    }

    @Test
    @DisplayName("assessment derives bmi and age at the assessment date")
    void assessmentStatus() {
        HealthAssessment assessment = new HealthAssessment(LocalDate.of(2024, 3, 1), null, 140, 30);
        assertEquals(15.31, assessment.bmi(), 0.01);
        assertEquals(NutritionalStatus.NORMAL,
            assessment.nutritionalStatus(Sex.FEMALE, LocalDate.of(2014, 1, 15)).orElseThrow());
        assertTrue(assessment.nutritionalStatus(Sex.FEMALE, LocalDate.of(2021, 1, 15)).isEmpty());
    }
}
