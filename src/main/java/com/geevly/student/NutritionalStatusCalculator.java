package com.geevly.student;

import java.util.Map;

/**
 * BMI-for-age classification for children aged 5 to 19 (WHO 2007 reference).
 *
 * <p>Each age row holds the -2 SD (wasted) and -3 SD (severely wasted) cut-offs and the upper
 * bound of the normal band.
 */
public final class NutritionalStatusCalculator {

    public static final int MIN_AGE = 5;
    public static final int MAX_AGE = 19;

    private record Thresholds(double wasted, double severelyWasted, double normalUpperBound) {}

    private static final Map<Integer, Thresholds> FEMALE = Map.ofEntries(
        Map.entry(5, new Thresholds(13.9, 13.0, 17.0)),
        Map.entry(6, new Thresholds(13.8, 12.9, 17.1)),
        Map.entry(7, new Thresholds(13.7, 12.9, 17.3)),
        Map.entry(8, new Thresholds(13.7, 12.9, 17.8)),
        Map.entry(9, new Thresholds(13.8, 13.0, 18.4)),
        Map.entry(10, new Thresholds(14.0, 13.2, 19.0)),
        Map.entry(11, new Thresholds(14.3, 13.5, 19.7)),
        Map.entry(12, new Thresholds(14.8, 14.0, 20.4)),
        Map.entry(13, new Thresholds(15.3, 14.5, 21.1)),
        Map.entry(14, new Thresholds(15.8, 15.0, 21.8)),
        Map.entry(15, new Thresholds(16.3, 15.5, 22.5)),
        Map.entry(16, new Thresholds(16.7, 15.9, 23.2)),
        Map.entry(17, new Thresholds(17.0, 16.2, 23.7)),
        Map.entry(18, new Thresholds(17.2, 16.4, 24.0)),
        Map.entry(19, new Thresholds(17.2, 16.4, 24.2))
    );

    private static final Map<Integer, Thresholds> MALE = Map.ofEntries(
        Map.entry(5, new Thresholds(13.8, 12.9, 17.0)),
        Map.entry(6, new Thresholds(13.7, 12.8, 17.2)),
        Map.entry(7, new Thresholds(13.6, 12.7, 17.4)),
        Map.entry(8, new Thresholds(13.5, 12.6, 17.9)),
        Map.entry(9, new Thresholds(13.5, 12.6, 18.4)),
        Map.entry(10, new Thresholds(13.6, 12.7, 19.0)),
        Map.entry(11, new Thresholds(13.9, 12.9, 19.6)),
        Map.entry(12, new Thresholds(14.3, 13.3, 20.3)),
        Map.entry(13, new Thresholds(14.8, 13.8, 20.9)),
        Map.entry(14, new Thresholds(15.3, 14.3, 21.5)),
        Map.entry(15, new Thresholds(15.8, 14.8, 22.1)),
        Map.entry(16, new Thresholds(16.3, 15.3, 22.6)),
        Map.entry(17, new Thresholds(16.7, 15.7, 23.0)),
        Map.entry(18, new Thresholds(17.0, 16.0, 23.3)),
        Map.entry(19, new Thresholds(17.3, 16.3, 23.6))
    );

    private NutritionalStatusCalculator() {
    }

    public static NutritionalStatus calculate(Sex sex, int age, double bmi) {
        Thresholds t = thresholds(sex, age, bmi);
        if (bmi < t.severelyWasted()) {
            return NutritionalStatus.SEVERELY_WASTED;
        }
        if (bmi < t.wasted()) {
            return NutritionalStatus.WASTED;
        }
        return NutritionalStatus.NORMAL;
    }

    public static boolean isBmiInNormalRange(Sex sex, int age, double bmi) {
        Thresholds t = thresholds(sex, age, bmi);
        return bmi >= t.wasted() && bmi <= t.normalUpperBound();
    }

    private static Thresholds thresholds(Sex sex, int age, double bmi) {
        if (age < MIN_AGE || age > MAX_AGE) {
            throw new IllegalArgumentException("age must be between " + MIN_AGE + " and " + MAX_AGE + ": " + age);
        }
        if (!(bmi > 0)) {
            throw new IllegalArgumentException("bmi must be positive: " + bmi);
        }
        if (sex == Sex.FEMALE) {
            return FEMALE.get(age);
        }
        if (sex == Sex.MALE) {
            return MALE.get(age);
        }
        throw new IllegalArgumentException("sex must be male or female: " + sex);
    }
}
