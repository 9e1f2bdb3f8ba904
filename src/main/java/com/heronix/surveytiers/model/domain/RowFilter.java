package com.heronix.surveytiers.model.domain;

/**
 * School / year group / wave filter. A null, blank or "all" value matches
 * everything.
 */
public record RowFilter(String school, String yearGroup, String wave) {

    public static final String ALL = "all";

    public static RowFilter none() {
        return new RowFilter(ALL, ALL, ALL);
    }

    public boolean test(SurveyResponse response) {
        return matches(school, response.getSchoolId())
                && matches(yearGroup, response.getYearGroup())
                && matches(wave, response.getWave());
    }

    public boolean test(AggregateRow row) {
        return matches(school, row.getSchoolId())
                && matches(yearGroup, row.getYearGroup())
                && matches(wave, row.getWave());
    }

    private static boolean matches(String wanted, String actual) {
        return wanted == null || wanted.isBlank() || ALL.equalsIgnoreCase(wanted) || wanted.equals(actual);
    }
}
