package com.heronix.surveytiers.model.enums;

import java.util.EnumSet;
import java.util.Set;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Fields an aggregation may group by.
 */
@Getter
@RequiredArgsConstructor
public enum GroupingField {

    SCHOOL("school", "All schools"),

    YEAR_GROUP("yearGroup", "All year groups"),

    WAVE("wave", "All waves"),

    /**
     * Secondary (ethnicity-like) reporting dimension
     */
    DEMOGRAPHIC_GROUP("demographicGroup", "All demographic groups"),

    TTP("ttp", "All TTPs");

    /**
     * Name used in request parameters
     */
    private final String key;

    /**
     * Value placed in a row when the field is not part of the grouping
     */
    private final String allLabel;

    /**
     * Get GroupingField from its key or enum name.
     *
     * @param value e.g. "yearGroup" or "YEAR_GROUP"
     * @return matching GroupingField
     * @throws IllegalArgumentException if value not found
     */
    public static GroupingField fromKey(String value) {
        String trimmed = value == null ? "" : value.trim();
        for (GroupingField field : values()) {
            if (field.key.equalsIgnoreCase(trimmed) || field.name().equalsIgnoreCase(trimmed)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown grouping field: " + value);
    }

    /**
     * The requested fields plus WAVE, which every grouping includes.
     */
    public static Set<GroupingField> withWave(Set<GroupingField> fields) {
        EnumSet<GroupingField> result = EnumSet.of(WAVE);
        result.addAll(fields);
        return result;
    }

    /**
     * School, year group and wave.
     */
    public static Set<GroupingField> standard() {
        return EnumSet.of(SCHOOL, YEAR_GROUP, WAVE);
    }
}
