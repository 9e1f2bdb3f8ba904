package com.heronix.surveytiers.model.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Generated student.
 *
 * The id is the upper-cased school id followed by a counter shared across all
 * schools (e.g. "CHERWELL-1031"). The name is personally identifying and never
 * leaves the school tier.
 */
@Value
@Builder
public class Student {

    String id;

    String schoolId;

    String yearGroup;

    String name;

    /**
     * Secondary reporting dimension (ethnicity-like).
     */
    String demographicGroup;
}
