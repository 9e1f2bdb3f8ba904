package com.heronix.surveytiers.model.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Student id to UID mapping held by the TTP.
 */
@Value
@Builder
public class RewriteMapEntry {

    String schoolId;

    String studentId;

    /**
     * Sequential zero-padded pseudonym (e.g. "UID-00042").
     */
    String uid;
}
