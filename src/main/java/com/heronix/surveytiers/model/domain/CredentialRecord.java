package com.heronix.surveytiers.model.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Identifiable login credential issued by a school.
 */
@Value
@Builder
public class CredentialRecord {

    String schoolId;

    /**
     * Login id, "&lt;schoolId&gt;-&lt;suffix&gt;", unique within the school.
     */
    String loginId;

    String password;

    /**
     * Per-school five digit base number drawn for the batch (legacy field).
     */
    int issueBatch;
}
