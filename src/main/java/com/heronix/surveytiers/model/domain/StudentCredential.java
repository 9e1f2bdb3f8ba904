package com.heronix.surveytiers.model.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A credential bound to exactly one student (school-facing PID view).
 */
@Value
@Builder
public class StudentCredential {

    String studentId;

    String schoolId;

    String studentName;

    String yearGroup;

    CredentialRecord credential;

    public String getLoginId() {
        return credential.getLoginId();
    }
}
