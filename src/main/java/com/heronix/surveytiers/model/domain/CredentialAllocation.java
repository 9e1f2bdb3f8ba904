package com.heronix.surveytiers.model.domain;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Result of issuing and assigning credentials for one run.
 */
@Value
@Builder
public class CredentialAllocation {

    /**
     * Every issued credential, grouped by school in catalog order.
     */
    List<CredentialRecord> credentials;

    /**
     * One entry per student, in student generation order.
     */
    List<StudentCredential> studentCredentials;

    /**
     * Surplus credentials left unassigned, kept for school administrators.
     */
    List<CredentialRecord> administrativeCredentials;
}
