package com.heronix.surveytiers.exception;

import lombok.Getter;

/**
 * Exception thrown when a school's credential pool runs out before every
 * student has a credential.
 *
 * Indicates an oversize factor inconsistent with the population, or a login
 * id format too short for the pool; dataset construction is aborted.
 */
@Getter
public class InsufficientCredentialsException extends RuntimeException {

    private final String studentId;
    private final String schoolId;

    public InsufficientCredentialsException(String studentId, String schoolId) {
        this("Not enough credentials for student " + studentId + " in school " + schoolId, studentId, schoolId);
    }

    private InsufficientCredentialsException(String message, String studentId, String schoolId) {
        super(message);
        this.studentId = studentId;
        this.schoolId = schoolId;
    }

    /**
     * The configured charset and id length cannot produce enough distinct
     * login ids for a school's pool.
     */
    public static InsufficientCredentialsException loginIdSpaceTooSmall(String schoolId, int poolSize, double idSpace) {
        return new InsufficientCredentialsException(
                String.format("Login id space of %.0f is too small for %d credentials in school %s",
                        idSpace, poolSize, schoolId),
                null, schoolId);
    }
}
