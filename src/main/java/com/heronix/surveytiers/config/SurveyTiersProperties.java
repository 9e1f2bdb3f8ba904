package com.heronix.surveytiers.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Configuration properties for Heronix Survey Tiers.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "heronix.survey-tiers")
public class SurveyTiersProperties {

    /**
     * Population generation configuration
     */
    @Valid
    private GenerationConfig generation = new GenerationConfig();

    /**
     * Credential pool configuration
     */
    @Valid
    private CredentialConfig credentials = new CredentialConfig();

    /**
     * Response simulation configuration
     */
    @Valid
    private ResponseConfig responses = new ResponseConfig();

    /**
     * Aggregation configuration
     */
    @Valid
    private AggregationConfig aggregation = new AggregationConfig();

    @Data
    public static class GenerationConfig {
        /**
         * Seed used when a caller does not supply one
         */
        private long defaultSeed = 42;

        /**
         * Smallest cohort per school and year group
         */
        @Min(1)
        private int minCohort = 8;

        /**
         * Largest cohort per school and year group (inclusive)
         */
        @Min(1)
        private int maxCohort = 13;

        /**
         * Naming attempts before a duplicate name is accepted
         */
        @Min(1)
        private int maxNameAttempts = 50;

        @AssertTrue(message = "min-cohort must not exceed max-cohort")
        public boolean isCohortRangeValid() {
            return minCohort <= maxCohort;
        }
    }

    @Data
    public static class CredentialConfig {
        /**
         * Pool size multiplier over the number of students in a school
         */
        @DecimalMin("1.0")
        private double oversizeFactor = 1.25;

        /**
         * Length of the random login id suffix
         */
        @Min(1)
        private int idLength = 6;

        /**
         * Characters used for login ids and passwords
         */
        @NotBlank
        private String charset = "0123456789abcdefghijklmnopqrstuvwxyz";
    }

    @Data
    public static class ResponseConfig {
        /**
         * Probability that a student starts in the elevated state
         */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double initialElevationRate = 0.10;

        /**
         * Probability that a (student, wave) response is missing
         */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double missingRate = 0.05;

        /**
         * Probability of a one-off elevated wave for a student in the normal state
         */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double waveElevationRate = 0.10;

        /**
         * Probability that an elevated student returns to normal after a wave
         */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double recoveryRate = 0.5;

        /**
         * Probability that an elevated wave turns into a carried-over elevated state
         */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double relapseRate = 0.5;
    }

    @Data
    public static class AggregationConfig {
        /**
         * Minimum group size below which aggregate rows are suppressed
         */
        @Min(0)
        private int suppressionThreshold = 5;
    }
}
