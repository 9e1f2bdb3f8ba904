package com.heronix.surveytiers.model.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Summary statistics of one survey's totals within one aggregate group.
 * Mean, stddev and ci95 are rounded to two decimals.
 */
@Value
@Builder
public class SurveyStatistics {

    public static final SurveyStatistics EMPTY = new SurveyStatistics(0, 0, 0.0, 0.0, 0.0);

    /**
     * Responses in the group with a defined total for the survey.
     */
    int n;

    long sum;

    double mean;

    /**
     * Sample standard deviation (divisor n - 1).
     */
    double stddev;

    /**
     * Normal-approximation 95% confidence half-width: 1.96 * stddev / sqrt(n).
     */
    double ci95;
}
