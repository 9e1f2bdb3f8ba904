package com.heronix.surveytiers.model.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Pooled value of one trend series at one wave.
 */
@Value
@Builder
public class TrendPoint {

    String wave;

    int n;

    double mean;

    double ci95;

    /**
     * False when every contributing row was suppressed or absent.
     */
    boolean available;
}
