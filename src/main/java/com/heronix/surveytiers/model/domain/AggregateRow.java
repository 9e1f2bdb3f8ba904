package com.heronix.surveytiers.model.domain;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * One aggregate group.
 *
 * Key fields that were not part of the grouping carry an "All ..." label.
 * Suppressed rows stay in the result so tables can highlight them; trend
 * series skip them.
 */
@Value
@Builder
public class AggregateRow {

    String schoolId;

    String yearGroup;

    String wave;

    String demographicGroup;

    String ttpId;

    /**
     * Statistics keyed by survey id, in catalog order.
     */
    Map<String, SurveyStatistics> statistics;

    boolean suppressed;

    String notes;

    public SurveyStatistics statistics(String surveyId) {
        return statistics.getOrDefault(surveyId, SurveyStatistics.EMPTY);
    }
}
