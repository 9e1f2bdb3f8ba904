package com.heronix.surveytiers.model.domain;

import java.util.Map;

/**
 * Fields shared by raw and relabelled survey responses.
 */
public interface SurveyResponse {

    String getSchoolId();

    String getYearGroup();

    String getDemographicGroup();

    String getWave();

    /**
     * Scores keyed by survey id, in catalog order.
     */
    Map<String, SurveyScores> getScores();

    /**
     * Total for a survey, or null when the response holds no scores for it.
     */
    default Integer total(String surveyId) {
        SurveyScores scores = getScores().get(surveyId);
        return scores != null ? scores.getTotal() : null;
    }
}
