package com.heronix.surveytiers.model.domain;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Survey response as collected at the school, keyed by the real student id.
 */
@Value
@Builder
public class RawResponse implements SurveyResponse {

    String studentId;

    String schoolId;

    String yearGroup;

    String demographicGroup;

    String wave;

    Map<String, SurveyScores> scores;
}
