package com.heronix.surveytiers.model.domain;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Pseudonymous survey response. Carries the UID; the student id is gone.
 */
@Value
@Builder
public class RelabelledResponse implements SurveyResponse {

    String uid;

    String schoolId;

    String yearGroup;

    String demographicGroup;

    String wave;

    Map<String, SurveyScores> scores;
}
