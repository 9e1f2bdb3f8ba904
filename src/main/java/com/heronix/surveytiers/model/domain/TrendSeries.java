package com.heronix.surveytiers.model.domain;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Wave-ordered series of pooled means for one school and survey.
 */
@Value
@Builder
public class TrendSeries {

    String label;

    String schoolId;

    String surveyId;

    List<TrendPoint> points;
}
