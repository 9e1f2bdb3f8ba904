package com.heronix.surveytiers.model.schema;

import java.util.function.Function;

import com.heronix.surveytiers.model.domain.SurveyResponse;

/**
 * One logical column of a flattened response row.
 *
 * @param key       stable column key (e.g. "phq9-item-3")
 * @param label     display label
 * @param extractor reads the column value from a response
 */
public record FieldColumn(
        String key,
        String label,
        Function<SurveyResponse, Object> extractor
) {

    public Object extract(SurveyResponse response) {
        return extractor.apply(response);
    }
}
