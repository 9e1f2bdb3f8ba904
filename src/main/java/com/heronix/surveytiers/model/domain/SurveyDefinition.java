package com.heronix.surveytiers.model.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A survey instrument from the fixed catalog (e.g. PHQ-9).
 */
@Value
@Builder
public class SurveyDefinition {

    String id;

    String name;

    int items;

    public String totalKey() {
        return id + "-total";
    }

    public String itemKey(int index) {
        return id + "-item-" + index;
    }
}
