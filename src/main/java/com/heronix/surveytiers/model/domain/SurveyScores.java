package com.heronix.surveytiers.model.domain;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Item scores for one survey within one response. Total is the item sum.
 */
@Value
@Builder
public class SurveyScores {

    int total;

    /**
     * Item scores in [0, 3], in item order.
     */
    List<Integer> items;

    public static SurveyScores of(List<Integer> items) {
        int total = 0;
        for (int score : items) {
            total += score;
        }
        return new SurveyScores(total, List.copyOf(items));
    }
}
