package com.heronix.surveytiers.model.dto;

import java.util.List;

import com.heronix.surveytiers.model.domain.AggregateRow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of an on-demand re-aggregation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AggregationResultDTO {

    private long seed;

    /**
     * Grouping field keys actually used (always includes "wave").
     */
    private List<String> groupBy;

    private int threshold;

    private List<AggregateRow> rows;

    /**
     * Number of rows flagged suppressed.
     */
    private long suppressedCount;
}
