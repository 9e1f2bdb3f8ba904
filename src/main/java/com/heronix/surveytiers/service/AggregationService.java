package com.heronix.surveytiers.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.heronix.surveytiers.config.SurveyTiersProperties;
import com.heronix.surveytiers.model.domain.AggregateRow;
import com.heronix.surveytiers.model.domain.StudyCatalog;
import com.heronix.surveytiers.model.domain.SurveyDefinition;
import com.heronix.surveytiers.model.domain.SurveyResponse;
import com.heronix.surveytiers.model.domain.SurveyStatistics;
import com.heronix.surveytiers.model.enums.GroupingField;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Groups responses by a chosen field set and computes per-survey statistics
 * with small-cell suppression.
 *
 * Side-effect free: the same responses may be aggregated repeatedly with
 * different groupings and thresholds.
 *
 * A row is suppressed iff n for the reference survey (first in the catalog) is
 * below the threshold. Suppressed rows are returned, flagged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregationService {

    static final double Z_95 = 1.96;

    static final String READY_NOTE = "Ready for responsive queries";

    private final StudyCatalog catalog;
    private final SurveyTiersProperties properties;

    /**
     * Aggregate with the configured suppression threshold.
     */
    public List<AggregateRow> aggregate(Collection<? extends SurveyResponse> responses, Set<GroupingField> fields) {
        return aggregate(responses, fields, properties.getAggregation().getSuppressionThreshold());
    }

    /**
     * Aggregate responses.
     *
     * @param responses responses to group; not modified
     * @param fields    grouping fields; WAVE is always added
     * @param threshold minimum reference-survey n for an unsuppressed row
     * @return one row per non-empty group, in first-seen order
     * @throws IllegalArgumentException if threshold is negative
     */
    public List<AggregateRow> aggregate(Collection<? extends SurveyResponse> responses,
                                        Set<GroupingField> fields, int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Suppression threshold must not be negative: " + threshold);
        }
        Set<GroupingField> grouping = GroupingField.withWave(fields);

        Map<Map<GroupingField, String>, List<SurveyResponse>> groups = new LinkedHashMap<>();
        for (SurveyResponse response : responses) {
            groups.computeIfAbsent(groupKey(response, grouping), k -> new ArrayList<>()).add(response);
        }

        List<AggregateRow> rows = new ArrayList<>(groups.size());
        for (var entry : groups.entrySet()) {
            rows.add(aggregateGroup(entry.getKey(), entry.getValue(), threshold));
        }

        long suppressed = rows.stream().filter(AggregateRow::isSuppressed).count();
        log.debug("Aggregated {} responses into {} groups by {} ({} suppressed at threshold {})",
                responses.size(), rows.size(), grouping, suppressed, threshold);

        return List.copyOf(rows);
    }

    /**
     * Build the row for one group. An empty group yields zero statistics and,
     * for any positive threshold, a suppressed row.
     */
    public AggregateRow aggregateGroup(Map<GroupingField, String> key,
                                       List<? extends SurveyResponse> group, int threshold) {
        Map<String, SurveyStatistics> statistics = new LinkedHashMap<>();
        for (SurveyDefinition survey : catalog.getSurveys()) {
            List<Integer> totals = new ArrayList<>(group.size());
            for (SurveyResponse response : group) {
                Integer total = response.total(survey.getId());
                if (total != null) {
                    totals.add(total);
                }
            }
            statistics.put(survey.getId(), statistics(totals));
        }

        int referenceN = statistics.get(catalog.referenceSurvey().getId()).getN();
        boolean suppressed = referenceN < threshold;

        return AggregateRow.builder()
                .schoolId(valueOf(key, GroupingField.SCHOOL))
                .yearGroup(valueOf(key, GroupingField.YEAR_GROUP))
                .wave(valueOf(key, GroupingField.WAVE))
                .demographicGroup(valueOf(key, GroupingField.DEMOGRAPHIC_GROUP))
                .ttpId(valueOf(key, GroupingField.TTP))
                .statistics(Collections.unmodifiableMap(statistics))
                .suppressed(suppressed)
                .notes(suppressed ? "Suppressed: fewer than " + threshold + " records" : READY_NOTE)
                .build();
    }

    /**
     * Count, sum, mean, sample standard deviation and 95% CI half-width of a
     * set of totals, rounded to two decimals.
     */
    public SurveyStatistics statistics(List<Integer> totals) {
        int n = totals.size();
        if (n == 0) {
            return SurveyStatistics.EMPTY;
        }

        long sum = 0;
        for (int total : totals) {
            sum += total;
        }
        double mean = (double) sum / n;

        double stddev = 0.0;
        if (n > 1) {
            double squares = 0.0;
            for (int total : totals) {
                squares += (total - mean) * (total - mean);
            }
            stddev = Math.sqrt(squares / (n - 1));
        }
        double ci95 = Z_95 * stddev / Math.sqrt(n);

        return SurveyStatistics.builder()
                .n(n)
                .sum(sum)
                .mean(round(mean))
                .stddev(round(stddev))
                .ci95(round(ci95))
                .build();
    }

    /**
     * Rows re-sorted into wave catalog order. Stable within a wave.
     */
    public List<AggregateRow> sortByWave(List<AggregateRow> rows) {
        List<AggregateRow> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparingInt(row -> catalog.waveIndex(row.getWave())));
        return sorted;
    }

    private Map<GroupingField, String> groupKey(SurveyResponse response, Set<GroupingField> grouping) {
        Map<GroupingField, String> key = new EnumMap<>(GroupingField.class);
        for (GroupingField field : GroupingField.values()) {
            key.put(field, grouping.contains(field) ? fieldValue(response, field) : field.getAllLabel());
        }
        return key;
    }

    private String fieldValue(SurveyResponse response, GroupingField field) {
        return switch (field) {
            case SCHOOL -> response.getSchoolId();
            case YEAR_GROUP -> response.getYearGroup();
            case WAVE -> response.getWave();
            case DEMOGRAPHIC_GROUP -> response.getDemographicGroup();
            case TTP -> ttpOf(response.getSchoolId());
        };
    }

    private String ttpOf(String schoolId) {
        String ttpId = catalog.ttpIdOf(schoolId);
        return ttpId != null ? ttpId : "unknown-ttp";
    }

    private static String valueOf(Map<GroupingField, String> key, GroupingField field) {
        return key.getOrDefault(field, field.getAllLabel());
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
