package com.heronix.surveytiers.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.heronix.surveytiers.model.domain.AggregateRow;
import com.heronix.surveytiers.model.domain.School;
import com.heronix.surveytiers.model.domain.StudyCatalog;
import com.heronix.surveytiers.model.domain.SurveyStatistics;
import com.heronix.surveytiers.model.domain.TrendPoint;
import com.heronix.surveytiers.model.domain.TrendSeries;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds wave-ordered trend series from aggregate rows for charting.
 *
 * All rows of a school and wave (typically one per year group) are pooled into
 * a weighted mean. Suppressed rows never contribute.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrendSeriesService {

    private final StudyCatalog catalog;

    /**
     * One series per school, in catalog order.
     *
     * @throws IllegalArgumentException if the survey id is unknown
     */
    public List<TrendSeries> crossSchool(List<AggregateRow> rows, String surveyId) {
        requireSurvey(surveyId);
        List<TrendSeries> series = new ArrayList<>();
        for (School school : catalog.getSchools()) {
            series.add(buildSeries(rows, surveyId, school));
        }
        return series;
    }

    /**
     * A single series for one school.
     *
     * @throws IllegalArgumentException if the survey or school id is unknown
     */
    public TrendSeries forSchool(List<AggregateRow> rows, String surveyId, String schoolId) {
        requireSurvey(surveyId);
        School school = catalog.findSchool(schoolId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown school: " + schoolId));
        return buildSeries(rows, surveyId, school);
    }

    private TrendSeries buildSeries(List<AggregateRow> rows, String surveyId, School school) {
        List<TrendPoint> points = new ArrayList<>();
        for (String wave : catalog.getWaves()) {
            List<SurveyStatistics> contributing = rows.stream()
                    .filter(row -> !row.isSuppressed())
                    .filter(row -> school.getId().equals(row.getSchoolId()) && wave.equals(row.getWave()))
                    .map(row -> row.statistics(surveyId))
                    .toList();
            points.add(pool(wave, contributing));
        }
        return TrendSeries.builder()
                .label(school.getName() + " Total")
                .schoolId(school.getId())
                .surveyId(surveyId)
                .points(List.copyOf(points))
                .build();
    }

    /**
     * Pool group statistics: weighted mean, and a CI95 from the pooled variance
     * (within-group spread plus spread of group means).
     */
    TrendPoint pool(String wave, List<SurveyStatistics> groups) {
        int totalN = 0;
        double weightedSum = 0.0;
        for (SurveyStatistics stats : groups) {
            totalN += stats.getN();
            weightedSum += stats.getN() * stats.getMean();
        }
        if (totalN == 0) {
            return TrendPoint.builder().wave(wave).n(0).mean(0.0).ci95(0.0).available(false).build();
        }
        double pooledMean = weightedSum / totalN;

        double variance = 0.0;
        for (SurveyStatistics stats : groups) {
            double stddev = stats.getStddev();
            double offset = stats.getMean() - pooledMean;
            variance += stats.getN() * stddev * stddev + stats.getN() * offset * offset;
        }
        variance /= totalN;
        double ci = AggregationService.Z_95 * Math.sqrt(variance / totalN);

        return TrendPoint.builder()
                .wave(wave)
                .n(totalN)
                .mean(AggregationService.round(pooledMean))
                .ci95(AggregationService.round(ci))
                .available(true)
                .build();
    }

    private void requireSurvey(String surveyId) {
        if (catalog.findSurvey(surveyId).isEmpty()) {
            throw new IllegalArgumentException("Unknown survey: " + surveyId);
        }
    }
}
