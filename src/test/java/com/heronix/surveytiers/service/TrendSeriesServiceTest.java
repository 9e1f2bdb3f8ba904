package com.heronix.surveytiers.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.heronix.surveytiers.TestServices;
import com.heronix.surveytiers.model.domain.AggregateRow;
import com.heronix.surveytiers.model.domain.StudyCatalog;
import com.heronix.surveytiers.model.domain.SurveyDataset;
import com.heronix.surveytiers.model.domain.SurveyStatistics;
import com.heronix.surveytiers.model.domain.TrendPoint;
import com.heronix.surveytiers.model.domain.TrendSeries;

class TrendSeriesServiceTest {

    private TrendSeriesService trends;

    @BeforeEach
    void setUp() {
        trends = new TrendSeriesService(StudyCatalog.standard());
    }

    @Test
    void poolsYearGroupsIntoWeightedMean() {
        List<AggregateRow> rows = List.of(
                row("cherwell", "Year 9", "Wave 1", stats(10, 10.0, 0.0), false),
                row("cherwell", "Year 10", "Wave 1", stats(30, 14.0, 0.0), false));

        TrendSeries series = trends.forSchool(rows, "phq9", "cherwell");
        TrendPoint wave1 = series.getPoints().get(0);

        assertThat(series.getLabel()).isEqualTo("Cherwell School Total");
        assertThat(wave1.getN()).isEqualTo(40);
        assertThat(wave1.getMean()).isEqualTo(13.0);
        // variance = (10 * 9 + 30 * 1) / 40 = 3, ci = 1.96 * sqrt(3 / 40)
        assertThat(wave1.getCi95()).isEqualTo(0.54);
        assertThat(wave1.isAvailable()).isTrue();
    }

    @Test
    void poolsFromStandardDeviationRatherThanRoundedInterval() {
        // ci95 values as rounded by aggregation: 1.96 * 0.3 / sqrt(5) and 1.96 * 1.0 / sqrt(20)
        SurveyStatistics small = SurveyStatistics.builder().n(5).sum(50).mean(10.0).stddev(0.3).ci95(0.26).build();
        SurveyStatistics large = SurveyStatistics.builder().n(20).sum(200).mean(10.0).stddev(1.0).ci95(0.44).build();

        TrendPoint point = trends.pool("Wave 1", List.of(small, large));

        // variance = (5 * 0.09 + 20 * 1) / 25, ci = 1.96 * sqrt(0.818 / 25) = 0.3545
        assertThat(point.getN()).isEqualTo(25);
        assertThat(point.getMean()).isEqualTo(10.0);
        assertThat(point.getCi95()).isEqualTo(0.35);
    }

    @Test
    void suppressedRowsDoNotContribute() {
        List<AggregateRow> rows = List.of(
                row("cherwell", "Year 9", "Wave 1", stats(3, 25.0, 0.0), true),
                row("cherwell", "Year 10", "Wave 1", stats(8, 9.0, 0.0), false));

        TrendPoint wave1 = trends.forSchool(rows, "phq9", "cherwell").getPoints().get(0);

        assertThat(wave1.getN()).isEqualTo(8);
        assertThat(wave1.getMean()).isEqualTo(9.0);
    }

    @Test
    void wavesWithoutDataAreMarkedUnavailable() {
        List<AggregateRow> rows = List.of(row("cherwell", "Year 9", "Wave 2", stats(6, 5.0, 1.0), false));

        List<TrendPoint> points = trends.forSchool(rows, "phq9", "cherwell").getPoints();

        assertThat(points).extracting(TrendPoint::getWave).containsExactly("Wave 1", "Wave 2", "Wave 3");
        assertThat(points.get(0).isAvailable()).isFalse();
        assertThat(points.get(0).getMean()).isZero();
        assertThat(points.get(1).isAvailable()).isTrue();
        assertThat(points.get(1).getCi95()).isEqualTo(0.8);
    }

    @Test
    void crossSchoolBuildsOneSeriesPerSchool() {
        SurveyDataset dataset = TestServices.assembler().generate(42);

        List<TrendSeries> series = trends.crossSchool(dataset.getDynamicAggregated(), "gad7");

        assertThat(series).extracting(TrendSeries::getSchoolId)
                .containsExactly("oxford-high", "cherwell", "magdalen", "pudong-high", "huangpu-academy");
        assertThat(series).allSatisfy(s -> {
            assertThat(s.getSurveyId()).isEqualTo("gad7");
            assertThat(s.getPoints()).hasSize(3);
        });
    }

    @Test
    void rejectsUnknownSurveyOrSchool() {
        assertThatThrownBy(() -> trends.crossSchool(List.of(), "bdi"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown survey: bdi");
        assertThatThrownBy(() -> trends.forSchool(List.of(), "phq9", "eton"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown school: eton");
    }

    private static SurveyStatistics stats(int n, double mean, double stddev) {
        double ci95 = n > 0 ? AggregationService.Z_95 * stddev / Math.sqrt(n) : 0.0;
        return SurveyStatistics.builder().n(n).sum(Math.round(n * mean)).mean(mean).stddev(stddev).ci95(ci95).build();
    }

    private static AggregateRow row(String school, String yearGroup, String wave,
                                    SurveyStatistics phq9, boolean suppressed) {
        return AggregateRow.builder()
                .schoolId(school)
                .yearGroup(yearGroup)
                .wave(wave)
                .demographicGroup("All demographic groups")
                .ttpId("All TTPs")
                .statistics(Map.of("phq9", phq9, "gad7", SurveyStatistics.EMPTY))
                .suppressed(suppressed)
                .notes(suppressed ? "Suppressed" : "Ready for responsive queries")
                .build();
    }
}
