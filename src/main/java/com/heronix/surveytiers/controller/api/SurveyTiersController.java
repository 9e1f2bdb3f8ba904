package com.heronix.surveytiers.controller.api;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.surveytiers.config.SurveyTiersProperties;
import com.heronix.surveytiers.exception.InsufficientCredentialsException;
import com.heronix.surveytiers.model.domain.AggregateRow;
import com.heronix.surveytiers.model.domain.RowFilter;
import com.heronix.surveytiers.model.domain.SurveyDataset;
import com.heronix.surveytiers.model.domain.SurveyResponse;
import com.heronix.surveytiers.model.domain.TrendSeries;
import com.heronix.surveytiers.model.dto.AccessCatalogDTO;
import com.heronix.surveytiers.model.dto.AggregationResultDTO;
import com.heronix.surveytiers.model.dto.ResponseRowsDTO;
import com.heronix.surveytiers.model.enums.GroupingField;
import com.heronix.surveytiers.model.schema.ResponseFieldSchema;
import com.heronix.surveytiers.service.AccessCatalogService;
import com.heronix.surveytiers.service.AggregationService;
import com.heronix.surveytiers.service.DatasetAssemblyService;
import com.heronix.surveytiers.service.TrendSeriesService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API handing generated datasets to the presentation layer.
 *
 * Provides endpoints for:
 * - The full dataset for a seed
 * - Re-aggregation with any grouping and suppression threshold
 * - Trend series for charts
 * - Filtered, flattened response rows
 * - Access rules and identifiability tiers
 */
@RestController
@RequestMapping("/api/v1/survey-tiers")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Survey Tiers", description = "Synthetic survey datasets across identifiability tiers")
public class SurveyTiersController {

    private final DatasetAssemblyService datasetAssembly;
    private final AggregationService aggregation;
    private final TrendSeriesService trendSeries;
    private final AccessCatalogService accessCatalog;
    private final ResponseFieldSchema fieldSchema;
    private final SurveyTiersProperties properties;

    // ========================================================================
    // DATASET
    // ========================================================================

    @GetMapping("/dataset")
    @Operation(summary = "Generate the full dataset for a seed")
    public ResponseEntity<?> getDataset(
            @RequestParam(required = false) Long seed,
            @RequestParam(required = false) Integer threshold) {

        log.debug("API: Generating dataset - seed={}, threshold={}", seed, threshold);

        try {
            return ResponseEntity.ok(generate(seed, threshold));
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        } catch (InsufficientCredentialsException e) {
            return generationFailed(e);
        }
    }

    // ========================================================================
    // AGGREGATION
    // ========================================================================

    @GetMapping("/aggregates")
    @Operation(summary = "Aggregate relabelled responses by the given fields")
    public ResponseEntity<?> getAggregates(
            @RequestParam(required = false) Long seed,
            @RequestParam(defaultValue = "school,yearGroup,wave") String fields,
            @RequestParam(required = false) Integer threshold) {

        log.debug("API: Aggregating - seed={}, fields={}, threshold={}", seed, fields, threshold);

        try {
            Set<GroupingField> grouping = GroupingField.withWave(parseFields(fields));
            int effectiveThreshold = threshold != null
                    ? threshold
                    : properties.getAggregation().getSuppressionThreshold();
            SurveyDataset dataset = generate(seed, null);

            List<AggregateRow> rows = aggregation.sortByWave(
                    aggregation.aggregate(dataset.getRelabelledResponses(), grouping, effectiveThreshold));

            return ResponseEntity.ok(AggregationResultDTO.builder()
                    .seed(dataset.getSeed())
                    .groupBy(grouping.stream().map(GroupingField::getKey).toList())
                    .threshold(effectiveThreshold)
                    .rows(rows)
                    .suppressedCount(rows.stream().filter(AggregateRow::isSuppressed).count())
                    .build());
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        } catch (InsufficientCredentialsException e) {
            return generationFailed(e);
        }
    }

    // ========================================================================
    // TRENDS
    // ========================================================================

    @GetMapping("/trends")
    @Operation(summary = "Wave-by-wave trend series for a survey")
    public ResponseEntity<?> getTrends(
            @RequestParam(required = false) Long seed,
            @RequestParam(defaultValue = "phq9") String survey,
            @RequestParam(required = false) String school) {

        log.debug("API: Building trends - seed={}, survey={}, school={}", seed, survey, school);

        try {
            SurveyDataset dataset = generate(seed, null);
            List<TrendSeries> series = school == null || school.isBlank()
                    ? trendSeries.crossSchool(dataset.getDynamicAggregated(), survey)
                    : List.of(trendSeries.forSchool(dataset.getDynamicAggregated(), survey, school));
            return ResponseEntity.ok(series);
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        } catch (InsufficientCredentialsException e) {
            return generationFailed(e);
        }
    }

    // ========================================================================
    // RESPONSE ROWS
    // ========================================================================

    @GetMapping("/responses")
    @Operation(summary = "Filtered response rows, raw or relabelled")
    public ResponseEntity<?> getResponses(
            @RequestParam(required = false) Long seed,
            @RequestParam(defaultValue = "relabelled") String tier,
            @RequestParam(required = false) String school,
            @RequestParam(required = false) String yearGroup,
            @RequestParam(required = false) String wave) {

        log.debug("API: Listing {} responses - seed={}, school={}, yearGroup={}, wave={}",
                tier, seed, school, yearGroup, wave);

        try {
            SurveyDataset dataset = generate(seed, null);
            List<? extends SurveyResponse> source = switch (tier.toLowerCase()) {
                case "raw" -> dataset.getSurveyResponses();
                case "relabelled" -> dataset.getRelabelledResponses();
                default -> throw new IllegalArgumentException("Unknown tier: " + tier);
            };
            RowFilter filter = new RowFilter(school, yearGroup, wave);
            List<SurveyResponse> filtered = source.stream()
                    .filter(filter::test)
                    .map(SurveyResponse.class::cast)
                    .toList();

            return ResponseEntity.ok(ResponseRowsDTO.builder()
                    .seed(dataset.getSeed())
                    .tier(tier.toLowerCase())
                    .columns(columns())
                    .rows(fieldSchema.toRows(filtered))
                    .build());
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        } catch (InsufficientCredentialsException e) {
            return generationFailed(e);
        }
    }

    // ========================================================================
    // CATALOG
    // ========================================================================

    @GetMapping("/access")
    @Operation(summary = "Access rules by actor and identifiability tier")
    public ResponseEntity<AccessCatalogDTO> getAccessCatalog() {
        return ResponseEntity.ok(AccessCatalogDTO.builder()
                .accessSummary(accessCatalog.accessSummary())
                .entityMatrix(accessCatalog.entityMatrix())
                .collectionTiers(accessCatalog.collectionTiers())
                .build());
    }

    @GetMapping("/schema")
    @Operation(summary = "Column schema of flattened responses")
    public ResponseEntity<List<ResponseRowsDTO.ColumnDTO>> getSchema() {
        return ResponseEntity.ok(columns());
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private SurveyDataset generate(Long seed, Integer threshold) {
        long effectiveSeed = seed != null ? seed : properties.getGeneration().getDefaultSeed();
        int effectiveThreshold = threshold != null
                ? threshold
                : properties.getAggregation().getSuppressionThreshold();
        return datasetAssembly.generate(effectiveSeed, effectiveThreshold);
    }

    static Set<GroupingField> parseFields(String fields) {
        Set<GroupingField> result = EnumSet.noneOf(GroupingField.class);
        if (fields == null || fields.isBlank()) {
            return result;
        }
        Arrays.stream(fields.split(","))
                .filter(f -> !f.isBlank())
                .map(GroupingField::fromKey)
                .forEach(result::add);
        return result;
    }

    private List<ResponseRowsDTO.ColumnDTO> columns() {
        return fieldSchema.getColumns().stream()
                .map(c -> new ResponseRowsDTO.ColumnDTO(c.key(), c.label()))
                .toList();
    }

    private ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        log.warn("API: Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "message", e.getMessage()
        ));
    }

    private ResponseEntity<Map<String, Object>> generationFailed(InsufficientCredentialsException e) {
        log.error("API: Dataset generation failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "success", false,
                "message", e.getMessage()
        ));
    }
}
