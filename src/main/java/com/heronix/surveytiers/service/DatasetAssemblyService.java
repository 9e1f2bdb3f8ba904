package com.heronix.surveytiers.service;

import java.util.List;

import org.springframework.stereotype.Service;

import com.heronix.surveytiers.config.SurveyTiersProperties;
import com.heronix.surveytiers.exception.InsufficientCredentialsException;
import com.heronix.surveytiers.model.domain.AggregateRow;
import com.heronix.surveytiers.model.domain.CredentialAllocation;
import com.heronix.surveytiers.model.domain.RawResponse;
import com.heronix.surveytiers.model.domain.RelabelledResponse;
import com.heronix.surveytiers.model.domain.RewriteMapEntry;
import com.heronix.surveytiers.model.domain.Student;
import com.heronix.surveytiers.model.domain.StudyCatalog;
import com.heronix.surveytiers.model.domain.SurveyDataset;
import com.heronix.surveytiers.model.enums.GroupingField;
import com.heronix.surveytiers.random.GenerationContext;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the full generation pipeline for a seed.
 *
 * PID tier -> pseudonymous tier -> anonymous tiers:
 * students, credentials, raw responses, rewrite map, relabelled responses,
 * then static (unsuppressed) and dynamic (suppressed) aggregates by school,
 * year group and wave.
 *
 * The stages share one {@link GenerationContext} created per call, in a fixed
 * order. Reordering stages changes the output for a given seed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DatasetAssemblyService {

    private final StudyCatalog catalog;
    private final SurveyTiersProperties properties;
    private final PopulationGeneratorService populationGenerator;
    private final CredentialPoolService credentialPool;
    private final ResponseSimulatorService responseSimulator;
    private final PseudonymizationService pseudonymizer;
    private final AggregationService aggregation;
    private final AccessCatalogService accessCatalog;

    /**
     * Generate with the configured default seed and threshold.
     */
    public SurveyDataset generate() {
        return generate(properties.getGeneration().getDefaultSeed());
    }

    public SurveyDataset generate(long seed) {
        return generate(seed, properties.getAggregation().getSuppressionThreshold());
    }

    /**
     * Generate the dataset for a seed.
     *
     * @param seed      generation seed; only the low 32 bits are significant
     * @param threshold suppression threshold for the dynamic aggregate
     * @throws InsufficientCredentialsException if a credential pool is undersized
     */
    public SurveyDataset generate(long seed, int threshold) {
        GenerationContext context = GenerationContext.forSeed(seed);

        List<Student> students = populationGenerator.generateStudents(context);
        CredentialAllocation credentials = credentialPool.allocate(students, context);
        List<RewriteMapEntry> rewriteMap = pseudonymizer.buildRewriteMap(students);
        List<RawResponse> responses = responseSimulator.simulate(students, context);
        List<RelabelledResponse> relabelled = pseudonymizer.relabel(responses, rewriteMap);

        // Static release: no suppression
        List<AggregateRow> staticAggregated = aggregation.aggregate(relabelled, GroupingField.standard(), 0);
        List<AggregateRow> dynamicAggregated = aggregation.aggregate(relabelled, GroupingField.standard(), threshold);

        log.info("Generated dataset for seed {}: {} students, {} credentials, {} responses, {} aggregate groups",
                seed, students.size(), credentials.getCredentials().size(), responses.size(), dynamicAggregated.size());

        return SurveyDataset.builder()
                .seed(seed)
                .ttps(catalog.getTtps())
                .schools(catalog.getSchools())
                .yearGroups(catalog.getYearGroups())
                .waves(catalog.getWaves())
                .demographicGroups(catalog.getDemographicGroups())
                .surveys(catalog.getSurveys())
                .students(students)
                .credentials(credentials.getCredentials())
                .studentCredentials(credentials.getStudentCredentials())
                .administrativeCredentials(credentials.getAdministrativeCredentials())
                .surveyResponses(responses)
                .rewriteMap(rewriteMap)
                .relabelledResponses(relabelled)
                .staticAggregated(staticAggregated)
                .dynamicAggregated(dynamicAggregated)
                .suppressionThreshold(threshold)
                .accessSummary(accessCatalog.accessSummary())
                .entityMatrix(accessCatalog.entityMatrix())
                .build();
    }
}
