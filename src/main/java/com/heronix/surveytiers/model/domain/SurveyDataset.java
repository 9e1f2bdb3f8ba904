package com.heronix.surveytiers.model.domain;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Everything produced by one generation run, handed to the presentation layer.
 *
 * Immutable and a pure function of the seed. Further aggregations are obtained
 * by passing {@link #getRelabelledResponses()} back to the aggregation service.
 */
@Value
@Builder
public class SurveyDataset {

    long seed;

    List<TrustedThirdParty> ttps;

    List<School> schools;

    List<String> yearGroups;

    List<String> waves;

    List<String> demographicGroups;

    List<SurveyDefinition> surveys;

    // PID tier
    List<Student> students;

    List<CredentialRecord> credentials;

    List<StudentCredential> studentCredentials;

    List<CredentialRecord> administrativeCredentials;

    List<RawResponse> surveyResponses;

    // Pseudonymous tier
    List<RewriteMapEntry> rewriteMap;

    List<RelabelledResponse> relabelledResponses;

    // Anonymous tiers
    List<AggregateRow> staticAggregated;

    List<AggregateRow> dynamicAggregated;

    int suppressionThreshold;

    List<AccessSummary> accessSummary;

    List<EntityTierRow> entityMatrix;
}
