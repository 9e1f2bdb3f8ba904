package com.heronix.surveytiers.service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.heronix.surveytiers.model.domain.AccessSummary;
import com.heronix.surveytiers.model.domain.EntityTierRow;
import com.heronix.surveytiers.model.enums.IdentifiabilityTier;

/**
 * Describes who may see which data, and how identifiable each dataset
 * collection is.
 *
 * Actors:
 * - Oxford University (research consumer) - aggregates only
 * - Trusted Third Party - rewrite maps and pseudonymous responses
 * - Schools - credentials (PID) and school-level results
 */
@Service
public class AccessCatalogService {

    public List<AccessSummary> accessSummary() {
        return List.of(
                AccessSummary.builder()
                        .entity("Oxford University")
                        .access(List.of("Aggregated data", "Cross-school comparisons", "Anonymised survey stats"))
                        .category("Anonymous (fully)")
                        .purpose("Research and monitoring")
                        .build(),
                AccessSummary.builder()
                        .entity("Trusted Third Party (TTP)")
                        .access(List.of("ID rewrite maps", "Pseudonymous survey data", "Aggregation logic"))
                        .category("Pseudonymous")
                        .purpose("Linkage and safe release")
                        .build(),
                AccessSummary.builder()
                        .entity("Schools")
                        .access(List.of("Student credentials", "School-level surveys", "Operational reports"))
                        .category("PID and Pseudonymous")
                        .purpose("Local pastoral support")
                        .build());
    }

    public List<EntityTierRow> entityMatrix() {
        return List.of(
                row("Oxford University",
                        List.of(),
                        List.of("Relabelled survey responses"),
                        List.of("Static aggregated data", "Dynamic aggregated data"),
                        List.of("Cross-school survey trends")),
                row("Trusted Third Party",
                        List.of(),
                        List.of("ID rewrite map"),
                        List.of("Relabelled survey responses"),
                        List.of()),
                row("Schools",
                        List.of("ID + Password + Student"),
                        List.of("ID Rewrite Map"),
                        List.of("Relabelled survey responses"),
                        List.of("Static aggregated data")));
    }

    /**
     * Identifiability tier of each named dataset collection.
     */
    public Map<String, IdentifiabilityTier> collectionTiers() {
        Map<String, IdentifiabilityTier> tiers = new LinkedHashMap<>();
        tiers.put("students", IdentifiabilityTier.PID);
        tiers.put("credentials", IdentifiabilityTier.PID);
        tiers.put("studentCredentials", IdentifiabilityTier.PID);
        tiers.put("administrativeCredentials", IdentifiabilityTier.PID);
        tiers.put("surveyResponses", IdentifiabilityTier.PID);
        tiers.put("rewriteMap", IdentifiabilityTier.PSEUDONYMOUS);
        tiers.put("relabelledResponses", IdentifiabilityTier.PSEUDONYMOUS);
        tiers.put("dynamicAggregated", IdentifiabilityTier.ANONYMOUS_REIDENTIFIABLE);
        tiers.put("staticAggregated", IdentifiabilityTier.ANONYMOUS);
        return tiers;
    }

    private static EntityTierRow row(String entity, List<String> pid, List<String> pseudonymous,
                                     List<String> reidentifiable, List<String> anonymous) {
        Map<IdentifiabilityTier, List<String>> holdings = new EnumMap<>(IdentifiabilityTier.class);
        holdings.put(IdentifiabilityTier.PID, pid);
        holdings.put(IdentifiabilityTier.PSEUDONYMOUS, pseudonymous);
        holdings.put(IdentifiabilityTier.ANONYMOUS_REIDENTIFIABLE, reidentifiable);
        holdings.put(IdentifiabilityTier.ANONYMOUS, anonymous);
        return EntityTierRow.builder().entity(entity).holdings(holdings).build();
    }
}
