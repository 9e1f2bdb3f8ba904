package com.heronix.surveytiers.model.dto;

import java.util.List;
import java.util.Map;

import com.heronix.surveytiers.model.domain.AccessSummary;
import com.heronix.surveytiers.model.domain.EntityTierRow;
import com.heronix.surveytiers.model.enums.IdentifiabilityTier;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Access rules and identifiability tiers for display.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccessCatalogDTO {

    private List<AccessSummary> accessSummary;

    private List<EntityTierRow> entityMatrix;

    /**
     * Dataset collection name to its tier.
     */
    private Map<String, IdentifiabilityTier> collectionTiers;
}
