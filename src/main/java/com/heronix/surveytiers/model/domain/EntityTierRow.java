package com.heronix.surveytiers.model.domain;

import java.util.List;
import java.util.Map;

import com.heronix.surveytiers.model.enums.IdentifiabilityTier;

import lombok.Builder;
import lombok.Value;

/**
 * Data kinds held by one actor, by identifiability tier.
 */
@Value
@Builder
public class EntityTierRow {

    String entity;

    Map<IdentifiabilityTier, List<String>> holdings;

    public List<String> holdings(IdentifiabilityTier tier) {
        return holdings.getOrDefault(tier, List.of());
    }
}
