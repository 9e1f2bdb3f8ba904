package com.heronix.surveytiers.model.domain;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * What one actor in the survey programme may see, and why.
 */
@Value
@Builder
public class AccessSummary {

    String entity;

    List<String> access;

    String category;

    String purpose;
}
