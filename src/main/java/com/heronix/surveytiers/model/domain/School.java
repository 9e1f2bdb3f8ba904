package com.heronix.surveytiers.model.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A participating school, handled by exactly one TTP.
 */
@Value
@Builder
public class School {

    String id;

    String name;

    String ttpId;
}
