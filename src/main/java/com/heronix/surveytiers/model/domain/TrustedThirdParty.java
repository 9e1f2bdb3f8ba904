package com.heronix.surveytiers.model.domain;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Trusted Third Party - mediates between schools and the research consumer and
 * holds the pseudonymisation mapping.
 *
 * Each TTP supplies the name pool used when generating the students of the
 * schools it handles.
 */
@Value
@Builder
public class TrustedThirdParty {

    String id;

    String name;

    /**
     * First names issued to students of this TTP's schools.
     */
    List<String> firstNames;

    /**
     * Last names issued to students of this TTP's schools.
     */
    List<String> lastNames;
}
