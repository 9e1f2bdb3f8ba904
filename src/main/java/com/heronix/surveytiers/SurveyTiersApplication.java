package com.heronix.surveytiers;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.heronix.surveytiers.config.SurveyTiersProperties;

/**
 * Heronix Survey Tiers - Identifiability Tier Demonstrator
 *
 * Simulates a multi-school wellbeing survey programme and shows how its data
 * moves from identifiable credentials, through pseudonymous records held by a
 * Trusted Third Party, to suppressed aggregates released for research.
 *
 * Every dataset is synthetic and a pure function of its seed.
 */
@SpringBootApplication
@EnableConfigurationProperties(SurveyTiersProperties.class)
public class SurveyTiersApplication {

    public static void main(String[] args) {
        SpringApplication.run(SurveyTiersApplication.class, args);
    }
}
