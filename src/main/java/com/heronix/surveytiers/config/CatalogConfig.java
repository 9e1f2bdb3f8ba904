package com.heronix.surveytiers.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.heronix.surveytiers.model.domain.StudyCatalog;
import com.heronix.surveytiers.model.schema.ResponseFieldSchema;

/**
 * Registers the fixed study catalog and the response column schema derived
 * from it.
 */
@Configuration
public class CatalogConfig {

    @Bean
    public StudyCatalog studyCatalog() {
        return StudyCatalog.standard();
    }

    /**
     * Column schema, built once per catalog.
     */
    @Bean
    public ResponseFieldSchema responseFieldSchema(StudyCatalog studyCatalog) {
        return ResponseFieldSchema.fromCatalog(studyCatalog);
    }
}
