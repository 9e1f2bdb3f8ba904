package com.heronix.surveytiers;

import com.heronix.surveytiers.config.SurveyTiersProperties;
import com.heronix.surveytiers.model.domain.StudyCatalog;
import com.heronix.surveytiers.service.AccessCatalogService;
import com.heronix.surveytiers.service.AggregationService;
import com.heronix.surveytiers.service.CredentialPoolService;
import com.heronix.surveytiers.service.DatasetAssemblyService;
import com.heronix.surveytiers.service.PopulationGeneratorService;
import com.heronix.surveytiers.service.PseudonymizationService;
import com.heronix.surveytiers.service.ResponseSimulatorService;

/**
 * Wires the pipeline by hand for tests that do not need a Spring context.
 */
public final class TestServices {

    private TestServices() {
    }

    public static DatasetAssemblyService assembler() {
        return assembler(StudyCatalog.standard(), new SurveyTiersProperties());
    }

    public static DatasetAssemblyService assembler(StudyCatalog catalog, SurveyTiersProperties properties) {
        return new DatasetAssemblyService(
                catalog,
                properties,
                new PopulationGeneratorService(catalog, properties),
                new CredentialPoolService(catalog, properties),
                new ResponseSimulatorService(catalog, properties),
                new PseudonymizationService(),
                new AggregationService(catalog, properties),
                new AccessCatalogService());
    }
}
