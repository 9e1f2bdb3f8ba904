package com.heronix.surveytiers.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.heronix.surveytiers.config.SurveyTiersProperties;
import com.heronix.surveytiers.model.domain.School;
import com.heronix.surveytiers.model.domain.Student;
import com.heronix.surveytiers.model.domain.StudyCatalog;
import com.heronix.surveytiers.model.domain.TrustedThirdParty;
import com.heronix.surveytiers.random.DeterministicRandomSource;
import com.heronix.surveytiers.random.GenerationContext;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the student population of every school and year group.
 *
 * Draw order on the primary stream, per school and year group:
 * - one draw for the cohort size
 * - two draws (first name, last name) per naming attempt
 *
 * Demographic groups come from the auxiliary stream.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PopulationGeneratorService {

    /**
     * First value of the student id counter, shared across all schools.
     */
    static final int FIRST_STUDENT_NUMBER = 1000;

    private final StudyCatalog catalog;
    private final SurveyTiersProperties properties;

    /**
     * Generate all students in school, then year group, order.
     */
    public List<Student> generateStudents(GenerationContext context) {
        DeterministicRandomSource random = context.getPrimary();
        var generation = properties.getGeneration();
        int cohortRange = generation.getMaxCohort() - generation.getMinCohort() + 1;

        List<Student> students = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();
        int counter = FIRST_STUDENT_NUMBER;
        int duplicates = 0;

        for (School school : catalog.getSchools()) {
            TrustedThirdParty pool = catalog.namePoolFor(school);

            for (String yearGroup : catalog.getYearGroups()) {
                int cohortSize = generation.getMinCohort() + random.nextInt(cohortRange);

                for (int i = 0; i < cohortSize; i++) {
                    String name = drawName(pool, usedNames, random, generation.getMaxNameAttempts());
                    if (!usedNames.add(name)) {
                        duplicates++;
                    }

                    students.add(Student.builder()
                            .id(school.getId().toUpperCase() + "-" + counter++)
                            .schoolId(school.getId())
                            .yearGroup(yearGroup)
                            .name(name)
                            .demographicGroup(context.getAuxiliary().pick(catalog.getDemographicGroups()))
                            .build());
                }
            }
        }

        if (duplicates > 0) {
            log.debug("Accepted {} duplicate student names after exhausting naming attempts", duplicates);
        }
        log.debug("Generated {} students across {} schools", students.size(), catalog.getSchools().size());

        return List.copyOf(students);
    }

    /**
     * Draw a name not yet issued in this run, giving up after maxAttempts and
     * returning the last (duplicate) draw.
     */
    String drawName(TrustedThirdParty pool, Set<String> usedNames,
                    DeterministicRandomSource random, int maxAttempts) {
        String name;
        int attempts = 0;
        do {
            String first = random.pick(pool.getFirstNames());
            String last = random.pick(pool.getLastNames());
            name = first + " " + last;
            attempts++;
        } while (usedNames.contains(name) && attempts < maxAttempts);
        return name;
    }
}
