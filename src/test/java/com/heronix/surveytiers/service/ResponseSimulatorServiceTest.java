package com.heronix.surveytiers.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.heronix.surveytiers.config.SurveyTiersProperties;
import com.heronix.surveytiers.model.domain.RawResponse;
import com.heronix.surveytiers.model.domain.Student;
import com.heronix.surveytiers.model.domain.StudyCatalog;
import com.heronix.surveytiers.model.domain.SurveyDefinition;
import com.heronix.surveytiers.model.domain.SurveyScores;
import com.heronix.surveytiers.random.DeterministicRandomSource;
import com.heronix.surveytiers.random.GenerationContext;

class ResponseSimulatorServiceTest {

    private StudyCatalog catalog;
    private SurveyTiersProperties properties;
    private ResponseSimulatorService simulator;
    private List<Student> students;

    @BeforeEach
    void setUp() {
        catalog = StudyCatalog.standard();
        properties = new SurveyTiersProperties();
        simulator = new ResponseSimulatorService(catalog, properties);
        students = new PopulationGeneratorService(catalog, properties).generateStudents(GenerationContext.forSeed(42));
    }

    @Test
    void totalsEqualItemSums() {
        List<RawResponse> responses = simulator.simulate(students, GenerationContext.forSeed(42));

        assertThat(responses).isNotEmpty();
        for (RawResponse response : responses) {
            for (SurveyDefinition survey : catalog.getSurveys()) {
                SurveyScores scores = response.getScores().get(survey.getId());
                assertThat(scores.getItems()).hasSize(survey.getItems());
                assertThat(scores.getItems()).allSatisfy(score -> assertThat(score).isBetween(0, 3));
                assertThat(scores.getTotal()).isEqualTo(scores.getItems().stream().mapToInt(Integer::intValue).sum());
            }
        }
    }

    @Test
    void responsesCarryStudentAttributes() {
        List<RawResponse> responses = simulator.simulate(students, GenerationContext.forSeed(4));

        Student first = students.get(0);
        assertThat(responses).filteredOn(r -> r.getStudentId().equals(first.getId()))
                .allSatisfy(r -> {
                    assertThat(r.getSchoolId()).isEqualTo(first.getSchoolId());
                    assertThat(r.getYearGroup()).isEqualTo(first.getYearGroup());
                    assertThat(r.getDemographicGroup()).isEqualTo(first.getDemographicGroup());
                    assertThat(catalog.getWaves()).contains(r.getWave());
                });
    }

    @Test
    void someResponsesAreMissing() {
        List<RawResponse> responses = simulator.simulate(students, GenerationContext.forSeed(42));

        assertThat(responses.size()).isLessThan(students.size() * catalog.getWaves().size());
    }

    @Test
    void noMissingnessYieldsEveryStudentWavePair() {
        properties.getResponses().setMissingRate(0.0);

        List<RawResponse> responses = simulator.simulate(students, GenerationContext.forSeed(42));

        assertThat(responses).hasSize(students.size() * catalog.getWaves().size());
    }

    @Test
    void fullMissingnessYieldsNoResponses() {
        properties.getResponses().setMissingRate(1.0);

        assertThat(simulator.simulate(students, GenerationContext.forSeed(42))).isEmpty();
    }

    @Test
    void alwaysElevatedStudentsScoreTwoOrThree() {
        properties.getResponses().setInitialElevationRate(1.0);
        properties.getResponses().setRecoveryRate(0.0);

        List<RawResponse> responses = simulator.simulate(students, GenerationContext.forSeed(42));

        assertThat(responses).allSatisfy(r -> r.getScores().values().forEach(scores ->
                assertThat(scores.getItems()).allSatisfy(score -> assertThat(score).isIn(2, 3))));
    }

    @Test
    void elevatedItemTakesTwoDraws() {
        DeterministicRandomSource random = new DeterministicRandomSource(5);
        DeterministicRandomSource reference = new DeterministicRandomSource(5);

        int score = ResponseSimulatorService.scoreItem(true, random);

        reference.next();
        int expected = Math.min(3, 2 + (int) Math.floor(reference.next() * 2));
        assertThat(score).isEqualTo(expected);
        assertThat(random.state()).isEqualTo(reference.state());
    }

    @Test
    void normalItemTakesOneDraw() {
        DeterministicRandomSource random = new DeterministicRandomSource(5);
        DeterministicRandomSource reference = new DeterministicRandomSource(5);

        int score = ResponseSimulatorService.scoreItem(false, random);

        assertThat(score).isEqualTo((int) Math.floor(reference.next() * 4));
        assertThat(random.state()).isEqualTo(reference.state());
    }
}
