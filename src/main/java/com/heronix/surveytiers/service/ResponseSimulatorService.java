package com.heronix.surveytiers.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.heronix.surveytiers.config.SurveyTiersProperties;
import com.heronix.surveytiers.model.domain.RawResponse;
import com.heronix.surveytiers.model.domain.Student;
import com.heronix.surveytiers.model.domain.StudyCatalog;
import com.heronix.surveytiers.model.domain.SurveyDefinition;
import com.heronix.surveytiers.model.domain.SurveyScores;
import com.heronix.surveytiers.model.enums.ElevationState;
import com.heronix.surveytiers.random.DeterministicRandomSource;
import com.heronix.surveytiers.random.GenerationContext;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Simulates per-student, per-wave survey responses.
 *
 * Each student carries an {@link ElevationState} across waves. Elevated waves
 * score every item in {2, 3}; other waves in {0, 1, 2, 3}. Some (student, wave)
 * pairs are skipped to mimic missing data.
 *
 * Draw order on the primary stream, per student:
 * - initial state
 * - per wave: missing check, then (NORMAL only) the wave elevation roll, then
 *   per survey and item one base draw plus one more on elevated waves, then
 *   the state transition
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseSimulatorService {

    private final StudyCatalog catalog;
    private final SurveyTiersProperties properties;

    public List<RawResponse> simulate(List<Student> students, GenerationContext context) {
        DeterministicRandomSource random = context.getPrimary();
        var rates = properties.getResponses();

        List<RawResponse> responses = new ArrayList<>();
        int skipped = 0;

        for (Student student : students) {
            ElevationState state = ElevationState.initial(random::next, rates.getInitialElevationRate());

            for (String wave : catalog.getWaves()) {
                if (random.next() < rates.getMissingRate()) {
                    skipped++;
                    continue;
                }
                boolean elevatedThisWave = state.elevatesWave(random::next, rates.getWaveElevationRate());

                responses.add(RawResponse.builder()
                        .studentId(student.getId())
                        .schoolId(student.getSchoolId())
                        .yearGroup(student.getYearGroup())
                        .demographicGroup(student.getDemographicGroup())
                        .wave(wave)
                        .scores(scoreSurveys(elevatedThisWave, random))
                        .build());

                state = state.next(elevatedThisWave, random::next, rates.getRecoveryRate(), rates.getRelapseRate());
            }
        }

        log.debug("Simulated {} responses ({} missing)", responses.size(), skipped);
        return List.copyOf(responses);
    }

    Map<String, SurveyScores> scoreSurveys(boolean elevated, DeterministicRandomSource random) {
        Map<String, SurveyScores> scores = new LinkedHashMap<>();
        for (SurveyDefinition survey : catalog.getSurveys()) {
            List<Integer> items = new ArrayList<>(survey.getItems());
            for (int i = 0; i < survey.getItems(); i++) {
                items.add(scoreItem(elevated, random));
            }
            scores.put(survey.getId(), SurveyScores.of(items));
        }
        return Collections.unmodifiableMap(scores);
    }

    /**
     * One item score. The base draw is always taken, even when an elevated
     * wave replaces it.
     */
    static int scoreItem(boolean elevated, DeterministicRandomSource random) {
        int normalScore = random.nextInt(4);
        if (elevated) {
            return Math.min(3, 2 + random.nextInt(2));
        }
        return normalScore;
    }
}
