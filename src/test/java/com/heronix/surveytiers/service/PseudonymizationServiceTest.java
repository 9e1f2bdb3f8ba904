package com.heronix.surveytiers.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.heronix.surveytiers.config.SurveyTiersProperties;
import com.heronix.surveytiers.model.domain.RawResponse;
import com.heronix.surveytiers.model.domain.RelabelledResponse;
import com.heronix.surveytiers.model.domain.RewriteMapEntry;
import com.heronix.surveytiers.model.domain.Student;
import com.heronix.surveytiers.model.domain.StudyCatalog;
import com.heronix.surveytiers.model.domain.SurveyScores;
import com.heronix.surveytiers.random.GenerationContext;

class PseudonymizationServiceTest {

    private PseudonymizationService pseudonymizer;
    private List<Student> students;

    @BeforeEach
    void setUp() {
        pseudonymizer = new PseudonymizationService();
        students = new PopulationGeneratorService(StudyCatalog.standard(), new SurveyTiersProperties())
                .generateStudents(GenerationContext.forSeed(42));
    }

    @Test
    void uidsAreSequentialAndZeroPadded() {
        List<RewriteMapEntry> map = pseudonymizer.buildRewriteMap(students);

        assertThat(map).hasSameSizeAs(students);
        assertThat(map.get(0).getUid()).isEqualTo("UID-00001");
        assertThat(map.get(1).getUid()).isEqualTo("UID-00002");
        for (int i = 0; i < map.size(); i++) {
            assertThat(map.get(i).getStudentId()).isEqualTo(students.get(i).getId());
            assertThat(map.get(i).getSchoolId()).isEqualTo(students.get(i).getSchoolId());
            assertThat(map.get(i).getUid()).isEqualTo(String.format("UID-%05d", i + 1));
        }
    }

    @Test
    void rewriteMapIsBijective() {
        List<RewriteMapEntry> map = pseudonymizer.buildRewriteMap(students);

        assertThat(map).extracting(RewriteMapEntry::getUid).doesNotHaveDuplicates();
        assertThat(map).extracting(RewriteMapEntry::getStudentId).doesNotHaveDuplicates();
    }

    @Test
    void relabelReplacesStudentIdWithUid() {
        List<RewriteMapEntry> map = pseudonymizer.buildRewriteMap(students);
        RawResponse response = response(students.get(2).getId());

        List<RelabelledResponse> relabelled = pseudonymizer.relabel(List.of(response), map);

        assertThat(relabelled).singleElement().satisfies(r -> {
            assertThat(r.getUid()).isEqualTo("UID-00003");
            assertThat(r.getWave()).isEqualTo("Wave 2");
            assertThat(r.getScores()).isEqualTo(response.getScores());
            assertThat(r.toString()).doesNotContain(students.get(2).getId());
        });
    }

    @Test
    void missingMappingYieldsUnknownSentinel() {
        RawResponse response = response("GHOST-9999");

        List<RelabelledResponse> relabelled = pseudonymizer.relabel(List.of(response), List.of());

        assertThat(relabelled).singleElement()
                .extracting(RelabelledResponse::getUid)
                .isEqualTo(PseudonymizationService.UNKNOWN_UID)
                .isEqualTo("UNKNOWN");
    }

    private static RawResponse response(String studentId) {
        return RawResponse.builder()
                .studentId(studentId)
                .schoolId("cherwell")
                .yearGroup("Year 10")
                .demographicGroup("Mixed")
                .wave("Wave 2")
                .scores(Map.of("phq9", SurveyScores.of(List.of(1, 2, 3))))
                .build();
    }
}
