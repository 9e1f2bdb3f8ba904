package com.heronix.surveytiers.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.heronix.surveytiers.model.domain.RawResponse;
import com.heronix.surveytiers.model.domain.RelabelledResponse;
import com.heronix.surveytiers.model.domain.RewriteMapEntry;
import com.heronix.surveytiers.model.domain.Student;

import lombok.extern.slf4j.Slf4j;

/**
 * Replaces student ids with UIDs.
 *
 * UIDs follow the format UID-NNNNN: the 1-based position of the student in
 * generation order, zero-padded to five digits. The mapping is a bijection and
 * does not depend on the school.
 *
 * A response whose student id has no mapping is relabelled with
 * {@link #UNKNOWN_UID} rather than rejected.
 */
@Service
@Slf4j
public class PseudonymizationService {

    public static final String UID_PREFIX = "UID-";

    /**
     * Placeholder UID for responses without a rewrite map entry. Never a real UID.
     */
    public static final String UNKNOWN_UID = "UNKNOWN";

    /**
     * Build the rewrite map in student order.
     */
    public List<RewriteMapEntry> buildRewriteMap(List<Student> students) {
        List<RewriteMapEntry> map = new ArrayList<>(students.size());
        for (int i = 0; i < students.size(); i++) {
            Student student = students.get(i);
            map.add(RewriteMapEntry.builder()
                    .schoolId(student.getSchoolId())
                    .studentId(student.getId())
                    .uid(formatUid(i + 1))
                    .build());
        }
        return List.copyOf(map);
    }

    /**
     * Relabel every response with its UID, dropping the student id.
     */
    public List<RelabelledResponse> relabel(List<RawResponse> responses, List<RewriteMapEntry> rewriteMap) {
        Map<String, String> byStudent = new HashMap<>();
        for (RewriteMapEntry entry : rewriteMap) {
            byStudent.put(entry.getStudentId(), entry.getUid());
        }

        List<RelabelledResponse> result = new ArrayList<>(responses.size());
        int unknown = 0;
        for (RawResponse response : responses) {
            String uid = byStudent.get(response.getStudentId());
            if (uid == null) {
                unknown++;
                uid = UNKNOWN_UID;
            }
            result.add(RelabelledResponse.builder()
                    .uid(uid)
                    .schoolId(response.getSchoolId())
                    .yearGroup(response.getYearGroup())
                    .demographicGroup(response.getDemographicGroup())
                    .wave(response.getWave())
                    .scores(response.getScores())
                    .build());
        }

        if (unknown > 0) {
            log.warn("{} responses had no rewrite map entry and were relabelled {}", unknown, UNKNOWN_UID);
        }
        return List.copyOf(result);
    }

    static String formatUid(int position) {
        return UID_PREFIX + String.format("%05d", position);
    }
}
