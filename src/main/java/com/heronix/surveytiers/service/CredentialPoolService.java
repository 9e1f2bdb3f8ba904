package com.heronix.surveytiers.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.heronix.surveytiers.config.SurveyTiersProperties;
import com.heronix.surveytiers.exception.InsufficientCredentialsException;
import com.heronix.surveytiers.model.domain.CredentialAllocation;
import com.heronix.surveytiers.model.domain.CredentialRecord;
import com.heronix.surveytiers.model.domain.School;
import com.heronix.surveytiers.model.domain.Student;
import com.heronix.surveytiers.model.domain.StudentCredential;
import com.heronix.surveytiers.model.domain.StudyCatalog;
import com.heronix.surveytiers.random.DeterministicRandomSource;
import com.heronix.surveytiers.random.GenerationContext;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues identifiable login credentials per school and binds them to students.
 *
 * Each school receives ceil(oversizeFactor x students) credentials. Login ids
 * follow the format SCHOOLID-SUFFIX, e.g. "cherwell-k3x9a2", and are unique
 * within the school. Passwords follow XXXX-XXXXXXXX.
 *
 * Primary stream: one draw per school for the batch base number. Id and
 * password characters come from the auxiliary stream.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialPoolService {

    private static final int PASSWORD_PREFIX_LENGTH = 4;
    private static final int PASSWORD_SUFFIX_LENGTH = 8;

    private final StudyCatalog catalog;
    private final SurveyTiersProperties properties;

    /**
     * Issue the pool for every school and assign one credential per student.
     *
     * @throws InsufficientCredentialsException if a school's pool runs out
     */
    public CredentialAllocation allocate(List<Student> students, GenerationContext context) {
        List<CredentialRecord> pool = issueCredentials(students, context);
        List<StudentCredential> assigned = assign(students, pool);

        Set<String> assignedIds = new HashSet<>();
        for (StudentCredential sc : assigned) {
            assignedIds.add(sc.getLoginId());
        }
        List<CredentialRecord> administrative = pool.stream()
                .filter(cred -> !assignedIds.contains(cred.getLoginId()))
                .toList();

        log.debug("Issued {} credentials, {} assigned, {} administrative",
                pool.size(), assigned.size(), administrative.size());

        return CredentialAllocation.builder()
                .credentials(pool)
                .studentCredentials(assigned)
                .administrativeCredentials(administrative)
                .build();
    }

    /**
     * Generate the credential pool, school by school in catalog order.
     *
     * @throws InsufficientCredentialsException if a pool exceeds the login id space
     */
    public List<CredentialRecord> issueCredentials(List<Student> students, GenerationContext context) {
        DeterministicRandomSource random = context.getPrimary();
        DeterministicRandomSource characters = context.getAuxiliary();
        var config = properties.getCredentials();

        double idSpace = loginIdSpace(config.getCharset(), config.getIdLength());

        List<CredentialRecord> pool = new ArrayList<>();
        for (School school : catalog.getSchools()) {
            int base = random.nextInt(90000) + 10000;
            long required = students.stream()
                    .filter(s -> s.getSchoolId().equals(school.getId()))
                    .count();
            int poolSize = poolSize(required, config.getOversizeFactor());
            if (poolSize > idSpace) {
                log.error("School {} needs {} login ids but only {} exist", school.getId(), poolSize, (long) idSpace);
                throw InsufficientCredentialsException.loginIdSpaceTooSmall(school.getId(), poolSize, idSpace);
            }

            Set<String> issued = new HashSet<>();
            for (int i = 0; i < poolSize; i++) {
                String loginId;
                do {
                    loginId = school.getId() + "-" + randomString(characters, config.getCharset(), config.getIdLength());
                } while (!issued.add(loginId));

                String password = randomString(characters, config.getCharset(), PASSWORD_PREFIX_LENGTH)
                        + "-" + randomString(characters, config.getCharset(), PASSWORD_SUFFIX_LENGTH);

                pool.add(CredentialRecord.builder()
                        .schoolId(school.getId())
                        .loginId(loginId)
                        .password(password)
                        .issueBatch(base)
                        .build());
            }
            log.debug("School {}: {} students, {} credentials (batch {})", school.getId(), required, poolSize, base);
        }
        return List.copyOf(pool);
    }

    /**
     * Bind each student, in order, to the first unassigned credential of its school.
     *
     * @throws InsufficientCredentialsException if a school has no credential left
     */
    public List<StudentCredential> assign(List<Student> students, List<CredentialRecord> pool) {
        Map<String, List<CredentialRecord>> available = new LinkedHashMap<>();
        for (CredentialRecord credential : pool) {
            available.computeIfAbsent(credential.getSchoolId(), k -> new ArrayList<>()).add(credential);
        }
        Map<String, Integer> nextIndex = new LinkedHashMap<>();

        List<StudentCredential> result = new ArrayList<>();
        for (Student student : students) {
            List<CredentialRecord> schoolPool = available.getOrDefault(student.getSchoolId(), List.of());
            int index = nextIndex.getOrDefault(student.getSchoolId(), 0);
            if (index >= schoolPool.size()) {
                log.error("Credential pool exhausted for school {} at student {}",
                        student.getSchoolId(), student.getId());
                throw new InsufficientCredentialsException(student.getId(), student.getSchoolId());
            }
            nextIndex.put(student.getSchoolId(), index + 1);

            result.add(StudentCredential.builder()
                    .studentId(student.getId())
                    .schoolId(student.getSchoolId())
                    .studentName(student.getName())
                    .yearGroup(student.getYearGroup())
                    .credential(schoolPool.get(index))
                    .build());
        }
        return List.copyOf(result);
    }

    static int poolSize(long required, double oversizeFactor) {
        return (int) Math.ceil(required * oversizeFactor);
    }

    /**
     * Number of distinct login id suffixes the charset and length allow.
     */
    static double loginIdSpace(String charset, int idLength) {
        return Math.pow(charset.chars().distinct().count(), idLength);
    }

    private String randomString(DeterministicRandomSource random, String charset, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(charset.charAt(random.nextInt(charset.length())));
        }
        return sb.toString();
    }
}
