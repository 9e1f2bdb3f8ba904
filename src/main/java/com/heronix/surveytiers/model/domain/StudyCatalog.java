package com.heronix.surveytiers.model.domain;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Value;

/**
 * Fixed reference data for the survey programme: TTPs, schools, year groups,
 * waves, demographic groups and survey instruments.
 *
 * List order is significant. Generation iterates every list in the order given
 * here, and changing it changes the random draw sequence.
 */
@Value
@Builder
public class StudyCatalog {

    List<TrustedThirdParty> ttps;

    List<School> schools;

    List<String> yearGroups;

    List<String> waves;

    List<String> demographicGroups;

    List<SurveyDefinition> surveys;

    // ========================================================================
    // LOOKUPS
    // ========================================================================

    public Optional<School> findSchool(String schoolId) {
        return schools.stream().filter(s -> s.getId().equals(schoolId)).findFirst();
    }

    public Optional<TrustedThirdParty> findTtp(String ttpId) {
        return ttps.stream().filter(t -> t.getId().equals(ttpId)).findFirst();
    }

    public Optional<SurveyDefinition> findSurvey(String surveyId) {
        return surveys.stream().filter(s -> s.getId().equals(surveyId)).findFirst();
    }

    /**
     * TTP id of a school, or null for a school outside the catalog.
     */
    public String ttpIdOf(String schoolId) {
        return findSchool(schoolId).map(School::getTtpId).orElse(null);
    }

    /**
     * Name pool of the TTP handling a school. Falls back to the first TTP.
     */
    public TrustedThirdParty namePoolFor(School school) {
        return findTtp(school.getTtpId()).orElse(ttps.get(0));
    }

    /**
     * The survey whose group size decides suppression.
     */
    public SurveyDefinition referenceSurvey() {
        return surveys.get(0);
    }

    public int waveIndex(String wave) {
        int index = waves.indexOf(wave);
        return index >= 0 ? index : Integer.MAX_VALUE;
    }

    // ========================================================================
    // STANDARD CATALOG
    // ========================================================================

    public static StudyCatalog standard() {
        TrustedThirdParty oxford = TrustedThirdParty.builder()
                .id("oxford-ttp")
                .name("Oxford Secure TTP")
                .firstNames(List.of(
                        "Alice", "Benjamin", "Charlotte", "Daniel", "Eleanor",
                        "Finn", "Grace", "Harriet", "Isabelle", "Jacob",
                        "Lily", "Matthew", "Nora", "Oliver", "Penelope",
                        "Quentin", "Rose", "Samuel", "Thomas", "Victoria"))
                .lastNames(List.of(
                        "Anderson", "Bennett", "Carter", "Davies", "Evans",
                        "Foster", "Green", "Hamilton", "Ingram", "Johnson",
                        "Knight", "Lewis", "Morgan", "Nelson", "Owen",
                        "Parker", "Quinn", "Roberts", "Stewart", "Turner"))
                .build();

        TrustedThirdParty shanghai = TrustedThirdParty.builder()
                .id("shanghai-ttp")
                .name("Shanghai Harmony TTP")
                .firstNames(List.of(
                        "An", "Bao", "Chun", "Daiyu", "Enlai",
                        "Fang", "Guang", "Haoran", "Jiayi", "Kai",
                        "Ling", "Ming", "Ning", "Peizhi", "Qiu",
                        "Rong", "Shan", "Tao", "Wei", "Ying"))
                .lastNames(List.of(
                        "Chen", "Deng", "Fang", "Gao", "Han",
                        "Huang", "Jiang", "Li", "Liu", "Ma",
                        "Peng", "Qian", "Sun", "Tang", "Wang",
                        "Xu", "Yang", "Zeng", "Zhang", "Zhou"))
                .build();

        return StudyCatalog.builder()
                .ttps(List.of(oxford, shanghai))
                .schools(List.of(
                        new School("oxford-high", "Oxford High", "oxford-ttp"),
                        new School("cherwell", "Cherwell School", "oxford-ttp"),
                        new School("magdalen", "Magdalen College School", "oxford-ttp"),
                        new School("pudong-high", "Pudong High School", "shanghai-ttp"),
                        new School("huangpu-academy", "Huangpu Academy", "shanghai-ttp")))
                .yearGroups(List.of("Year 9", "Year 10", "Year 11"))
                .waves(List.of("Wave 1", "Wave 2", "Wave 3"))
                .demographicGroups(List.of("Asian", "Black", "Mixed", "White", "Other"))
                .surveys(List.of(
                        new SurveyDefinition("phq9", "PHQ-9", 9),
                        new SurveyDefinition("gad7", "GAD-7", 7)))
                .build();
    }
}
