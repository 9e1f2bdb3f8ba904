package com.heronix.surveytiers.model.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.heronix.surveytiers.model.domain.RawResponse;
import com.heronix.surveytiers.model.domain.RelabelledResponse;
import com.heronix.surveytiers.model.domain.School;
import com.heronix.surveytiers.model.domain.StudyCatalog;
import com.heronix.surveytiers.model.domain.SurveyDefinition;
import com.heronix.surveytiers.model.domain.SurveyResponse;
import com.heronix.surveytiers.model.domain.SurveyScores;
import com.heronix.surveytiers.model.domain.TrustedThirdParty;

/**
 * Column schema for flattening survey responses into table rows.
 *
 * Built once from the survey catalog. Columns, in order:
 * id, school, ttp, yearGroup, demographicGroup, wave, then per survey
 * "&lt;survey&gt;-total" followed by "&lt;survey&gt;-item-0" .. "&lt;survey&gt;-item-(n-1)".
 *
 * The id column holds the student id for raw responses and the UID for
 * relabelled responses.
 */
public final class ResponseFieldSchema {

    private final List<FieldColumn> columns;

    private ResponseFieldSchema(List<FieldColumn> columns) {
        this.columns = List.copyOf(columns);
    }

    public static ResponseFieldSchema fromCatalog(StudyCatalog catalog) {
        List<FieldColumn> columns = new ArrayList<>();
        columns.add(new FieldColumn("id", "ID", ResponseFieldSchema::identifier));
        columns.add(new FieldColumn("school", "School", r -> schoolName(catalog, r.getSchoolId())));
        columns.add(new FieldColumn("ttp", "TTP", r -> ttpName(catalog, r.getSchoolId())));
        columns.add(new FieldColumn("yearGroup", "Yeargroup", SurveyResponse::getYearGroup));
        columns.add(new FieldColumn("demographicGroup", "Demographic group", SurveyResponse::getDemographicGroup));
        columns.add(new FieldColumn("wave", "Wave", SurveyResponse::getWave));

        for (SurveyDefinition survey : catalog.getSurveys()) {
            String surveyId = survey.getId();
            columns.add(new FieldColumn(survey.totalKey(), survey.getName() + " total", r -> r.total(surveyId)));
            for (int i = 0; i < survey.getItems(); i++) {
                int item = i;
                columns.add(new FieldColumn(survey.itemKey(i), survey.getName() + " Q" + (i + 1),
                        r -> itemScore(r, surveyId, item)));
            }
        }
        return new ResponseFieldSchema(columns);
    }

    public List<FieldColumn> getColumns() {
        return columns;
    }

    public Optional<FieldColumn> column(String key) {
        return columns.stream().filter(c -> c.key().equals(key)).findFirst();
    }

    /**
     * Flatten a response into an ordered column key to value map.
     */
    public Map<String, Object> toRow(SurveyResponse response) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (FieldColumn column : columns) {
            row.put(column.key(), column.extract(response));
        }
        return row;
    }

    public List<Map<String, Object>> toRows(List<? extends SurveyResponse> responses) {
        return responses.stream().map(this::toRow).toList();
    }

    private static Object identifier(SurveyResponse response) {
        if (response instanceof RawResponse) {
            return ((RawResponse) response).getStudentId();
        }
        if (response instanceof RelabelledResponse) {
            return ((RelabelledResponse) response).getUid();
        }
        return null;
    }

    private static Integer itemScore(SurveyResponse response, String surveyId, int item) {
        SurveyScores scores = response.getScores().get(surveyId);
        if (scores == null || item >= scores.getItems().size()) {
            return null;
        }
        return scores.getItems().get(item);
    }

    private static String schoolName(StudyCatalog catalog, String schoolId) {
        return catalog.findSchool(schoolId).map(School::getName).orElse(schoolId);
    }

    private static String ttpName(StudyCatalog catalog, String schoolId) {
        String ttpId = catalog.ttpIdOf(schoolId);
        if (ttpId == null) {
            return "-";
        }
        return catalog.findTtp(ttpId).map(TrustedThirdParty::getName).orElse(ttpId);
    }
}
