package com.heronix.surveytiers.model.dto;

import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flattened, filtered responses ready for a table view.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResponseRowsDTO {

    private long seed;

    /**
     * "raw" or "relabelled"
     */
    private String tier;

    private List<ColumnDTO> columns;

    private List<Map<String, Object>> rows;

    public record ColumnDTO(String key, String label) {}
}
