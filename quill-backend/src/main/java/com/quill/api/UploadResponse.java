package com.quill.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.quill.model.ColumnInfo;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response for {@code POST /api/upload}.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UploadResponse {
    private boolean success;
    private String tableName;
    private long rowCount;
    private List<ColumnInfo> columns;
}
