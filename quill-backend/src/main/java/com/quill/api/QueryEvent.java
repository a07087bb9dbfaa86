package com.quill.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * One Server-Sent Event of a streaming query.
 *
 * <p>{@code type} is one of {@code thinking}, {@code sql}, {@code result}, {@code summary},
 * {@code summary_done}, {@code error}. {@code row_count} and {@code attempts} are only set on
 * {@code result}.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryEvent {
    private String type;
    private Object content;
    private Integer rowCount;
    private Integer attempts;
}
