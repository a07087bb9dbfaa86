package com.quill.api;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Response for {@code GET /api/tables}.
 */
@Data
public class TablesResponse {
    private List<TableInfo> tables = new ArrayList<>();
}
