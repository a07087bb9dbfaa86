package com.quill.resolver;

import java.util.List;

/**
 * How keywords are compared with column names. Selected once at startup.
 */
public interface MatchingStrategy {

    /**
     * Mode label shown in the formatted context, {@code fuzzy} or {@code hybrid}.
     */
    String mode();

    /**
     * Precompute whatever the strategy needs for a column set.
     *
     * @param entries flattened columns of the new schema
     * @return scorer aligned with {@code entries}
     */
    ColumnScorer prepare(List<ColumnEntry> entries);
}
