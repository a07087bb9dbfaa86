package com.quill.resolver;

import com.quill.model.Schema;

import java.util.List;

/**
 * Everything the resolver derives from one schema; replaced as a whole on refresh.
 */
record ResolverSnapshot(Schema schema, List<ColumnEntry> entries, ColumnScorer scorer) {

    ResolverSnapshot {
        entries = List.copyOf(entries);
    }
}
