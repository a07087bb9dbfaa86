package com.quill.service;

import com.quill.engine.QueryEngine;
import com.quill.model.EnrichedContext;
import com.quill.model.Schema;
import com.quill.resolver.SchemaResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ContextAssemblerTest {

    private QueryEngine engine;
    private SchemaResolver resolver;
    private ContextAssembler assembler;
    private EnrichedContext enriched;

    @BeforeEach
    void setUp() {
        engine = mock(QueryEngine.class);
        resolver = mock(SchemaResolver.class);
        assembler = new ContextAssembler(engine, resolver, 85, 50);
        enriched = new EnrichedContext(Schema.empty(), List.of(), Map.of(), List.of());
        when(resolver.formatEnrichedContext(enriched)).thenReturn("BASE");
    }

    @Test
    void appendsRelationshipsAndCategoricals() {
        Map<String, List<String>> categoricals = new LinkedHashMap<>();
        categoricals.put("customers.country", List.of("Germany", "Mexico"));
        categoricals.put("orders.status", List.of("open"));
        when(engine.detectRelationships(any(), eq(85))).thenReturn(List.of("orders.customerID <-> customers.customerID"));
        when(engine.getCategoricalValues(any(), eq(50))).thenReturn(categoricals);

        String context = assembler.assemble(enriched);

        assertThat(context).isEqualTo("BASE"
                + "\n\nDetected Join Relationships:\norders.customerID <-> customers.customerID"
                + "\n\nCategorical Values:\ncustomers.country: Germany, Mexico\norders.status: open\n");
    }

    @Test
    void omitsEmptySections() {
        when(engine.detectRelationships(any(), eq(85))).thenReturn(List.of());
        when(engine.getCategoricalValues(any(), eq(50))).thenReturn(Map.of());

        assertThat(assembler.assemble(enriched)).isEqualTo("BASE");
    }

    @Test
    void failingLookupsAreSkipped() {
        when(engine.detectRelationships(any(), eq(85))).thenThrow(new IllegalStateException("pool closed"));
        when(engine.getCategoricalValues(any(), eq(50))).thenReturn(Map.of("t.c", List.of("x")));

        assertThat(assembler.assemble(enriched)).isEqualTo("BASE\n\nCategorical Values:\nt.c: x\n");
    }
}
