package org.koa.encoding;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

class PositiveAggregatorTest {

    private static EncodingContext context() {
        return new EncodingContext(List.of("a", "b"), 2);
    }

    @Test
    void testSingleSymbolIsAnchored() {
        EncodingContext context = context();
        new PositiveAggregator(context).add(List.of("a"));
        OccurrenceTables tables = context.getTables();

        Assertions.assertEquals(1, tables.count(TableKind.SOURCE_TO_FIRST, OccurrenceKey.of(1)));
        Assertions.assertEquals(1, tables.count(TableKind.LAST_TO_SINK, OccurrenceKey.anchored(1)));
        Assertions.assertEquals(0, tables.count(TableKind.LAST_TO_SINK, OccurrenceKey.of(1)));
        Assertions.assertTrue(tables.entries(TableKind.FIRST_TO_SECOND).isEmpty());
        Assertions.assertTrue(tables.entries(TableKind.PAIR_BEFORE_SINK).isEmpty());
        Assertions.assertEquals(2, tables.distinctKeys());
    }

    @Test
    void testPairIsAnchoredBeforeSink() {
        EncodingContext context = context();
        new PositiveAggregator(context).add(List.of("a", "b"));
        OccurrenceTables tables = context.getTables();

        Assertions.assertEquals(1, tables.count(TableKind.SOURCE_TO_FIRST, OccurrenceKey.of(1)));
        Assertions.assertEquals(1, tables.count(TableKind.LAST_TO_SINK, OccurrenceKey.of(2)));
        Assertions.assertEquals(1, tables.count(TableKind.FIRST_TO_SECOND, OccurrenceKey.of(1, 2)));
        Assertions.assertEquals(1, tables.count(TableKind.PAIR_BEFORE_SINK, OccurrenceKey.anchored(1, 2)));
        Assertions.assertTrue(tables.entries(TableKind.INTERIOR_PAIR).isEmpty());
        Assertions.assertTrue(tables.entries(TableKind.FIRST_TRIPLE).isEmpty());
    }

    @Test
    void testLongSample() {
        EncodingContext context = context();
        new PositiveAggregator(context).add(List.of("a", "b", "a", "b"));
        OccurrenceTables tables = context.getTables();

        Assertions.assertEquals(List.of(OccurrenceKey.of(2, 1), OccurrenceKey.of(1, 2)),
                List.copyOf(tables.entries(TableKind.INTERIOR_PAIR).keySet()));
        Assertions.assertEquals(Map.of(OccurrenceKey.of(1, 2, 1), 1), tables.entries(TableKind.FIRST_TRIPLE));
        Assertions.assertEquals(Map.of(OccurrenceKey.of(2, 1, 2), 1), tables.entries(TableKind.INTERIOR_TRIPLE));
        Assertions.assertEquals(Map.of(OccurrenceKey.of(1, 2), 1), tables.entries(TableKind.PAIR_BEFORE_SINK));
        Assertions.assertEquals(Map.of(OccurrenceKey.of(2), 1), tables.entries(TableKind.LAST_TO_SINK));
    }

    @Test
    void testRepeatedEvidenceOnlyCounts() {
        EncodingContext context = context();
        PositiveAggregator aggregator = new PositiveAggregator(context);
        aggregator.addAll(List.of(List.of("a", "b", "b"), List.of("a", "b", "b")));
        OccurrenceTables tables = context.getTables();

        Assertions.assertEquals(2, tables.count(TableKind.FIRST_TRIPLE, OccurrenceKey.of(1, 2, 2)));
        Assertions.assertEquals(6, tables.distinctKeys());
        Assertions.assertEquals(12, tables.totalOccurrences());
    }

    @Test
    void testEmptySampleUpdatesNothing() {
        EncodingContext context = context();
        new PositiveAggregator(context).add(List.of());

        Assertions.assertTrue(context.getTables().isEmpty());
        Assertions.assertEquals(0, context.getTables().totalOccurrences());
    }

    @Test
    void testUnknownSymbol() {
        EncodingContext context = context();
        PositiveAggregator aggregator = new PositiveAggregator(context);

        Assertions.assertThrows(IllegalArgumentException.class, () -> aggregator.add(List.of("a", "z")));
    }
}
