package org.koa.encoding;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

class OccurrenceTablesTest {

    @Test
    void testRecordValidatesKeys() {
        OccurrenceTables tables = new OccurrenceTables(new AlphabetIndex(List.of("a", "b")));

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> tables.record(TableKind.FIRST_TO_SECOND, OccurrenceKey.of(1)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> tables.record(TableKind.SOURCE_TO_FIRST, OccurrenceKey.of(3)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> tables.record(TableKind.SOURCE_TO_FIRST, OccurrenceKey.of(0)));
        Assertions.assertTrue(tables.isEmpty());
    }

    @Test
    void testInsertionOrderIsKept() {
        OccurrenceTables tables = new OccurrenceTables(new AlphabetIndex(List.of("a", "b")));
        tables.record(TableKind.INTERIOR_PAIR, OccurrenceKey.of(2, 2));
        tables.record(TableKind.INTERIOR_PAIR, OccurrenceKey.of(1, 2));
        tables.record(TableKind.INTERIOR_PAIR, OccurrenceKey.of(2, 2));

        Assertions.assertEquals(List.of(OccurrenceKey.of(2, 2), OccurrenceKey.of(1, 2)),
                List.copyOf(tables.entries(TableKind.INTERIOR_PAIR).keySet()));
        Assertions.assertEquals(2, tables.distinctKeys());
        Assertions.assertEquals(3, tables.totalOccurrences());
    }

    @Test
    void testViewsAreReadOnly() {
        OccurrenceTables tables = new OccurrenceTables(new AlphabetIndex(List.of("a")));

        Assertions.assertThrows(UnsupportedOperationException.class,
                () -> tables.entries(TableKind.SOURCE_TO_FIRST).put(OccurrenceKey.of(1), 1));
    }

    @Test
    void testDump() {
        OccurrenceTables tables = new OccurrenceTables(new AlphabetIndex(List.of("a")));
        tables.record(TableKind.LAST_TO_SINK, OccurrenceKey.anchored(1));
        String dump = tables.dump();

        Assertions.assertTrue(dump.contains("vincolo A:"));
        Assertions.assertTrue(dump.contains("vincolo B:"));
        Assertions.assertTrue(dump.contains("ultimo->snk: {(1)*=1}"));
        Assertions.assertTrue(dump.indexOf("ultimo->snk") < dump.indexOf("vincolo B:"));
        Assertions.assertTrue(dump.indexOf("vincolo B:") < dump.indexOf("(primo)id1->id2->id3"));
    }

    @Test
    void testTransitivityTables() {
        List<TableKind> partB = new ArrayList<>();
        for (TableKind kind : TableKind.values()) {
            if (kind.isTransitivity()) {
                partB.add(kind);
                Assertions.assertTrue(kind.getArity() >= 2);
            }
        }

        Assertions.assertEquals(List.of(TableKind.FIRST_TRIPLE, TableKind.INTERIOR_TRIPLE, TableKind.PAIR_BEFORE_SINK), partB);
    }

    @Test
    void testKeyRendering() {
        Assertions.assertEquals("(1, 2, 3)", OccurrenceKey.of(1, 2, 3).toString());
        Assertions.assertEquals("(2)*", OccurrenceKey.anchored(2).toString());
        Assertions.assertNotEquals(OccurrenceKey.of(1), OccurrenceKey.anchored(1));
    }

    @Test
    void testKeyEquality() {
        OccurrenceKey key = new OccurrenceKey(List.of(1, 2), true);

        Assertions.assertEquals(OccurrenceKey.anchored(1, 2), key);
        Assertions.assertEquals(OccurrenceKey.anchored(1, 2).hashCode(), key.hashCode());
        Assertions.assertNotEquals(OccurrenceKey.of(2, 1), OccurrenceKey.of(1, 2));
        Assertions.assertTrue(key.isAnchored());
        Assertions.assertEquals(List.of(1, 2), key.getIds());

        Map<OccurrenceKey, Integer> counts = new HashMap<>();
        counts.merge(OccurrenceKey.of(1, 2), 1, Integer::sum);
        counts.merge(OccurrenceKey.of(1, 2), 1, Integer::sum);
        Assertions.assertEquals(2, counts.get(OccurrenceKey.of(1, 2)));
    }
}
