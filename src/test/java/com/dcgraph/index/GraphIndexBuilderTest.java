package com.dcgraph.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class GraphIndexBuilderTest {

    @Test
    void shouldKeepCallAndDependencyMapsTransposed() {
        GraphIndexBuilder builder = new GraphIndexBuilder()
                .recordCall("a", "b")
                .recordCall("a", "c")
                .recordCall("a", "b")
                .recordCall("b", "a");

        assertTrue(builder.isTransposeConsistent());
        GraphIndex index = builder.build();
        assertEquals(List.of("b", "c", "b"), index.calleesOf("a"));
        assertEquals(List.of("a", "a"), index.callersOf("b"));
        assertEquals(List.of("b"), index.callersOf("a"));
        assertEquals(4, index.edgeCount());
        assertEquals(4, builder.edgeCount());
    }

    @Test
    void shouldMergeInArgumentOrder() {
        GraphIndexBuilder first = new GraphIndexBuilder().recordCall("x", "shared");
        GraphIndexBuilder second = new GraphIndexBuilder().recordCall("y", "shared").defineProcedure("z");

        GraphIndex merged = new GraphIndexBuilder().merge(first).merge(second).build();

        assertEquals(List.of("x", "y"), merged.callersOf("shared"));
        assertEquals(List.of("x", "y", "z"), List.copyOf(merged.procedureNames()));
        assertEquals(2, merged.edgeCount());
    }

    @Test
    void shouldDistinguishDefinedProceduresFromCalledNames() {
        GraphIndex index = new GraphIndexBuilder()
                .defineProcedure("leaf")
                .recordCall("root", "external")
                .build();

        assertTrue(index.contains("leaf"));
        assertTrue(index.calleesOf("leaf").isEmpty());
        assertFalse(index.contains("external"));
        assertTrue(index.hasDependencyInfo("external"));
        assertFalse(index.hasDependencyInfo("nowhere"));
        assertEquals(List.of(), index.callersOf("nowhere"));
    }

    @Test
    void shouldNotLetBuiltIndexChangeWithBuilder() {
        GraphIndexBuilder builder = new GraphIndexBuilder().recordCall("a", "b");
        GraphIndex index = builder.build();

        builder.recordCall("a", "c");

        assertEquals(List.of("b"), index.calleesOf("a"));
        assertThrows(UnsupportedOperationException.class, () -> index.calleesOf("a").add("d"));
        assertThrows(UnsupportedOperationException.class, () -> index.callMap().remove("a"));
    }

    @Test
    void shouldDetectInconsistentRawSections() {
        GraphIndexBuilder builder = new GraphIndexBuilder();
        builder.appendCallEntry("a", List.of("b", "b"));
        builder.appendDependencyEntry("b", List.of("a"));

        assertFalse(builder.isTransposeConsistent());
    }

    @Test
    void shouldTreatEmptyGraphAsEmpty() {
        assertTrue(GraphIndex.empty().isEmpty());
        assertFalse(new GraphIndexBuilder().defineProcedure("p").build().isEmpty());
    }
}
