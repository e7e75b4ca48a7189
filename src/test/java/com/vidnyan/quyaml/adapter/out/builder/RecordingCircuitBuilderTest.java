package com.vidnyan.quyaml.adapter.out.builder;

import com.vidnyan.quyaml.domain.condition.Condition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordingCircuitBuilderTest {

    @Test
    void calls_ShouldBeRecordedInOrder() {
        RecordingCircuitBuilder builder = new RecordingCircuitBuilder();

        builder.addGate("rx", List.of(0), null, 0.5);
        builder.beginIf(new Condition.BitEq(0, 1));
        builder.measure(0, 0);
        builder.endIf();

        assertEquals(List.of("addGate", "beginIf", "measure", "endIf"), builder.methods());
        assertEquals("addGate(rx, [0], null, 0.5)", builder.calls().get(0).format());
        assertEquals("beginIf(c[0] == 1)", builder.calls().get(1).format());
        assertTrue(builder.isBalanced());
    }

    @Test
    void mismatchedBlocks_ShouldBeRejected() {
        RecordingCircuitBuilder builder = new RecordingCircuitBuilder();

        assertThrows(IllegalStateException.class, builder::endIf);
        builder.beginFor(0, 2);
        assertThrows(IllegalStateException.class, builder::beginElse);
        assertThrows(IllegalStateException.class, builder::endWhile);
        assertFalse(builder.isBalanced());
    }
}
