package com.vidnyan.quyaml.domain.gate;

import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GateRegistryTest {

    private final GateRegistry registry = GateRegistry.standard();

    @Test
    void resolve_ShouldFindGatesCaseInsensitively() {
        GateSpec cx = registry.resolve("CX");

        assertEquals("cx", cx.name());
        assertEquals(2, cx.arity());
        assertEquals(0, cx.classicalArity());
        assertFalse(cx.parametric());
    }

    @Test
    void resolve_ShouldMapAliasesToCanonicalGate() {
        assertEquals(registry.resolve("cx"), registry.resolve("cnot"));
        assertEquals("cphase", registry.resolve("cp").name());
        assertEquals(3, registry.resolve("Toffoli").arity());
    }

    @Test
    void resolve_ShouldDescribeRotations() {
        GateSpec rx = registry.resolve("rx");

        assertTrue(rx.parametric());
        assertEquals("rx(<expr>) q", rx.signature());
        assertEquals("cphase(<expr>) q q", registry.resolve("cphase").signature());
    }

    @Test
    void resolve_ShouldDescribeReadoutsWithClassicalOperand() {
        GateSpec mx = registry.resolve("measure_x");

        assertEquals("mx", mx.name());
        assertEquals(1, mx.classicalArity());
        assertEquals("mx q c", mx.signature());
        assertEquals("my q c", registry.resolve("MY").signature());
    }

    @Test
    void resolve_ShouldFailForUnknownMnemonic() {
        QuyamlException e = assertThrows(QuyamlException.class, () -> registry.resolve("foo"));

        assertEquals(ErrorKind.UNKNOWN_GATE, e.kind());
        assertEquals("Unknown gate 'foo'", e.detail());
        assertTrue(registry.find("foo").isEmpty());
    }

    @Test
    void builder_ShouldRejectInconsistentTables() {
        assertThrows(IllegalArgumentException.class, () -> GateRegistry.builder()
                .gate(GateSpec.fixed("h", 1))
                .gate(GateSpec.fixed("H", 1)));
        assertThrows(IllegalArgumentException.class, () -> GateRegistry.builder()
                .gate(GateSpec.fixed("h", 1))
                .alias("hadamard", "had")
                .build());
        assertThrows(IllegalArgumentException.class, () -> GateRegistry.builder()
                .gate(GateSpec.fixed("h", 1))
                .gate(GateSpec.fixed("x", 1))
                .alias("x", "h")
                .build());
        assertThrows(IllegalArgumentException.class, () -> GateSpec.fixed("none", 0));
    }

    @Test
    void builder_ShouldSupportCustomGates() {
        GateRegistry custom = GateRegistry.builder()
                .gate(GateSpec.fixed("h", 1))
                .gate(new GateSpec("measure_into", 1, 1, false))
                .build();

        assertEquals(2, custom.size());
        assertEquals("measure_into q c", custom.resolve("measure_into").signature());
    }
}
