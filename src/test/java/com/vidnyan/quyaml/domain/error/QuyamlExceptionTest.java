package com.vidnyan.quyaml.domain.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuyamlExceptionTest {

    @Test
    void under_ShouldPrefixEnclosingPath() {
        QuyamlException nested = QuyamlException.at(ErrorKind.UNKNOWN_GATE, "name", "Unknown gate 'foo'");

        QuyamlException anchored = nested.under("ops[2].gate");

        assertEquals("ops[2].gate.name", anchored.path());
        assertEquals(ErrorKind.UNKNOWN_GATE, anchored.kind());
        assertEquals("UNKNOWN_GATE at ops[2].gate.name: Unknown gate 'foo'", anchored.getMessage());
    }

    @Test
    void under_ShouldJoinIndexSegmentsWithoutDot() {
        assertEquals("ops[1]", QuyamlException.at(ErrorKind.STRUCTURAL, "[1]", "x").under("ops").path());
        assertEquals("ops[0]", QuyamlException.of(ErrorKind.EVALUATION, "x").under("ops[0]").path());
    }

    @Test
    void message_WithoutPathShouldOmitLocation() {
        QuyamlException e = QuyamlException.of(ErrorKind.SAFETY, "YAML aliases are not allowed");

        assertNull(e.path());
        assertEquals("SAFETY: YAML aliases are not allowed", e.getMessage());
        assertSame(e, e.under(null));
    }
}
