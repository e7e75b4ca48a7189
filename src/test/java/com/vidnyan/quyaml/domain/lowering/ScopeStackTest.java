package com.vidnyan.quyaml.domain.lowering;

import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScopeStackTest {

    @Test
    void branches_ShouldAdvanceThenElifElse() {
        ScopeStack scopes = new ScopeStack();

        scopes.open(ScopeStack.BlockKind.IF, "ops[0]");
        scopes.enterElif("ops[0].if.elif[0]");
        scopes.enterElif("ops[0].if.elif[1]");
        scopes.enterElse("ops[0].if.else");
        scopes.close(ScopeStack.BlockKind.IF, "ops[0]");

        assertEquals(0, scopes.depth());
        assertDoesNotThrow(scopes::verifyEmpty);
    }

    @Test
    void elifAfterElse_ShouldBeRejected() {
        ScopeStack scopes = new ScopeStack();
        scopes.open(ScopeStack.BlockKind.IF, "ops[0]");
        scopes.enterElse("ops[0].if.else");

        QuyamlException e = assertThrows(QuyamlException.class, () -> scopes.enterElif("ops[0].if.elif[0]"));

        assertEquals(ErrorKind.LOWERING, e.kind());
        assertThrows(QuyamlException.class, () -> scopes.enterElse("ops[0].if.else"));
    }

    @Test
    void mismatchedClose_ShouldBeRejected() {
        ScopeStack scopes = new ScopeStack();
        scopes.open(ScopeStack.BlockKind.FOR, "ops[0]");
        scopes.open(ScopeStack.BlockKind.WHILE, "ops[0].for.body[0]");

        assertThrows(QuyamlException.class, () -> scopes.close(ScopeStack.BlockKind.FOR, "ops[0]"));
        assertThrows(QuyamlException.class, () -> scopes.enterElse("ops[0].for.body[0]"));
        assertEquals(2, scopes.depth());
        assertEquals(2, scopes.maxDepth());
    }

    @Test
    void verifyEmpty_ShouldReportOpenBlocks() {
        ScopeStack scopes = new ScopeStack();
        scopes.open(ScopeStack.BlockKind.WHILE, "ops[3]");

        QuyamlException e = assertThrows(QuyamlException.class, scopes::verifyEmpty);

        assertEquals(ErrorKind.LOWERING, e.kind());
        assertEquals("ops[3]", e.path());
    }
}
