package com.vidnyan.quyaml.domain.expression;

import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionParserTest {

    private final ExpressionParser parser = new ExpressionParser(ExpressionWhitelist.defaults(), 64);

    private ErrorKind failureOf(String text) {
        return assertThrows(QuyamlException.class, () -> parser.compile(text, Set.of("theta"))).kind();
    }

    @Test
    void compile_ShouldBuildTreeWithStandardPrecedence() {
        Expr expr = parser.compile("2*$theta + pi/2", Set.of("theta"));

        Expr expected = new Expr.BinOp(Expr.BinaryOperator.ADD,
                new Expr.BinOp(Expr.BinaryOperator.MUL, new Expr.Const(2), new Expr.Name("theta")),
                new Expr.BinOp(Expr.BinaryOperator.DIV, new Expr.Name("pi"), new Expr.Const(2)));
        assertEquals(expected, expr);
    }

    @Test
    void compile_PowerShouldBeRightAssociativeAndBindTighterThanUnaryMinus() {
        Expr power = parser.compile("2**3**2", Set.of());
        Expr negated = parser.compile("-2**2", Set.of());

        assertEquals(new Expr.BinOp(Expr.BinaryOperator.POW, new Expr.Const(2),
                new Expr.BinOp(Expr.BinaryOperator.POW, new Expr.Const(3), new Expr.Const(2))), power);
        assertEquals(new Expr.UnaryOp(Expr.UnaryOperator.MINUS,
                new Expr.BinOp(Expr.BinaryOperator.POW, new Expr.Const(2), new Expr.Const(2))), negated);
    }

    @Test
    void compile_ShouldAcceptBareParameterNamesAndWhitelistedCalls() {
        Expr expr = parser.compile("sin(theta) % 1.5e-1", Set.of("theta"));

        assertEquals(new Expr.BinOp(Expr.BinaryOperator.MOD,
                new Expr.Call("sin", List.of(new Expr.Name("theta"))), new Expr.Const(0.15)), expr);
    }

    @Test
    void compile_ShouldRejectHostCodeWithoutEvaluatingIt() {
        assertEquals(ErrorKind.DISALLOWED_CONSTRUCT, failureOf("__import__('os')"));
        assertEquals(ErrorKind.DISALLOWED_CONSTRUCT, failureOf("eval(1)"));
        assertEquals(ErrorKind.DISALLOWED_CONSTRUCT, failureOf("os.system"));
        assertEquals(ErrorKind.DISALLOWED_CONSTRUCT, failureOf("x = 1"));
        assertEquals(ErrorKind.DISALLOWED_CONSTRUCT, failureOf("theta[0]"));
    }

    @Test
    void compile_ShouldRejectUnknownNames() {
        assertEquals(ErrorKind.UNDEFINED_PARAMETER, failureOf("$phi + 1"));
        assertEquals(ErrorKind.DISALLOWED_CONSTRUCT, failureOf("phi + 1"));
    }

    @Test
    void compile_ShouldReportMalformedExpressions() {
        assertEquals(ErrorKind.EXPRESSION_SYNTAX, failureOf(""));
        assertEquals(ErrorKind.EXPRESSION_SYNTAX, failureOf("1 +"));
        assertEquals(ErrorKind.EXPRESSION_SYNTAX, failureOf("(1 + 2"));
        assertEquals(ErrorKind.EXPRESSION_SYNTAX, failureOf("1 2"));
        assertEquals(ErrorKind.EXPRESSION_SYNTAX, failureOf("sin(1, 2)"));
        assertEquals(ErrorKind.EXPRESSION_SYNTAX, failureOf("1 # 2"));
        assertEquals(ErrorKind.EXPRESSION_SYNTAX, failureOf("$"));
    }

    @Test
    void compile_ShouldEnforceDepthLimit() {
        ExpressionParser shallow = new ExpressionParser(ExpressionWhitelist.defaults(), 3);

        assertDoesNotThrow(() -> shallow.compile("((1))", Set.of()));
        QuyamlException e = assertThrows(QuyamlException.class, () -> shallow.compile("((((1))))", Set.of()));
        assertEquals(ErrorKind.EXPRESSION_SYNTAX, e.kind());
    }

    @Test
    void compile_ShouldBoundOperatorChainsByDepthLimit() {
        ExpressionParser shallow = new ExpressionParser(ExpressionWhitelist.defaults(), 3);

        // each binary operator adds one level to the tree
        assertDoesNotThrow(() -> shallow.compile("1+2+3+4", Set.of()));
        assertDoesNotThrow(() -> shallow.compile("1*2-3", Set.of()));
        assertEquals(ErrorKind.EXPRESSION_SYNTAX,
                assertThrows(QuyamlException.class, () -> shallow.compile("1+2+3+4+5", Set.of())).kind());
        assertEquals(ErrorKind.EXPRESSION_SYNTAX,
                assertThrows(QuyamlException.class, () -> shallow.compile("1*2*3*4*5", Set.of())).kind());
        assertEquals(ErrorKind.EXPRESSION_SYNTAX,
                assertThrows(QuyamlException.class, () -> shallow.compile("sin(1+2+3+4)", Set.of())).kind());
    }

    @Test
    void compile_LongChainShouldFailInsteadOfOverflowingStack() {
        String chain = String.join("+", Collections.nCopies(100_000, "0"));

        QuyamlException e = assertThrows(QuyamlException.class, () -> parser.compile(chain, Set.of()));

        assertEquals(ErrorKind.EXPRESSION_SYNTAX, e.kind());
        assertTrue(e.detail().contains("nested deeper than 64"));
    }

    @Test
    void render_ShouldReparseToSameTree() {
        Expr expr = parser.compile("-(1 + $theta) * cos(pi / 4) ** 2", Set.of("theta"));

        assertEquals(expr, parser.compile(expr.render(), Set.of("theta")));
    }
}
