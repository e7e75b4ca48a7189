package com.vidnyan.quyaml.domain.expression;

import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {

    private final ExpressionWhitelist whitelist = ExpressionWhitelist.defaults();
    private final ExpressionParser parser = new ExpressionParser(whitelist, 64);
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator(whitelist);

    private double eval(String text, Map<String, Double> bindings) {
        return evaluator.evaluate(parser.compile(text, bindings.keySet()), bindings);
    }

    private ErrorKind failureOf(String text) {
        Expr expr = parser.compile(text, Map.<String, Double>of().keySet());
        return assertThrows(QuyamlException.class, () -> evaluator.evaluate(expr, Map.of())).kind();
    }

    @Test
    void evaluate_ShouldApplyArithmetic() {
        assertEquals(Math.PI / 2 + 1.0, eval("2*$theta + pi/2", Map.of("theta", 0.5)), 1e-12);
        assertEquals(512.0, eval("2**3**2", Map.of()));
        assertEquals(-4.0, eval("-2**2", Map.of()));
        assertEquals(1.0, eval("sin(pi/2)", Map.of()), 1e-12);
        assertEquals(1.0, eval("log(e)", Map.of()), 1e-12);
        assertEquals(3.0, eval("abs(-3)", Map.of()));
    }

    @Test
    void evaluate_RemainderShouldTakeSignOfDivisor() {
        assertEquals(2.0, eval("$a % 3", Map.of("a", -1.0)));
        assertEquals(-1.0, eval("$a % -3", Map.of("a", 2.0)));
        assertEquals(1.5, eval("7.5 % 2", Map.of()));
    }

    @Test
    void evaluate_ParameterShouldShadowConstant() {
        assertEquals(3.0, eval("pi", Map.of("pi", 3.0)));
    }

    @Test
    void evaluate_ShouldReportArithmeticFailures() {
        assertEquals(ErrorKind.EVALUATION, failureOf("1/0"));
        assertEquals(ErrorKind.EVALUATION, failureOf("1 % 0"));
        assertEquals(ErrorKind.EVALUATION, failureOf("sqrt(-1)"));
        assertEquals(ErrorKind.EVALUATION, failureOf("log(0)"));
        assertEquals(ErrorKind.EVALUATION, failureOf("(-8) ** 0.5"));
        assertEquals(ErrorKind.EVALUATION, failureOf("10 ** 400"));
    }

    @Test
    void evaluate_ShouldFailOnUnboundName() {
        Expr expr = new Expr.Name("theta");

        QuyamlException e = assertThrows(QuyamlException.class, () -> evaluator.evaluate(expr, Map.of()));

        assertEquals(ErrorKind.UNDEFINED_PARAMETER, e.kind());
    }
}
