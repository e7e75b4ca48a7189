package com.vidnyan.quyaml.domain.expression;

import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;

import java.util.Map;

/**
 * Pure interpreter for compiled expressions.
 * No side effects; arithmetic failures are reported as {@link ErrorKind#EVALUATION}.
 */
public class ExpressionEvaluator {

    private final ExpressionWhitelist whitelist;

    public ExpressionEvaluator(ExpressionWhitelist whitelist) {
        this.whitelist = whitelist;
    }

    /**
     * Evaluate an expression against parameter bindings.
     * Bindings shadow whitelisted constants of the same name.
     */
    public double evaluate(Expr expr, Map<String, Double> bindings) {
        double value = eval(expr, bindings);
        if (!Double.isFinite(value)) {
            throw QuyamlException.of(ErrorKind.EVALUATION,
                    "Expression '" + expr.render() + "' evaluated to " + value);
        }
        return value;
    }

    private double eval(Expr expr, Map<String, Double> bindings) {
        if (expr instanceof Expr.Const c) {
            return c.value();
        }
        if (expr instanceof Expr.Name name) {
            Double bound = bindings.get(name.name());
            if (bound != null) {
                return bound;
            }
            Double constant = whitelist.constants().get(name.name());
            if (constant != null) {
                return constant;
            }
            throw QuyamlException.of(ErrorKind.UNDEFINED_PARAMETER,
                    "Parameter '" + name.name() + "' has no binding");
        }
        if (expr instanceof Expr.UnaryOp unary) {
            double operand = eval(unary.operand(), bindings);
            return unary.op() == Expr.UnaryOperator.MINUS ? -operand : operand;
        }
        if (expr instanceof Expr.BinOp bin) {
            return applyBinary(bin, eval(bin.left(), bindings), eval(bin.right(), bindings));
        }
        if (expr instanceof Expr.Call call) {
            return applyFunction(call, eval(call.args().get(0), bindings));
        }
        throw new IllegalStateException("Unknown expression node: " + expr.getClass().getName());
    }

    private double applyBinary(Expr.BinOp bin, double left, double right) {
        return switch (bin.op()) {
            case ADD -> left + right;
            case SUB -> left - right;
            case MUL -> left * right;
            case DIV -> {
                if (right == 0.0) {
                    throw QuyamlException.of(ErrorKind.EVALUATION, "Division by zero in '" + bin.render() + "'");
                }
                yield left / right;
            }
            case MOD -> {
                if (right == 0.0) {
                    throw QuyamlException.of(ErrorKind.EVALUATION, "Modulo by zero in '" + bin.render() + "'");
                }
                // floored remainder: result takes the sign of the divisor
                double r = left % right;
                yield (r != 0.0 && (r < 0) != (right < 0)) ? r + right : r;
            }
            case POW -> {
                double result = Math.pow(left, right);
                if (Double.isNaN(result)) {
                    throw QuyamlException.of(ErrorKind.EVALUATION,
                            "Power " + left + " ** " + right + " is not a real number");
                }
                yield result;
            }
        };
    }

    private double applyFunction(Expr.Call call, double argument) {
        var function = whitelist.functions().get(call.function());
        if (function == null) {
            throw QuyamlException.of(ErrorKind.DISALLOWED_CONSTRUCT,
                    "Function '" + call.function() + "' is not whitelisted");
        }
        double result = function.applyAsDouble(argument);
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw QuyamlException.of(ErrorKind.EVALUATION,
                    "Domain error: " + call.function() + "(" + argument + ") = " + result);
        }
        return result;
    }
}
