package com.vidnyan.quyaml.domain.expression;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

/**
 * The closed set of constants and unary functions an expression may use.
 * Anything not listed here fails compilation.
 */
public record ExpressionWhitelist(
    Map<String, Double> constants,
    Map<String, DoubleUnaryOperator> functions
) {

    public ExpressionWhitelist {
        constants = Map.copyOf(constants);
        functions = Map.copyOf(functions);
    }

    /**
     * Default whitelist: {@code pi}, {@code e} and common unary math functions.
     */
    public static ExpressionWhitelist defaults() {
        Map<String, DoubleUnaryOperator> functions = new LinkedHashMap<>();
        functions.put("sin", Math::sin);
        functions.put("cos", Math::cos);
        functions.put("tan", Math::tan);
        functions.put("asin", Math::asin);
        functions.put("acos", Math::acos);
        functions.put("atan", Math::atan);
        functions.put("sinh", Math::sinh);
        functions.put("cosh", Math::cosh);
        functions.put("tanh", Math::tanh);
        functions.put("sqrt", Math::sqrt);
        functions.put("exp", Math::exp);
        functions.put("log", Math::log);
        functions.put("log10", Math::log10);
        functions.put("abs", Math::abs);
        functions.put("floor", Math::floor);
        functions.put("ceil", Math::ceil);
        return new ExpressionWhitelist(Map.of("pi", Math.PI, "e", Math.E), functions);
    }

    public boolean isConstant(String name) {
        return constants.containsKey(name);
    }

    public boolean isFunction(String name) {
        return functions.containsKey(name);
    }

    public Set<String> functionNames() {
        return functions.keySet();
    }
}
