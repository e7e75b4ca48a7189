package com.vidnyan.quyaml.domain.parser;

import com.vidnyan.quyaml.domain.condition.Condition;
import com.vidnyan.quyaml.domain.condition.ConditionParser;
import com.vidnyan.quyaml.domain.document.Operation;
import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;
import com.vidnyan.quyaml.domain.expression.Expr;
import com.vidnyan.quyaml.domain.expression.ExpressionParser;
import com.vidnyan.quyaml.domain.gate.GateRegistry;
import com.vidnyan.quyaml.domain.gate.GateSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes operation entries of the structural tree into {@link Operation} nodes.
 * <p>
 * Two surface forms are accepted:
 * <ul>
 *   <li>shorthand strings: {@code h 0}, {@code cx 0 1}, {@code rx($theta/2) 0},
 *       {@code cx q[0], q[1]}, {@code measure 0 0}, {@code measure},
 *       {@code reset 1}, {@code barrier}</li>
 *   <li>structured single-key mappings: {@code measure}, {@code reset},
 *       {@code barrier}, {@code gate}, {@code if}, {@code while}, {@code for}</li>
 * </ul>
 * Both forms of a gate produce equal nodes. Every error carries the path of
 * the offending entry.
 */
public class InstructionParser {

    private static final Pattern INDEX_TOKEN = Pattern.compile("^(?:[A-Za-z_]\\w*\\[(\\d+)]|(\\d+))$");
    private static final List<String> STRUCTURED_KEYS =
            List.of("measure", "reset", "barrier", "gate", "if", "while", "for");

    private final GateRegistry gates;
    private final ExpressionParser expressions;
    private final ConditionParser conditions;

    public InstructionParser(GateRegistry gates, ExpressionParser expressions, ConditionParser conditions) {
        this.gates = gates;
        this.expressions = expressions;
        this.conditions = conditions;
    }

    /**
     * Register sizes and parameter names an operation is validated against.
     */
    public record Scope(int qubitCount, int bitCount, Set<String> parameterNames) {
        public Scope {
            parameterNames = Set.copyOf(parameterNames);
        }
    }

    /**
     * Parse an operation list. {@code path} names the list itself, e.g. {@code ops}
     * or {@code ops[3].if.then}.
     */
    public List<Operation> parseAll(Object node, String path, Scope scope) {
        if (!(node instanceof List<?> entries)) {
            throw QuyamlException.at(ErrorKind.STRUCTURAL, path,
                    "Expected a list of operations, got " + describe(node));
        }
        List<Operation> ops = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            ops.add(parseOperation(entries.get(i), path + "[" + i + "]", scope));
        }
        return ops;
    }

    public Operation parseOperation(Object node, String path, Scope scope) {
        if (node instanceof String text) {
            return parseShorthand(text, path, scope);
        }
        if (node instanceof Map<?, ?> map) {
            return parseStructured(map, path, scope);
        }
        throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path,
                "Operation must be a string or a mapping, got " + describe(node));
    }

    // --- shorthand ---

    private Operation parseShorthand(String raw, String path, Scope scope) {
        String text = raw.trim();
        if (text.isEmpty()) {
            throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path, "Empty instruction");
        }

        String mnemonic;
        String paramText = null;
        String rest;
        int open = text.indexOf('(');
        if (open >= 0) {
            mnemonic = text.substring(0, open).trim();
            int close = matchingParen(text, open);
            if (close < 0) {
                throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path,
                        "Unmatched parentheses in instruction '" + text + "'");
            }
            paramText = text.substring(open + 1, close);
            rest = text.substring(close + 1);
            if (mnemonic.isEmpty() || mnemonic.chars().anyMatch(Character::isWhitespace)) {
                throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path,
                        "Parameter must directly follow the gate name in '" + text + "'");
            }
        } else {
            String[] head = text.split("\\s+", 2);
            mnemonic = head[0];
            rest = head.length > 1 ? head[1] : "";
        }
        if (rest.indexOf(')') >= 0) {
            throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path,
                    "Unmatched parentheses in instruction '" + text + "'");
        }

        mnemonic = mnemonic.toLowerCase();
        List<String> operands = splitOperands(rest);

        switch (mnemonic) {
            case "measure" -> {
                rejectParameter(mnemonic, paramText, path);
                if (operands.isEmpty()) {
                    return new Operation.MeasureAll();
                }
                if (operands.size() != 2) {
                    throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path,
                            "measure takes a qubit and a bit (measure q c), or no operands");
                }
                return new Operation.Measure(
                        qubitIndex(operands.get(0), path, scope), bitIndex(operands.get(1), path, scope));
            }
            case "reset" -> {
                rejectParameter(mnemonic, paramText, path);
                if (operands.size() != 1) {
                    throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path, "reset takes exactly one qubit");
                }
                return new Operation.Reset(qubitIndex(operands.get(0), path, scope));
            }
            case "barrier" -> {
                rejectParameter(mnemonic, paramText, path);
                List<Integer> qubits = new ArrayList<>();
                for (String operand : operands) {
                    qubits.add(qubitIndex(operand, path, scope));
                }
                return new Operation.Barrier(qubits);
            }
            default -> {
                GateSpec spec = resolveGate(mnemonic, path);
                int expected = spec.arity() + spec.classicalArity();
                if (operands.size() != expected) {
                    throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path, "Gate '" + spec.name()
                            + "' expects " + expected + " operand(s), got " + operands.size()
                            + " (usage: " + spec.signature() + ")");
                }
                List<Integer> qubits = new ArrayList<>();
                for (int i = 0; i < spec.arity(); i++) {
                    qubits.add(qubitIndex(operands.get(i), path, scope));
                }
                Integer classical = spec.classicalArity() == 1
                        ? bitIndex(operands.get(spec.arity()), path, scope)
                        : null;
                Expr param = paramText == null ? null : compileExpression(paramText, path, scope);
                return gate(spec, qubits, classical, param, paramText != null, path);
            }
        }
    }

    private static int matchingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> splitOperands(String rest) {
        List<String> operands = new ArrayList<>();
        for (String part : rest.trim().split("[\\s,]+")) {
            if (!part.isEmpty()) {
                operands.add(part);
            }
        }
        return operands;
    }

    private static void rejectParameter(String mnemonic, String paramText, String path) {
        if (paramText != null) {
            throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path, "'" + mnemonic + "' takes no parameter");
        }
    }

    // --- structured ---

    private Operation parseStructured(Map<?, ?> map, String path, Scope scope) {
        if (map.size() != 1) {
            throw QuyamlException.at(ErrorKind.STRUCTURAL, path,
                    "Structured operation must have exactly one key, found " + map.keySet());
        }
        Map.Entry<?, ?> entry = map.entrySet().iterator().next();
        String key = String.valueOf(entry.getKey());
        Object body = entry.getValue();
        String here = path + "." + key;

        return switch (key) {
            case "measure" -> {
                Map<?, ?> fields = fields(body, here, Set.of("q", "c"), Set.of("q", "c"));
                yield new Operation.Measure(
                        qubitIndex(fields.get("q"), here + ".q", scope),
                        bitIndex(fields.get("c"), here + ".c", scope));
            }
            case "reset" -> {
                Map<?, ?> fields = fields(body, here, Set.of("q"), Set.of("q"));
                yield new Operation.Reset(qubitIndex(fields.get("q"), here + ".q", scope));
            }
            case "barrier" -> new Operation.Barrier(body == null ? List.of() : qubitList(body, here, scope));
            case "gate" -> parseGateMapping(body, here, scope);
            case "if" -> parseIf(body, here, scope);
            case "while" -> parseWhile(body, here, scope);
            case "for" -> parseFor(body, here, scope);
            default -> throw QuyamlException.at(ErrorKind.STRUCTURAL, path, "Unknown structured operation '"
                    + key + "'. Supported: " + String.join(", ", STRUCTURED_KEYS));
        };
    }

    private Operation parseGateMapping(Object body, String path, Scope scope) {
        Map<?, ?> fields = fields(body, path, Set.of("name", "q"), Set.of("name", "q", "c", "param"));
        Object name = fields.get("name");
        if (!(name instanceof String mnemonic)) {
            throw QuyamlException.at(ErrorKind.STRUCTURAL, path + ".name", "Gate name must be a string");
        }
        GateSpec spec = resolveGate(mnemonic.trim().toLowerCase(), path + ".name");

        Object q = fields.get("q");
        List<Integer> qubits = q instanceof List<?>
                ? qubitList(q, path + ".q", scope)
                : List.of(qubitIndex(q, path + ".q", scope));
        if (qubits.size() != spec.arity()) {
            throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path + ".q", "Gate '" + spec.name()
                    + "' expects " + spec.arity() + " qubit(s), got " + qubits.size());
        }

        Integer classical = null;
        if (fields.containsKey("c")) {
            if (spec.classicalArity() == 0) {
                throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path + ".c",
                        "Gate '" + spec.name() + "' takes no classical bit");
            }
            classical = bitIndex(fields.get("c"), path + ".c", scope);
        } else if (spec.classicalArity() == 1) {
            throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path,
                    "Gate '" + spec.name() + "' requires a classical bit 'c'");
        }

        Expr param = null;
        boolean hasParam = fields.containsKey("param");
        if (hasParam) {
            Object raw = fields.get("param");
            if (raw instanceof Number number) {
                param = new Expr.Const(number.doubleValue());
            } else if (raw instanceof String text) {
                param = compileExpression(text, path + ".param", scope);
            } else {
                throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path + ".param",
                        "Gate parameter must be a number or an expression string");
            }
        }
        return gate(spec, qubits, classical, param, hasParam, path);
    }

    private Operation parseIf(Object body, String path, Scope scope) {
        requireBits("if", path, scope);
        Map<?, ?> fields = fields(body, path, Set.of("cond", "then"), Set.of("cond", "then", "elif", "else"));
        Condition cond = condition(fields.get("cond"), path + ".cond", scope);
        List<Operation> thenOps = parseAll(fields.get("then"), path + ".then", scope);

        List<Operation.ElifBranch> elifs = new ArrayList<>();
        if (fields.containsKey("elif")) {
            Object rawElifs = fields.get("elif");
            if (!(rawElifs instanceof List<?> branches)) {
                throw QuyamlException.at(ErrorKind.STRUCTURAL, path + ".elif",
                        "'elif' must be a list of {cond, then} entries");
            }
            for (int i = 0; i < branches.size(); i++) {
                String branchPath = path + ".elif[" + i + "]";
                Map<?, ?> branch = fields(branches.get(i), branchPath, Set.of("cond", "then"), Set.of("cond", "then"));
                elifs.add(new Operation.ElifBranch(
                        condition(branch.get("cond"), branchPath + ".cond", scope),
                        parseAll(branch.get("then"), branchPath + ".then", scope)));
            }
        }

        List<Operation> elseOps = fields.containsKey("else")
                ? parseAll(fields.get("else"), path + ".else", scope)
                : null;
        return new Operation.If(cond, thenOps, elifs, elseOps);
    }

    private Operation parseWhile(Object body, String path, Scope scope) {
        requireBits("while", path, scope);
        Map<?, ?> fields = fields(body, path, Set.of("cond", "body"), Set.of("cond", "body", "max_iter"));
        Condition cond = condition(fields.get("cond"), path + ".cond", scope);
        List<Operation> ops = parseAll(fields.get("body"), path + ".body", scope);
        Integer maxIter = null;
        if (fields.containsKey("max_iter")) {
            maxIter = integer(fields.get("max_iter"), path + ".max_iter", ErrorKind.STRUCTURAL);
            if (maxIter < 0) {
                throw QuyamlException.at(ErrorKind.STRUCTURAL, path + ".max_iter",
                        "max_iter must be a non-negative integer");
            }
        }
        return new Operation.While(cond, ops, maxIter);
    }

    private Operation parseFor(Object body, String path, Scope scope) {
        Map<?, ?> fields = fields(body, path, Set.of("range", "body"), Set.of("range", "body"));
        Object range = fields.get("range");
        if (!(range instanceof List<?> bounds) || bounds.size() != 2) {
            throw QuyamlException.at(ErrorKind.STRUCTURAL, path + ".range",
                    "'range' must be a two-element [start, stop] list");
        }
        int start = integer(bounds.get(0), path + ".range[0]", ErrorKind.STRUCTURAL);
        int stop = integer(bounds.get(1), path + ".range[1]", ErrorKind.STRUCTURAL);
        return new Operation.For(start, stop, parseAll(fields.get("body"), path + ".body", scope));
    }

    // --- shared helpers ---

    private Operation.Gate gate(GateSpec spec, List<Integer> qubits, Integer classical, Expr param,
                                boolean hasParam, String path) {
        if (spec.parametric() && !hasParam) {
            throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path,
                    "Gate '" + spec.name() + "' requires a parameter (usage: " + spec.signature() + ")");
        }
        if (!spec.parametric() && hasParam) {
            throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path,
                    "Gate '" + spec.name() + "' takes no parameter");
        }
        if (new HashSet<>(qubits).size() != qubits.size()) {
            throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path,
                    "Gate '" + spec.name() + "' has duplicate qubit operands " + qubits);
        }
        return new Operation.Gate(spec.name(), qubits, classical, param);
    }

    private GateSpec resolveGate(String mnemonic, String path) {
        try {
            return gates.resolve(mnemonic);
        } catch (QuyamlException e) {
            throw e.under(path);
        }
    }

    private Expr compileExpression(String text, String path, Scope scope) {
        try {
            return expressions.compile(text, scope.parameterNames());
        } catch (QuyamlException e) {
            throw e.under(path);
        }
    }

    private Condition condition(Object raw, String path, Scope scope) {
        if (!(raw instanceof String text)) {
            throw QuyamlException.at(ErrorKind.STRUCTURAL, path, "Condition must be a string, got " + describe(raw));
        }
        try {
            return conditions.parse(text, scope.bitCount());
        } catch (QuyamlException e) {
            throw e.under(path);
        }
    }

    private static void requireBits(String block, String path, Scope scope) {
        if (scope.bitCount() == 0) {
            throw QuyamlException.at(ErrorKind.STRUCTURAL, path,
                    "'" + block + "' blocks require a classical register (creg/bits)");
        }
    }

    private static Map<?, ?> fields(Object body, String path, Set<String> required, Set<String> allowed) {
        if (!(body instanceof Map<?, ?> map)) {
            throw QuyamlException.at(ErrorKind.STRUCTURAL, path, "Expected a mapping, got " + describe(body));
        }
        for (Object key : map.keySet()) {
            if (!allowed.contains(String.valueOf(key))) {
                throw QuyamlException.at(ErrorKind.STRUCTURAL, path + "." + key, "Unexpected key '" + key + "'");
            }
        }
        for (String key : required) {
            if (!map.containsKey(key)) {
                throw QuyamlException.at(ErrorKind.STRUCTURAL, path, "Missing required key '" + key + "'");
            }
        }
        return map;
    }

    private static List<Integer> qubitList(Object raw, String path, Scope scope) {
        if (!(raw instanceof List<?> items)) {
            throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path, "Expected a list of qubit indices");
        }
        List<Integer> qubits = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            qubits.add(qubitIndex(items.get(i), path + "[" + i + "]", scope));
        }
        return qubits;
    }

    private static int qubitIndex(Object raw, String path, Scope scope) {
        int index = indexValue(raw, path, "qubit");
        if (index >= scope.qubitCount()) {
            throw QuyamlException.at(ErrorKind.INDEX_OUT_OF_RANGE, path, "Qubit index " + index
                    + " out of range (circuit has " + scope.qubitCount() + " qubits)");
        }
        return index;
    }

    private static int bitIndex(Object raw, String path, Scope scope) {
        int index = indexValue(raw, path, "bit");
        if (index >= scope.bitCount()) {
            throw QuyamlException.at(ErrorKind.INDEX_OUT_OF_RANGE, path, "Bit index " + index
                    + " out of range (circuit has " + scope.bitCount() + " classical bits)");
        }
        return index;
    }

    /**
     * Accepts a non-negative integer scalar, a plain digit token, or a
     * register-qualified token such as {@code q[3]}.
     */
    private static int indexValue(Object raw, String path, String what) {
        if (raw instanceof Long value) {
            if (value < 0 || value > Integer.MAX_VALUE) {
                throw QuyamlException.at(ErrorKind.INDEX_OUT_OF_RANGE, path,
                        "Invalid " + what + " index " + value);
            }
            return value.intValue();
        }
        if (raw instanceof String token) {
            Matcher m = INDEX_TOKEN.matcher(token.trim());
            if (m.matches()) {
                String digits = m.group(1) != null ? m.group(1) : m.group(2);
                try {
                    return Integer.parseInt(digits);
                } catch (NumberFormatException e) {
                    throw QuyamlException.at(ErrorKind.INDEX_OUT_OF_RANGE, path,
                            "Invalid " + what + " index '" + token + "'");
                }
            }
            throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path,
                    "Invalid " + what + " index '" + token + "'. Use 'q[n]' or 'n' format");
        }
        throw QuyamlException.at(ErrorKind.INSTRUCTION_SYNTAX, path,
                "Invalid " + what + " index, got " + describe(raw));
    }

    private static int integer(Object raw, String path, ErrorKind kind) {
        if (raw instanceof Long value && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return value.intValue();
        }
        throw QuyamlException.at(kind, path, "Expected an integer, got " + describe(raw));
    }

    static String describe(Object value) {
        if (value == null) return "null";
        if (value instanceof Map) return "a mapping";
        if (value instanceof List) return "a list";
        if (value instanceof String) return "a string";
        if (value instanceof Boolean) return "a boolean";
        return value instanceof Number ? "a number (" + value + ")" : value.getClass().getSimpleName();
    }
}
