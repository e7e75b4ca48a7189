package com.vidnyan.quyaml.domain.gate;

/**
 * Registry entry for one gate mnemonic.
 *
 * @param name canonical mnemonic passed to the builder
 * @param arity number of qubit operands
 * @param classicalArity number of classical-bit operands (0 or 1)
 * @param parametric whether the gate takes exactly one parameter expression
 */
public record GateSpec(
    String name,
    int arity,
    int classicalArity,
    boolean parametric
) {

    public GateSpec {
        if (arity < 1) {
            throw new IllegalArgumentException("Gate '" + name + "' must act on at least one qubit");
        }
        if (classicalArity < 0 || classicalArity > 1) {
            throw new IllegalArgumentException("Gate '" + name + "' classical arity must be 0 or 1");
        }
    }

    public static GateSpec fixed(String name, int arity) {
        return new GateSpec(name, arity, 0, false);
    }

    public static GateSpec rotation(String name, int arity) {
        return new GateSpec(name, arity, 0, true);
    }

    /**
     * Single-qubit readout into one classical bit.
     */
    public static GateSpec readout(String name) {
        return new GateSpec(name, 1, 1, false);
    }

    /**
     * Shorthand signature, e.g. {@code rx(<expr>) q} or {@code cx q q}.
     */
    public String signature() {
        StringBuilder sb = new StringBuilder(name);
        if (parametric) sb.append("(<expr>)");
        for (int i = 0; i < arity; i++) sb.append(" q");
        for (int i = 0; i < classicalArity; i++) sb.append(" c");
        return sb.toString();
    }
}
