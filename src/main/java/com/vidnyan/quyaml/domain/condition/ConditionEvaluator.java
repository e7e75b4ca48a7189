package com.vidnyan.quyaml.domain.condition;

import java.util.BitSet;

/**
 * Decides a condition against a snapshot of the classical register.
 * Used by builders and simulators at execution time, never by the compiler.
 */
public final class ConditionEvaluator {

    private ConditionEvaluator() {
    }

    /**
     * @param register classical bits; bit {@code i} is {@code c[i]}
     * @param bitCount declared register width, bits at or beyond it are ignored
     */
    public static boolean evaluate(Condition condition, BitSet register, int bitCount) {
        if (condition instanceof Condition.BitEq bit) {
            return (register.get(bit.bitIndex()) ? 1 : 0) == bit.value();
        }
        if (condition instanceof Condition.RegisterEq reg) {
            BitSet visible = register.get(0, bitCount);
            BitSet expected = new BitSet();
            for (int i = 0; i < reg.value().bitLength(); i++) {
                if (reg.value().testBit(i)) {
                    expected.set(i);
                }
            }
            return visible.equals(expected);
        }
        if (condition instanceof Condition.And and) {
            return evaluate(and.left(), register, bitCount) && evaluate(and.right(), register, bitCount);
        }
        if (condition instanceof Condition.Or or) {
            return evaluate(or.left(), register, bitCount) || evaluate(or.right(), register, bitCount);
        }
        throw new IllegalStateException("Unknown condition node: " + condition.getClass().getName());
    }

    /**
     * Convenience overload for registers of at most 64 bits.
     */
    public static boolean evaluate(Condition condition, long register, int bitCount) {
        return evaluate(condition, BitSet.valueOf(new long[] {register}), bitCount);
    }
}
