package com.vidnyan.quyaml.domain.condition;

import java.math.BigInteger;

/**
 * Classical predicate over the circuit's classical register.
 * Built at parse time, evaluated by the builder side at execution time.
 */
public interface Condition {

    /**
     * Canonical text form, parseable by {@link ConditionParser}.
     */
    String render();

    /**
     * {@code c[bitIndex] == value}.
     */
    record BitEq(int bitIndex, int value) implements Condition {
        public BitEq {
            if (value != 0 && value != 1) {
                throw new IllegalArgumentException("Bit value must be 0 or 1, got " + value);
            }
        }

        @Override
        public String render() {
            return "c[" + bitIndex + "] == " + value;
        }
    }

    /**
     * {@code c == value}, comparing the whole register read as an unsigned integer
     * (bit 0 is the least significant).
     */
    record RegisterEq(BigInteger value) implements Condition {
        public RegisterEq {
            if (value.signum() < 0) {
                throw new IllegalArgumentException("Register value must be non-negative, got " + value);
            }
        }

        public RegisterEq(long value) {
            this(BigInteger.valueOf(value));
        }

        @Override
        public String render() {
            return "c == " + value;
        }
    }

    record And(Condition left, Condition right) implements Condition {
        @Override
        public String render() {
            return (left instanceof Or ? "(" + left.render() + ")" : left.render())
                    + " && " + (right instanceof Or || right instanceof And ? "(" + right.render() + ")" : right.render());
        }
    }

    record Or(Condition left, Condition right) implements Condition {
        @Override
        public String render() {
            return left.render() + " || " + (right instanceof Or ? "(" + right.render() + ")" : right.render());
        }
    }
}
