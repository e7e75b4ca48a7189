package com.vidnyan.quyaml.domain.document;

import com.vidnyan.quyaml.domain.condition.Condition;
import com.vidnyan.quyaml.domain.expression.Expr;

import java.util.List;

/**
 * One node of a circuit's operation tree.
 * Nodes own their children; there is no sharing between branches.
 */
public interface Operation {

    /**
     * Short tag for logging and stats.
     */
    String kind();

    /**
     * A registry gate. {@code classicalIndex} and {@code param} are null when
     * the gate takes no classical operand or parameter.
     */
    record Gate(String name, List<Integer> qubits, Integer classicalIndex, Expr param) implements Operation {
        public Gate {
            qubits = List.copyOf(qubits);
        }

        @Override
        public String kind() {
            return "gate";
        }
    }

    record Measure(int qubit, int bit) implements Operation {
        @Override
        public String kind() {
            return "measure";
        }
    }

    /**
     * Measure every qubit (the bare {@code measure} shorthand).
     */
    record MeasureAll() implements Operation {
        @Override
        public String kind() {
            return "measure_all";
        }
    }

    record Reset(int qubit) implements Operation {
        @Override
        public String kind() {
            return "reset";
        }
    }

    /**
     * An empty qubit list means a barrier across all qubits.
     */
    record Barrier(List<Integer> qubits) implements Operation {
        public Barrier {
            qubits = List.copyOf(qubits);
        }

        @Override
        public String kind() {
            return "barrier";
        }
    }

    /**
     * {@code elseOps} is null when no else branch was written, which is
     * distinct from an empty else branch.
     */
    record If(Condition cond, List<Operation> thenOps, List<ElifBranch> elifBranches, List<Operation> elseOps)
            implements Operation {
        public If {
            thenOps = List.copyOf(thenOps);
            elifBranches = List.copyOf(elifBranches);
            elseOps = elseOps == null ? null : List.copyOf(elseOps);
        }

        public boolean hasElse() {
            return elseOps != null;
        }

        @Override
        public String kind() {
            return "if";
        }
    }

    record ElifBranch(Condition cond, List<Operation> ops) {
        public ElifBranch {
            ops = List.copyOf(ops);
        }
    }

    /**
     * {@code maxIter} is an opaque hint for the builder, null when absent.
     */
    record While(Condition cond, List<Operation> body, Integer maxIter) implements Operation {
        public While {
            body = List.copyOf(body);
        }

        @Override
        public String kind() {
            return "while";
        }
    }

    /**
     * Iterates {@code [start, stop)}; {@code start >= stop} is an empty range.
     */
    record For(int start, int stop, List<Operation> body) implements Operation {
        public For {
            body = List.copyOf(body);
        }

        public int iterations() {
            return Math.max(0, stop - start);
        }

        @Override
        public String kind() {
            return "for";
        }
    }
}
