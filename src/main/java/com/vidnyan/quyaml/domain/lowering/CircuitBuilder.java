package com.vidnyan.quyaml.domain.lowering;

import com.vidnyan.quyaml.domain.condition.Condition;

import java.util.List;

/**
 * The external circuit-construction collaborator.
 * Receives the lowered call sequence strictly in order, from a single thread.
 * Implementations may throw to reject a call; lowering then aborts.
 */
public interface CircuitBuilder {

    /**
     * @param classicalIndex classical operand, null when the gate has none
     * @param parameter evaluated parameter, null for non-parametric gates
     */
    void addGate(String name, List<Integer> qubits, Integer classicalIndex, Double parameter);

    void measure(int qubit, int bit);

    void measureAll();

    void reset(int qubit);

    /**
     * @param qubits empty for a barrier across all qubits
     */
    void barrier(List<Integer> qubits);

    void beginIf(Condition condition);

    /**
     * Switch the innermost open if-block to its next else-if branch.
     */
    void beginElif(Condition condition);

    /**
     * Switch the innermost open if-block to its else branch.
     */
    void beginElse();

    void endIf();

    /**
     * @param maxIter opaque iteration hint, null when the document gave none
     */
    void beginWhile(Condition condition, Integer maxIter);

    void endWhile();

    /**
     * Open a loop over {@code [start, stop)}.
     */
    void beginFor(int start, int stop);

    void endFor();
}
