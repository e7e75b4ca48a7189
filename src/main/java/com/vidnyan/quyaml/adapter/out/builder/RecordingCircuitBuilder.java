package com.vidnyan.quyaml.adapter.out.builder;

import com.vidnyan.quyaml.domain.condition.Condition;
import com.vidnyan.quyaml.domain.lowering.CircuitBuilder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Builder that records every call in order instead of constructing a circuit.
 * Conditions are recorded in their canonical text form.
 * <p>
 * Checks block pairing as it goes and throws {@link IllegalStateException}
 * on a mismatched end or branch switch. Single-use, not thread-safe.
 */
public class RecordingCircuitBuilder implements CircuitBuilder {

    private final List<BuilderCall> calls = new ArrayList<>();
    private final Deque<String> openBlocks = new ArrayDeque<>();

    /**
     * One recorded call. {@code args} may contain nulls for absent operands.
     */
    public record BuilderCall(String method, List<Object> args) {

        static BuilderCall of(String method, Object... args) {
            return new BuilderCall(method, Collections.unmodifiableList(Arrays.asList(args)));
        }

        public String format() {
            StringBuilder sb = new StringBuilder(method).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(args.get(i));
            }
            return sb.append(')').toString();
        }
    }

    public List<BuilderCall> calls() {
        return Collections.unmodifiableList(calls);
    }

    public List<String> methods() {
        return calls.stream().map(BuilderCall::method).toList();
    }

    public boolean isBalanced() {
        return openBlocks.isEmpty();
    }

    @Override
    public void addGate(String name, List<Integer> qubits, Integer classicalIndex, Double parameter) {
        calls.add(BuilderCall.of("addGate", name, List.copyOf(qubits), classicalIndex, parameter));
    }

    @Override
    public void measure(int qubit, int bit) {
        calls.add(BuilderCall.of("measure", qubit, bit));
    }

    @Override
    public void measureAll() {
        calls.add(BuilderCall.of("measureAll"));
    }

    @Override
    public void reset(int qubit) {
        calls.add(BuilderCall.of("reset", qubit));
    }

    @Override
    public void barrier(List<Integer> qubits) {
        calls.add(BuilderCall.of("barrier", List.copyOf(qubits)));
    }

    @Override
    public void beginIf(Condition condition) {
        openBlocks.push("if");
        calls.add(BuilderCall.of("beginIf", condition.render()));
    }

    @Override
    public void beginElif(Condition condition) {
        requireOpen("if", "beginElif");
        calls.add(BuilderCall.of("beginElif", condition.render()));
    }

    @Override
    public void beginElse() {
        requireOpen("if", "beginElse");
        calls.add(BuilderCall.of("beginElse"));
    }

    @Override
    public void endIf() {
        close("if", "endIf");
    }

    @Override
    public void beginWhile(Condition condition, Integer maxIter) {
        openBlocks.push("while");
        calls.add(BuilderCall.of("beginWhile", condition.render(), maxIter));
    }

    @Override
    public void endWhile() {
        close("while", "endWhile");
    }

    @Override
    public void beginFor(int start, int stop) {
        openBlocks.push("for");
        calls.add(BuilderCall.of("beginFor", start, stop));
    }

    @Override
    public void endFor() {
        close("for", "endFor");
    }

    private void requireOpen(String block, String method) {
        if (!block.equals(openBlocks.peek())) {
            throw new IllegalStateException(method + " outside of an open " + block + " block");
        }
    }

    private void close(String block, String method) {
        requireOpen(block, method);
        openBlocks.pop();
        calls.add(BuilderCall.of(method));
    }
}
