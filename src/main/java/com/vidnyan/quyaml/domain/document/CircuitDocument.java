package com.vidnyan.quyaml.domain.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated circuit. Immutable aggregate root, produced once per parse.
 */
public record CircuitDocument(
    String version,
    String name,
    int qubitCount,
    int bitCount,
    Map<String, Double> parameters,
    List<Operation> ops
) {

    public CircuitDocument {
        // keep declaration order of parameters
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        ops = List.copyOf(ops);
    }

    /**
     * Count every operation in the tree, control blocks included.
     */
    public int operationCount() {
        return count(ops);
    }

    private static int count(List<Operation> ops) {
        int total = 0;
        for (Operation op : ops) {
            total++;
            if (op instanceof Operation.If block) {
                total += count(block.thenOps());
                for (Operation.ElifBranch branch : block.elifBranches()) {
                    total += count(branch.ops());
                }
                if (block.hasElse()) {
                    total += count(block.elseOps());
                }
            } else if (op instanceof Operation.While loop) {
                total += count(loop.body());
            } else if (op instanceof Operation.For loop) {
                total += count(loop.body());
            }
        }
        return total;
    }
}
