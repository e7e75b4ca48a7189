package com.vidnyan.quyaml.domain.lowering;

import com.vidnyan.quyaml.domain.document.CircuitDocument;
import com.vidnyan.quyaml.domain.document.Operation;
import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;
import com.vidnyan.quyaml.domain.expression.ExpressionEvaluator;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Lowers a validated document into an ordered sequence of builder calls.
 * <p>
 * Depth-first over the op tree with an explicit scope stack: each
 * {@code beginIf/beginWhile/beginFor} gets exactly one matching end, empty
 * bodies included. An if-chain is emitted as
 * {@code beginIf, then.., beginElif, ops.., beginElse, ops.., endIf}.
 * <p>
 * Fail-fast: the first evaluation error or builder rejection aborts the walk,
 * and whatever the builder accumulated must be discarded by the caller.
 */
@Slf4j
public class CircuitLowerer {

    private final ExpressionEvaluator evaluator;

    public CircuitLowerer(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public LoweringStats lower(CircuitDocument document, CircuitBuilder builder) {
        Walk walk = new Walk(builder, document.parameters());
        walk.emitAll(document.ops(), "ops");
        walk.scopes.verifyEmpty();
        LoweringStats stats = new LoweringStats(
                walk.calls, walk.gates, walk.blocks, walk.scopes.maxDepth());
        log.debug("Lowered '{}': {} builder calls, {} gates, {} control blocks",
                document.name(), stats.builderCalls(), stats.gates(), stats.controlBlocks());
        return stats;
    }

    /**
     * State of one lowering pass. Not shared between documents.
     */
    private final class Walk {
        private final CircuitBuilder builder;
        private final Map<String, Double> bindings;
        private final ScopeStack scopes = new ScopeStack();
        private int calls;
        private int gates;
        private int blocks;

        Walk(CircuitBuilder builder, Map<String, Double> bindings) {
            this.builder = builder;
            this.bindings = bindings;
        }

        void emitAll(List<Operation> ops, String path) {
            for (int i = 0; i < ops.size(); i++) {
                emit(ops.get(i), path + "[" + i + "]");
            }
        }

        void emit(Operation op, String path) {
            if (op instanceof Operation.Gate gate) {
                Double parameter = null;
                if (gate.param() != null) {
                    try {
                        parameter = evaluator.evaluate(gate.param(), bindings);
                    } catch (QuyamlException e) {
                        throw e.under(path);
                    }
                }
                Double evaluated = parameter;
                call(path, () -> builder.addGate(gate.name(), gate.qubits(), gate.classicalIndex(), evaluated));
                gates++;
            } else if (op instanceof Operation.Measure measure) {
                call(path, () -> builder.measure(measure.qubit(), measure.bit()));
            } else if (op instanceof Operation.MeasureAll) {
                call(path, builder::measureAll);
            } else if (op instanceof Operation.Reset reset) {
                call(path, () -> builder.reset(reset.qubit()));
            } else if (op instanceof Operation.Barrier barrier) {
                call(path, () -> builder.barrier(barrier.qubits()));
            } else if (op instanceof Operation.If block) {
                emitIf(block, path);
            } else if (op instanceof Operation.While loop) {
                blocks++;
                scopes.open(ScopeStack.BlockKind.WHILE, path);
                call(path, () -> builder.beginWhile(loop.cond(), loop.maxIter()));
                emitAll(loop.body(), path + ".while.body");
                scopes.close(ScopeStack.BlockKind.WHILE, path);
                call(path, builder::endWhile);
            } else if (op instanceof Operation.For loop) {
                blocks++;
                scopes.open(ScopeStack.BlockKind.FOR, path);
                call(path, () -> builder.beginFor(loop.start(), loop.stop()));
                emitAll(loop.body(), path + ".for.body");
                scopes.close(ScopeStack.BlockKind.FOR, path);
                call(path, builder::endFor);
            } else {
                throw QuyamlException.at(ErrorKind.LOWERING, path,
                        "No lowering for operation '" + op.kind() + "'");
            }
        }

        void emitIf(Operation.If block, String path) {
            blocks++;
            scopes.open(ScopeStack.BlockKind.IF, path);
            call(path, () -> builder.beginIf(block.cond()));
            emitAll(block.thenOps(), path + ".if.then");

            List<Operation.ElifBranch> elifs = block.elifBranches();
            for (int i = 0; i < elifs.size(); i++) {
                Operation.ElifBranch branch = elifs.get(i);
                String branchPath = path + ".if.elif[" + i + "]";
                scopes.enterElif(branchPath);
                call(branchPath, () -> builder.beginElif(branch.cond()));
                emitAll(branch.ops(), branchPath + ".then");
            }

            if (block.hasElse()) {
                scopes.enterElse(path + ".if.else");
                call(path + ".if.else", builder::beginElse);
                emitAll(block.elseOps(), path + ".if.else");
            }

            scopes.close(ScopeStack.BlockKind.IF, path);
            call(path, builder::endIf);
        }

        void call(String path, Runnable builderCall) {
            try {
                builderCall.run();
            } catch (QuyamlException e) {
                throw e.under(path);
            } catch (RuntimeException e) {
                throw new QuyamlException(ErrorKind.LOWERING, path,
                        "Builder rejected call: " + e.getMessage(), e);
            }
            calls++;
        }
    }
}
