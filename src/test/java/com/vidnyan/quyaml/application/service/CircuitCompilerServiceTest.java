package com.vidnyan.quyaml.application.service;

import com.vidnyan.quyaml.adapter.out.builder.RecordingCircuitBuilder;
import com.vidnyan.quyaml.adapter.out.yaml.SnakeYamlSafeLoader;
import com.vidnyan.quyaml.application.port.in.CompileCircuitUseCase.CompilationResult;
import com.vidnyan.quyaml.application.port.in.CompileCircuitUseCase.CompileRequest;
import com.vidnyan.quyaml.domain.condition.ConditionParser;
import com.vidnyan.quyaml.domain.document.CircuitDocument;
import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;
import com.vidnyan.quyaml.domain.expression.ExpressionEvaluator;
import com.vidnyan.quyaml.domain.expression.ExpressionParser;
import com.vidnyan.quyaml.domain.expression.ExpressionWhitelist;
import com.vidnyan.quyaml.domain.gate.GateRegistry;
import com.vidnyan.quyaml.domain.lowering.CircuitLowerer;
import com.vidnyan.quyaml.domain.parser.CompilerLimits;
import com.vidnyan.quyaml.domain.parser.DocumentParser;
import com.vidnyan.quyaml.domain.parser.InstructionParser;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CircuitCompilerServiceTest {

    private static final String TELEPORT = """
            version: 0.4
            circuit: teleport
            qubits: q[3]
            bits: c[3]
            params:
              theta: 0.7
            ops:
              - ry($theta) 0
              - h 1
              - cx 1 2
              - cx 0 1
              - h 0
              - measure 0 0
              - measure 1 1
              - if:
                  cond: "c[1] == 1"
                  then: [x 2]
              - if:
                  cond: "c[0] == 1"
                  then: [z 2]
                  elif:
                    - cond: "c == 0b10"
                      then: [y 2]
                  else: []
              - measure 2 2
            """;

    private final CircuitCompilerService service = newService();

    private static CircuitCompilerService newService() {
        ExpressionWhitelist whitelist = ExpressionWhitelist.defaults();
        InstructionParser instructions = new InstructionParser(
                GateRegistry.standard(), new ExpressionParser(whitelist, 64), new ConditionParser(64));
        return new CircuitCompilerService(
                new SnakeYamlSafeLoader(CompilerLimits.defaults()),
                new DocumentParser(instructions, false),
                new CircuitLowerer(new ExpressionEvaluator(whitelist)));
    }

    @Test
    void compile_ShouldLowerWholeDocument() {
        RecordingCircuitBuilder builder = new RecordingCircuitBuilder();

        CompilationResult result = service.compile(new CompileRequest(TELEPORT, builder));

        assertEquals("teleport", result.document().name());
        assertEquals(List.of(
                "addGate", "addGate", "addGate", "addGate", "addGate", "measure", "measure",
                "beginIf", "addGate", "endIf",
                "beginIf", "addGate", "beginElif", "addGate", "beginElse", "endIf",
                "measure"), builder.methods());
        assertEquals(0.7, builder.calls().get(0).args().get(3));
        assertEquals(builder.calls().size(), result.stats().builderCalls());
        assertEquals(2, result.stats().controlBlocks());
    }

    @Test
    void compile_ScenarioA_ShouldEmitTwoGatesInOrder() {
        RecordingCircuitBuilder builder = new RecordingCircuitBuilder();

        service.compile(new CompileRequest("version: 0.4\nqubits: 2\nops: [h 0, cx 0 1]\n", builder));

        assertEquals(2, builder.calls().size());
        assertEquals("addGate(h, [0], null, null)", builder.calls().get(0).format());
        assertEquals("addGate(cx, [0, 1], null, null)", builder.calls().get(1).format());
    }

    @Test
    void compile_ScenarioC_WhileWithIterationHint() {
        RecordingCircuitBuilder builder = new RecordingCircuitBuilder();
        String text = """
                version: 0.4
                qubits: 1
                bits: 1
                ops:
                  - while:
                      cond: "c[0] == 0"
                      max_iter: 5
                      body: []
                """;

        service.compile(new CompileRequest(text, builder));

        assertEquals(List.of("beginWhile(c[0] == 0, 5)", "endWhile()"),
                builder.calls().stream().map(RecordingCircuitBuilder.BuilderCall::format).toList());
    }

    @Test
    void parse_FlatDocumentCallCountShouldMatchOperationCount() {
        String text = """
                version: 0.4
                qubits: 3
                bits: 3
                ops: [h 0, cx 0 1, reset 2, barrier, barrier 0 1, "rz(pi/4) 2", measure 0 0, measure]
                """;
        CircuitDocument document = service.parse(text);
        RecordingCircuitBuilder builder = new RecordingCircuitBuilder();

        service.lower(document, builder);

        assertEquals(document.operationCount(), builder.calls().size());
        assertEquals(8, document.operationCount());
    }

    @Test
    void parse_ShouldBeIdempotent() {
        assertEquals(service.parse(TELEPORT), service.parse(TELEPORT));
    }

    @Test
    void parse_ShouldRejectUnsafeConstructsAnywhere() {
        String[] unsafe = {
                "version: &v 0.4\nqubits: 1\nops: []\n",
                "version: 0.4\nqubits: 1\nops: [h 0, *x]\n",
                "version: 0.4\nqubits: !!int 1\nops: []\n",
                "version: 0.4\nqubits: 1\nparams:\n  <<: {a: 1}\nops: []\n",
                "version: 0.4\nqubits: 1\nbits: 1\nops:\n  - if:\n      cond: \"c == 1\"\n      then: [!gate h 0]\n"
        };
        for (String text : unsafe) {
            QuyamlException e = assertThrows(QuyamlException.class, () -> service.parse(text), text);
            assertEquals(ErrorKind.SAFETY, e.kind(), text);
        }
    }

    @Test
    void parse_DistinctFailuresShouldKeepTheirKinds() {
        assertEquals(ErrorKind.YAML_SYNTAX, kindOf("version: 0.4\nops: [h 0\n"));
        assertEquals(ErrorKind.SCHEMA, kindOf("version: 0.4\nops: []\n"));
        assertEquals(ErrorKind.SCHEMA, kindOf(""));
        assertEquals(ErrorKind.UNKNOWN_GATE, kindOf("version: 0.4\nqubits: 1\nops: [foo 0]\n"));
        assertEquals(ErrorKind.INDEX_OUT_OF_RANGE, kindOf("version: 0.4\nqubits: 1\nops: [h 1]\n"));
        assertEquals(ErrorKind.DISALLOWED_CONSTRUCT, kindOf("version: 0.4\nqubits: 1\nops: [\"rx(__import__('os')) 0\"]\n"));
        assertEquals(ErrorKind.STRUCTURAL, kindOf("version: 0.4\nqubits: 1\nbits: 1\nops:\n  - if: {then: [h 0]}\n"));
    }

    @Test
    void parse_LongOperatorChainsShouldFailAsSyntaxErrors() {
        String sum = String.join("+", Collections.nCopies(10_000, "0"));
        String conjunction = String.join(" && ", Collections.nCopies(10_000, "c == 0"));

        assertEquals(ErrorKind.EXPRESSION_SYNTAX,
                kindOf("version: 0.4\nqubits: 1\nops: [\"rx(" + sum + ") 0\"]\n"));
        assertEquals(ErrorKind.CONDITION_SYNTAX,
                kindOf("version: 0.4\nqubits: 1\nbits: 1\nops:\n  - if: {cond: \"" + conjunction
                        + "\", then: [h 0]}\n"));
    }

    @Test
    void compile_DivisionByZeroShouldFailDuringLowering() {
        String text = "version: 0.4\nqubits: 1\nparams: {z: 0}\nops: [h 0, rx(1/$z) 0]\n";
        CircuitDocument document = service.parse(text);

        QuyamlException e = assertThrows(QuyamlException.class,
                () -> service.lower(document, new RecordingCircuitBuilder()));

        assertEquals(ErrorKind.EVALUATION, e.kind());
        assertEquals("ops[1]", e.path());
    }

    private ErrorKind kindOf(String text) {
        return assertThrows(QuyamlException.class, () -> service.parse(text)).kind();
    }
}
