package com.vidnyan.quyaml;

import com.vidnyan.quyaml.adapter.out.builder.RecordingCircuitBuilder;
import com.vidnyan.quyaml.application.port.in.CompileCircuitUseCase;
import com.vidnyan.quyaml.application.port.in.CompileCircuitUseCase.CompileRequest;
import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;
import com.vidnyan.quyaml.domain.parser.CompilerLimits;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "quyaml.compiler.max-document-chars=2000",
        "quyaml.compiler.allow-legacy-versions=true"
})
class QuyamlApplicationTest {

    @Autowired
    private CompileCircuitUseCase compileCircuitUseCase;

    @Autowired
    private CompilerLimits compilerLimits;

    @Test
    void contextLoads_WithBoundCompilerProperties() {
        assertEquals(2000, compilerLimits.maxDocumentChars());
        assertEquals(CompilerLimits.DEFAULT_MAX_NESTING_DEPTH, compilerLimits.maxNestingDepth());
    }

    @Test
    void compile_ShouldRunThroughWiredComponents() {
        RecordingCircuitBuilder builder = new RecordingCircuitBuilder();

        compileCircuitUseCase.compile(new CompileRequest("qubits: 2\nops: [h 0, cx 0 1]\n", builder));

        assertEquals(2, builder.calls().size());
        assertEquals("0.3", compileCircuitUseCase.parse("qubits: 1\nops: []\n").version());
    }

    @Test
    void parse_ShouldApplyConfiguredSizeLimit() {
        String big = "version: 0.4\nqubits: 1\nops:\n" + "  - h 0\n".repeat(400);

        QuyamlException e = assertThrows(QuyamlException.class, () -> compileCircuitUseCase.parse(big));

        assertEquals(ErrorKind.SAFETY, e.kind());
    }
}
