package com.vidnyan.quyaml.application.port.in;

import com.vidnyan.quyaml.domain.document.CircuitDocument;
import com.vidnyan.quyaml.domain.document.CircuitJob;
import com.vidnyan.quyaml.domain.lowering.CircuitBuilder;
import com.vidnyan.quyaml.domain.lowering.LoweringStats;

/**
 * Primary use case: compile QuYAML text into builder calls.
 * This is the main entry point to the compiler.
 */
public interface CompileCircuitUseCase {

    /**
     * Load and validate a circuit document.
     * @throws com.vidnyan.quyaml.domain.error.QuyamlException on any failure
     */
    CircuitDocument parse(String text);

    /**
     * Like {@link #parse(String)}, keeping the job manifest sections.
     */
    CircuitJob parseJob(String text);

    /**
     * Lower an already validated document. On failure the builder's contents
     * must be discarded.
     */
    LoweringStats lower(CircuitDocument document, CircuitBuilder builder);

    /**
     * Parse then lower in one step.
     */
    CompilationResult compile(CompileRequest request);

    /**
     * Compilation request.
     */
    record CompileRequest(
        String text,
        CircuitBuilder builder
    ) {}

    /**
     * Compilation result.
     */
    record CompilationResult(
        CircuitDocument document,
        LoweringStats stats,
        long totalDurationMs
    ) {}
}
