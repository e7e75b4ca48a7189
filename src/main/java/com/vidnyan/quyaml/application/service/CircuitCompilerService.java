package com.vidnyan.quyaml.application.service;

import com.vidnyan.quyaml.application.port.in.CompileCircuitUseCase;
import com.vidnyan.quyaml.application.port.out.DocumentLoader;
import com.vidnyan.quyaml.domain.document.CircuitDocument;
import com.vidnyan.quyaml.domain.document.CircuitJob;
import com.vidnyan.quyaml.domain.lowering.CircuitBuilder;
import com.vidnyan.quyaml.domain.lowering.CircuitLowerer;
import com.vidnyan.quyaml.domain.lowering.LoweringStats;
import com.vidnyan.quyaml.domain.parser.DocumentParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Application service that orchestrates load, parse and lowering.
 * Implements the primary use case. Holds no per-document state, so one
 * instance may serve concurrent callers with separate builders.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CircuitCompilerService implements CompileCircuitUseCase {

    private final DocumentLoader documentLoader;
    private final DocumentParser documentParser;
    private final CircuitLowerer circuitLowerer;

    @Override
    public CircuitDocument parse(String text) {
        return parseJob(text).document();
    }

    @Override
    public CircuitJob parseJob(String text) {
        // Step 1: Load structural tree
        log.debug("Step 1: Loading structural tree ({} chars)...", text == null ? 0 : text.length());
        Object tree = documentLoader.load(text);

        // Step 2: Validate schema and operations
        log.debug("Step 2: Validating document...");
        CircuitJob job = documentParser.parseJob(tree);
        CircuitDocument document = job.document();
        log.info("Parsed '{}' (v{}): {} qubits, {} bits, {} parameters, {} operations",
                document.name(), document.version(), document.qubitCount(), document.bitCount(),
                document.parameters().size(), document.operationCount());
        return job;
    }

    @Override
    public LoweringStats lower(CircuitDocument document, CircuitBuilder builder) {
        log.debug("Step 3: Lowering '{}'...", document.name());
        return circuitLowerer.lower(document, builder);
    }

    @Override
    public CompilationResult compile(CompileRequest request) {
        Instant startTime = Instant.now();
        CircuitDocument document = parse(request.text());
        LoweringStats stats = lower(document, request.builder());

        Duration totalDuration = Duration.between(startTime, Instant.now());
        log.info("Compiled '{}': {} builder calls ({} gates, {} control blocks) in {}ms",
                document.name(), stats.builderCalls(), stats.gates(), stats.controlBlocks(),
                totalDuration.toMillis());
        return new CompilationResult(document, stats, totalDuration.toMillis());
    }
}
