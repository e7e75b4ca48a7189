package com.vidnyan.quyaml.adapter.in.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.quyaml.adapter.out.builder.RecordingCircuitBuilder;
import com.vidnyan.quyaml.application.port.in.CompileCircuitUseCase;
import com.vidnyan.quyaml.application.port.in.CompileCircuitUseCase.CompilationResult;
import com.vidnyan.quyaml.application.port.in.CompileCircuitUseCase.CompileRequest;
import com.vidnyan.quyaml.domain.document.CircuitDocument;
import com.vidnyan.quyaml.domain.document.CircuitJob;
import com.vidnyan.quyaml.domain.error.QuyamlException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI Runner for one-shot validation or compilation of a QuYAML file.
 * Runs when the quyaml.cli.path property is set.
 */
@Slf4j
@Component
public class CompileCliRunner implements CommandLineRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID = 1;
    public static final int EXIT_USAGE = 2;

    private final CompileCircuitUseCase compileCircuitUseCase;
    private final ObjectMapper objectMapper;
    private final String path;
    private final String mode;

    public CompileCliRunner(CompileCircuitUseCase compileCircuitUseCase,
                            ObjectMapper objectMapper,
                            @Value("${quyaml.cli.path:}") String path,
                            @Value("${quyaml.cli.mode:validate}") String mode) {
        this.compileCircuitUseCase = compileCircuitUseCase;
        this.objectMapper = objectMapper;
        this.path = path;
        this.mode = mode;
    }

    @Override
    public void run(String... args) {
        if (path == null || path.isBlank()) {
            log.info("No input specified. Set quyaml.cli.path (and optionally quyaml.cli.mode=validate|compile).");
            return;
        }
        int status = execute(Path.of(path), mode);
        if (status != EXIT_OK) {
            log.warn("QuYAML {} finished with status {}", mode, status);
        }
    }

    /**
     * Validate or compile one file and log the outcome.
     * @return {@link #EXIT_OK}, {@link #EXIT_INVALID} for a rejected document,
     *         or {@link #EXIT_USAGE} for an unreadable file or unknown mode
     */
    public int execute(Path file, String mode) {
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException e) {
            log.error("Cannot read {}: {}", file, e.getMessage());
            return EXIT_USAGE;
        }

        try {
            switch (mode) {
                case "validate" -> validate(file, text);
                case "compile" -> compile(file, text);
                default -> {
                    log.error("Unknown mode '{}'. Use 'validate' or 'compile'.", mode);
                    return EXIT_USAGE;
                }
            }
            return EXIT_OK;
        } catch (QuyamlException e) {
            if (e.path() != null) {
                log.error("{} error in {} at {}: {}", e.kind(), file.getFileName(), e.path(), e.detail());
            } else {
                log.error("{} error in {}: {}", e.kind(), file.getFileName(), e.detail());
            }
            return EXIT_INVALID;
        }
    }

    private void validate(Path file, String text) {
        CircuitJob job = compileCircuitUseCase.parseJob(text);
        CircuitDocument document = job.document();
        log.info("✅ {} is valid: '{}' v{}, {} qubits, {} bits, {} operations",
                file.getFileName(), document.name(), document.version(),
                document.qubitCount(), document.bitCount(), document.operationCount());
        if (!job.metadata().isEmpty() || !job.execution().isEmpty()) {
            log.info("   Job manifest: {} metadata keys, {} execution keys, {} post-processing steps",
                    job.metadata().size(), job.execution().size(), job.postProcessing().size());
        }
    }

    private void compile(Path file, String text) {
        RecordingCircuitBuilder builder = new RecordingCircuitBuilder();
        CompilationResult result = compileCircuitUseCase.compile(new CompileRequest(text, builder));
        log.info("Compiled {}: {} builder calls in {}ms",
                file.getFileName(), result.stats().builderCalls(), result.totalDurationMs());
        log.info("{}", toJson(builder));
    }

    String toJson(RecordingCircuitBuilder builder) {
        try {
            return objectMapper.writeValueAsString(builder.calls());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize builder calls", e);
        }
    }
}
