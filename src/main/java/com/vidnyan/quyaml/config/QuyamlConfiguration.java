package com.vidnyan.quyaml.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.quyaml.adapter.out.yaml.SnakeYamlSafeLoader;
import com.vidnyan.quyaml.application.port.out.DocumentLoader;
import com.vidnyan.quyaml.domain.condition.ConditionParser;
import com.vidnyan.quyaml.domain.expression.ExpressionEvaluator;
import com.vidnyan.quyaml.domain.expression.ExpressionParser;
import com.vidnyan.quyaml.domain.expression.ExpressionWhitelist;
import com.vidnyan.quyaml.domain.gate.GateRegistry;
import com.vidnyan.quyaml.domain.lowering.CircuitLowerer;
import com.vidnyan.quyaml.domain.parser.CompilerLimits;
import com.vidnyan.quyaml.domain.parser.DocumentParser;
import com.vidnyan.quyaml.domain.parser.InstructionParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for compiler components.
 * The domain classes are framework-free; this wires them with explicit limits.
 */
@Slf4j
@Configuration
public class QuyamlConfiguration {

    /**
     * ObjectMapper for CLI JSON output.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public CompilerLimits compilerLimits(CompilerProperties properties) {
        CompilerLimits limits = properties.toLimits();
        log.info("Compiler limits: {} chars, nesting depth {}, expression depth {}",
                limits.maxDocumentChars(), limits.maxNestingDepth(), limits.maxExpressionDepth());
        return limits;
    }

    /**
     * Closed gate table. Log available gates on startup.
     */
    @Bean
    public GateRegistry gateRegistry() {
        GateRegistry registry = GateRegistry.standard();
        log.info("Registered {} gates:", registry.size());
        registry.gates().forEach(g -> log.debug("  - {}", g.signature()));
        return registry;
    }

    @Bean
    public ExpressionWhitelist expressionWhitelist() {
        ExpressionWhitelist whitelist = ExpressionWhitelist.defaults();
        log.debug("Expression whitelist: constants {}, functions {}",
                whitelist.constants().keySet(), whitelist.functionNames());
        return whitelist;
    }

    @Bean
    public DocumentLoader documentLoader(CompilerLimits limits) {
        return new SnakeYamlSafeLoader(limits);
    }

    @Bean
    public ExpressionParser expressionParser(ExpressionWhitelist whitelist, CompilerLimits limits) {
        return new ExpressionParser(whitelist, limits.maxExpressionDepth());
    }

    @Bean
    public ExpressionEvaluator expressionEvaluator(ExpressionWhitelist whitelist) {
        return new ExpressionEvaluator(whitelist);
    }

    @Bean
    public ConditionParser conditionParser(CompilerLimits limits) {
        return new ConditionParser(limits.maxExpressionDepth());
    }

    @Bean
    public InstructionParser instructionParser(GateRegistry gates, ExpressionParser expressions,
                                               ConditionParser conditions) {
        return new InstructionParser(gates, expressions, conditions);
    }

    @Bean
    public DocumentParser documentParser(InstructionParser instructions, CompilerProperties properties) {
        if (properties.isAllowLegacyVersions()) {
            log.warn("Legacy QuYAML versions (0.2, 0.3) are enabled");
        }
        return new DocumentParser(instructions, properties.isAllowLegacyVersions());
    }

    @Bean
    public CircuitLowerer circuitLowerer(ExpressionEvaluator evaluator) {
        return new CircuitLowerer(evaluator);
    }
}
