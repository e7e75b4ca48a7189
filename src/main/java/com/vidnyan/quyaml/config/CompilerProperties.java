package com.vidnyan.quyaml.config;

import com.vidnyan.quyaml.domain.parser.CompilerLimits;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the compiler.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "quyaml.compiler")
public class CompilerProperties {

    /**
     * Largest accepted document, in characters.
     */
    private int maxDocumentChars = CompilerLimits.DEFAULT_MAX_DOCUMENT_CHARS;

    /**
     * Deepest accepted mapping/sequence nesting.
     */
    private int maxNestingDepth = CompilerLimits.DEFAULT_MAX_NESTING_DEPTH;

    /**
     * Deepest accepted nesting inside expressions and conditions.
     */
    private int maxExpressionDepth = CompilerLimits.DEFAULT_MAX_EXPRESSION_DEPTH;

    /**
     * Accept version 0.2/0.3 documents, and documents without a version.
     * Default: false
     */
    private boolean allowLegacyVersions = false;

    public CompilerLimits toLimits() {
        return new CompilerLimits(maxDocumentChars, maxNestingDepth, maxExpressionDepth);
    }
}
