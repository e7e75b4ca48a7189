package com.vidnyan.quyaml.domain.parser;

/**
 * Resource ceilings passed explicitly into the loader and parsers.
 *
 * @param maxDocumentChars largest accepted input, in characters
 * @param maxNestingDepth deepest accepted mapping/sequence nesting
 * @param maxExpressionDepth deepest accepted parenthesis/operator nesting in
 *                           parameter expressions and conditions
 */
public record CompilerLimits(
    int maxDocumentChars,
    int maxNestingDepth,
    int maxExpressionDepth
) {

    public static final int DEFAULT_MAX_DOCUMENT_CHARS = 1_000_000;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 50;
    public static final int DEFAULT_MAX_EXPRESSION_DEPTH = 64;

    public CompilerLimits {
        if (maxDocumentChars <= 0 || maxNestingDepth <= 0 || maxExpressionDepth <= 0) {
            throw new IllegalArgumentException("Compiler limits must be positive");
        }
    }

    public static CompilerLimits defaults() {
        return new CompilerLimits(
                DEFAULT_MAX_DOCUMENT_CHARS, DEFAULT_MAX_NESTING_DEPTH, DEFAULT_MAX_EXPRESSION_DEPTH);
    }
}
