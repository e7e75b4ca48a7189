package com.vidnyan.quyaml.domain.error;

/**
 * Categories of compilation failure.
 * Callers (CLI, services) report these distinctly.
 */
public enum ErrorKind {
    /** Anchor, alias, tag, merge key, oversize input or excessive nesting. */
    SAFETY,
    /** Text is not well-formed YAML for this loader. */
    YAML_SYNTAX,
    /** Missing, extra or mistyped top-level field. */
    SCHEMA,
    UNKNOWN_GATE,
    /** Qubit or classical index at or beyond the declared register size. */
    INDEX_OUT_OF_RANGE,
    UNDEFINED_PARAMETER,
    EXPRESSION_SYNTAX,
    /** Non-whitelisted function, identifier or syntax in an expression. */
    DISALLOWED_CONSTRUCT,
    /** Arithmetic failure while evaluating a parameter expression. */
    EVALUATION,
    CONDITION_SYNTAX,
    /** Malformed shorthand instruction text. */
    INSTRUCTION_SYNTAX,
    /** Malformed structured operation or control block. */
    STRUCTURAL,
    /** The builder rejected a call or the scope stack was left unbalanced. */
    LOWERING
}
