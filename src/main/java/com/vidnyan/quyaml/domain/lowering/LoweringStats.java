package com.vidnyan.quyaml.domain.lowering;

/**
 * Counters collected while lowering one document.
 */
public record LoweringStats(
    int builderCalls,
    int gates,
    int controlBlocks,
    int maxScopeDepth
) {}
