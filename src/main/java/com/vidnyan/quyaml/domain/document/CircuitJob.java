package com.vidnyan.quyaml.domain.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A job manifest: the circuit plus pass-through sections.
 * {@code metadata}, {@code execution} and {@code postProcessing} are never
 * interpreted by the compiler. The top level of each section is copied;
 * nested values are kept as loaded, and the loader only produces
 * unmodifiable collections.
 */
public record CircuitJob(
    CircuitDocument document,
    Map<String, Object> metadata,
    Map<String, Object> execution,
    List<Object> postProcessing
) {

    public CircuitJob {
        // absent sections are empty; entries may hold null values, so no Map.copyOf
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        execution = execution == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(execution));
        postProcessing = postProcessing == null ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(postProcessing));
    }
}
