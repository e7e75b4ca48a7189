package com.vidnyan.quyaml.application.port.out;

/**
 * Port for turning raw document text into a plain structural tree.
 * Implemented by adapters (e.g., the SnakeYAML safety loader).
 */
public interface DocumentLoader {

    /**
     * Load text into a tree of {@code Map<String, Object>}, {@code List<Object>}
     * and scalars ({@code String}, {@code Long}, {@code Double}, {@code Boolean}, null).
     * The returned collections are unmodifiable.
     *
     * @throws com.vidnyan.quyaml.domain.error.QuyamlException with kind SAFETY for
     *         any disallowed construct or exceeded limit, YAML_SYNTAX for malformed text;
     *         no partial tree is ever returned
     */
    Object load(String text);
}
