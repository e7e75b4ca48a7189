package com.vidnyan.quyaml.domain.gate;

import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed mnemonic table: name to (arity, classical arity, parametric).
 * Adding a gate is a table change here, never a new code path.
 * Immutable once built.
 */
public final class GateRegistry {

    private final Map<String, GateSpec> specs;
    private final Map<String, String> aliases;

    private GateRegistry(Map<String, GateSpec> specs, Map<String, String> aliases) {
        this.specs = Collections.unmodifiableMap(specs);
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    /**
     * Standard single-, two- and three-qubit gates, the rotations, and
     * X/Y-basis readouts that write a classical bit.
     */
    public static GateRegistry standard() {
        return builder()
                .gate(GateSpec.fixed("id", 1))
                .gate(GateSpec.fixed("h", 1))
                .gate(GateSpec.fixed("x", 1))
                .gate(GateSpec.fixed("y", 1))
                .gate(GateSpec.fixed("z", 1))
                .gate(GateSpec.fixed("s", 1))
                .gate(GateSpec.fixed("sdg", 1))
                .gate(GateSpec.fixed("t", 1))
                .gate(GateSpec.fixed("tdg", 1))
                .gate(GateSpec.fixed("sx", 1))
                .gate(GateSpec.fixed("cx", 2))
                .gate(GateSpec.fixed("cy", 2))
                .gate(GateSpec.fixed("cz", 2))
                .gate(GateSpec.fixed("swap", 2))
                .gate(GateSpec.fixed("ccx", 3))
                .gate(GateSpec.fixed("cswap", 3))
                .gate(GateSpec.rotation("rx", 1))
                .gate(GateSpec.rotation("ry", 1))
                .gate(GateSpec.rotation("rz", 1))
                .gate(GateSpec.rotation("p", 1))
                .gate(GateSpec.rotation("cphase", 2))
                .gate(GateSpec.rotation("crx", 2))
                .gate(GateSpec.rotation("cry", 2))
                .gate(GateSpec.rotation("crz", 2))
                .gate(GateSpec.rotation("rzz", 2))
                .gate(GateSpec.readout("mx"))
                .gate(GateSpec.readout("my"))
                .alias("cnot", "cx")
                .alias("cp", "cphase")
                .alias("toffoli", "ccx")
                .alias("fredkin", "cswap")
                .alias("phase", "p")
                .alias("measure_x", "mx")
                .alias("measure_y", "my")
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Find a gate by mnemonic or alias, case-insensitively.
     */
    public Optional<GateSpec> find(String mnemonic) {
        if (mnemonic == null) {
            return Optional.empty();
        }
        String key = mnemonic.toLowerCase(Locale.ROOT);
        String canonical = aliases.getOrDefault(key, key);
        return Optional.ofNullable(specs.get(canonical));
    }

    /**
     * Resolve a mnemonic or fail with {@link ErrorKind#UNKNOWN_GATE}.
     */
    public GateSpec resolve(String mnemonic) {
        return find(mnemonic).orElseThrow(() -> QuyamlException.of(
                ErrorKind.UNKNOWN_GATE, "Unknown gate '" + mnemonic + "'"));
    }

    public Collection<GateSpec> gates() {
        return specs.values();
    }

    public int size() {
        return specs.size();
    }

    public static final class Builder {
        private final Map<String, GateSpec> specs = new LinkedHashMap<>();
        private final Map<String, String> aliases = new LinkedHashMap<>();

        public Builder gate(GateSpec spec) {
            String key = spec.name().toLowerCase(Locale.ROOT);
            if (specs.putIfAbsent(key, spec) != null) {
                throw new IllegalArgumentException("Duplicate gate '" + spec.name() + "'");
            }
            return this;
        }

        public Builder alias(String alias, String target) {
            aliases.put(alias.toLowerCase(Locale.ROOT), target.toLowerCase(Locale.ROOT));
            return this;
        }

        public GateRegistry build() {
            for (Map.Entry<String, String> alias : aliases.entrySet()) {
                if (!specs.containsKey(alias.getValue())) {
                    throw new IllegalArgumentException(
                            "Alias '" + alias.getKey() + "' targets unknown gate '" + alias.getValue() + "'");
                }
                if (specs.containsKey(alias.getKey())) {
                    throw new IllegalArgumentException("Alias '" + alias.getKey() + "' shadows a gate");
                }
            }
            return new GateRegistry(new LinkedHashMap<>(specs), new LinkedHashMap<>(aliases));
        }
    }
}
