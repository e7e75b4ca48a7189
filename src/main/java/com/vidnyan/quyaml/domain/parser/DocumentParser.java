package com.vidnyan.quyaml.domain.parser;

import com.vidnyan.quyaml.domain.document.CircuitDocument;
import com.vidnyan.quyaml.domain.document.CircuitJob;
import com.vidnyan.quyaml.domain.document.Operation;
import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates the top-level schema of a loaded tree and builds the circuit.
 * <p>
 * Accepts a plain circuit document, or a job manifest whose {@code circuit}
 * field is itself a mapping of circuit fields, alongside opaque
 * {@code metadata}, {@code execution} and {@code post_processing} sections.
 */
public class DocumentParser {

    public static final String CURRENT_VERSION = "0.4";
    public static final String LEGACY_DEFAULT_VERSION = "0.3";
    private static final Set<String> LEGACY_VERSIONS = Set.of("0.2", "0.3");
    private static final String DEFAULT_NAME = "circuit";

    private static final Pattern REGISTER = Pattern.compile("^\\s*[A-Za-z_]\\w*\\s*\\[\\s*(\\d+)\\s*]\\s*$");
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_]\\w*$");

    private static final String VERSION = "version";
    private static final String CIRCUIT = "circuit";
    private static final String METADATA = "metadata";
    private static final String EXECUTION = "execution";
    private static final String POST_PROCESSING = "post_processing";

    /**
     * Circuit fields with their verbose and short spellings.
     */
    enum Field {
        NAME("name", "circuit"),
        QUBITS("qreg", "qubits"),
        BITS("creg", "bits"),
        PARAMETERS("parameters", "params"),
        OPS("instructions", "ops");

        final String verbose;
        final String shortName;

        Field(String verbose, String shortName) {
            this.verbose = verbose;
            this.shortName = shortName;
        }
    }

    private final InstructionParser instructions;
    private final boolean allowLegacyVersions;

    public DocumentParser(InstructionParser instructions, boolean allowLegacyVersions) {
        this.instructions = instructions;
        this.allowLegacyVersions = allowLegacyVersions;
    }

    public CircuitDocument parse(Object tree) {
        return parseJob(tree).document();
    }

    public CircuitJob parseJob(Object tree) {
        if (!(tree instanceof Map<?, ?> root)) {
            throw QuyamlException.of(ErrorKind.SCHEMA, "Top level of QuYAML must be a mapping");
        }
        String version = checkVersion(root.get(VERSION));

        Map<String, Object> metadata = section(root, METADATA, Map.class);
        Map<String, Object> execution = section(root, EXECUTION, Map.class);
        List<Object> postProcessing = section(root, POST_PROCESSING, List.class);

        Map<?, ?> circuitFields;
        String prefix;
        if (root.get(CIRCUIT) instanceof Map<?, ?> nested) {
            rejectUnknown(root, Set.of(VERSION, CIRCUIT, METADATA, EXECUTION, POST_PROCESSING), "");
            circuitFields = nested;
            prefix = CIRCUIT + ".";
            Set<String> allowed = fieldNames(Set.of());
            allowed.remove(Field.NAME.shortName);
            rejectUnknown(nested, allowed, prefix);
        } else {
            circuitFields = root;
            prefix = "";
            rejectUnknown(root, fieldNames(Set.of(VERSION, METADATA, EXECUTION, POST_PROCESSING)), prefix);
        }

        CircuitDocument document = circuit(version, circuitFields, prefix, metadata);
        return new CircuitJob(document, metadata, execution, postProcessing);
    }

    private String checkVersion(Object raw) {
        if (raw == null) {
            if (allowLegacyVersions) {
                return LEGACY_DEFAULT_VERSION;
            }
            throw QuyamlException.at(ErrorKind.SCHEMA, VERSION,
                    "Missing required 'version' field (expected '" + CURRENT_VERSION + "')");
        }
        String version = String.valueOf(raw).trim();
        if (CURRENT_VERSION.equals(version)) {
            return version;
        }
        if (allowLegacyVersions && LEGACY_VERSIONS.contains(version)) {
            return version;
        }
        String extra = allowLegacyVersions ? ", 0.2, 0.3 (legacy)" : "";
        throw QuyamlException.at(ErrorKind.SCHEMA, VERSION,
                "Unsupported QuYAML version '" + version + "'. Supported: " + CURRENT_VERSION + extra);
    }

    private CircuitDocument circuit(String version, Map<?, ?> fields, String prefix, Map<String, Object> metadata) {
        String name = name(fields, prefix, metadata);

        Object rawQubits = field(fields, Field.QUBITS, prefix);
        if (rawQubits == null) {
            throw QuyamlException.at(ErrorKind.SCHEMA, prefix + Field.QUBITS.verbose,
                    "QuYAML must define a quantum register (qreg/qubits)");
        }
        int qubitCount = registerSize(rawQubits, prefix + Field.QUBITS.verbose);
        if (qubitCount < 1) {
            throw QuyamlException.at(ErrorKind.SCHEMA, prefix + Field.QUBITS.verbose,
                    "Quantum register must hold at least one qubit");
        }
        Object rawBits = field(fields, Field.BITS, prefix);
        int bitCount = rawBits == null ? 0 : registerSize(rawBits, prefix + Field.BITS.verbose);

        Map<String, Double> parameters = parameters(field(fields, Field.PARAMETERS, prefix), prefix);

        String opsPath = prefix + key(fields, Field.OPS);
        Object rawOps = field(fields, Field.OPS, prefix);
        if (rawOps == null) {
            throw QuyamlException.at(ErrorKind.SCHEMA, opsPath, "Missing required operation list (instructions/ops)");
        }
        if (!(rawOps instanceof List<?>)) {
            throw QuyamlException.at(ErrorKind.SCHEMA, opsPath, "'instructions'/'ops' must be a list");
        }
        InstructionParser.Scope scope = new InstructionParser.Scope(qubitCount, bitCount, parameters.keySet());
        List<Operation> ops = instructions.parseAll(rawOps, opsPath, scope);

        return new CircuitDocument(version, name, qubitCount, bitCount, parameters, ops);
    }

    private String name(Map<?, ?> fields, String prefix, Map<String, Object> metadata) {
        Object raw = field(fields, Field.NAME, prefix);
        if (raw == null && metadata.get("name") != null) {
            raw = metadata.get("name");
        }
        if (raw == null) {
            return DEFAULT_NAME;
        }
        if (raw instanceof Map || raw instanceof List) {
            throw QuyamlException.at(ErrorKind.SCHEMA, prefix + Field.NAME.verbose, "Circuit name must be a scalar");
        }
        return String.valueOf(raw);
    }

    /**
     * Value of a field under either spelling; giving both is an error.
     */
    private static Object field(Map<?, ?> fields, Field field, String prefix) {
        boolean verbose = fields.containsKey(field.verbose);
        boolean shortForm = fields.containsKey(field.shortName);
        if (verbose && shortForm) {
            throw QuyamlException.at(ErrorKind.SCHEMA, prefix + field.verbose, "Both '" + field.verbose
                    + "' and '" + field.shortName + "' given; use one spelling");
        }
        return verbose ? fields.get(field.verbose) : fields.get(field.shortName);
    }

    private static String key(Map<?, ?> fields, Field field) {
        return fields.containsKey(field.verbose) ? field.verbose : field.shortName;
    }

    private static int registerSize(Object raw, String path) {
        if (raw instanceof Long size) {
            if (size < 0 || size > Integer.MAX_VALUE) {
                throw QuyamlException.at(ErrorKind.SCHEMA, path, "Register size out of range: " + size);
            }
            return size.intValue();
        }
        if (raw instanceof String text) {
            Matcher m = REGISTER.matcher(text);
            if (m.matches()) {
                try {
                    return Integer.parseInt(m.group(1));
                } catch (NumberFormatException e) {
                    throw QuyamlException.at(ErrorKind.SCHEMA, path, "Register size out of range: " + text);
                }
            }
        }
        throw QuyamlException.at(ErrorKind.SCHEMA, path,
                "Register must be written as 'q[n]' or a non-negative integer, got '" + raw + "'");
    }

    private static Map<String, Double> parameters(Object raw, String prefix) {
        Map<String, Double> parameters = new LinkedHashMap<>();
        if (raw == null) {
            return parameters;
        }
        String path = prefix + Field.PARAMETERS.verbose;
        if (!(raw instanceof Map<?, ?> entries)) {
            throw QuyamlException.at(ErrorKind.SCHEMA, path, "Parameters must be a mapping of name to number");
        }
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (!IDENTIFIER.matcher(name).matches()) {
                throw QuyamlException.at(ErrorKind.SCHEMA, path + "." + name, "Invalid parameter name '" + name + "'");
            }
            if (!(entry.getValue() instanceof Number number)) {
                throw QuyamlException.at(ErrorKind.SCHEMA, path + "." + name,
                        "Parameter '" + name + "' must be a number");
            }
            double value = number.doubleValue();
            if (!Double.isFinite(value)) {
                throw QuyamlException.at(ErrorKind.SCHEMA, path + "." + name,
                        "Parameter '" + name + "' must be finite");
            }
            parameters.put(name, value);
        }
        return parameters;
    }

    @SuppressWarnings("unchecked")
    private static <T> T section(Map<?, ?> root, String key, Class<?> type) {
        Object raw = root.get(key);
        if (raw == null) {
            return (T) (type == Map.class ? Map.of() : List.of());
        }
        if (!type.isInstance(raw)) {
            throw QuyamlException.at(ErrorKind.SCHEMA, key,
                    "'" + key + "' must be a " + (type == Map.class ? "mapping" : "list"));
        }
        return (T) raw;
    }

    private static Set<String> fieldNames(Set<String> extra) {
        Set<String> names = new LinkedHashSet<>(extra);
        for (Field field : Field.values()) {
            names.add(field.verbose);
            names.add(field.shortName);
        }
        return names;
    }

    private static void rejectUnknown(Map<?, ?> map, Set<String> allowed, String prefix) {
        for (Object key : map.keySet()) {
            if (!allowed.contains(String.valueOf(key))) {
                throw QuyamlException.at(ErrorKind.SCHEMA, prefix + key, "Unknown field '" + key + "'");
            }
        }
    }
}
