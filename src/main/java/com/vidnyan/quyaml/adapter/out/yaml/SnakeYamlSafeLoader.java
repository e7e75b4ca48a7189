package com.vidnyan.quyaml.adapter.out.yaml;

import com.vidnyan.quyaml.application.port.out.DocumentLoader;
import com.vidnyan.quyaml.domain.error.ErrorKind;
import com.vidnyan.quyaml.domain.error.QuyamlException;
import com.vidnyan.quyaml.domain.parser.CompilerLimits;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.events.AliasEvent;
import org.yaml.snakeyaml.events.CollectionEndEvent;
import org.yaml.snakeyaml.events.CollectionStartEvent;
import org.yaml.snakeyaml.events.DocumentStartEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.NodeEvent;
import org.yaml.snakeyaml.events.ScalarEvent;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.StringReader;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Safety-restricted YAML loader built on SnakeYAML's event stream.
 * <p>
 * The tree is constructed directly from parser events, so anchors, aliases,
 * explicit tags and merge keys are rejected at the event that carries them,
 * before the document is complete. SnakeYAML's composer and constructor are
 * never used, hence no object instantiation and no alias expansion.
 */
@Slf4j
public class SnakeYamlSafeLoader implements DocumentLoader {

    private static final String MERGE_KEY = "<<";

    private final CompilerLimits limits;
    private final Resolver resolver = new Resolver();

    public SnakeYamlSafeLoader(CompilerLimits limits) {
        this.limits = limits;
    }

    @Override
    public Object load(String text) {
        if (text == null) {
            throw QuyamlException.of(ErrorKind.YAML_SYNTAX, "Document text is null");
        }
        if (text.length() > limits.maxDocumentChars()) {
            throw QuyamlException.of(ErrorKind.SAFETY, "QuYAML document too large: " + text.length()
                    + " characters exceeds limit of " + limits.maxDocumentChars());
        }

        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        options.setMaxAliasesForCollections(0);
        options.setCodePointLimit(Math.max(limits.maxDocumentChars(), 1));
        Yaml yaml = new Yaml(options);

        TreeAssembler assembler = new TreeAssembler();
        try {
            for (Event event : yaml.parse(new StringReader(text))) {
                assembler.accept(event);
            }
        } catch (MarkedYAMLException e) {
            throw QuyamlException.of(ErrorKind.YAML_SYNTAX, "Invalid YAML syntax" + at(e.getProblemMark())
                    + ": " + e.getProblem());
        } catch (YAMLException e) {
            throw QuyamlException.of(ErrorKind.YAML_SYNTAX, "Invalid YAML syntax: " + e.getMessage());
        }

        log.debug("Loaded structural tree: {} chars, nesting depth {}", text.length(), assembler.maxDepth);
        return assembler.root;
    }

    private static String at(Mark mark) {
        return mark == null ? "" : " (line " + (mark.getLine() + 1) + ", column " + (mark.getColumn() + 1) + ")";
    }

    /**
     * Builds the plain tree from events with an explicit frame stack.
     */
    private final class TreeAssembler {
        private final Deque<Frame> frames = new ArrayDeque<>();
        private Object root;
        private int documents;
        private int maxDepth;

        void accept(Event event) {
            if (event instanceof DocumentStartEvent) {
                if (++documents > 1) {
                    throw QuyamlException.of(ErrorKind.YAML_SYNTAX,
                            "Multiple YAML documents in one stream" + at(event.getStartMark()));
                }
                return;
            }
            if (event instanceof AliasEvent alias) {
                throw QuyamlException.of(ErrorKind.SAFETY, "YAML aliases (*" + alias.getAnchor()
                        + ") are not allowed in QuYAML for safety" + at(event.getStartMark()));
            }
            if (event instanceof NodeEvent node) {
                rejectAnchor(node);
            }
            if (event instanceof ScalarEvent scalar) {
                if (scalar.getTag() != null) {
                    throw customTag(scalar.getTag(), event);
                }
                acceptScalar(scalar);
            } else if (event instanceof CollectionStartEvent start) {
                if (start.getTag() != null) {
                    throw customTag(start.getTag(), event);
                }
                openCollection(start);
            } else if (event instanceof CollectionEndEvent) {
                Frame done = frames.pop();
                attach(done.seal());
            }
        }

        private void rejectAnchor(NodeEvent node) {
            if (node.getAnchor() != null) {
                throw QuyamlException.of(ErrorKind.SAFETY, "YAML anchors (&" + node.getAnchor()
                        + ") are not allowed in QuYAML for safety" + at(node.getStartMark()));
            }
        }

        private QuyamlException customTag(String tag, Event event) {
            return QuyamlException.of(ErrorKind.SAFETY, "YAML custom tags (" + tag
                    + ") are not allowed in QuYAML for safety" + at(event.getStartMark()));
        }

        private void openCollection(CollectionStartEvent start) {
            Frame parent = frames.peek();
            if (parent instanceof MapFrame map && map.pendingKey == null) {
                throw QuyamlException.of(ErrorKind.YAML_SYNTAX,
                        "Mapping keys must be plain scalars" + at(start.getStartMark()));
            }
            if (frames.size() + 1 > limits.maxNestingDepth()) {
                throw QuyamlException.of(ErrorKind.SAFETY, "QuYAML nesting too deep: exceeds limit of "
                        + limits.maxNestingDepth() + at(start.getStartMark()));
            }
            frames.push(start instanceof MappingStartEvent ? new MapFrame() : new ListFrame());
            maxDepth = Math.max(maxDepth, frames.size());
        }

        private void acceptScalar(ScalarEvent scalar) {
            Frame parent = frames.peek();
            if (parent instanceof MapFrame map && map.pendingKey == null) {
                String key = scalar.getValue();
                if (MERGE_KEY.equals(key)) {
                    throw QuyamlException.of(ErrorKind.SAFETY,
                            "YAML merge keys (<<:) are not allowed in QuYAML for safety" + at(scalar.getStartMark()));
                }
                if (map.values.containsKey(key)) {
                    throw QuyamlException.of(ErrorKind.YAML_SYNTAX,
                            "Duplicate key '" + key + "'" + at(scalar.getStartMark()));
                }
                map.pendingKey = key;
                return;
            }
            attach(resolveScalar(scalar));
        }

        private void attach(Object value) {
            Frame parent = frames.peek();
            if (parent == null) {
                root = value;
            } else if (parent instanceof MapFrame map) {
                map.values.put(map.pendingKey, value);
                map.pendingKey = null;
            } else {
                ((ListFrame) parent).values.add(value);
            }
        }
    }

    private Object resolveScalar(ScalarEvent scalar) {
        String value = scalar.getValue();
        if (!scalar.getImplicit().canOmitTagInPlainScalar()) {
            // quoted or block scalar
            return value;
        }
        Tag tag = resolver.resolve(NodeId.scalar, value, true);
        if (Tag.NULL.equals(tag)) {
            return null;
        }
        if (Tag.BOOL.equals(tag)) {
            String lower = value.toLowerCase();
            return lower.equals("true") || lower.equals("yes") || lower.equals("on");
        }
        if (Tag.INT.equals(tag)) {
            return parseInteger(value, scalar);
        }
        if (Tag.FLOAT.equals(tag)) {
            return parseFloat(value);
        }
        return value;
    }

    private static Object parseInteger(String raw, ScalarEvent scalar) {
        String value = raw.replace("_", "");
        if (value.contains(":")) {
            // sexagesimal integers are kept as text
            return raw;
        }
        int sign = 1;
        if (value.startsWith("-")) {
            sign = -1;
            value = value.substring(1);
        } else if (value.startsWith("+")) {
            value = value.substring(1);
        }
        int radix = 10;
        if (value.startsWith("0b")) {
            radix = 2;
            value = value.substring(2);
        } else if (value.startsWith("0x")) {
            radix = 16;
            value = value.substring(2);
        } else if (value.length() > 1 && value.startsWith("0")) {
            radix = 8;
            value = value.substring(1);
        }
        BigInteger parsed = new BigInteger(value, radix);
        if (sign < 0) {
            parsed = parsed.negate();
        }
        if (parsed.bitLength() >= Long.SIZE) {
            throw QuyamlException.of(ErrorKind.YAML_SYNTAX,
                    "Integer '" + raw + "' is out of range" + at(scalar.getStartMark()));
        }
        return parsed.longValue();
    }

    private static Object parseFloat(String raw) {
        String value = raw.replace("_", "");
        String lower = value.toLowerCase();
        if (lower.endsWith(".inf")) {
            return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (lower.equals(".nan")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return raw;
        }
    }

    private interface Frame {
        Object seal();
    }

    private static final class MapFrame implements Frame {
        final Map<String, Object> values = new LinkedHashMap<>();
        String pendingKey;

        @Override
        public Object seal() {
            return Collections.unmodifiableMap(values);
        }
    }

    private static final class ListFrame implements Frame {
        final List<Object> values = new ArrayList<>();

        @Override
        public Object seal() {
            return Collections.unmodifiableList(values);
        }
    }
}
