package com.actguard.execution.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Classifies a raw output schema (as parsed from JSON: maps, lists, strings, booleans) into a
 * {@link WellFormedSchema} tree or {@link MalformedSchema}.
 * <p>
 * The root must be a mapping with a {@code type} keyword; a root without one is the legacy
 * flat-properties shape and is rejected. Below the root, {@code type} is optional, but every
 * descriptor under {@code properties}, {@code patternProperties}, {@code items},
 * {@code additionalItems} and {@code additionalProperties} must itself be a mapping (or a boolean
 * where JSON Schema allows one). A single bad descriptor anywhere makes the whole schema malformed.
 * <p>
 * Stateless and thread-safe; the input is never modified.
 */
public final class SchemaClassifier {

    private static final String TYPE = "type";
    private static final String PROPERTIES = "properties";
    private static final String PATTERN_PROPERTIES = "patternProperties";
    private static final String ADDITIONAL_PROPERTIES = "additionalProperties";
    private static final String ITEMS = "items";
    private static final String ADDITIONAL_ITEMS = "additionalItems";
    private static final String SECRET = "secret";

    private SchemaClassifier() {
    }

    /**
     * Classifies the given raw schema.
     *
     * @param rawSchema schema as a JSON-like value (typically {@code Map<String, Object>}); may be null
     * @return well-formed tree, or {@link MalformedSchema} with the reason
     */
    public static OutputSchema classify(Object rawSchema) {
        if (!(rawSchema instanceof Map)) {
            return MalformedSchema.because("schema is not a mapping");
        }
        Map<?, ?> root = (Map<?, ?>) rawSchema;
        if (!root.containsKey(TYPE)) {
            return MalformedSchema.because("schema has no 'type' (legacy properties-only shape)");
        }
        try {
            return parseNode(root, "$");
        } catch (Rejected e) {
            return MalformedSchema.because(e.getMessage());
        }
    }

    private static WellFormedSchema parseNode(Map<?, ?> node, String path) {
        WellFormedSchema.Builder b = WellFormedSchema.builder();

        if (node.containsKey(TYPE)) {
            parseTypes(node.get(TYPE), path, b);
        }

        Object secret = node.get(SECRET);
        if (secret != null) {
            if (!(secret instanceof Boolean)) {
                throw new Rejected(path + ".secret must be a boolean");
            }
            b.secret((Boolean) secret);
        }

        Object properties = node.get(PROPERTIES);
        if (properties != null) {
            for (Map.Entry<?, ?> e : requireMapping(properties, path + "." + PROPERTIES).entrySet()) {
                String name = String.valueOf(e.getKey());
                String childPath = path + "." + PROPERTIES + "." + name;
                b.property(name, parseNode(requireMapping(e.getValue(), childPath), childPath));
            }
        }

        Object patternProperties = node.get(PATTERN_PROPERTIES);
        if (patternProperties != null) {
            for (Map.Entry<?, ?> e : requireMapping(patternProperties, path + "." + PATTERN_PROPERTIES).entrySet()) {
                String regex = String.valueOf(e.getKey());
                String childPath = path + "." + PATTERN_PROPERTIES + "." + regex;
                Pattern pattern;
                try {
                    pattern = Pattern.compile(regex);
                } catch (PatternSyntaxException ex) {
                    throw new Rejected(childPath + " is not a valid regular expression: " + ex.getDescription());
                }
                b.patternProperty(pattern, parseNode(requireMapping(e.getValue(), childPath), childPath));
            }
        }

        Object additionalProperties = node.get(ADDITIONAL_PROPERTIES);
        if (additionalProperties instanceof Boolean) {
            b.additionalPropertiesAllowed((Boolean) additionalProperties);
        } else if (additionalProperties != null) {
            String childPath = path + "." + ADDITIONAL_PROPERTIES;
            b.additionalPropertiesSchema(parseNode(requireMapping(additionalProperties, childPath), childPath));
        }

        Object items = node.get(ITEMS);
        if (items instanceof Map) {
            b.itemsSchema(parseNode((Map<?, ?>) items, path + "." + ITEMS));
        } else if (items instanceof List) {
            List<WellFormedSchema> positional = new ArrayList<>();
            int i = 0;
            for (Object item : (List<?>) items) {
                String childPath = path + "." + ITEMS + "[" + i++ + "]";
                positional.add(parseNode(requireMapping(item, childPath), childPath));
            }
            b.positionalItems(positional);
        } else if (items != null) {
            throw new Rejected(path + "." + ITEMS + " must be a mapping or a list of mappings");
        }

        Object additionalItems = node.get(ADDITIONAL_ITEMS);
        if (additionalItems != null && !(additionalItems instanceof Boolean)) {
            String childPath = path + "." + ADDITIONAL_ITEMS;
            b.additionalItemsSchema(parseNode(requireMapping(additionalItems, childPath), childPath));
        }

        return b.build();
    }

    private static void parseTypes(Object type, String path, WellFormedSchema.Builder b) {
        if (type instanceof String) {
            b.type(requireKnownType((String) type, path));
        } else if (type instanceof Collection && !((Collection<?>) type).isEmpty()) {
            for (Object t : (Collection<?>) type) {
                if (!(t instanceof String)) {
                    throw new Rejected(path + ".type entries must be strings");
                }
                b.type(requireKnownType((String) t, path));
            }
        } else {
            throw new Rejected(path + ".type must be a type name or a non-empty list of type names");
        }
    }

    private static SchemaType requireKnownType(String name, String path) {
        return SchemaType.fromValue(name)
                .orElseThrow(() -> new Rejected(path + ".type '" + name + "' is not a JSON Schema type"));
    }

    private static Map<?, ?> requireMapping(Object value, String path) {
        if (!(value instanceof Map)) {
            throw new Rejected(path + " must be a mapping");
        }
        return (Map<?, ?>) value;
    }

    /** Internal signal carrying the rejection reason; converted to {@link MalformedSchema}. */
    private static final class Rejected extends RuntimeException {
        Rejected(String message) {
            super(message, null, false, false);
        }
    }
}
