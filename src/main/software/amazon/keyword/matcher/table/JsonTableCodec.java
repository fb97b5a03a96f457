package software.amazon.keyword.matcher.table;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Encodes a {@link KeywordTable} as JSON and back. The layout is one object member per state, keyed by state id:
 * <pre>
 * {@code
 *   {
 *     "0": { "children": { "h": 1, "s": 2 }, "output": [] },
 *     "1": { "children": { "e": 3 }, "output": [] },
 *     ...
 *   }
 * }
 * </pre>
 * Non-ASCII symbols and keywords are written as is, not escaped. When reading, the top level may also be an array
 * indexed by state id, and {@code children} may be an array of child ids, read as an object keyed by the array
 * indexes {@code "0"}, {@code "1"}, ... (the form a writer produces when the symbols are exactly those digits, and the
 * form an empty {@code children} often takes). Members other than {@code children} and {@code output} (such as a
 * {@code "fail": null} left by other writers) are ignored.
 */
public final class JsonTableCodec {

    private static final JsonFactory JSON_FACTORY = new JsonFactory();
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper(JSON_FACTORY);

    static final String CHILDREN = "children";
    static final String OUTPUT = "output";

    private JsonTableCodec() { }

    /**
     * @param table the table
     * @return the table as UTF-8 JSON, the same document {@link #writeString(KeywordTable)} returns
     */
    public static byte[] write(final KeywordTable table) throws IOException {
        // the byte generator escapes surrogate pairs, the character one does not
        return writeString(table).getBytes(StandardCharsets.UTF_8);
    }

    public static String writeString(final KeywordTable table) throws IOException {
        final StringWriter out = new StringWriter();
        try (JsonGenerator generator = JSON_FACTORY.createGenerator(out)) {
            writeTable(generator, table);
        }
        return out.toString();
    }

    /**
     * Decode a table. The result is not checked for being a valid trie; that happens when it is imported.
     *
     * @param source the JSON
     * @return the table
     * @throws IOException if the source is not valid JSON
     * @throws MalformedTableException if the source is valid JSON but not shaped like a table
     */
    public static KeywordTable read(final String source) throws IOException {
        return fromTree(OBJECT_MAPPER.readTree(source));
    }

    public static KeywordTable read(final byte[] source) throws IOException {
        return fromTree(OBJECT_MAPPER.readTree(source));
    }

    public static KeywordTable read(final InputStream source) throws IOException {
        return fromTree(OBJECT_MAPPER.readTree(source));
    }

    public static KeywordTable read(final Reader source) throws IOException {
        return fromTree(OBJECT_MAPPER.readTree(source));
    }

    private static void writeTable(final JsonGenerator generator, final KeywordTable table) throws IOException {
        generator.writeStartObject();
        for (Map.Entry<Integer, KeywordTable.Entry> state : table.getEntries().entrySet()) {
            generator.writeFieldName(String.valueOf(state.getKey()));
            generator.writeStartObject();

            generator.writeFieldName(CHILDREN);
            generator.writeStartObject();
            for (Map.Entry<String, Integer> child : state.getValue().getChildren().entrySet()) {
                generator.writeNumberField(child.getKey(), child.getValue());
            }
            generator.writeEndObject();

            generator.writeFieldName(OUTPUT);
            generator.writeStartArray();
            for (String keyword : state.getValue().getOutput()) {
                generator.writeString(keyword);
            }
            generator.writeEndArray();

            generator.writeEndObject();
        }
        generator.writeEndObject();
    }

    private static KeywordTable fromTree(final JsonNode root) {
        if (root == null || root.isMissingNode()) {
            throw new MalformedTableException("Document holds no table");
        }
        final Map<Integer, KeywordTable.Entry> entries = new TreeMap<>();
        if (root.isArray()) {
            for (int id = 0; id < root.size(); id++) {
                entries.put(id, readEntry(String.valueOf(id), root.get(id)));
            }
        } else if (root.isObject()) {
            final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                entries.put(parseId(field.getKey()), readEntry(field.getKey(), field.getValue()));
            }
        } else {
            throw new MalformedTableException("Table must be a JSON object or array, found " + root.getNodeType());
        }
        return new KeywordTable(entries);
    }

    private static int parseId(final String id) {
        try {
            return Integer.parseInt(id);
        } catch (NumberFormatException e) {
            throw new MalformedTableException("State id '" + id + "' is not an integer", e);
        }
    }

    private static int readChildId(final String id, final String symbol, final JsonNode node) {
        if (!node.isInt()) {
            throw new MalformedTableException("State " + id + " has a non-integer child id for '" + symbol + "'");
        }
        return node.intValue();
    }

    private static KeywordTable.Entry readEntry(final String id, final JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedTableException("State " + id + " must be a JSON object");
        }

        final Map<String, Integer> children = new LinkedHashMap<>();
        final JsonNode childrenNode = node.get(CHILDREN);
        if (childrenNode != null && !childrenNode.isNull()) {
            if (childrenNode.isObject()) {
                final Iterator<Map.Entry<String, JsonNode>> fields = childrenNode.fields();
                while (fields.hasNext()) {
                    final Map.Entry<String, JsonNode> child = fields.next();
                    children.put(child.getKey(), readChildId(id, child.getKey(), child.getValue()));
                }
            } else if (childrenNode.isArray()) {
                for (int index = 0; index < childrenNode.size(); index++) {
                    final String symbol = String.valueOf(index);
                    children.put(symbol, readChildId(id, symbol, childrenNode.get(index)));
                }
            } else {
                throw new MalformedTableException("State " + id + " has children that are not a JSON object or array");
            }
        }

        final List<String> output = new ArrayList<>();
        final JsonNode outputNode = node.get(OUTPUT);
        if (outputNode != null && !outputNode.isNull()) {
            if (!outputNode.isArray()) {
                throw new MalformedTableException("State " + id + " has an output that is not a JSON array");
            }
            for (JsonNode keyword : outputNode) {
                if (!keyword.isTextual()) {
                    throw new MalformedTableException("State " + id + " outputs a non-string keyword");
                }
                output.add(keyword.textValue());
            }
        }
        return new KeywordTable.Entry(children, output);
    }
}
