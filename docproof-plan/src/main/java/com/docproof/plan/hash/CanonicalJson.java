package com.docproof.plan.hash;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Deterministic JSON rendering used for every hash in the system.
 * <ul>
 *   <li>object keys sorted lexicographically at every depth</li>
 *   <li>null object members omitted (absent and null are the same thing)</li>
 *   <li>array order preserved, null array elements written as {@code null}</li>
 *   <li>integral floating point values written without fraction ({@code 1.0} → {@code 1});
 *       NaN and infinities written as {@code null}</li>
 *   <li>no insignificant whitespace</li>
 * </ul>
 * Values are converted to a Jackson tree first, so any bean with Jackson annotations can be canonicalized.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private CanonicalJson() {
    }

    /**
     * Canonical JSON text of the given value.
     *
     * @param value map, list, scalar or Jackson-serializable bean (null → {@code "null"})
     */
    public static String canonicalize(Object value) {
        JsonNode tree = value instanceof JsonNode n ? n : MAPPER.valueToTree(value);
        StringBuilder out = new StringBuilder();
        write(tree, out);
        return out.toString();
    }

    private static void write(JsonNode node, StringBuilder out) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            out.append("null");
            return;
        }
        JsonNodeType type = node.getNodeType();
        switch (type) {
            case OBJECT -> writeObject(node, out);
            case ARRAY -> {
                out.append('[');
                for (int i = 0; i < node.size(); i++) {
                    if (i > 0) out.append(',');
                    write(node.get(i), out);
                }
                out.append(']');
            }
            case STRING -> writeString(node.textValue(), out);
            case BOOLEAN -> out.append(node.booleanValue());
            case NUMBER -> writeNumber(node, out);
            case BINARY, POJO -> writeString(node.asText(), out);
            default -> out.append("null");
        }
    }

    private static void writeObject(JsonNode node, StringBuilder out) {
        List<String> names = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode v = field.getValue();
            if (v != null && !v.isNull() && !v.isMissingNode()) {
                names.add(field.getKey());
            }
        }
        Collections.sort(names);
        out.append('{');
        boolean first = true;
        for (String name : names) {
            if (!first) out.append(',');
            first = false;
            writeString(name, out);
            out.append(':');
            write(node.get(name), out);
        }
        out.append('}');
    }

    private static void writeNumber(JsonNode node, StringBuilder out) {
        if (node.isIntegralNumber()) {
            out.append(node.bigIntegerValue().toString());
            return;
        }
        if (node.isBigDecimal()) {
            BigDecimal d = node.decimalValue().stripTrailingZeros();
            out.append(d.scale() <= 0 ? d.toBigInteger().toString() : d.toPlainString());
            return;
        }
        double d = node.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            out.append("null");
        } else if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            out.append((long) d);
        } else {
            out.append(d);
        }
    }

    private static void writeString(String s, StringBuilder out) {
        out.append('"');
        out.append(JsonStringEncoder.getInstance().quoteAsString(s));
        out.append('"');
    }
}
