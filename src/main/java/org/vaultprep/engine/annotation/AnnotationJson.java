package org.vaultprep.engine.annotation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-dependency JSON reader and writer for annotation documents.
 *
 * Objects parse to insertion-ordered maps and arrays to lists, so column and
 * group order survive a load/save cycle unchanged.
 *
 * Supports: objects, arrays, strings, integers, booleans, null
 */
public final class AnnotationJson {

    private static final String INDENT = "  ";

    private AnnotationJson() {
    }

    // ========== PARSING ==========

    /**
     * Parse a JSON string into a Map (for objects) or List (for arrays).
     */
    public static Object parse(String json) {
        if (json == null || json.isBlank()) {
            throw new AnnotationParseException("Empty annotation document");
        }
        Parser parser = new Parser(json.trim());
        Object value = parser.parseValue();
        parser.expectEnd();
        return value;
    }

    /**
     * Parse JSON and require a top-level object.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String json) {
        Object result = parse(json);
        if (!(result instanceof Map)) {
            throw new AnnotationParseException("Annotation document must be a JSON object");
        }
        return (Map<String, Object>) result;
    }

    // ========== SERIALIZATION ==========

    /**
     * Serialize to indented JSON (two spaces per level).
     */
    public static String toJson(Object value) {
        StringBuilder sb = new StringBuilder();
        writeValue(sb, value, 0);
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    private static void writeValue(StringBuilder sb, Object value, int depth) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            writeString(sb, s);
        } else if (value instanceof Number n) {
            sb.append(n);
        } else if (value instanceof Boolean b) {
            sb.append(b ? "true" : "false");
        } else if (value instanceof Map<?, ?> m) {
            writeObject(sb, (Map<String, Object>) m, depth);
        } else if (value instanceof List<?> l) {
            writeArray(sb, l, depth);
        } else {
            throw new IllegalArgumentException("Unsupported annotation value: " + value.getClass().getName());
        }
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    private static void writeObject(StringBuilder sb, Map<String, Object> map, int depth) {
        if (map.isEmpty()) {
            sb.append("{}");
            return;
        }
        sb.append("{\n");
        boolean first = true;
        for (var entry : map.entrySet()) {
            if (!first)
                sb.append(",\n");
            first = false;
            indent(sb, depth + 1);
            writeString(sb, entry.getKey());
            sb.append(": ");
            writeValue(sb, entry.getValue(), depth + 1);
        }
        sb.append('\n');
        indent(sb, depth);
        sb.append('}');
    }

    private static void writeArray(StringBuilder sb, List<?> list, int depth) {
        if (list.isEmpty()) {
            sb.append("[]");
            return;
        }
        sb.append("[\n");
        boolean first = true;
        for (Object item : list) {
            if (!first)
                sb.append(",\n");
            first = false;
            indent(sb, depth + 1);
            writeValue(sb, item, depth + 1);
        }
        sb.append('\n');
        indent(sb, depth);
        sb.append(']');
    }

    private static void indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
    }

    // ========== PARSER IMPLEMENTATION ==========

    /**
     * Single-pass reader over the trimmed document. Numbers are integers only:
     * orders and ordinal positions are the only numeric fields.
     */
    private static final class Parser {
        private final String json;
        private int pos = 0;

        Parser(String json) {
            this.json = json;
        }

        Object parseValue() {
            skipWhitespace();
            return switch (peek("Unexpected end of document")) {
                case '{' -> parseObject();
                case '[' -> parseArray();
                case '"' -> parseString();
                case 't' -> literal("true", Boolean.TRUE);
                case 'f' -> literal("false", Boolean.FALSE);
                case 'n' -> literal("null", null);
                default -> parseInteger();
            };
        }

        void expectEnd() {
            skipWhitespace();
            if (pos < json.length()) {
                throw new AnnotationParseException("Unexpected trailing content", pos);
            }
        }

        private Map<String, Object> parseObject() {
            Map<String, Object> map = new LinkedHashMap<>();
            pos++;
            if (consumeClosing('}')) {
                return map;
            }
            do {
                skipWhitespace();
                if (peek("Expected object key") != '"') {
                    throw new AnnotationParseException("Expected object key", pos);
                }
                String key = parseString();
                skipWhitespace();
                if (peek("Expected ':'") != ':') {
                    throw new AnnotationParseException("Expected ':'", pos);
                }
                pos++;
                map.put(key, parseValue());
            } while (separator('}', "Unterminated object"));
            return map;
        }

        private List<Object> parseArray() {
            List<Object> list = new ArrayList<>();
            pos++;
            if (consumeClosing(']')) {
                return list;
            }
            do {
                list.add(parseValue());
            } while (separator(']', "Unterminated array"));
            return list;
        }

        /**
         * Consumes ',' (returns true) or the closing bracket (returns false).
         */
        private boolean separator(char closing, String unterminated) {
            skipWhitespace();
            char c = peek(unterminated);
            pos++;
            if (c == ',') {
                return true;
            }
            if (c == closing) {
                return false;
            }
            throw new AnnotationParseException("Expected ',' or '" + closing + "'", pos - 1);
        }

        private boolean consumeClosing(char closing) {
            skipWhitespace();
            if (pos < json.length() && json.charAt(pos) == closing) {
                pos++;
                return true;
            }
            return false;
        }

        private String parseString() {
            int start = pos++;
            StringBuilder sb = new StringBuilder();
            while (pos < json.length()) {
                char c = json.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                char escaped = peek("Unterminated string");
                pos++;
                switch (escaped) {
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> sb.append(unicodeEscape());
                    default -> sb.append(escaped);
                }
            }
            throw new AnnotationParseException("Unterminated string", start);
        }

        private char unicodeEscape() {
            if (pos + 4 > json.length()) {
                throw new AnnotationParseException("Truncated unicode escape", pos);
            }
            try {
                char c = (char) Integer.parseInt(json.substring(pos, pos + 4), 16);
                pos += 4;
                return c;
            } catch (NumberFormatException e) {
                throw new AnnotationParseException("Invalid unicode escape", pos);
            }
        }

        private Long parseInteger() {
            int start = pos;
            if (json.charAt(pos) == '-') {
                pos++;
            }
            while (pos < json.length() && Character.isDigit(json.charAt(pos))) {
                pos++;
            }
            if (pos < json.length() && ".eE".indexOf(json.charAt(pos)) >= 0) {
                throw new AnnotationParseException("Expected an integer", start);
            }
            try {
                return Long.parseLong(json.substring(start, pos));
            } catch (NumberFormatException e) {
                throw new AnnotationParseException("Expected an integer or a JSON value", start);
            }
        }

        private Object literal(String word, Object value) {
            if (!json.startsWith(word, pos)) {
                throw new AnnotationParseException("Expected '" + word + "'", pos);
            }
            pos += word.length();
            return value;
        }

        private char peek(String endOfInputMessage) {
            if (pos >= json.length()) {
                throw new AnnotationParseException(endOfInputMessage, pos);
            }
            return json.charAt(pos);
        }

        private void skipWhitespace() {
            while (pos < json.length() && Character.isWhitespace(json.charAt(pos))) {
                pos++;
            }
        }
    }

    // ========== ACCESSORS ==========

    public static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof String s ? s : null;
    }

    public static Integer getInt(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        return null;
    }

    public static boolean getBoolean(Map<String, Object> map, String key) {
        return map.get(key) instanceof Boolean b && b;
    }

    /**
     * Get a list of objects; non-object entries are rejected.
     */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> getObjectList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new AnnotationParseException("Field '" + key + "' must be an array");
        }
        List<Map<String, Object>> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map)) {
                throw new AnnotationParseException("Field '" + key + "' must contain only objects");
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }

    /**
     * Get a list of strings, preserving order; null entries are dropped.
     */
    public static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new AnnotationParseException("Field '" + key + "' must be an array");
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}
