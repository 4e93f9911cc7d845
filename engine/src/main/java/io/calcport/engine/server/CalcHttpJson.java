package io.calcport.engine.server;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-dependency JSON codec for the HTTP surface.
 *
 * <p>Objects decode to insertion-ordered {@link Map}s, arrays to {@link List}s,
 * integers to {@link Long}, other numbers to {@link Double}. Malformed input
 * raises {@link JsonException} with the offending offset.
 */
public final class CalcHttpJson {

    /**
     * Malformed JSON text.
     */
    public static final class JsonException extends IllegalArgumentException {
        JsonException(String message, int offset) {
            super(message + " at offset " + offset);
        }
    }

    private CalcHttpJson() {
    }

    // ========== PARSING ==========

    /**
     * Parse one JSON document. Anything but whitespace after the value is an error.
     */
    public static Object parse(String json) {
        if (json == null || json.isBlank()) {
            throw new JsonException("Empty document", 0);
        }
        Reader reader = new Reader(json);
        Object value = reader.value();
        reader.skipWhitespace();
        if (!reader.atEnd()) {
            throw new JsonException("Unexpected trailing content", reader.pos);
        }
        return value;
    }

    /**
     * Parse a document whose top level must be an object.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String json) {
        Object value = parse(json);
        if (!(value instanceof Map)) {
            throw new JsonException("Expected a JSON object", 0);
        }
        return (Map<String, Object>) value;
    }

    // ========== SERIALIZATION ==========

    public static String toJson(Object value) {
        StringBuilder sb = new StringBuilder();
        write(sb, value);
        return sb.toString();
    }

    private static void write(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            quote(sb, s);
        } else if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            sb.append("null");
        } else if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
        } else if (value instanceof Map<?, ?> map) {
            sb.append('{');
            String sep = "";
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                sb.append(sep);
                quote(sb, String.valueOf(entry.getKey()));
                sb.append(':');
                write(sb, entry.getValue());
                sep = ",";
            }
            sb.append('}');
        } else if (value instanceof Iterable<?> items) {
            sb.append('[');
            String sep = "";
            for (Object item : items) {
                sb.append(sep);
                write(sb, item);
                sep = ",";
            }
            sb.append(']');
        } else {
            quote(sb, value.toString());
        }
    }

    private static void quote(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
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

    // ========== READER ==========

    private static final class Reader {
        private final String json;
        private int pos;

        Reader(String json) {
            this.json = json;
        }

        boolean atEnd() {
            return pos >= json.length();
        }

        Object value() {
            skipWhitespace();
            if (atEnd()) {
                throw new JsonException("Unexpected end of document", pos);
            }
            char c = json.charAt(pos);
            return switch (c) {
                case '{' -> object();
                case '[' -> array();
                case '"' -> string();
                case 't' -> keyword("true", Boolean.TRUE);
                case 'f' -> keyword("false", Boolean.FALSE);
                case 'n' -> keyword("null", null);
                default -> {
                    if (c == '-' || Character.isDigit(c)) {
                        yield number();
                    }
                    throw new JsonException("Unexpected character '" + c + "'", pos);
                }
            };
        }

        private Map<String, Object> object() {
            Map<String, Object> map = new LinkedHashMap<>();
            pos++;
            skipWhitespace();
            if (consume('}')) {
                return map;
            }
            do {
                skipWhitespace();
                if (atEnd() || json.charAt(pos) != '"') {
                    throw new JsonException("Expected a member name", pos);
                }
                String key = string();
                skipWhitespace();
                require(':');
                map.put(key, value());
                skipWhitespace();
            } while (consume(','));
            require('}');
            return map;
        }

        private List<Object> array() {
            List<Object> list = new ArrayList<>();
            pos++;
            skipWhitespace();
            if (consume(']')) {
                return list;
            }
            do {
                list.add(value());
                skipWhitespace();
            } while (consume(','));
            require(']');
            return list;
        }

        private String string() {
            int start = pos++;
            StringBuilder sb = new StringBuilder();
            while (!atEnd()) {
                char c = json.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (atEnd()) {
                    break;
                }
                char escaped = json.charAt(pos++);
                switch (escaped) {
                    case '"', '\\', '/' -> sb.append(escaped);
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> {
                        if (pos + 4 > json.length()) {
                            throw new JsonException("Truncated unicode escape", pos);
                        }
                        try {
                            sb.append((char) Integer.parseInt(json.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException e) {
                            throw new JsonException("Bad unicode escape", pos);
                        }
                        pos += 4;
                    }
                    default -> throw new JsonException("Bad escape '\\" + escaped + "'", pos - 1);
                }
            }
            throw new JsonException("Unterminated string", start);
        }

        private Number number() {
            int start = pos;
            consume('-');
            digits();
            boolean fractional = false;
            if (consume('.')) {
                fractional = true;
                digits();
            }
            if (!atEnd() && (json.charAt(pos) == 'e' || json.charAt(pos) == 'E')) {
                fractional = true;
                pos++;
                if (!consume('+')) {
                    consume('-');
                }
                digits();
            }
            String text = json.substring(start, pos);
            try {
                return fractional ? Double.valueOf(text) : Long.valueOf(text);
            } catch (NumberFormatException e) {
                throw new JsonException("Bad number '" + text + "'", start);
            }
        }

        private void digits() {
            int start = pos;
            while (!atEnd() && Character.isDigit(json.charAt(pos))) {
                pos++;
            }
            if (pos == start) {
                throw new JsonException("Expected a digit", pos);
            }
        }

        private Object keyword(String word, Object value) {
            if (!json.startsWith(word, pos)) {
                throw new JsonException("Expected '" + word + "'", pos);
            }
            pos += word.length();
            return value;
        }

        private boolean consume(char c) {
            if (!atEnd() && json.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        private void require(char c) {
            skipWhitespace();
            if (!consume(c)) {
                throw new JsonException("Expected '" + c + "'", pos);
            }
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(json.charAt(pos))) {
                pos++;
            }
        }
    }

    // ========== ACCESSORS ==========

    public static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof String s ? s : null;
    }

    public static boolean getBoolean(Map<String, Object> map, String key, boolean fallback) {
        Object value = map.get(key);
        return value instanceof Boolean b ? b : fallback;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getObject(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof List ? (List<Object>) value : null;
    }
}
