/*
 * Copyright 2026 The Chain of Product Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.chainofproduct.document;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Map;

import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;

import io.chainofproduct.StructuralException;
import io.chainofproduct.crypto.Primitives;

/**
 * Deterministic encoding of documents. The canonical form is compact UTF-8 JSON with:
 * <ul>
 *     <li>object keys sorted by {@link String#compareTo(String)} at every nesting level;</li>
 *     <li>no insignificant whitespace;</li>
 *     <li>integers written as plain digits with an optional leading minus sign, and other numbers in plain decimal
 *     notation with trailing zeros removed (never exponent form);</li>
 *     <li>strings escaped with the minimal JSON escape set, everything else written as raw UTF-8.</li>
 * </ul>
 * Two documents canonicalize to the same bytes exactly when they are {@linkplain Document#equals(Object) equal}.
 */
public final class Canonicalizer {

    private Canonicalizer() {}

    public static byte[] canonicalize(Document document) {
        return canonicalize(document.asValue());
    }

    public static byte[] canonicalize(DocumentValue value) {
        return canonicalString(value).getBytes(UTF_8);
    }

    public static byte[] hash(byte[] canonicalBytes) {
        return Primitives.hash(canonicalBytes);
    }

    public static byte[] contentHash(Document document) {
        return hash(canonicalize(document));
    }

    /**
     * Decodes canonical bytes (or any JSON object text) back into a document. Numbers are read exactly, never via
     * {@code double}.
     *
     * @throws StructuralException if the bytes are not a JSON object, or contain a number outside the range
     * described by {@link DocumentValue.NumberValue#MAX_DIGITS}.
     */
    public static Document parse(byte[] canonicalBytes) throws StructuralException {
        try {
            var object = JsonParser.object().withLazyNumbers().from(new String(canonicalBytes, UTF_8));
            return Document.of(object);
        } catch (JsonParserException e) {
            throw new StructuralException("Document is not a JSON object", e);
        }
    }

    static String canonicalString(DocumentValue value) {
        var out = new StringBuilder();
        write(out, value);
        return out.toString();
    }

    static boolean isWellFormed(String string) {
        for (int i = 0; i < string.length(); ++i) {
            char c = string.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= string.length() || !Character.isLowSurrogate(string.charAt(i + 1))) {
                    return false;
                }
                ++i;
            } else if (Character.isLowSurrogate(c)) {
                return false;
            }
        }
        return true;
    }

    private static void write(StringBuilder out, DocumentValue value) {
        if (value instanceof DocumentValue.NullValue) {
            out.append("null");
        } else if (value instanceof DocumentValue.BooleanValue b) {
            out.append(b == DocumentValue.BooleanValue.TRUE ? "true" : "false");
        } else if (value instanceof DocumentValue.NumberValue n) {
            out.append(number(n));
        } else if (value instanceof DocumentValue.StringValue s) {
            string(out, s.value());
        } else if (value instanceof DocumentValue.ListValue l) {
            out.append('[');
            var first = true;
            for (var element : l.elements()) {
                if (!first) {
                    out.append(',');
                }
                first = false;
                write(out, element);
            }
            out.append(']');
        } else if (value instanceof DocumentValue.MapValue m) {
            var keys = new ArrayList<>(m.entries().keySet());
            keys.sort(String::compareTo);
            out.append('{');
            var first = true;
            for (var key : keys) {
                if (!first) {
                    out.append(',');
                }
                first = false;
                string(out, key);
                out.append(':');
                write(out, m.entries().get(key));
            }
            out.append('}');
        } else {
            throw new AssertionError("Unknown document value type: " + value.getClass());
        }
    }

    private static String number(DocumentValue.NumberValue number) {
        BigDecimal value = number.value();
        if (number.isIntegral()) {
            return value.toBigIntegerExact().toString();
        }
        return value.toPlainString();
    }

    private static void string(StringBuilder out, String value) {
        out.append('"');
        for (int i = 0; i < value.length(); ++i) {
            char c = value.charAt(i);
            switch (c) {
                case '"': out.append("\\\""); break;
                case '\\': out.append("\\\\"); break;
                case '\b': out.append("\\b"); break;
                case '\f': out.append("\\f"); break;
                case '\n': out.append("\\n"); break;
                case '\r': out.append("\\r"); break;
                case '\t': out.append("\\t"); break;
                default:
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
            }
        }
        out.append('"');
    }

    /**
     * Used by {@link Document} to reject keys that would not survive canonicalization.
     */
    static void requireWellFormedKeys(Map<String, DocumentValue> entries) {
        for (var key : entries.keySet()) {
            if (!isWellFormed(key)) {
                throw new IllegalArgumentException("Map key is not well-formed UTF-16");
            }
        }
    }
}
