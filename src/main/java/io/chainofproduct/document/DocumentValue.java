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

import static java.util.Objects.requireNonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.chainofproduct.StructuralException;

/**
 * The values that can appear in a transaction document. This is a closed hierarchy corresponding to the JSON data
 * model, restricted so that every value has exactly one canonical encoding:
 * <ul>
 *     <li><code>null</code>.</li>
 *     <li>The Boolean values <code>true</code> and <code>false</code>.</li>
 *     <li>A number, held as an exact decimal. NaN and infinities are not representable.</li>
 *     <li>A Unicode string.</li>
 *     <li>A list of values.</li>
 *     <li>A map whose keys are strings. Key order is preserved for display but is not significant: two maps
 *     with the same entries are equal and canonicalize to the same bytes.</li>
 * </ul>
 */
public sealed interface DocumentValue {

    /**
     * Converts a plain Java object graph, such as one produced by a JSON parser, into a document value.
     *
     * @param value a {@code null}, {@link Boolean}, {@link Number}, {@link CharSequence}, {@link List} or
     *              {@link Map} with string keys, nested arbitrarily.
     * @return the equivalent document value.
     * @throws StructuralException if the object graph contains anything else (sets, byte arrays, non-finite
     * floating point numbers, non-string map keys and so on).
     */
    static DocumentValue convert(Object value) throws StructuralException {
        if (value == null) {
            return NullValue.NULL;
        } else if (value instanceof DocumentValue dv) {
            return dv;
        } else if (value instanceof Boolean b) {
            return bool(b);
        } else if (value instanceof Number n) {
            return number(n);
        } else if (value instanceof CharSequence cs) {
            var str = cs.toString();
            if (!Canonicalizer.isWellFormed(str)) {
                throw new StructuralException("String contains an unpaired surrogate");
            }
            return string(str);
        } else if (value instanceof List<?> l) {
            var elements = new ArrayList<DocumentValue>(l.size());
            for (var element : l) {
                elements.add(convert(element));
            }
            return new ListValue(elements);
        } else if (value instanceof Map<?, ?> m) {
            var entries = new LinkedHashMap<String, DocumentValue>(m.size());
            for (var entry : m.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new StructuralException("Map keys must be strings");
                }
                if (!Canonicalizer.isWellFormed(key)) {
                    throw new StructuralException("Map key contains an unpaired surrogate");
                }
                entries.put(key, convert(entry.getValue()));
            }
            return new MapValue(entries);
        }
        throw new StructuralException("Value of type " + value.getClass().getSimpleName() +
                " has no canonical encoding");
    }

    static DocumentValue nullValue() {
        return NullValue.NULL;
    }

    static DocumentValue bool(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static DocumentValue string(String value) {
        return new StringValue(value);
    }

    static DocumentValue number(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    /**
     * Converts a number exactly. Numbers that are not already {@link BigDecimal}, {@link BigInteger} or a primitive
     * wrapper (such as the lazy numbers produced by a JSON parser) are converted from their decimal string form.
     *
     * @throws StructuralException if the number is NaN or infinite, or needs more than
     * {@link NumberValue#MAX_DIGITS} digits or an exponent beyond that bound.
     */
    static DocumentValue number(Number value) throws StructuralException {
        requireNonNull(value, "value");
        if (value instanceof BigDecimal bd) {
            return bounded(bd);
        } else if (value instanceof BigInteger bi) {
            return bounded(new BigDecimal(bi));
        } else if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new StructuralException("Non-finite numbers have no canonical encoding");
            }
            return bounded(new BigDecimal(value.toString()));
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short ||
                value instanceof Byte) {
            return new NumberValue(BigDecimal.valueOf(value.longValue()));
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(value.toString());
        } catch (NumberFormatException e) {
            throw new StructuralException("Unsupported number type " + value.getClass().getSimpleName(), e);
        }
        return bounded(parsed);
    }

    private static DocumentValue bounded(BigDecimal value) throws StructuralException {
        if (!NumberValue.isWithinBounds(value)) {
            throw new StructuralException("Number exceeds " + NumberValue.MAX_DIGITS + " digits or exponent range");
        }
        return new NumberValue(value);
    }

    /**
     * Converts this value back into plain Java objects: {@code null}, {@link Boolean}, {@link BigDecimal} (or
     * {@link Long} for integers that fit), {@link String}, {@link List} and {@link Map}.
     */
    Object toJava();

    default boolean isNull() {
        return this instanceof NullValue;
    }

    default Optional<String> asString() {
        return this instanceof StringValue sv ? Optional.of(sv.value) : Optional.empty();
    }

    default Optional<BigDecimal> asNumber() {
        return this instanceof NumberValue nv ? Optional.of(nv.value) : Optional.empty();
    }

    default Optional<Boolean> asBoolean() {
        return this instanceof BooleanValue bv ? Optional.of(bv == BooleanValue.TRUE) : Optional.empty();
    }

    default Optional<List<DocumentValue>> asList() {
        return this instanceof ListValue lv ? Optional.of(lv.elements) : Optional.empty();
    }

    default Optional<Map<String, DocumentValue>> asMap() {
        return this instanceof MapValue mv ? Optional.of(mv.entries) : Optional.empty();
    }

    enum NullValue implements DocumentValue {
        NULL;

        @Override
        public Object toJava() {
            return null;
        }
    }

    enum BooleanValue implements DocumentValue {
        TRUE, FALSE;

        @Override
        public Object toJava() {
            return this == TRUE;
        }
    }

    /**
     * A numeric value. The decimal is normalized on construction (trailing zeros stripped) so that numerically
     * equal values are equal, whatever their original scale.
     * <p>
     * Both the number of significant digits and the magnitude of the exponent are limited to {@link #MAX_DIGITS},
     * which keeps the plain-decimal canonical form to a few thousand characters.
     *
     * @param value the number.
     */
    record NumberValue(BigDecimal value) implements DocumentValue {
        public static final int MAX_DIGITS = 1000;

        public NumberValue {
            requireNonNull(value, "value");
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
            if (!isNormalizedWithinBounds(value)) {
                throw new IllegalArgumentException("Number exceeds " + MAX_DIGITS + " digits or exponent range");
            }
        }

        static boolean isWithinBounds(BigDecimal value) {
            return isNormalizedWithinBounds(value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros());
        }

        private static boolean isNormalizedWithinBounds(BigDecimal value) {
            return value.precision() <= MAX_DIGITS && Math.abs((long) value.scale()) <= MAX_DIGITS;
        }

        public boolean isIntegral() {
            return value.scale() <= 0;
        }

        @Override
        public Object toJava() {
            if (isIntegral() && value.precision() - value.scale() <= 18) {
                return value.longValueExact();
            }
            return value;
        }
    }

    record StringValue(String value) implements DocumentValue {
        public StringValue {
            requireNonNull(value, "value");
            if (!Canonicalizer.isWellFormed(value)) {
                throw new IllegalArgumentException("String is not well-formed UTF-16");
            }
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record ListValue(List<DocumentValue> elements) implements DocumentValue {
        public ListValue {
            elements = List.copyOf(elements);
        }

        @Override
        public Object toJava() {
            var result = new ArrayList<>(elements.size());
            for (var element : elements) {
                result.add(element.toJava());
            }
            return result;
        }
    }

    record MapValue(Map<String, DocumentValue> entries) implements DocumentValue {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
            Canonicalizer.requireWellFormedKeys(entries);
            entries.values().forEach(v -> requireNonNull(v, "map value"));
        }

        @Override
        public Object toJava() {
            var result = new LinkedHashMap<String, Object>(entries.size());
            entries.forEach((key, value) -> result.put(key, value.toJava()));
            return result;
        }
    }
}
