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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.chainofproduct.StructuralException;

/**
 * A structured transaction document: an ordered mapping from field names to {@link DocumentValue}s. Field order is
 * kept for presentation only. Equality, hashing and the {@linkplain Canonicalizer canonical encoding} ignore it.
 */
public final class Document {
    private final DocumentValue.MapValue fields;

    private Document(DocumentValue.MapValue fields) {
        this.fields = fields;
    }

    public static Document of(Map<String, ?> fields) throws StructuralException {
        var converted = DocumentValue.convert(requireNonNull(fields, "fields"));
        return new Document((DocumentValue.MapValue) converted);
    }

    public static Document fromValues(Map<String, DocumentValue> fields) {
        return new Document(new DocumentValue.MapValue(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<DocumentValue> get(String field) {
        return Optional.ofNullable(fields.entries().get(field));
    }

    public Optional<String> getString(String field) {
        return get(field).flatMap(DocumentValue::asString);
    }

    public Set<String> fieldNames() {
        return fields.entries().keySet();
    }

    public boolean isEmpty() {
        return fields.entries().isEmpty();
    }

    /**
     * Returns a new document containing only the named fields, in this document's field order. Names that are not
     * present are ignored.
     */
    public Document select(Collection<String> fieldNames) {
        var selected = new LinkedHashMap<String, DocumentValue>();
        fields.entries().forEach((name, value) -> {
            if (fieldNames.contains(name)) {
                selected.put(name, value);
            }
        });
        return fromValues(selected);
    }

    public DocumentValue asValue() {
        return fields;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> toJava() {
        return (Map<String, Object>) fields.toJava();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof Document)) { return false; }
        return fields.equals(((Document) other).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return Canonicalizer.canonicalString(fields);
    }

    public static final class Builder {
        private final Map<String, DocumentValue> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder field(String name, String value) {
            return field(name, DocumentValue.string(value));
        }

        public Builder field(String name, long value) {
            return field(name, DocumentValue.number(value));
        }

        public Builder field(String name, boolean value) {
            return field(name, DocumentValue.bool(value));
        }

        public Builder field(String name, DocumentValue value) {
            fields.put(requireNonNull(name, "name"), requireNonNull(value, "value"));
            return this;
        }

        public Document build() {
            return fromValues(fields);
        }
    }
}
