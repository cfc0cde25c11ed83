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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.chainofproduct.StructuralException;

/**
 * Groups the fields of a document into named, non-overlapping sections for layered disclosure. A partition is only
 * accepted when every field of the document belongs to exactly one section.
 */
public final class SectionMap {
    private final Map<String, Set<String>> sections;
    private final String remainder;

    private SectionMap(Map<String, Set<String>> sections, String remainder) {
        this.sections = sections;
        this.remainder = remainder;
    }

    public static SectionMap of(Map<String, ? extends List<String>> sections) throws StructuralException {
        var builder = builder();
        for (var entry : sections.entrySet()) {
            builder.section(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> sectionNames() {
        var names = new LinkedHashSet<>(sections.keySet());
        if (remainder != null) {
            names.add(remainder);
        }
        return Collections.unmodifiableSet(names);
    }

    public Optional<String> remainder() {
        return Optional.ofNullable(remainder);
    }

    /**
     * Splits a document into one sub-document per section.
     *
     * @param document the document to split.
     * @return the section documents, keyed by section name in declaration order.
     * @throws StructuralException if a section names a field the document does not have, or if a document field
     * is not covered by any section (and no remainder section was configured).
     */
    public Map<String, Document> partition(Document document) throws StructuralException {
        var assigned = new HashMap<String, String>();
        for (var section : sections.entrySet()) {
            for (var field : section.getValue()) {
                if (document.get(field).isEmpty()) {
                    throw new StructuralException("Section '" + section.getKey() + "' names a missing field");
                }
                assigned.put(field, section.getKey());
            }
        }

        var leftOver = new LinkedHashSet<String>();
        for (var field : document.fieldNames()) {
            if (!assigned.containsKey(field)) {
                leftOver.add(field);
            }
        }
        if (!leftOver.isEmpty() && remainder == null) {
            throw new StructuralException(leftOver.size() + " document field(s) not assigned to any section");
        }

        var result = new LinkedHashMap<String, Document>();
        sections.forEach((name, fields) -> result.put(name, document.select(fields)));
        if (remainder != null) {
            result.put(remainder, document.select(leftOver));
        }
        return result;
    }

    public static final class Builder {
        private final Map<String, Set<String>> sections = new LinkedHashMap<>();
        private final Map<String, String> owners = new HashMap<>();
        private String remainder;

        private Builder() {}

        public Builder section(String name, List<String> fields) throws StructuralException {
            requireNonNull(name, "name");
            requireNonNull(fields, "fields");
            if (name.isEmpty()) {
                throw new StructuralException("Section names must not be empty");
            }
            if (sections.containsKey(name) || name.equals(remainder)) {
                throw new StructuralException("Duplicate section '" + name + "'");
            }
            for (var field : fields) {
                var previous = owners.putIfAbsent(field, name);
                if (previous != null) {
                    throw new StructuralException("Field assigned to both '" + previous + "' and '" + name + "'");
                }
            }
            sections.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(fields)));
            return this;
        }

        /**
         * Collects every field not named by another section into the given section.
         */
        public Builder remainder(String name) throws StructuralException {
            requireNonNull(name, "name");
            if (name.isEmpty() || sections.containsKey(name)) {
                throw new StructuralException("Invalid remainder section '" + name + "'");
            }
            this.remainder = name;
            return this;
        }

        public SectionMap build() throws StructuralException {
            if (sections.isEmpty() && remainder == null) {
                throw new StructuralException("At least one section is required");
            }
            return new SectionMap(Collections.unmodifiableMap(new LinkedHashMap<>(sections)), remainder);
        }
    }
}
