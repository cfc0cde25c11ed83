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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.testng.annotations.Test;

import io.chainofproduct.StructuralException;

public class SectionMapTest {

    private final Document order = Document.builder()
            .field("id", "tx-1")
            .field("amount", 100)
            .field("currency", "EUR")
            .field("shipping", "DHL")
            .build();

    @Test
    public void shouldPartitionDocument() throws Exception {
        // Given
        var sections = SectionMap.builder()
                .section("commercial", List.of("amount", "currency"))
                .section("logistics", List.of("shipping"))
                .section("header", List.of("id"))
                .build();

        // When
        var parts = sections.partition(order);

        // Then
        assertThat(parts).containsOnlyKeys("commercial", "logistics", "header");
        assertThat(parts.get("commercial").fieldNames()).containsExactly("amount", "currency");
        assertThat(parts.get("logistics").getString("shipping")).contains("DHL");
        assertThat(parts.get("header").getString("id")).contains("tx-1");
    }

    @Test
    public void shouldRejectUnassignedFields() throws Exception {
        var sections = SectionMap.builder().section("commercial", List.of("amount", "currency")).build();

        assertThatThrownBy(() -> sections.partition(order))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("not assigned");
    }

    @Test
    public void shouldCollectUnassignedFieldsIntoRemainder() throws Exception {
        var sections = SectionMap.builder()
                .section("commercial", List.of("amount", "currency"))
                .remainder("public")
                .build();

        var parts = sections.partition(order);

        assertThat(sections.sectionNames()).containsExactly("commercial", "public");
        assertThat(parts.get("public").fieldNames()).containsExactlyInAnyOrder("id", "shipping");
    }

    @Test
    public void shouldRejectMissingFields() throws Exception {
        var sections = SectionMap.builder()
                .section("commercial", List.of("amount", "discount"))
                .remainder("rest")
                .build();

        assertThatThrownBy(() -> sections.partition(order)).isInstanceOf(StructuralException.class);
    }

    @Test
    public void shouldRejectOverlappingSections() throws Exception {
        var builder = SectionMap.builder().section("a", List.of("amount"));

        assertThatThrownBy(() -> builder.section("b", List.of("currency", "amount")))
                .isInstanceOf(StructuralException.class);
    }

    @Test
    public void shouldRejectDuplicateOrEmptySections() throws Exception {
        var builder = SectionMap.builder().section("a", List.of("amount"));

        assertThatThrownBy(() -> builder.section("a", List.of("currency")))
                .isInstanceOf(StructuralException.class);
        assertThatThrownBy(() -> builder.section("", List.of("currency")))
                .isInstanceOf(StructuralException.class);
        assertThatThrownBy(() -> SectionMap.builder().build())
                .isInstanceOf(StructuralException.class);
    }
}
