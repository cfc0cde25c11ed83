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

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.testng.annotations.Test;

public class DocumentValueTest {

    @Test
    public void shouldConvertNestedJavaObjects() throws Exception {
        var value = DocumentValue.convert(Map.of("list", Arrays.asList(1, "two", null, true)));

        var list = value.asMap().orElseThrow().get("list").asList().orElseThrow();
        assertThat(list).hasSize(4);
        assertThat(list.get(0).asNumber()).contains(BigDecimal.ONE);
        assertThat(list.get(1).asString()).contains("two");
        assertThat(list.get(2).isNull()).isTrue();
        assertThat(list.get(3).asBoolean()).contains(true);
    }

    @Test
    public void shouldTreatNumericallyEqualValuesAsEqual() throws Exception {
        assertThat(DocumentValue.number(100)).isEqualTo(DocumentValue.number(new BigDecimal("100.000")));
        assertThat(DocumentValue.number(0.5d)).isEqualTo(DocumentValue.number(new BigDecimal("0.50")));
        assertThat(DocumentValue.number(1)).isNotEqualTo(DocumentValue.string("1"));
    }

    @Test
    public void shouldBoundNumberValues() {
        assertThatThrownBy(() -> new DocumentValue.NumberValue(new BigDecimal("1E1001")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new DocumentValue.NumberValue(new BigDecimal("1.000E+3")).value())
                .isEqualTo(new BigDecimal("1E+3"));
    }

    @Test
    public void shouldConvertBackToJava() throws Exception {
        var document = Document.of(Map.of("amount", 100, "price", new BigDecimal("2.25"),
                "tags", List.of("a", "b")));

        var java = document.toJava();

        assertThat(java).containsEntry("amount", 100L)
                .containsEntry("price", new BigDecimal("2.25"))
                .containsEntry("tags", List.of("a", "b"));
    }

    @Test
    public void shouldSelectFields() {
        var document = Document.builder().field("a", 1).field("b", 2).field("c", 3).build();

        var selected = document.select(List.of("c", "a", "missing"));

        assertThat(selected.fieldNames()).containsExactly("a", "c");
    }

    @Test
    public void shouldKeepInsertionOrderForDisplayOnly() {
        var document = Document.builder().field("z", true).field("a", false).build();

        assertThat(document.fieldNames()).containsExactly("z", "a");
        assertThat(document.toString()).isEqualTo("{\"a\":false,\"z\":true}");
    }
}
