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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import io.chainofproduct.StructuralException;

public class CanonicalizerTest {

    @Test
    public void shouldSortKeysAtEveryLevel() throws Exception {
        var inner = new LinkedHashMap<String, Object>();
        inner.put("z", 1);
        inner.put("a", List.of(true, false));
        var fields = new LinkedHashMap<String, Object>();
        fields.put("b", inner);
        fields.put("a", "x");

        var canonical = Canonicalizer.canonicalize(Document.of(fields));

        assertThat(canonical).asString(UTF_8).isEqualTo("{\"a\":\"x\",\"b\":{\"a\":[true,false],\"z\":1}}");
    }

    @Test
    public void shouldIgnoreFieldOrder() throws Exception {
        var first = Document.builder().field("id", "tx-1").field("amount", 100).build();
        var second = Document.builder().field("amount", 100).field("id", "tx-1").build();

        assertThat(first).isEqualTo(second);
        assertThat(Canonicalizer.canonicalize(first)).isEqualTo(Canonicalizer.canonicalize(second));
        assertThat(Canonicalizer.contentHash(first)).isEqualTo(Canonicalizer.contentHash(second));
    }

    @Test
    public void shouldHashWithSha256() {
        var hash = Canonicalizer.contentHash(Document.builder().field("id", "tx-1").field("amount", 100).build());

        assertThat(HexFormat.of().formatHex(hash))
                .isEqualTo("a36721e6ad1cb025bdbab5bef2c11ad689ba21786c9ee48021d526242d7bf379");
        assertThat(HexFormat.of().formatHex(Canonicalizer.contentHash(Document.builder().build())))
                .isEqualTo("44136fa355b3678a1146ad16f7e8649e94fb4fc21fe77e8310c060f61caaff8a");
    }

    @DataProvider
    public Object[][] numbers() {
        return new Object[][] {
                { 100, "100" },
                { 100.0d, "100" },
                { new BigDecimal("100.00"), "100" },
                { new BigDecimal("1.50"), "1.5" },
                { new BigDecimal("1E+3"), "1000" },
                { new BigDecimal("1E-7"), "0.0000001" },
                { -42L, "-42" },
                { new BigDecimal("-0.0"), "0" },
                { new BigInteger("123456789012345678901234567890"), "123456789012345678901234567890" },
        };
    }

    @Test(dataProvider = "numbers")
    public void shouldWriteNumbersInPlainForm(Number number, String expected) throws Exception {
        var canonical = Canonicalizer.canonicalize(DocumentValue.number(number));
        assertThat(canonical).asString(UTF_8).isEqualTo(expected);
    }

    @DataProvider
    public Object[][] strings() {
        return new Object[][] {
                { "plain", "\"plain\"" },
                { "quote\"backslash\\", "\"quote\\\"backslash\\\\\"" },
                { "tab\tnewline\n", "\"tab\\tnewline\\n\"" },
                { "\u0001", "\"\\u0001\"" },
                { "caf\u00e9 \uD83D\uDE00", "\"caf\u00e9 \uD83D\uDE00\"" },
                { "/", "\"/\"" },
        };
    }

    @Test(dataProvider = "strings")
    public void shouldEscapeMinimally(String value, String expected) {
        var canonical = Canonicalizer.canonicalize(DocumentValue.string(value));
        assertThat(canonical).asString(UTF_8).isEqualTo(expected);
    }

    @Test
    public void shouldDistinguishDifferentDocuments() {
        var first = Document.builder().field("amount", 100).build();
        var second = Document.builder().field("amount", "100").build();

        assertThat(Canonicalizer.contentHash(first)).isNotEqualTo(Canonicalizer.contentHash(second));
    }

    @Test
    public void shouldParseCanonicalBytesBack() throws Exception {
        var document = Document.of(Map.of("id", "tx-1", "amount", 100, "price", 1.5,
                "items", List.of(Map.of("sku", "A1", "qty", 2)), "note", "line\nbreak", "paid", false));

        var parsed = Canonicalizer.parse(Canonicalizer.canonicalize(document));

        assertThat(parsed).isEqualTo(document);
    }

    @DataProvider
    public Object[][] preciseDecimals() {
        return new Object[][] {
                { "12345678901234567.89" },
                { "0.1000000000000000055511151231257827" },
                { "-3.14159265358979323846264338327950288" },
                { "123456789012345678901234567891" },
        };
    }

    @Test(dataProvider = "preciseDecimals")
    public void shouldParseDecimalsWithoutLosingPrecision(String decimal) throws Exception {
        var document = Document.of(Map.of("amount", new BigDecimal(decimal)));

        var parsed = Canonicalizer.parse(Canonicalizer.canonicalize(document));

        assertThat(parsed).isEqualTo(document);
        assertThat(parsed.get("amount").flatMap(DocumentValue::asNumber)).contains(new BigDecimal(decimal));
        assertThat(Canonicalizer.canonicalize(parsed)).isEqualTo(Canonicalizer.canonicalize(document));
    }

    @DataProvider
    public Object[][] oversizedNumbers() {
        return new Object[][] {
                { new BigDecimal("1E50000000") },
                { new BigDecimal("1E-1001") },
                { new BigDecimal(BigInteger.TEN.pow(1001).subtract(BigInteger.ONE)) },
        };
    }

    @Test(dataProvider = "oversizedNumbers", timeOut = 5000)
    public void shouldRejectNumbersBeyondSupportedRange(BigDecimal number) {
        assertThatThrownBy(() -> Document.of(Map.of("amount", number)))
                .isInstanceOf(StructuralException.class);
    }

    @Test(timeOut = 5000)
    public void shouldRejectOversizedNumberWhenParsing() {
        assertThatThrownBy(() -> Canonicalizer.parse("{\"amount\":1E50000000}".getBytes(UTF_8)))
                .isInstanceOf(StructuralException.class);
    }

    @Test
    public void shouldAcceptNumbersAtSupportedRange() throws Exception {
        var largest = DocumentValue.number(new BigDecimal("1E1000"));
        var smallest = DocumentValue.number(new BigDecimal("1E-1000"));

        assertThat(Canonicalizer.canonicalize(largest)).hasSize(1001);
        assertThat(Canonicalizer.canonicalize(smallest)).asString(UTF_8).startsWith("0.000").endsWith("1");
    }

    @Test
    public void shouldRejectNonObjectJson() {
        assertThatThrownBy(() -> Canonicalizer.parse("[1,2]".getBytes(UTF_8)))
                .isInstanceOf(StructuralException.class);
        assertThatThrownBy(() -> Canonicalizer.parse("{\"a\":".getBytes(UTF_8)))
                .isInstanceOf(StructuralException.class);
    }

    @DataProvider
    public Object[][] unrepresentable() {
        return new Object[][] {
                { Set.of("a") },
                { new byte[] { 1, 2, 3 } },
                { Double.NaN },
                { Double.POSITIVE_INFINITY },
                { Map.of(1, "non-string key") },
                { "\uD800 unpaired" },
                { List.of(new Object()) },
        };
    }

    @Test(dataProvider = "unrepresentable")
    public void shouldRejectUnrepresentableValues(Object value) {
        assertThatThrownBy(() -> Document.of(Map.of("field", value)))
                .isInstanceOf(StructuralException.class);
    }
}
