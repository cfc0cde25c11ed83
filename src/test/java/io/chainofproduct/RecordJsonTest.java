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

package io.chainofproduct;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonWriter;

import io.chainofproduct.document.Document;
import io.chainofproduct.document.SectionMap;

public class RecordJsonTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

    private LocalParty seller;
    private LocalParty buyer;
    private LocalParty auditor;
    private InMemoryKeyRegistry registry;
    private ProtectedTransaction transaction;
    private LayeredProtectedTransaction layered;

    @BeforeClass
    public void setup() throws Exception {
        seller = LocalParty.generate("seller");
        buyer = LocalParty.generate("buyer");
        auditor = LocalParty.generate("auditor");
        registry = new InMemoryKeyRegistry().register(seller).register(buyer).register(auditor);
        var document = Document.builder()
                .field("id", "tx-1")
                .field("amount", 100)
                .field("incoterm", "FOB")
                .build();
        transaction = new TransactionProtocol(CLOCK).protect(document, seller, "buyer", registry);
        layered = new LayeredDisclosureProtocol(CLOCK).protectWithLayers(document,
                SectionMap.builder().section("pricing", List.of("amount")).remainder("terms").build(),
                seller, "buyer", registry);
    }

    @Test
    public void shouldRoundTripTransaction() throws Exception {
        var json = RecordJson.toJson(transaction);

        var decoded = RecordJson.parseTransaction(json);

        assertThat(decoded).isEqualTo(transaction);
        assertThat(decoded.getSigBuyer()).isEmpty();
        assertThat(json).contains("\"doc_id\":\"tx-1\"", "\"key_wraps\"", "\"sig_seller\"",
                "\"created_at\":\"2024-03-01T12:00:00Z\"", "\"suite\":\"COP-v1\"");
        assertThat(json).doesNotContain("sig_buyer");
    }

    @Test
    public void shouldRoundTripCounterSignedTransactionThatStillOpens() throws Exception {
        var protocol = new TransactionProtocol(CLOCK);
        var counterSigned = protocol.counterSign(transaction, buyer, registry);

        var decoded = RecordJson.parseTransaction(RecordJson.toJson(counterSigned));

        assertThat(decoded).isEqualTo(counterSigned);
        assertThat(decoded.getState()).isEqualTo(TransactionState.BUYER_COUNTERSIGNED);
        assertThat(protocol.verify(decoded, registry).isValid()).isTrue();
        assertThat(protocol.unprotect(decoded, "buyer", buyer.getEncryptionKey()).getString("incoterm"))
                .contains("FOB");
    }

    @Test
    public void shouldRoundTripLayeredTransaction() throws Exception {
        var json = RecordJson.toJson(layered);

        var decoded = RecordJson.parseLayeredTransaction(json);

        assertThat(decoded).isEqualTo(layered);
        assertThat(json).contains("\"aggregate_hash\"", "\"layered\":true");
        assertThat(new LayeredDisclosureProtocol(CLOCK)
                .unprotectLayer(decoded, "seller", "pricing", seller.getEncryptionKey()).fieldNames())
                .containsExactly("amount");
    }

    @Test
    public void shouldRoundTripShareRecords() throws Exception {
        var whole = new TransactionProtocol(CLOCK).createShareRecord(transaction, buyer, "auditor", null, registry);
        var scoped = new LayeredDisclosureProtocol(CLOCK).createLayerShareRecords(layered, buyer, "auditor",
                List.of("terms"), List.of(), registry).get(0);

        var decodedWhole = RecordJson.parseShareRecord(RecordJson.toJson(whole));
        var decodedScoped = RecordJson.parseShareRecord(RecordJson.toJson(scoped));

        assertThat(decodedWhole).isEqualTo(whole);
        assertThat(decodedWhole.getSection()).isEmpty();
        assertThat(decodedScoped).isEqualTo(scoped);
        assertThat(decodedScoped.getSection()).contains("terms");
        assertThat(new TransactionProtocol(CLOCK).verifyShareRecord(decodedScoped, registry)).isTrue();
    }

    @Test
    public void shouldRejectUnknownSuite() throws Exception {
        var json = RecordJson.toJson(transaction).replace("COP-v1", "COP-v9");

        assertThatThrownBy(() -> RecordJson.parseTransaction(json))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("COP-v9");
    }

    @DataProvider
    public Object[][] requiredFields() {
        return new Object[][] {
                { "doc_id" }, { "seller_id" }, { "ciphertext" }, { "nonce" }, { "tag" }, { "key_wraps" },
                { "content_hash" }, { "sig_seller" }, { "created_at" }, { "meta" }
        };
    }

    @Test(dataProvider = "requiredFields")
    public void shouldRejectMissingField(String field) throws Exception {
        JsonObject json = JsonParser.object().from(RecordJson.toJson(transaction));
        json.remove(field);
        var text = JsonWriter.string(json);

        assertThatThrownBy(() -> RecordJson.parseTransaction(text)).isInstanceOf(StructuralException.class);
    }

    @Test
    public void shouldRejectMalformedInput() {
        assertThatThrownBy(() -> RecordJson.parseTransaction("not json"))
                .isInstanceOf(StructuralException.class);
        assertThatThrownBy(() -> RecordJson.parseShareRecord("[1, 2, 3]"))
                .isInstanceOf(StructuralException.class);
        assertThatThrownBy(() -> RecordJson.parseTransaction(RecordJson.toJson(transaction)
                .replace("\"created_at\":\"2024-03-01T12:00:00Z\"", "\"created_at\":\"yesterday\"")))
                .isInstanceOf(StructuralException.class);
    }

    @Test
    public void shouldRejectInvalidBase64() throws Exception {
        JsonObject json = JsonParser.object().from(RecordJson.toJson(transaction));
        json.put("nonce", "***");
        var text = JsonWriter.string(json);

        assertThatThrownBy(() -> RecordJson.parseTransaction(text)).isInstanceOf(StructuralException.class);
    }
}
