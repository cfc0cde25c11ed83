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
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import io.chainofproduct.crypto.Primitives;
import io.chainofproduct.crypto.WrappedKeyEntry;
import io.chainofproduct.document.Document;
import io.chainofproduct.document.DocumentValue;

public class TransactionProtocolTest {
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final TransactionProtocol protocol = new TransactionProtocol(Clock.fixed(NOW, ZoneOffset.UTC));

    private LocalParty seller;
    private LocalParty buyer;
    private LocalParty auditor;
    private LocalParty outsider;
    private InMemoryKeyRegistry registry;
    private Document document;

    @BeforeMethod
    public void setup() {
        seller = LocalParty.generate("seller");
        buyer = LocalParty.generate("buyer");
        auditor = LocalParty.generate("auditor");
        outsider = LocalParty.generate("outsider");
        registry = new InMemoryKeyRegistry().register(seller).register(buyer).register(auditor).register(outsider);
        document = Document.builder().field("id", "tx-1").field("amount", 100).build();
    }

    @Test
    public void shouldProtectCounterSignAndShare() throws Exception {
        // Given
        var protectedTx = protocol.protect(document, "seller", seller.getSigningKey(),
                seller.publicKeys().encryptionPublicKey(), "buyer", buyer.publicKeys().encryptionPublicKey());

        // When
        var counterSigned = protocol.counterSign(protectedTx, "buyer", buyer.getSigningKey(),
                buyer.getEncryptionKey(), seller.publicKeys().signingPublicKey());
        var share = protocol.createShareRecord(counterSigned, "buyer", buyer.getEncryptionKey(),
                buyer.getSigningKey(), "auditor", auditor.publicKeys().encryptionPublicKey());
        var revealed = protocol.unprotect(counterSigned, "auditor", auditor.getEncryptionKey(), share, registry);

        // Then
        assertThat(protectedTx.getDocId()).isEqualTo("tx-1");
        assertThat(protectedTx.getKeyWraps()).containsOnlyKeys("seller", "buyer");
        assertThat(protectedTx.getState()).isEqualTo(TransactionState.SELLER_PROTECTED);
        assertThat(protectedTx.getCreatedAt()).isEqualTo(NOW);
        assertThat(Primitives.verify(seller.publicKeys().signingPublicKey(), protectedTx.getContentHash(),
                protectedTx.getSigSeller())).isTrue();

        assertThat(counterSigned.getState()).isEqualTo(TransactionState.BUYER_COUNTERSIGNED);
        assertThat(Primitives.verify(buyer.publicKeys().signingPublicKey(), counterSigned.getContentHash(),
                counterSigned.getSigBuyer().orElseThrow())).isTrue();

        assertThat(share.getFromId()).isEqualTo("buyer");
        assertThat(share.getToId()).isEqualTo("auditor");
        assertThat(share.getSection()).isEmpty();
        assertThat(share.getTimestamp()).isEqualTo(NOW);
        assertThat(protocol.verifyShareRecord(share, registry)).isTrue();

        assertThat(revealed).isEqualTo(document);
        assertThat(revealed.toJava()).containsEntry("id", "tx-1").containsEntry("amount", 100L);
    }

    @Test
    public void shouldRoundTripForSellerAndBuyer() throws Exception {
        var protectedTx = protocol.protect(document, seller, "buyer", registry);

        assertThat(protocol.unprotect(protectedTx, "seller", seller.getEncryptionKey())).isEqualTo(document);
        assertThat(protocol.unprotect(protectedTx, "buyer", buyer.getEncryptionKey())).isEqualTo(document);
    }

    @Test
    public void shouldPreserveDecimalPrecisionThroughProtection() throws Exception {
        var amount = new BigDecimal("0.1000000000000000055511151231257827");
        var precise = Document.of(Map.of("id", "tx-1", "amount", amount));

        var protectedTx = protocol.protect(precise, seller, "buyer", registry);
        var recovered = protocol.unprotect(protectedTx, "buyer", buyer.getEncryptionKey());

        assertThat(recovered).isEqualTo(precise);
        assertThat(recovered.get("amount").flatMap(DocumentValue::asNumber)).contains(amount);
    }

    @Test
    public void shouldGenerateDocIdWhenDocumentHasNone() throws Exception {
        var anonymous = Document.builder().field("amount", 5).build();

        var first = protocol.protect(anonymous, seller, "buyer", registry);
        var second = protocol.protect(anonymous, seller, "buyer", registry);

        assertThat(first.getDocId()).isNotBlank().isNotEqualTo(second.getDocId());
    }

    @Test
    public void shouldUseFreshKeysAndNoncesForEachProtection() throws Exception {
        var first = protocol.protect(document, seller, "buyer", registry);
        var second = protocol.protect(document, seller, "buyer", registry);

        assertThat(first.getContentHash()).isEqualTo(second.getContentHash());
        assertThat(first.getNonce()).isNotEqualTo(second.getNonce());
        assertThat(first.getCiphertext()).isNotEqualTo(second.getCiphertext());
    }

    @Test
    public void shouldVerifyWithPublicKeysOnly() throws Exception {
        var protectedTx = protocol.protect(document, seller, "buyer", registry);

        var beforeCounterSign = protocol.verify(protectedTx, registry);
        var afterCounterSign = protocol.verify(protocol.counterSign(protectedTx, buyer, registry), registry);

        assertThat(beforeCounterSign.seller()).isEqualTo(SignatureStatus.VALID);
        assertThat(beforeCounterSign.buyer()).isEqualTo(SignatureStatus.ABSENT);
        assertThat(beforeCounterSign.isValid()).isTrue();
        assertThat(afterCounterSign.sellerOk()).isTrue();
        assertThat(afterCounterSign.buyerOk()).isTrue();
    }

    @DataProvider
    public Object[][] tamperings() {
        return new Object[][] {
                { "ciphertext", (UnaryOperator<ProtectedTransaction>) tx -> {
                    var ct = tx.getCiphertext();
                    ct[0] ^= 1;
                    return tx.toBuilder().ciphertext(ct, tx.getNonce(), tx.getAuthTag()).build();
                } },
                { "tag", (UnaryOperator<ProtectedTransaction>) tx -> {
                    var tag = tx.getAuthTag();
                    tag[15] ^= (byte) 0x80;
                    return tx.toBuilder().ciphertext(tx.getCiphertext(), tx.getNonce(), tag).build();
                } },
                { "content hash", (UnaryOperator<ProtectedTransaction>) tx -> {
                    var hash = tx.getContentHash();
                    hash[7] ^= 4;
                    return tx.toBuilder().contentHash(hash).build();
                } },
                { "key wrap", (UnaryOperator<ProtectedTransaction>) tx -> {
                    var entry = tx.getKeyWrap("buyer").orElseThrow();
                    var wrapped = entry.wrappedKey();
                    wrapped[0] ^= 1;
                    return tx.toBuilder()
                            .keyWrap(new WrappedKeyEntry("buyer", wrapped, entry.nonce(), entry.senderPublicKey()))
                            .build();
                } },
                { "doc id", (UnaryOperator<ProtectedTransaction>) tx -> tx.toBuilder().docId("tx-2").build() },
        };
    }

    @Test(dataProvider = "tamperings")
    public void shouldDetectTampering(String field, UnaryOperator<ProtectedTransaction> tamper) throws Exception {
        // Given
        var tampered = tamper.apply(protocol.protect(document, seller, "buyer", registry));

        // Then
        assertThatThrownBy(() -> protocol.unprotect(tampered, "buyer", buyer.getEncryptionKey()))
                .as(field)
                .isInstanceOfAny(AuthFailureException.class, HashMismatchException.class);
        assertThatThrownBy(() -> protocol.counterSign(tampered, buyer, registry))
                .as(field)
                .isInstanceOfAny(AuthFailureException.class, HashMismatchException.class);
    }

    @Test
    public void shouldReportUnwrapFailureForTamperedBuyerWrap() throws Exception {
        var protectedTx = protocol.protect(document, seller, "buyer", registry);
        var swapped = protectedTx.toBuilder()
                .keyWrap(renamed(protectedTx.getKeyWrap("seller").orElseThrow(), "buyer"))
                .build();

        assertThatThrownBy(() -> protocol.counterSign(swapped, buyer, registry))
                .isInstanceOf(UnwrapFailureException.class);
    }

    @Test
    public void shouldRejectSellerSignatureOverDifferentHash() throws Exception {
        // Given
        var protectedTx = protocol.protect(document, seller, "buyer", registry);
        var otherHash = Primitives.hash(new byte[] { 1, 2, 3 });
        var forged = protectedTx.toBuilder()
                .sigSeller(Primitives.sign(seller.getSigningKey(), otherHash))
                .build();

        // Then
        assertThatThrownBy(() -> protocol.counterSign(forged, buyer, registry))
                .isInstanceOf(SignatureInvalidException.class);
        assertThat(protocol.verify(forged, registry).seller()).isEqualTo(SignatureStatus.INVALID);
    }

    @Test
    public void shouldRejectSignatureFromWrongSellerKey() throws Exception {
        var protectedTx = protocol.protect(document, seller, "buyer", registry);

        assertThatThrownBy(() -> protocol.counterSign(protectedTx, "buyer", buyer.getSigningKey(),
                buyer.getEncryptionKey(), outsider.publicKeys().signingPublicKey()))
                .isInstanceOf(SignatureInvalidException.class);
    }

    @Test
    public void shouldOnlyCounterSignOnceAndOnlyAsBuyer() throws Exception {
        var protectedTx = protocol.protect(document, seller, "buyer", registry);
        var counterSigned = protocol.counterSign(protectedTx, buyer, registry);

        assertThatThrownBy(() -> protocol.counterSign(counterSigned, buyer, registry))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> protocol.counterSign(protectedTx, seller, registry))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    public void shouldDenyPartyWithoutGrant() throws Exception {
        var protectedTx = protocol.protect(document, seller, "buyer", registry);

        assertThatThrownBy(() -> protocol.unprotect(protectedTx, "auditor", auditor.getEncryptionKey()))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    public void shouldNotLetBuyerUseAnotherPartysKey() throws Exception {
        var protectedTx = protocol.protect(document, seller, "buyer", registry);

        assertThatThrownBy(() -> protocol.unprotect(protectedTx, "buyer", auditor.getEncryptionKey()))
                .isInstanceOf(UnwrapFailureException.class);
    }

    @Test
    public void shouldNotEscalateAccess() throws Exception {
        var protectedTx = protocol.protect(document, seller, "buyer", registry);

        assertThatThrownBy(() -> protocol.createShareRecord(protectedTx, "auditor", auditor.getEncryptionKey(),
                auditor.getSigningKey(), "outsider", outsider.publicKeys().encryptionPublicKey()))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> protocol.createShareRecord(protectedTx, "auditor", buyer.getEncryptionKey(),
                auditor.getSigningKey(), "outsider", outsider.publicKeys().encryptionPublicKey()))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    public void shouldOnlyHonourShareForItsRecipient() throws Exception {
        var protectedTx = protocol.protect(document, seller, "buyer", registry);
        var share = protocol.createShareRecord(protectedTx, buyer, "auditor", null, registry);

        assertThatThrownBy(() -> protocol.unprotect(protectedTx, outsider, share, registry))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    public void shouldOnlyHonourShareForItsDocument() throws Exception {
        var first = protocol.protect(document, seller, "buyer", registry);
        var second = protocol.protect(Document.builder().field("id", "tx-2").field("amount", 7).build(), seller,
                "buyer", registry);
        var share = protocol.createShareRecord(first, buyer, "auditor", null, registry);

        assertThatThrownBy(() -> protocol.unprotect(second, auditor, share, registry))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    public void shouldRejectForgedShareRecord() throws Exception {
        var protectedTx = protocol.protect(document, seller, "buyer", registry);
        var share = protocol.createShareRecord(protectedTx, buyer, "auditor", null, registry);
        var backdated = new ShareRecord(share.getShareId(), share.getDocId(), null, share.getFromId(),
                share.getToId(), share.getWrappedKey(), share.getContentHash(),
                share.getTimestamp().minusSeconds(3600), share.getSignature());
        var wrongSigner = new ShareRecord(share.getShareId(), share.getDocId(), null, "seller",
                share.getToId(), share.getWrappedKey(), share.getContentHash(), share.getTimestamp(),
                share.getSignature());

        assertThatThrownBy(() -> protocol.unprotect(protectedTx, auditor, backdated, registry))
                .isInstanceOf(SignatureInvalidException.class);
        assertThatThrownBy(() -> protocol.unprotect(protectedTx, auditor, wrongSigner, registry))
                .isInstanceOf(SignatureInvalidException.class);
        assertThat(protocol.verifyShareRecord(backdated, registry)).isFalse();
    }

    @Test
    public void shouldAllowOnwardSharingThroughShare() throws Exception {
        // Given
        var protectedTx = protocol.protect(document, seller, "buyer", registry);
        var toAuditor = protocol.createShareRecord(protectedTx, buyer, "auditor", null, registry);

        // When
        var toOutsider = protocol.createShareRecord(protectedTx, auditor, "outsider", toAuditor, registry);

        // Then
        assertThat(toOutsider.getFromId()).isEqualTo("auditor");
        assertThat(protocol.unprotect(protectedTx, outsider, toOutsider, registry)).isEqualTo(document);
        var check = protocol.check(protectedTx, List.of(toAuditor, toOutsider), registry);
        assertThat(check.shares()).hasSize(2).allMatch(ShareCheck::isValid);
        assertThat(check.isValid()).isTrue();
    }

    @Test
    public void shouldFlagShareForOtherContent() throws Exception {
        var first = protocol.protect(document, seller, "buyer", registry);
        var second = protocol.protect(Document.builder().field("id", "tx-1").field("amount", 999).build(), seller,
                "buyer", registry);
        var share = protocol.createShareRecord(first, buyer, "auditor", null, registry);

        var check = protocol.check(second, List.of(share), registry);

        assertThat(check.shares()).hasSize(1);
        assertThat(check.shares().get(0).signatureValid()).isTrue();
        assertThat(check.shares().get(0).hashBound()).isFalse();
        assertThat(check.isValid()).isFalse();
        assertThatThrownBy(() -> protocol.unprotect(second, auditor, share, registry))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Test
    public void shouldReportUnknownParties() throws Exception {
        assertThatThrownBy(() -> protocol.protect(document, seller, "nobody", registry))
                .isInstanceOf(NotFoundException.class);
        var notFound = catchThrowableOfType(() -> registry.getPublicKeys("nobody"), NotFoundException.class);
        assertThat(notFound.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    public void shouldDistinguishWrongRecipientFromMissingGrant() throws Exception {
        var protectedTx = protocol.protect(document, seller, "buyer", registry);

        var wrongKey = catchThrowableOfType(
                () -> protocol.unprotect(protectedTx, "buyer", auditor.getEncryptionKey()),
                UnwrapFailureException.class);
        var noGrant = catchThrowableOfType(
                () -> protocol.unprotect(protectedTx, "auditor", auditor.getEncryptionKey()),
                AccessDeniedException.class);

        assertThat(wrongKey.getKind()).isEqualTo(ErrorKind.UNWRAP_FAILURE);
        assertThat(noGrant.getKind()).isEqualTo(ErrorKind.ACCESS_DENIED);
        assertThat(noGrant.getKind().userMessage()).doesNotContain("auditor", "tx-1");
    }

    private static WrappedKeyEntry renamed(WrappedKeyEntry entry, String recipientId) {
        return new WrappedKeyEntry(recipientId, entry.wrappedKey(), entry.nonce(), entry.senderPublicKey());
    }
}
