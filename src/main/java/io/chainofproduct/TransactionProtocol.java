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

import static java.util.Objects.requireNonNull;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainofproduct.crypto.DestroyableSecretKey;
import io.chainofproduct.crypto.KdfPurpose;
import io.chainofproduct.crypto.KeyWrapEngine;
import io.chainofproduct.crypto.Primitives;
import io.chainofproduct.document.Canonicalizer;
import io.chainofproduct.document.Document;
import io.chainofproduct.io.CborWriter;

/**
 * Protects a whole transaction document for a seller and a buyer, and lets third parties be granted access through
 * signed {@link ShareRecord}s.
 * <p>
 * A transaction moves through {@link TransactionState#DRAFT} (a plain {@link Document}),
 * {@link TransactionState#SELLER_PROTECTED} (after {@link #protect}) and
 * {@link TransactionState#BUYER_COUNTERSIGNED} (after {@link #counterSign}). Sharing never changes the state.
 * <p>
 * Every method is a pure function of its arguments and the clock: the protocol holds no keys and performs no I/O,
 * so a single instance can be used concurrently.
 */
public final class TransactionProtocol {
    private static final Logger logger = LoggerFactory.getLogger(TransactionProtocol.class);
    private static final String DOC_ID_FIELD = "id";
    private static final String AAD_CONTEXT = "cop-document";

    private final Clock clock;

    public TransactionProtocol() {
        this(Clock.systemUTC());
    }

    public TransactionProtocol(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
    }

    /**
     * Encrypts a document under a fresh content key, wraps the key for the seller and the buyer and signs the
     * content hash with the seller's key.
     *
     * @param document the document to protect.
     * @param sellerId the seller's party id.
     * @param sellerSigningKey the seller's Ed25519 private key.
     * @param sellerEncryptionKey the seller's own X25519 public key, so the seller can reopen the record later.
     * @param buyerId the buyer's party id.
     * @param buyerEncryptionKey the buyer's X25519 public key.
     * @return the protected transaction, in state {@link TransactionState#SELLER_PROTECTED}.
     * @throws MalformedKeyException if any of the keys is of the wrong type.
     */
    public ProtectedTransaction protect(Document document, String sellerId, PrivateKey sellerSigningKey,
            PublicKey sellerEncryptionKey, String buyerId, PublicKey buyerEncryptionKey) throws MalformedKeyException {
        requireNonNull(document, "document");
        requireNonNull(sellerId, "sellerId");
        requireNonNull(buyerId, "buyerId");
        if (sellerId.equals(buyerId)) {
            throw new IllegalArgumentException("Seller and buyer must be different parties");
        }

        var docId = docIdFor(document);
        var canonical = Canonicalizer.canonicalize(document);
        try (var contentKey = Primitives.generateContentKey()) {
            var contentHash = Canonicalizer.hash(canonical);
            var nonce = Primitives.freshNonce();
            var sealed = Primitives.aeadEncrypt(contentKey, nonce, canonical, associatedData(docId, contentHash));

            var result = ProtectedTransaction.builder()
                    .docId(docId)
                    .parties(sellerId, buyerId)
                    .ciphertext(sealed.ciphertext(), nonce, sealed.tag())
                    .contentHash(contentHash)
                    .keyWrap(KeyWrapEngine.wrapFor(contentKey, sellerId, sellerEncryptionKey,
                            KdfPurpose.CONTENT_KEY_WRAP, docId, ""))
                    .keyWrap(KeyWrapEngine.wrapFor(contentKey, buyerId, buyerEncryptionKey,
                            KdfPurpose.CONTENT_KEY_WRAP, docId, ""))
                    .sigSeller(Primitives.sign(sellerSigningKey, contentHash))
                    .createdAt(clock.instant())
                    .build();
            logger.info("Seller {} protected document {} for buyer {}", sellerId, docId, buyerId);
            return result;
        } finally {
            Arrays.fill(canonical, (byte) 0);
        }
    }

    /**
     * Protects a document, looking up both parties' public keys in the registry.
     */
    public ProtectedTransaction protect(Document document, KeyVault seller, String buyerId, KeyRegistry registry)
            throws ProtectionException {
        var sellerKeys = registry.getPublicKeys(seller.getPartyId());
        var buyerKeys = registry.getPublicKeys(buyerId);
        return protect(document, seller.getPartyId(), seller.getSigningKey(), sellerKeys.encryptionPublicKey(),
                buyerId, buyerKeys.encryptionPublicKey());
    }

    /**
     * Has the buyer check and counter-sign a protected transaction. The buyer opens the document with its own key
     * wrap, recomputes the content hash, checks that the seller signed exactly that hash and then signs it too.
     *
     * @return a copy of the transaction carrying the buyer's signature.
     * @throws AccessDeniedException if {@code buyerId} is not the buyer of this transaction.
     * @throws UnwrapFailureException if the buyer's key wrap cannot be opened.
     * @throws AuthFailureException if the ciphertext fails authentication.
     * @throws HashMismatchException if the decrypted content does not match the recorded content hash.
     * @throws SignatureInvalidException if the seller's signature does not verify over the content hash.
     * @throws IllegalStateException if the transaction has already been counter-signed.
     */
    public ProtectedTransaction counterSign(ProtectedTransaction transaction, String buyerId,
            PrivateKey buyerSigningKey, PrivateKey buyerEncryptionKey, PublicKey sellerSigningKey)
            throws ProtectionException {
        requireNonNull(transaction, "transaction");
        requireNonNull(sellerSigningKey, "sellerSigningKey");
        if (transaction.getState() == TransactionState.BUYER_COUNTERSIGNED) {
            throw new IllegalStateException("Transaction has already been counter-signed");
        }
        if (!transaction.getBuyerId().equals(buyerId)) {
            throw new AccessDeniedException("Only the buyer can counter-sign a transaction");
        }
        if (transaction.getKeyWrap(buyerId).isEmpty()) {
            throw new AccessDeniedException("Transaction has no key wrap for the buyer");
        }

        try (var opened = open(transaction, buyerId, buyerEncryptionKey, null, null)) {
            if (!Primitives.verify(sellerSigningKey, opened.contentHash, transaction.getSigSeller())) {
                logger.warn("Seller signature on document {} does not verify", transaction.getDocId());
                throw new SignatureInvalidException("Seller signature does not match the content hash");
            }
            var sigBuyer = Primitives.sign(buyerSigningKey, opened.contentHash);
            logger.info("Buyer {} counter-signed document {}", buyerId, transaction.getDocId());
            return transaction.toBuilder().sigBuyer(sigBuyer).build();
        }
    }

    /**
     * Counter-signs as the given buyer, looking up the seller's signing key in the registry.
     */
    public ProtectedTransaction counterSign(ProtectedTransaction transaction, KeyVault buyer, KeyRegistry registry)
            throws ProtectionException {
        var sellerKeys = registry.getPublicKeys(transaction.getSellerId());
        return counterSign(transaction, buyer.getPartyId(), buyer.getSigningKey(), buyer.getEncryptionKey(),
                sellerKeys.signingPublicKey());
    }

    /**
     * Checks the signatures present on a transaction against the recorded content hash, without decrypting.
     *
     * @throws NotFoundException if the seller or buyer is not known to the registry.
     */
    public VerificationResult verify(ProtectedTransaction transaction, KeyRegistry registry)
            throws NotFoundException {
        return check(transaction, List.of(), registry);
    }

    /**
     * Verifies the signatures on a transaction and checks each share record: that its signature verifies and that
     * it is bound to this transaction's content hash.
     */
    public VerificationResult check(ProtectedTransaction transaction, List<ShareRecord> shares,
            KeyRegistry registry) throws NotFoundException {
        var contentHash = transaction.getContentHash();
        var sellerKeys = registry.getPublicKeys(transaction.getSellerId());
        var seller = SignatureStatus.of(
                Primitives.verify(sellerKeys.signingPublicKey(), contentHash, transaction.getSigSeller()));

        var buyer = SignatureStatus.ABSENT;
        var sigBuyer = transaction.getSigBuyer();
        if (sigBuyer.isPresent()) {
            var buyerKeys = registry.getPublicKeys(transaction.getBuyerId());
            buyer = SignatureStatus.of(
                    Primitives.verify(buyerKeys.signingPublicKey(), contentHash, sigBuyer.get()));
        }

        var shareChecks = new ArrayList<ShareCheck>(shares.size());
        for (var share : shares) {
            var recorded = share.getSection().isPresent() ? null : contentHash;
            shareChecks.add(KeyAccess.check(share, transaction.getDocId(), recorded, registry));
        }
        logger.debug("Verified document {}: seller={}, buyer={}", transaction.getDocId(), seller, buyer);
        return new VerificationResult(seller, buyer, shareChecks);
    }

    /**
     * Verifies the discloser's signature on a share record.
     */
    public boolean verifyShareRecord(ShareRecord share, KeyRegistry registry) throws NotFoundException {
        return KeyAccess.verifySignature(share, registry);
    }

    /**
     * Decrypts a protected transaction for a party named in its key wraps.
     */
    public Document unprotect(ProtectedTransaction transaction, String partyId, PrivateKey encryptionKey)
            throws ProtectionException {
        return unprotect(transaction, partyId, encryptionKey, null, null);
    }

    /**
     * Decrypts a protected transaction. Parties with a key wrap of their own use it. Other parties must supply a
     * share record issued to them for this document, whose signature is checked against the discloser's key in
     * the registry.
     *
     * @param share a share record, or null.
     * @param registry the registry used to verify the share record, or null if no share record is given.
     * @return the original document.
     * @throws AccessDeniedException if the party has no key wrap and no applicable share record.
     * @throws SignatureInvalidException if the share record's signature does not verify.
     * @throws UnwrapFailureException if the key wrap cannot be opened with the given private key.
     * @throws AuthFailureException if the ciphertext fails authentication.
     * @throws HashMismatchException if the decrypted content does not match the recorded content hash.
     */
    public Document unprotect(ProtectedTransaction transaction, String partyId, PrivateKey encryptionKey,
            ShareRecord share, KeyRegistry registry) throws ProtectionException {
        try (var opened = open(transaction, partyId, encryptionKey, share, registry)) {
            return Canonicalizer.parse(opened.plaintext);
        }
    }

    public Document unprotect(ProtectedTransaction transaction, KeyVault party, ShareRecord share,
            KeyRegistry registry) throws ProtectionException {
        return unprotect(transaction, party.getPartyId(), party.getEncryptionKey(), share, registry);
    }

    /**
     * Grants a third party access to a protected transaction. The discloser must be able to open the transaction
     * itself, with its own key wrap; the content key it recovers is then wrapped for the recipient and recorded in
     * a signed share record. Nothing is produced if the discloser cannot open the transaction.
     *
     * @throws AccessDeniedException if the discloser has no access to the transaction.
     */
    public ShareRecord createShareRecord(ProtectedTransaction transaction, String discloserId,
            PrivateKey discloserEncryptionKey, PrivateKey discloserSigningKey, String recipientId,
            PublicKey recipientEncryptionKey) throws ProtectionException {
        return createShareRecord(transaction, discloserId, discloserEncryptionKey, discloserSigningKey, recipientId,
                recipientEncryptionKey, null, null);
    }

    /**
     * Grants a third party access, where the discloser may itself hold access only through a share record
     * ({@code viaShare}).
     */
    public ShareRecord createShareRecord(ProtectedTransaction transaction, String discloserId,
            PrivateKey discloserEncryptionKey, PrivateKey discloserSigningKey, String recipientId,
            PublicKey recipientEncryptionKey, ShareRecord viaShare, KeyRegistry registry)
            throws ProtectionException {
        requireNonNull(recipientId, "recipientId");
        requireNonNull(recipientEncryptionKey, "recipientEncryptionKey");
        try (var opened = open(transaction, discloserId, discloserEncryptionKey, viaShare, registry)) {
            return KeyAccess.issue(target(transaction), opened.contentKey, discloserId, discloserSigningKey,
                    recipientId, recipientEncryptionKey, clock);
        }
    }

    /**
     * Shares a transaction with a registered party, looking up the recipient's encryption key in the registry.
     */
    public ShareRecord createShareRecord(ProtectedTransaction transaction, KeyVault discloser, String recipientId,
            ShareRecord viaShare, KeyRegistry registry) throws ProtectionException {
        var recipientKeys = registry.getPublicKeys(recipientId);
        return createShareRecord(transaction, discloser.getPartyId(), discloser.getEncryptionKey(),
                discloser.getSigningKey(), recipientId, recipientKeys.encryptionPublicKey(), viaShare, registry);
    }

    private Opened open(ProtectedTransaction transaction, String partyId, PrivateKey encryptionKey,
            ShareRecord share, KeyRegistry registry) throws ProtectionException {
        requireNonNull(transaction, "transaction");
        var contentKey = KeyAccess.open(target(transaction), partyId, encryptionKey, share, registry);
        try {
            var plaintext = Primitives.aeadDecrypt(contentKey, transaction.getNonce(), transaction.getCiphertext(),
                    transaction.getAuthTag(), associatedData(transaction.getDocId(), transaction.getContentHash()));
            var recomputed = Canonicalizer.hash(plaintext);
            if (!Primitives.equal(recomputed, transaction.getContentHash())) {
                logger.warn("Decrypted content of document {} does not match its content hash",
                        transaction.getDocId());
                throw new HashMismatchException("Decrypted content does not match the recorded content hash");
            }
            return new Opened(contentKey, plaintext, recomputed);
        } catch (ProtectionException | RuntimeException e) {
            contentKey.destroy();
            throw e;
        }
    }

    private static KeyAccess.Target target(ProtectedTransaction transaction) {
        return new KeyAccess.Target(transaction.getDocId(), null, transaction.getContentHash(),
                transaction.getKeyWraps());
    }

    static String docIdFor(Document document) {
        return document.getString(DOC_ID_FIELD)
                .filter(id -> !id.isEmpty())
                .orElseGet(() -> UUID.randomUUID().toString());
    }

    private static byte[] associatedData(String docId, byte[] contentHash) {
        return CborWriter.transcript(AAD_CONTEXT, docId, contentHash);
    }

    /**
     * An opened transaction. Closing it destroys the content key and wipes the plaintext.
     */
    private static final class Opened implements AutoCloseable {
        final DestroyableSecretKey contentKey;
        final byte[] plaintext;
        final byte[] contentHash;

        Opened(DestroyableSecretKey contentKey, byte[] plaintext, byte[] contentHash) {
            this.contentKey = contentKey;
            this.plaintext = plaintext;
            this.contentHash = contentHash;
        }

        @Override
        public void close() {
            contentKey.destroy();
            Arrays.fill(plaintext, (byte) 0);
        }
    }
}
