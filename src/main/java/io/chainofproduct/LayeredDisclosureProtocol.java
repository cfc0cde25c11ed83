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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainofproduct.crypto.CryptoSuite;
import io.chainofproduct.crypto.DestroyableSecretKey;
import io.chainofproduct.crypto.KdfPurpose;
import io.chainofproduct.crypto.KeyWrapEngine;
import io.chainofproduct.crypto.Primitives;
import io.chainofproduct.crypto.WrappedKeyEntry;
import io.chainofproduct.document.Canonicalizer;
import io.chainofproduct.document.Document;
import io.chainofproduct.document.SectionMap;
import io.chainofproduct.io.CborWriter;

/**
 * Layered (selective) disclosure: a document is partitioned into named sections, each encrypted under its own
 * content key, so that a third party can be given some sections without learning anything about the others.
 * <p>
 * The sections are tied together by an <em>aggregate hash</em> over the document id, the parties, the sorted
 * section names, and for each section its content hash and every key wrap. The seller (and later the buyer) signs
 * the aggregate hash, and each section's ciphertext authenticates it as associated data. Dropping, renaming or
 * substituting a section, or moving a key wrap between sections or recipients, is therefore detected when any
 * section is opened.
 */
public final class LayeredDisclosureProtocol {
    private static final Logger logger = LoggerFactory.getLogger(LayeredDisclosureProtocol.class);
    private static final String AGGREGATE_CONTEXT = "cop-aggregate";
    private static final String AAD_CONTEXT = "cop-section";

    private final Clock clock;

    public LayeredDisclosureProtocol() {
        this(Clock.systemUTC());
    }

    public LayeredDisclosureProtocol(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
    }

    /**
     * Splits a document into sections and protects each one for the seller and the buyer.
     *
     * @throws StructuralException if the section map does not partition the document.
     * @throws MalformedKeyException if any of the keys is of the wrong type.
     */
    public LayeredProtectedTransaction protectWithLayers(Document document, SectionMap sectionMap, String sellerId,
            PrivateKey sellerSigningKey, PublicKey sellerEncryptionKey, String buyerId,
            PublicKey buyerEncryptionKey) throws ProtectionException {
        requireNonNull(document, "document");
        requireNonNull(sellerId, "sellerId");
        requireNonNull(buyerId, "buyerId");
        if (sellerId.equals(buyerId)) {
            throw new IllegalArgumentException("Seller and buyer must be different parties");
        }

        var docId = TransactionProtocol.docIdFor(document);
        var parts = sectionMap.partition(document);

        var contentKeys = new TreeMap<String, DestroyableSecretKey>();
        var plaintexts = new TreeMap<String, byte[]>();
        var sectionHashes = new TreeMap<String, byte[]>();
        var sectionWraps = new TreeMap<String, Map<String, WrappedKeyEntry>>();
        try {
            for (var part : parts.entrySet()) {
                var name = part.getKey();
                var contentKey = Primitives.generateContentKey();
                contentKeys.put(name, contentKey);
                var canonical = Canonicalizer.canonicalize(part.getValue());
                plaintexts.put(name, canonical);
                sectionHashes.put(name, Canonicalizer.hash(canonical));

                var wraps = new TreeMap<String, WrappedKeyEntry>();
                wraps.put(sellerId, KeyWrapEngine.wrapFor(contentKey, sellerId, sellerEncryptionKey,
                        KdfPurpose.CONTENT_KEY_WRAP, docId, name));
                wraps.put(buyerId, KeyWrapEngine.wrapFor(contentKey, buyerId, buyerEncryptionKey,
                        KdfPurpose.CONTENT_KEY_WRAP, docId, name));
                sectionWraps.put(name, wraps);
            }

            var aggregateHash = aggregateHash(docId, sellerId, buyerId, sectionHashes, sectionWraps);
            var sections = new TreeMap<String, ProtectedSection>();
            for (var name : contentKeys.keySet()) {
                var nonce = Primitives.freshNonce();
                var sealed = Primitives.aeadEncrypt(contentKeys.get(name), nonce, plaintexts.get(name),
                        associatedData(docId, name, aggregateHash));
                sections.put(name, new ProtectedSection(sealed.ciphertext(), nonce, sealed.tag(),
                        sectionHashes.get(name), sectionWraps.get(name)));
            }

            var sigSeller = Primitives.sign(sellerSigningKey, aggregateHash);
            logger.info("Seller {} protected document {} in sections {} for buyer {}", sellerId, docId,
                    sections.keySet(), buyerId);
            return new LayeredProtectedTransaction(docId, sellerId, buyerId, sections, aggregateHash, sigSeller,
                    null, clock.instant(), CryptoSuite.COP_V1);
        } finally {
            contentKeys.values().forEach(DestroyableSecretKey::destroy);
            plaintexts.values().forEach(bytes -> Arrays.fill(bytes, (byte) 0));
        }
    }

    /**
     * Protects a document in sections, looking up both parties' public keys in the registry.
     */
    public LayeredProtectedTransaction protectWithLayers(Document document, SectionMap sectionMap, KeyVault seller,
            String buyerId, KeyRegistry registry) throws ProtectionException {
        var sellerKeys = registry.getPublicKeys(seller.getPartyId());
        var buyerKeys = registry.getPublicKeys(buyerId);
        return protectWithLayers(document, sectionMap, seller.getPartyId(), seller.getSigningKey(),
                sellerKeys.encryptionPublicKey(), buyerId, buyerKeys.encryptionPublicKey());
    }

    /**
     * Has the buyer open every section, check the aggregate hash and the seller's signature over it, and then sign
     * the aggregate hash.
     *
     * @throws IllegalStateException if the transaction has already been counter-signed.
     */
    public LayeredProtectedTransaction counterSign(LayeredProtectedTransaction transaction, String buyerId,
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

        var aggregateHash = checkAggregate(transaction);
        for (var name : transaction.getSections().keySet()) {
            if (transaction.getSections().get(name).getKeyWrap(buyerId).isEmpty()) {
                throw new AccessDeniedException("Transaction has no key wrap for the buyer");
            }
            try (var opened = openSection(transaction, name, buyerId, buyerEncryptionKey, null, null)) {
                logger.trace("Buyer {} checked section '{}'", buyerId, name);
            }
        }
        if (!Primitives.verify(sellerSigningKey, aggregateHash, transaction.getSigSeller())) {
            logger.warn("Seller signature on layered document {} does not verify", transaction.getDocId());
            throw new SignatureInvalidException("Seller signature does not match the aggregate hash");
        }
        var sigBuyer = Primitives.sign(buyerSigningKey, aggregateHash);
        logger.info("Buyer {} counter-signed layered document {}", buyerId, transaction.getDocId());
        return transaction.withBuyerSignature(sigBuyer);
    }

    public LayeredProtectedTransaction counterSign(LayeredProtectedTransaction transaction, KeyVault buyer,
            KeyRegistry registry) throws ProtectionException {
        var sellerKeys = registry.getPublicKeys(transaction.getSellerId());
        return counterSign(transaction, buyer.getPartyId(), buyer.getSigningKey(), buyer.getEncryptionKey(),
                sellerKeys.signingPublicKey());
    }

    public VerificationResult verify(LayeredProtectedTransaction transaction, KeyRegistry registry)
            throws NotFoundException {
        return check(transaction, List.of(), registry);
    }

    /**
     * Verifies the signatures over the aggregate hash and checks each share record against the recorded hash of
     * the section it names. Nothing is decrypted.
     */
    public VerificationResult check(LayeredProtectedTransaction transaction, List<ShareRecord> shares,
            KeyRegistry registry) throws NotFoundException {
        var aggregateHash = transaction.getAggregateHash();
        var sellerKeys = registry.getPublicKeys(transaction.getSellerId());
        var seller = SignatureStatus.of(
                Primitives.verify(sellerKeys.signingPublicKey(), aggregateHash, transaction.getSigSeller()));

        var buyer = SignatureStatus.ABSENT;
        var sigBuyer = transaction.getSigBuyer();
        if (sigBuyer.isPresent()) {
            var buyerKeys = registry.getPublicKeys(transaction.getBuyerId());
            buyer = SignatureStatus.of(
                    Primitives.verify(buyerKeys.signingPublicKey(), aggregateHash, sigBuyer.get()));
        }

        var shareChecks = new ArrayList<ShareCheck>(shares.size());
        for (var share : shares) {
            var recorded = share.getSection()
                    .flatMap(transaction::getSection)
                    .map(ProtectedSection::getContentHash)
                    .orElse(null);
            shareChecks.add(KeyAccess.check(share, transaction.getDocId(), recorded, registry));
        }
        return new VerificationResult(seller, buyer, shareChecks);
    }

    /**
     * Decrypts a single section.
     *
     * @param share a share record scoped to this section, or null if the party has its own key wrap.
     * @param registry used to verify the share record, or null if no share record is given.
     * @return the fields of the document that belong to the section.
     * @throws HashMismatchException if the aggregate hash does not match the sections present, or the decrypted
     * section does not match its recorded hash.
     * @throws NotFoundException if the transaction has no section with this name.
     * @throws AccessDeniedException if the party has no key wrap for this section and no share record for it.
     * @throws SignatureInvalidException if the share record's signature does not verify.
     * @throws UnwrapFailureException if the key wrap cannot be opened with the given private key.
     * @throws AuthFailureException if the section ciphertext fails authentication.
     */
    public Document unprotectLayer(LayeredProtectedTransaction transaction, String partyId, String sectionName,
            PrivateKey encryptionKey, ShareRecord share, KeyRegistry registry) throws ProtectionException {
        requireNonNull(transaction, "transaction");
        requireNonNull(sectionName, "sectionName");
        checkAggregate(transaction);
        try (var opened = openSection(transaction, sectionName, partyId, encryptionKey, share, registry)) {
            return Canonicalizer.parse(opened.plaintext);
        }
    }

    public Document unprotectLayer(LayeredProtectedTransaction transaction, String partyId, String sectionName,
            PrivateKey encryptionKey) throws ProtectionException {
        return unprotectLayer(transaction, partyId, sectionName, encryptionKey, null, null);
    }

    public Document unprotectLayer(LayeredProtectedTransaction transaction, KeyVault party, String sectionName,
            ShareRecord share, KeyRegistry registry) throws ProtectionException {
        return unprotectLayer(transaction, party.getPartyId(), sectionName, party.getEncryptionKey(), share,
                registry);
    }

    /**
     * Issues one share record per requested section. Every requested section is opened and checked by the discloser
     * before any record is produced, so either all records are issued or none are.
     *
     * @param viaShares share records through which the discloser holds access to sections it has no key wrap for.
     *                  May be empty.
     * @param registry used to verify {@code viaShares}, or null if there are none.
     * @throws NotFoundException if a requested section does not exist.
     * @throws AccessDeniedException if the discloser has no access to one of the requested sections.
     */
    public List<ShareRecord> createLayerShareRecords(LayeredProtectedTransaction transaction, String discloserId,
            PrivateKey discloserEncryptionKey, PrivateKey discloserSigningKey, String recipientId,
            PublicKey recipientEncryptionKey, Collection<String> sectionNames, Collection<ShareRecord> viaShares,
            KeyRegistry registry) throws ProtectionException {
        requireNonNull(transaction, "transaction");
        requireNonNull(recipientId, "recipientId");
        requireNonNull(recipientEncryptionKey, "recipientEncryptionKey");
        var names = new LinkedHashSet<>(requireNonNull(sectionNames, "sectionNames"));
        if (names.isEmpty()) {
            throw new IllegalArgumentException("At least one section must be shared");
        }

        checkAggregate(transaction);
        var opened = new LinkedHashMap<String, OpenedSection>();
        try {
            for (var name : names) {
                var viaShare = shareFor(viaShares, name);
                opened.put(name, openSection(transaction, name, discloserId, discloserEncryptionKey, viaShare,
                        registry));
            }

            var records = new ArrayList<ShareRecord>(names.size());
            for (var entry : opened.entrySet()) {
                var name = entry.getKey();
                records.add(KeyAccess.issue(target(transaction, name), entry.getValue().contentKey, discloserId,
                        discloserSigningKey, recipientId, recipientEncryptionKey, clock));
            }
            return records;
        } finally {
            opened.values().forEach(OpenedSection::close);
        }
    }

    public List<ShareRecord> createLayerShareRecords(LayeredProtectedTransaction transaction, String discloserId,
            PrivateKey discloserEncryptionKey, PrivateKey discloserSigningKey, String recipientId,
            PublicKey recipientEncryptionKey, Collection<String> sectionNames) throws ProtectionException {
        return createLayerShareRecords(transaction, discloserId, discloserEncryptionKey, discloserSigningKey,
                recipientId, recipientEncryptionKey, sectionNames, List.of(), null);
    }

    /**
     * Shares sections with a registered party, looking up the recipient's encryption key in the registry.
     */
    public List<ShareRecord> createLayerShareRecords(LayeredProtectedTransaction transaction, KeyVault discloser,
            String recipientId, Collection<String> sectionNames, Collection<ShareRecord> viaShares,
            KeyRegistry registry) throws ProtectionException {
        var recipientKeys = registry.getPublicKeys(recipientId);
        return createLayerShareRecords(transaction, discloser.getPartyId(), discloser.getEncryptionKey(),
                discloser.getSigningKey(), recipientId, recipientKeys.encryptionPublicKey(), sectionNames,
                viaShares, registry);
    }

    /**
     * Recomputes the aggregate hash from the sections present in a transaction.
     */
    static byte[] aggregateHash(LayeredProtectedTransaction transaction) {
        var sectionHashes = new TreeMap<String, byte[]>();
        var sectionWraps = new TreeMap<String, Map<String, WrappedKeyEntry>>();
        transaction.getSections().forEach((name, section) -> {
            sectionHashes.put(name, section.getContentHash());
            sectionWraps.put(name, section.getKeyWraps());
        });
        return aggregateHash(transaction.getDocId(), transaction.getSellerId(), transaction.getBuyerId(),
                sectionHashes, sectionWraps);
    }

    private static byte[] aggregateHash(String docId, String sellerId, String buyerId,
            TreeMap<String, byte[]> sectionHashes, TreeMap<String, Map<String, WrappedKeyEntry>> sectionWraps) {
        var sections = new ArrayList<Object>(sectionHashes.size());
        for (var name : sectionHashes.keySet()) {
            var wraps = new ArrayList<Object>();
            for (var wrap : new TreeMap<>(sectionWraps.get(name)).values()) {
                wraps.add(List.of(wrap.recipientId(), wrap.senderPublicKey(), wrap.nonce(), wrap.wrappedKey()));
            }
            sections.add(List.of(name, sectionHashes.get(name), wraps));
        }
        var transcript = CborWriter.transcript(AGGREGATE_CONTEXT, docId, sellerId, buyerId,
                new ArrayList<Object>(sectionHashes.keySet()), sections);
        return Primitives.hash(transcript);
    }

    private static byte[] checkAggregate(LayeredProtectedTransaction transaction) throws HashMismatchException {
        var recomputed = aggregateHash(transaction);
        if (!Primitives.equal(recomputed, transaction.getAggregateHash())) {
            logger.warn("Aggregate hash of layered document {} does not match its sections",
                    transaction.getDocId());
            throw new HashMismatchException("Sections do not match the recorded aggregate hash");
        }
        return recomputed;
    }

    private OpenedSection openSection(LayeredProtectedTransaction transaction, String name, String partyId,
            PrivateKey encryptionKey, ShareRecord share, KeyRegistry registry) throws ProtectionException {
        var section = transaction.getSection(name)
                .orElseThrow(() -> new NotFoundException("No section named '" + name + "'"));
        var contentKey = KeyAccess.open(target(transaction, name), partyId, encryptionKey, share, registry);
        try {
            var plaintext = Primitives.aeadDecrypt(contentKey, section.getNonce(), section.getCiphertext(),
                    section.getAuthTag(), associatedData(transaction.getDocId(), name,
                            transaction.getAggregateHash()));
            if (!Primitives.equal(Canonicalizer.hash(plaintext), section.getContentHash())) {
                logger.warn("Section '{}' of document {} does not match its recorded hash", name,
                        transaction.getDocId());
                throw new HashMismatchException("Decrypted section does not match its recorded hash");
            }
            return new OpenedSection(contentKey, plaintext);
        } catch (ProtectionException | RuntimeException e) {
            contentKey.destroy();
            throw e;
        }
    }

    private static ShareRecord shareFor(Collection<ShareRecord> shares, String section) {
        if (shares == null) {
            return null;
        }
        for (var share : shares) {
            if (share.getSection().filter(section::equals).isPresent()) {
                return share;
            }
        }
        return null;
    }

    private static KeyAccess.Target target(LayeredProtectedTransaction transaction, String name) {
        var section = transaction.getSections().get(name);
        return new KeyAccess.Target(transaction.getDocId(), name, section.getContentHash(), section.getKeyWraps());
    }

    private static byte[] associatedData(String docId, String sectionName, byte[] aggregateHash) {
        return CborWriter.transcript(AAD_CONTEXT, docId, sectionName, aggregateHash);
    }

    private static final class OpenedSection implements AutoCloseable {
        final DestroyableSecretKey contentKey;
        final byte[] plaintext;

        OpenedSection(DestroyableSecretKey contentKey, byte[] plaintext) {
            this.contentKey = contentKey;
            this.plaintext = plaintext;
        }

        @Override
        public void close() {
            contentKey.destroy();
            Arrays.fill(plaintext, (byte) 0);
        }
    }
}
