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

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import io.chainofproduct.crypto.CryptoSuite;

/**
 * A transaction document split into named sections, each encrypted under its own content key. The aggregate hash
 * commits to the set of section names, each section's content hash and every key wrap, and is what the seller
 * and buyer sign.
 */
public final class LayeredProtectedTransaction {
    private final String docId;
    private final String sellerId;
    private final String buyerId;
    private final Map<String, ProtectedSection> sections;
    private final byte[] aggregateHash;
    private final byte[] sigSeller;
    private final byte[] sigBuyer;
    private final Instant createdAt;
    private final CryptoSuite suite;

    LayeredProtectedTransaction(String docId, String sellerId, String buyerId, Map<String, ProtectedSection> sections,
            byte[] aggregateHash, byte[] sigSeller, byte[] sigBuyer, Instant createdAt, CryptoSuite suite) {
        this.docId = requireNonNull(docId, "docId");
        this.sellerId = requireNonNull(sellerId, "sellerId");
        this.buyerId = requireNonNull(buyerId, "buyerId");
        this.sections = Collections.unmodifiableMap(new TreeMap<>(sections));
        this.aggregateHash = requireNonNull(aggregateHash, "aggregateHash").clone();
        this.sigSeller = requireNonNull(sigSeller, "sigSeller").clone();
        this.sigBuyer = sigBuyer == null ? null : sigBuyer.clone();
        this.createdAt = requireNonNull(createdAt, "createdAt");
        this.suite = requireNonNull(suite, "suite");
    }

    public String getDocId() {
        return docId;
    }

    public String getSellerId() {
        return sellerId;
    }

    public String getBuyerId() {
        return buyerId;
    }

    /**
     * Returns the sections, sorted by name.
     */
    public Map<String, ProtectedSection> getSections() {
        return sections;
    }

    public Optional<ProtectedSection> getSection(String name) {
        return Optional.ofNullable(sections.get(name));
    }

    public byte[] getAggregateHash() {
        return aggregateHash.clone();
    }

    public byte[] getSigSeller() {
        return sigSeller.clone();
    }

    public Optional<byte[]> getSigBuyer() {
        return Optional.ofNullable(sigBuyer).map(byte[]::clone);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public CryptoSuite getSuite() {
        return suite;
    }

    public TransactionState getState() {
        return sigBuyer == null ? TransactionState.SELLER_PROTECTED : TransactionState.BUYER_COUNTERSIGNED;
    }

    LayeredProtectedTransaction withSections(Map<String, ProtectedSection> sections) {
        return new LayeredProtectedTransaction(docId, sellerId, buyerId, sections, aggregateHash, sigSeller, sigBuyer,
                createdAt, suite);
    }

    LayeredProtectedTransaction withBuyerSignature(byte[] sigBuyer) {
        return new LayeredProtectedTransaction(docId, sellerId, buyerId, sections, aggregateHash, sigSeller, sigBuyer,
                createdAt, suite);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof LayeredProtectedTransaction)) { return false; }
        LayeredProtectedTransaction that = (LayeredProtectedTransaction) other;
        return docId.equals(that.docId)
                && sellerId.equals(that.sellerId)
                && buyerId.equals(that.buyerId)
                && sections.equals(that.sections)
                && Arrays.equals(aggregateHash, that.aggregateHash)
                && Arrays.equals(sigSeller, that.sigSeller)
                && Arrays.equals(sigBuyer, that.sigBuyer)
                && createdAt.equals(that.createdAt)
                && suite.equals(that.suite);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(docId, sellerId, buyerId, sections, createdAt, suite);
        result = 31 * result + Arrays.hashCode(aggregateHash);
        return result;
    }

    @Override
    public String toString() {
        return "LayeredProtectedTransaction{" +
                "docId='" + docId + '\'' +
                ", sections=" + sections.keySet() +
                ", state=" + getState() +
                ", suite=" + suite +
                '}';
    }
}
