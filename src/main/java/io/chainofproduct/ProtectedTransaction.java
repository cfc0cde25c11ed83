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
import io.chainofproduct.crypto.WrappedKeyEntry;

/**
 * A transaction document encrypted under a single content key, with that key wrapped for the seller and the buyer.
 * Instances are immutable: counter-signing returns a new instance.
 */
public final class ProtectedTransaction {
    private final String docId;
    private final String sellerId;
    private final String buyerId;
    private final byte[] ciphertext;
    private final byte[] nonce;
    private final byte[] authTag;
    private final Map<String, WrappedKeyEntry> keyWraps;
    private final byte[] contentHash;
    private final byte[] sigSeller;
    private final byte[] sigBuyer;
    private final Instant createdAt;
    private final CryptoSuite suite;

    private ProtectedTransaction(Builder builder) {
        this.docId = requireNonNull(builder.docId, "docId");
        this.sellerId = requireNonNull(builder.sellerId, "sellerId");
        this.buyerId = requireNonNull(builder.buyerId, "buyerId");
        this.ciphertext = requireNonNull(builder.ciphertext, "ciphertext").clone();
        this.nonce = requireNonNull(builder.nonce, "nonce").clone();
        this.authTag = requireNonNull(builder.authTag, "authTag").clone();
        this.keyWraps = Collections.unmodifiableMap(new TreeMap<>(builder.keyWraps));
        this.contentHash = requireNonNull(builder.contentHash, "contentHash").clone();
        this.sigSeller = requireNonNull(builder.sigSeller, "sigSeller").clone();
        this.sigBuyer = builder.sigBuyer == null ? null : builder.sigBuyer.clone();
        this.createdAt = requireNonNull(builder.createdAt, "createdAt");
        this.suite = requireNonNull(builder.suite, "suite");
    }

    static Builder builder() {
        return new Builder();
    }

    Builder toBuilder() {
        var builder = new Builder()
                .docId(docId)
                .parties(sellerId, buyerId)
                .ciphertext(ciphertext, nonce, authTag)
                .contentHash(contentHash)
                .sigSeller(sigSeller)
                .sigBuyer(sigBuyer)
                .createdAt(createdAt)
                .suite(suite);
        keyWraps.values().forEach(builder::keyWrap);
        return builder;
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

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    public byte[] getNonce() {
        return nonce.clone();
    }

    public byte[] getAuthTag() {
        return authTag.clone();
    }

    /**
     * Returns the wrapped content keys, keyed by recipient id.
     */
    public Map<String, WrappedKeyEntry> getKeyWraps() {
        return keyWraps;
    }

    public Optional<WrappedKeyEntry> getKeyWrap(String partyId) {
        return Optional.ofNullable(keyWraps.get(partyId));
    }

    public byte[] getContentHash() {
        return contentHash.clone();
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

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof ProtectedTransaction)) { return false; }
        ProtectedTransaction that = (ProtectedTransaction) other;
        return docId.equals(that.docId)
                && sellerId.equals(that.sellerId)
                && buyerId.equals(that.buyerId)
                && Arrays.equals(ciphertext, that.ciphertext)
                && Arrays.equals(nonce, that.nonce)
                && Arrays.equals(authTag, that.authTag)
                && keyWraps.equals(that.keyWraps)
                && Arrays.equals(contentHash, that.contentHash)
                && Arrays.equals(sigSeller, that.sigSeller)
                && Arrays.equals(sigBuyer, that.sigBuyer)
                && createdAt.equals(that.createdAt)
                && suite.equals(that.suite);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(docId, sellerId, buyerId, keyWraps, createdAt, suite);
        result = 31 * result + Arrays.hashCode(contentHash);
        result = 31 * result + Arrays.hashCode(ciphertext);
        return result;
    }

    @Override
    public String toString() {
        return "ProtectedTransaction{" +
                "docId='" + docId + '\'' +
                ", sellerId='" + sellerId + '\'' +
                ", buyerId='" + buyerId + '\'' +
                ", recipients=" + keyWraps.keySet() +
                ", state=" + getState() +
                ", suite=" + suite +
                '}';
    }

    static final class Builder {
        private String docId;
        private String sellerId;
        private String buyerId;
        private byte[] ciphertext;
        private byte[] nonce;
        private byte[] authTag;
        private final Map<String, WrappedKeyEntry> keyWraps = new TreeMap<>();
        private byte[] contentHash;
        private byte[] sigSeller;
        private byte[] sigBuyer;
        private Instant createdAt;
        private CryptoSuite suite = CryptoSuite.COP_V1;

        Builder docId(String docId) {
            this.docId = docId;
            return this;
        }

        Builder parties(String sellerId, String buyerId) {
            this.sellerId = sellerId;
            this.buyerId = buyerId;
            return this;
        }

        Builder ciphertext(byte[] ciphertext, byte[] nonce, byte[] authTag) {
            this.ciphertext = ciphertext;
            this.nonce = nonce;
            this.authTag = authTag;
            return this;
        }

        Builder keyWrap(WrappedKeyEntry entry) {
            keyWraps.put(entry.recipientId(), entry);
            return this;
        }

        Builder contentHash(byte[] contentHash) {
            this.contentHash = contentHash;
            return this;
        }

        Builder sigSeller(byte[] sigSeller) {
            this.sigSeller = sigSeller;
            return this;
        }

        Builder sigBuyer(byte[] sigBuyer) {
            this.sigBuyer = sigBuyer;
            return this;
        }

        Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        Builder suite(CryptoSuite suite) {
            this.suite = suite;
            return this;
        }

        ProtectedTransaction build() {
            return new ProtectedTransaction(this);
        }
    }
}
