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
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.chainofproduct.crypto.Primitives;
import io.chainofproduct.crypto.WrappedKeyEntry;
import io.chainofproduct.io.CborWriter;

/**
 * A signed, auditable grant of access: party {@code fromId} wrapped the content key of document {@code docId}
 * (or of one of its sections) for party {@code toId} at {@code timestamp}. The signature covers every other field,
 * so the record proves who disclosed what to whom and when.
 */
public final class ShareRecord {
    private static final String SIGNATURE_CONTEXT = "cop-share-v1";

    private final String shareId;
    private final String docId;
    private final String section;
    private final String fromId;
    private final String toId;
    private final WrappedKeyEntry wrappedKey;
    private final byte[] contentHash;
    private final Instant timestamp;
    private final byte[] signature;

    ShareRecord(String shareId, String docId, String section, String fromId, String toId, WrappedKeyEntry wrappedKey,
            byte[] contentHash, Instant timestamp, byte[] signature) {
        this.shareId = requireNonNull(shareId, "shareId");
        this.docId = requireNonNull(docId, "docId");
        this.section = section;
        this.fromId = requireNonNull(fromId, "fromId");
        this.toId = requireNonNull(toId, "toId");
        this.wrappedKey = requireNonNull(wrappedKey, "wrappedKey");
        this.contentHash = requireNonNull(contentHash, "contentHash").clone();
        this.timestamp = requireNonNull(timestamp, "timestamp");
        this.signature = requireNonNull(signature, "signature").clone();
    }

    public String getShareId() {
        return shareId;
    }

    public String getDocId() {
        return docId;
    }

    /**
     * The section this record grants access to, or empty if it grants access to the whole document.
     */
    public Optional<String> getSection() {
        return Optional.ofNullable(section);
    }

    public String getFromId() {
        return fromId;
    }

    public String getToId() {
        return toId;
    }

    public WrappedKeyEntry getWrappedKey() {
        return wrappedKey;
    }

    /**
     * The content hash of the disclosed document or section at the time the share was made.
     */
    public byte[] getContentHash() {
        return contentHash.clone();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public byte[] getSignature() {
        return signature.clone();
    }

    /**
     * The hash that {@code fromId} signs: SHA-256 over a CBOR encoding of every field except the signature.
     */
    public byte[] signedHash() {
        return Primitives.hash(CborWriter.transcript(SIGNATURE_CONTEXT, shareId, docId,
                section == null ? List.of() : List.of(section), fromId, toId,
                List.of(wrappedKey.recipientId(), wrappedKey.wrappedKey(), wrappedKey.nonce(),
                        wrappedKey.senderPublicKey()),
                contentHash, timestamp.toString()));
    }

    ShareRecord withSignature(byte[] signature) {
        return new ShareRecord(shareId, docId, section, fromId, toId, wrappedKey, contentHash, timestamp, signature);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof ShareRecord)) { return false; }
        ShareRecord that = (ShareRecord) other;
        return shareId.equals(that.shareId)
                && docId.equals(that.docId)
                && Objects.equals(section, that.section)
                && fromId.equals(that.fromId)
                && toId.equals(that.toId)
                && wrappedKey.equals(that.wrappedKey)
                && Arrays.equals(contentHash, that.contentHash)
                && timestamp.equals(that.timestamp)
                && Arrays.equals(signature, that.signature);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(shareId, docId, section, fromId, toId, wrappedKey, timestamp);
        result = 31 * result + Arrays.hashCode(signature);
        return result;
    }

    @Override
    public String toString() {
        return "ShareRecord{" +
                "shareId='" + shareId + '\'' +
                ", docId='" + docId + '\'' +
                ", section=" + (section == null ? "<all>" : "'" + section + "'") +
                ", fromId='" + fromId + '\'' +
                ", toId='" + toId + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
