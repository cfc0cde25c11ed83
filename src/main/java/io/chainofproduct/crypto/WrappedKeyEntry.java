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

package io.chainofproduct.crypto;

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.Objects;

/**
 * A content key encrypted so that only one recipient can recover it.
 *
 * @param recipientId the party the key is wrapped for.
 * @param wrappedKey the encrypted content key followed by its 16-byte authentication tag.
 * @param nonce the AEAD nonce used to wrap the key.
 * @param senderPublicKey the raw X25519 ephemeral public key the recipient needs to re-derive the wrap key.
 */
public record WrappedKeyEntry(String recipientId, byte[] wrappedKey, byte[] nonce, byte[] senderPublicKey) {
    public WrappedKeyEntry {
        requireNonNull(recipientId, "recipientId");
        wrappedKey = requireNonNull(wrappedKey, "wrappedKey").clone();
        nonce = requireNonNull(nonce, "nonce").clone();
        senderPublicKey = requireNonNull(senderPublicKey, "senderPublicKey").clone();
    }

    @Override
    public byte[] wrappedKey() {
        return wrappedKey.clone();
    }

    @Override
    public byte[] nonce() {
        return nonce.clone();
    }

    @Override
    public byte[] senderPublicKey() {
        return senderPublicKey.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof WrappedKeyEntry)) { return false; }
        WrappedKeyEntry that = (WrappedKeyEntry) other;
        return recipientId.equals(that.recipientId)
                && Arrays.equals(wrappedKey, that.wrappedKey)
                && Arrays.equals(nonce, that.nonce)
                && Arrays.equals(senderPublicKey, that.senderPublicKey);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(recipientId);
        result = 31 * result + Arrays.hashCode(wrappedKey);
        result = 31 * result + Arrays.hashCode(nonce);
        result = 31 * result + Arrays.hashCode(senderPublicKey);
        return result;
    }

    @Override
    public String toString() {
        return "WrappedKeyEntry{" +
                "recipientId='" + recipientId + '\'' +
                ", senderPublicKey=" + Utils.hex(senderPublicKey) +
                '}';
    }
}
