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

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import io.chainofproduct.crypto.WrappedKeyEntry;

/**
 * One independently encrypted section of a {@link LayeredProtectedTransaction}.
 */
public final class ProtectedSection {
    private final byte[] ciphertext;
    private final byte[] nonce;
    private final byte[] authTag;
    private final byte[] contentHash;
    private final Map<String, WrappedKeyEntry> keyWraps;

    ProtectedSection(byte[] ciphertext, byte[] nonce, byte[] authTag, byte[] contentHash,
            Map<String, WrappedKeyEntry> keyWraps) {
        this.ciphertext = requireNonNull(ciphertext, "ciphertext").clone();
        this.nonce = requireNonNull(nonce, "nonce").clone();
        this.authTag = requireNonNull(authTag, "authTag").clone();
        this.contentHash = requireNonNull(contentHash, "contentHash").clone();
        this.keyWraps = Collections.unmodifiableMap(new TreeMap<>(keyWraps));
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

    /** The hash of the section's canonical plaintext. */
    public byte[] getContentHash() {
        return contentHash.clone();
    }

    public Map<String, WrappedKeyEntry> getKeyWraps() {
        return keyWraps;
    }

    public Optional<WrappedKeyEntry> getKeyWrap(String partyId) {
        return Optional.ofNullable(keyWraps.get(partyId));
    }

    ProtectedSection withCiphertext(byte[] ciphertext) {
        return new ProtectedSection(ciphertext, nonce, authTag, contentHash, keyWraps);
    }

    ProtectedSection withKeyWraps(Map<String, WrappedKeyEntry> keyWraps) {
        return new ProtectedSection(ciphertext, nonce, authTag, contentHash, keyWraps);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof ProtectedSection)) { return false; }
        ProtectedSection that = (ProtectedSection) other;
        return Arrays.equals(ciphertext, that.ciphertext)
                && Arrays.equals(nonce, that.nonce)
                && Arrays.equals(authTag, that.authTag)
                && Arrays.equals(contentHash, that.contentHash)
                && keyWraps.equals(that.keyWraps);
    }

    @Override
    public int hashCode() {
        int result = keyWraps.hashCode();
        result = 31 * result + Arrays.hashCode(contentHash);
        result = 31 * result + Arrays.hashCode(ciphertext);
        return result;
    }

    @Override
    public String toString() {
        return "ProtectedSection{recipients=" + keyWraps.keySet() + '}';
    }
}
