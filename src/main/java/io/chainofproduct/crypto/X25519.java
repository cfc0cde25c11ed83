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

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.XECPrivateKey;
import java.security.interfaces.XECPublicKey;

import io.chainofproduct.MalformedKeyException;
import software.pando.crypto.nacl.CryptoBox;
import software.pando.crypto.nacl.Subtle;

final class X25519 {
    static final int PK_SIZE = 32;

    static byte[] compute(PrivateKey privateKey, PublicKey publicKey) throws MalformedKeyException {
        if (!(privateKey instanceof XECPrivateKey) || !(publicKey instanceof XECPublicKey)) {
            throw new MalformedKeyException("Not an X25519 key");
        }
        byte[] secret;
        try {
            secret = Subtle.scalarMultiplication(privateKey, publicKey);
        } catch (IllegalArgumentException e) {
            throw new MalformedKeyException("X25519 key agreement failed", e);
        }
        if (Utils.allZero(secret)) {
            // Low-order public key
            throw new MalformedKeyException("X25519 key agreement produced an all-zero secret");
        }
        return secret;
    }

    static KeyPair generateKeyPair() {
        return CryptoBox.keyPair();
    }

    static byte[] serializePublicKey(PublicKey pk) throws MalformedKeyException {
        if (!(pk instanceof XECPublicKey)) {
            throw new MalformedKeyException("Public key has wrong algorithm: " + pk.getAlgorithm());
        }
        return Utils.toUnsignedLittleEndian(((XECPublicKey) pk).getU(), PK_SIZE);
    }

    static PublicKey deserializePublicKey(byte[] encoded) throws MalformedKeyException {
        if (encoded == null || encoded.length != PK_SIZE) {
            throw new MalformedKeyException("X25519 public keys must be " + PK_SIZE + " bytes");
        }
        try {
            return CryptoBox.publicKey(encoded);
        } catch (IllegalArgumentException e) {
            throw new MalformedKeyException("Invalid X25519 public key", e);
        }
    }

    private X25519() {}
}
