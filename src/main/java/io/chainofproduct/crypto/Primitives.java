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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.security.KeyPair;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Arrays;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainofproduct.AuthFailureException;
import io.chainofproduct.MalformedKeyException;
import software.pando.crypto.nacl.Bytes;
import software.pando.crypto.nacl.Crypto;

/**
 * The cryptographic primitives used by the protocols. Every method is a pure function of its arguments: no keys
 * are stored, and callers own (and should destroy) any key returned.
 * <p>
 * The algorithms are those of {@link CryptoSuite#COP_V1}:
 * <ul>
 *     <li>Hash: SHA-256.</li>
 *     <li>AEAD: AES-256-GCM with a random 96-bit nonce and a detached 128-bit tag.</li>
 *     <li>Key agreement: X25519.</li>
 *     <li>KDF: HKDF-SHA-256, with a fixed salt derived from the suite identifier and the {@link KdfPurpose}
 *     label prefixed to the context.</li>
 *     <li>Signatures: Ed25519 over a message hash.</li>
 * </ul>
 */
public final class Primitives {
    private static final Logger logger = LoggerFactory.getLogger(Primitives.class);

    public static final int CONTENT_KEY_SIZE = AesGcm.KEY_SIZE;
    public static final int NONCE_SIZE = AesGcm.NONCE_SIZE;
    public static final int TAG_SIZE = AesGcm.TAG_SIZE;
    public static final int HASH_SIZE = 32;
    public static final String CONTENT_KEY_ALGORITHM = "AES";

    private static final byte[] KDF_SALT =
            Arrays.copyOf(Crypto.hash(("ChainOfProduct-" + CryptoSuite.COP_V1.identifier()).getBytes(UTF_8)), 32);

    public static DestroyableSecretKey generateContentKey() {
        var keyMaterial = Bytes.secureRandom(CONTENT_KEY_SIZE);
        try {
            return new DestroyableSecretKey(CONTENT_KEY_ALGORITHM, keyMaterial);
        } finally {
            Utils.wipe(keyMaterial);
        }
    }

    /**
     * Imports raw content key bytes, for example after unwrapping. The input array is not modified.
     *
     * @throws MalformedKeyException if the key is the wrong size or has been zeroed.
     */
    public static DestroyableSecretKey importContentKey(byte[] keyMaterial) throws MalformedKeyException {
        requireNonNull(keyMaterial, "keyMaterial");
        if (keyMaterial.length != CONTENT_KEY_SIZE) {
            throw new MalformedKeyException("Content keys must be " + CONTENT_KEY_SIZE + " bytes");
        }
        if (Utils.allZero(keyMaterial)) {
            throw new MalformedKeyException("Key material has been zeroed");
        }
        return new DestroyableSecretKey(CONTENT_KEY_ALGORITHM, keyMaterial);
    }

    public static byte[] freshNonce() {
        return Bytes.secureRandom(NONCE_SIZE);
    }

    public static SealedBox aeadEncrypt(SecretKey key, byte[] nonce, byte[] plaintext, byte[] associatedData) {
        return AesGcm.encrypt(requireNonNull(key, "key"), requireNonNull(nonce, "nonce"),
                requireNonNull(plaintext, "plaintext"), requireNonNull(associatedData, "associatedData"));
    }

    /**
     * Decrypts and authenticates a ciphertext.
     *
     * @throws AuthFailureException if the tag does not verify for this key, nonce and associated data.
     */
    public static byte[] aeadDecrypt(SecretKey key, byte[] nonce, byte[] ciphertext, byte[] tag,
            byte[] associatedData) throws AuthFailureException {
        return AesGcm.decrypt(requireNonNull(key, "key"), requireNonNull(nonce, "nonce"),
                requireNonNull(ciphertext, "ciphertext"), requireNonNull(tag, "tag"),
                requireNonNull(associatedData, "associatedData"));
    }

    public static byte[] deriveSharedSecret(PrivateKey myPrivateKey, PublicKey theirPublicKey)
            throws MalformedKeyException {
        return X25519.compute(requireNonNull(myPrivateKey, "myPrivateKey"),
                requireNonNull(theirPublicKey, "theirPublicKey"));
    }

    /**
     * Derives a 256-bit AES key from a shared secret.
     *
     * @param secret the shared secret. Not modified.
     * @param purpose what the derived key will be used for.
     * @param context additional context bound into the derivation, such as the parties' identities.
     * @return the derived key.
     */
    public static DestroyableSecretKey kdf(byte[] secret, KdfPurpose purpose, byte[] context) {
        requireNonNull(secret, "secret");
        var info = Utils.concat(purpose.labelBytes(), new byte[] { 0 }, requireNonNull(context, "context"));
        logger.trace("KDF purpose={}, context={}", purpose, Redaction.redact(context));
        var keyMaterial = HKDF.deriveKey(secret, KDF_SALT, info, CONTENT_KEY_SIZE);
        try {
            return new DestroyableSecretKey(CONTENT_KEY_ALGORITHM, keyMaterial);
        } finally {
            Utils.wipe(keyMaterial);
        }
    }

    public static byte[] sign(PrivateKey signingKey, byte[] messageHash) throws MalformedKeyException {
        return Ed25519.sign(requireNonNull(signingKey, "signingKey"), requireNonNull(messageHash, "messageHash"));
    }

    /**
     * Verifies a signature. Malformed signatures and keys of the wrong type fail verification rather than
     * throwing.
     */
    public static boolean verify(PublicKey verificationKey, byte[] messageHash, byte[] signature) {
        return Ed25519.verify(requireNonNull(verificationKey, "verificationKey"),
                requireNonNull(messageHash, "messageHash"), signature);
    }

    public static byte[] hash(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("JVM doesn't support SHA-256", e);
        }
    }

    /** Constant-time comparison of two hashes, tags or keys. */
    public static boolean equal(byte[] a, byte[] b) {
        return a != null && b != null && Bytes.equal(a, b);
    }

    public static KeyPair generateEncryptionKeyPair() {
        return X25519.generateKeyPair();
    }

    public static KeyPair generateSigningKeyPair() {
        return Ed25519.generateKeyPair();
    }

    public static byte[] encodeEncryptionPublicKey(PublicKey publicKey) throws MalformedKeyException {
        return X25519.serializePublicKey(requireNonNull(publicKey, "publicKey"));
    }

    public static PublicKey decodeEncryptionPublicKey(byte[] encoded) throws MalformedKeyException {
        return X25519.deserializePublicKey(encoded);
    }

    public static byte[] encodeSigningPublicKey(PublicKey publicKey) throws MalformedKeyException {
        return Ed25519.serializePublicKey(requireNonNull(publicKey, "publicKey"));
    }

    public static PublicKey decodeSigningPublicKey(byte[] encoded) throws MalformedKeyException {
        return Ed25519.deserializePublicKey(requireNonNull(encoded, "encoded"));
    }

    private Primitives() {}
}
