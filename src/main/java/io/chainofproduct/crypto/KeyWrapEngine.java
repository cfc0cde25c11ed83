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

import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.List;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainofproduct.AuthFailureException;
import io.chainofproduct.MalformedKeyException;
import io.chainofproduct.UnwrapFailureException;
import io.chainofproduct.io.CborWriter;

/**
 * Wraps content keys for individual recipients. Each wrap uses a fresh ephemeral X25519 key pair, so every
 * (content key, recipient) pair has its own wrap key: compromising one recipient's private key reveals nothing
 * about the copies wrapped for anybody else.
 * <p>
 * The wrap key is derived with HKDF from the X25519 shared secret, with the ephemeral public key and recipient
 * identifier as context. The content key is then encrypted with AES-GCM, authenticating the purpose, the
 * recipient identifier and a caller-supplied <em>binding</em> (the document id and section name) so that an entry
 * cannot be moved to another recipient, transaction or section.
 */
public final class KeyWrapEngine {
    private static final Logger logger = LoggerFactory.getLogger(KeyWrapEngine.class);

    /**
     * Wraps a content key for a recipient.
     *
     * @param contentKey the key to wrap. Not destroyed by this method.
     * @param recipientId the identifier of the recipient.
     * @param recipientPublicKey the recipient's X25519 public encryption key.
     * @param purpose whether this is a direct or share wrap.
     * @param binding the document id, section name and so on that this wrap is valid for.
     * @return the wrapped key.
     * @throws MalformedKeyException if the recipient's public key is not a valid X25519 key.
     */
    public static WrappedKeyEntry wrapFor(SecretKey contentKey, String recipientId, PublicKey recipientPublicKey,
            KdfPurpose purpose, String... binding) throws MalformedKeyException {
        requireNonNull(contentKey, "contentKey");
        requireNonNull(recipientId, "recipientId");
        requireNonNull(purpose, "purpose");

        var ephemeralKeys = X25519.generateKeyPair();
        var epk = X25519.serializePublicKey(ephemeralKeys.getPublic());
        byte[] sharedSecret = null;
        byte[] keyMaterial = null;
        try {
            sharedSecret = X25519.compute(ephemeralKeys.getPrivate(), requireNonNull(recipientPublicKey));
            try (var wrapKey = Primitives.kdf(sharedSecret, purpose, kdfContext(epk, recipientId))) {
                var nonce = Primitives.freshNonce();
                keyMaterial = contentKey.getEncoded();
                var sealed = AesGcm.encrypt(wrapKey, nonce, keyMaterial,
                        associatedData(purpose, recipientId, binding));
                logger.debug("Wrapped content key for recipient {} ({})", recipientId, purpose);
                return new WrappedKeyEntry(recipientId, Utils.concat(sealed.ciphertext(), sealed.tag()), nonce,
                        epk);
            }
        } finally {
            Utils.wipe(sharedSecret, keyMaterial);
            Utils.destroy(ephemeralKeys.getPrivate());
        }
    }

    /**
     * Recovers a content key from a wrapped key entry.
     *
     * @param entry the wrapped key.
     * @param privateKey the recipient's X25519 private encryption key.
     * @param purpose the purpose the entry was wrapped for.
     * @param binding the binding the entry was wrapped with.
     * @return the content key. The caller should destroy it once finished.
     * @throws UnwrapFailureException if the entry was not wrapped for this private key, purpose and binding, or
     * has been tampered with.
     */
    public static DestroyableSecretKey unwrapFrom(WrappedKeyEntry entry, PrivateKey privateKey, KdfPurpose purpose,
            String... binding) throws UnwrapFailureException {
        requireNonNull(entry, "entry");
        requireNonNull(privateKey, "privateKey");
        requireNonNull(purpose, "purpose");

        var wrapped = entry.wrappedKey();
        if (wrapped.length != Primitives.CONTENT_KEY_SIZE + Primitives.TAG_SIZE) {
            throw new UnwrapFailureException("Wrapped key has the wrong length");
        }
        byte[] sharedSecret = null;
        byte[] keyMaterial = null;
        try {
            var epk = entry.senderPublicKey();
            sharedSecret = X25519.compute(privateKey, X25519.deserializePublicKey(epk));
            try (var wrapKey = Primitives.kdf(sharedSecret, purpose, kdfContext(epk, entry.recipientId()))) {
                int split = Primitives.CONTENT_KEY_SIZE;
                keyMaterial = AesGcm.decrypt(wrapKey, entry.nonce(), Arrays.copyOf(wrapped, split),
                        Arrays.copyOfRange(wrapped, split, wrapped.length),
                        associatedData(purpose, entry.recipientId(), binding));
                return Primitives.importContentKey(keyMaterial);
            }
        } catch (MalformedKeyException | AuthFailureException e) {
            logger.debug("Unable to unwrap key for recipient {}: {}", entry.recipientId(), e.getKind());
            throw new UnwrapFailureException("Unable to unwrap content key", e);
        } finally {
            Utils.wipe(sharedSecret, keyMaterial);
        }
    }

    private static byte[] kdfContext(byte[] epk, String recipientId) {
        return CborWriter.transcript(epk, recipientId);
    }

    private static byte[] associatedData(KdfPurpose purpose, String recipientId, String... binding) {
        return CborWriter.transcript(purpose.label(), recipientId, List.of(binding));
    }

    private KeyWrapEngine() {}
}
