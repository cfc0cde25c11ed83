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

import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainofproduct.AuthFailureException;

/**
 * AES-256-GCM with a 96-bit nonce and a 128-bit tag. The tag is returned separately from the ciphertext.
 */
final class AesGcm {
    private static final Logger logger = LoggerFactory.getLogger(AesGcm.class);
    private static final String ALGORITHM = "AES/GCM/NoPadding";
    static final int KEY_SIZE = 32;
    static final int NONCE_SIZE = 12;
    static final int TAG_SIZE = 16;

    private static final ThreadLocal<Cipher> CIPHER_THREAD_LOCAL =
            ThreadLocal.withInitial(() -> {
                try {
                    return Cipher.getInstance(ALGORITHM);
                } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
                    throw new AssertionError("JVM doesn't support AES/GCM encryption", e);
                }
            });

    static SealedBox encrypt(SecretKey key, byte[] nonce, byte[] plaintext, byte[] associatedData) {
        checkKey(key);
        Utils.require(nonce.length == NONCE_SIZE, "Nonce must be " + NONCE_SIZE + " bytes");
        var cipher = CIPHER_THREAD_LOCAL.get();
        try {
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_SIZE * 8, nonce));
            cipher.updateAAD(associatedData);
            var output = cipher.doFinal(plaintext);
            int split = output.length - TAG_SIZE;
            return new SealedBox(Arrays.copyOf(output, split), Arrays.copyOfRange(output, split, output.length));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    static byte[] decrypt(SecretKey key, byte[] nonce, byte[] ciphertext, byte[] tag, byte[] associatedData)
            throws AuthFailureException {
        checkKey(key);
        if (nonce.length != NONCE_SIZE || tag.length != TAG_SIZE) {
            logger.debug("Rejecting AEAD input: nonce length {}, tag length {}", nonce.length, tag.length);
            throw new AuthFailureException("Invalid nonce or tag length");
        }
        var cipher = CIPHER_THREAD_LOCAL.get();
        try {
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_SIZE * 8, nonce));
            cipher.updateAAD(associatedData);
            return cipher.doFinal(Utils.concat(ciphertext, tag));
        } catch (AEADBadTagException e) {
            throw new AuthFailureException("Authentication tag does not verify", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption failed", e);
        }
    }

    private static void checkKey(SecretKey key) {
        Utils.require(!key.isDestroyed(), "Key has been destroyed");
        Utils.require("AES".equalsIgnoreCase(key.getAlgorithm()), "Not an AES key");
        Utils.require("RAW".equalsIgnoreCase(key.getFormat()), "Key is not RAW format");
    }

    private AesGcm() {}
}
