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

import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainofproduct.MalformedKeyException;

final class Ed25519 {
    private static final Logger logger = LoggerFactory.getLogger(Ed25519.class);
    private static final String ALGORITHM = "Ed25519";
    static final int SIGNATURE_SIZE = 64;

    private static final KeyPairGenerator keyPairGenerator;
    private static final KeyFactory keyFactory;

    static {
        try {
            keyPairGenerator = KeyPairGenerator.getInstance(ALGORITHM);
            keyFactory = KeyFactory.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("Ed25519 not supported", e);
        }
    }

    static KeyPair generateKeyPair() {
        synchronized (keyPairGenerator) {
            return keyPairGenerator.generateKeyPair();
        }
    }

    static byte[] sign(PrivateKey privateKey, byte[] message) throws MalformedKeyException {
        try {
            var signature = newSignature();
            signature.initSign(privateKey);
            signature.update(message);
            return signature.sign();
        } catch (InvalidKeyException e) {
            throw new MalformedKeyException("Not an Ed25519 signing key", e);
        } catch (SignatureException e) {
            throw new IllegalStateException(e);
        }
    }

    static boolean verify(PublicKey publicKey, byte[] message, byte[] signatureBytes) {
        if (signatureBytes == null || signatureBytes.length != SIGNATURE_SIZE) {
            logger.debug("Rejecting signature of wrong length");
            return false;
        }
        try {
            var signature = newSignature();
            signature.initVerify(publicKey);
            signature.update(message);
            return signature.verify(signatureBytes);
        } catch (InvalidKeyException | SignatureException e) {
            logger.debug("Signature verification failed", e);
            return false;
        }
    }

    static byte[] serializePublicKey(PublicKey publicKey) throws MalformedKeyException {
        if (!"X.509".equalsIgnoreCase(publicKey.getFormat()) || !isEdDsa(publicKey)) {
            throw new MalformedKeyException("Not an Ed25519 public key");
        }
        return publicKey.getEncoded();
    }

    static PublicKey deserializePublicKey(byte[] encoded) throws MalformedKeyException {
        try {
            synchronized (keyFactory) {
                return keyFactory.generatePublic(new X509EncodedKeySpec(encoded));
            }
        } catch (InvalidKeySpecException e) {
            throw new MalformedKeyException("Invalid Ed25519 public key", e);
        }
    }

    private static boolean isEdDsa(PublicKey publicKey) {
        return "EdDSA".equalsIgnoreCase(publicKey.getAlgorithm()) ||
                ALGORITHM.equalsIgnoreCase(publicKey.getAlgorithm());
    }

    private static Signature newSignature() {
        try {
            return Signature.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("Ed25519 not supported", e);
        }
    }

    private Ed25519() {}
}
