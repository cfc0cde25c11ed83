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

import static io.chainofproduct.crypto.Utils.allZero;

import java.security.InvalidKeyException;
import java.security.Key;
import java.security.NoSuchAlgorithmException;

import javax.crypto.Mac;

/**
 * HKDF with HMAC-SHA-256, as specified in <a href="https://datatracker.ietf.org/doc/html/rfc5869">RFC 5869</a>.
 */
final class HKDF {
    static final String HMAC_ALGORITHM = "HmacSHA256";
    static final int HMAC_TAG_SIZE_BYTES = 32;

    static DestroyableSecretKey extract(byte[] inputKeyMaterial, byte[] salt) {
        return hmacKey(hmac(hmacKey(salt.clone()), inputKeyMaterial));
    }

    static byte[] expand(Key prk, byte[] context, int outputKeySizeBytes) {
        if (outputKeySizeBytes <= 0 || outputKeySizeBytes > 255 * HMAC_TAG_SIZE_BYTES) {
            throw new IllegalArgumentException("Output size must be >= 1 and <= " + 255 * HMAC_TAG_SIZE_BYTES);
        }
        byte[] last = new byte[0];
        byte[] counter = new byte[1];
        byte[] output = new byte[outputKeySizeBytes];
        for (int i = 0; i < outputKeySizeBytes; i += HMAC_TAG_SIZE_BYTES) {
            counter[0]++;
            var previous = last;
            last = hmac(prk, previous, context, counter);
            Utils.wipe(previous);
            System.arraycopy(last, 0, output, i, Math.min(outputKeySizeBytes - i, HMAC_TAG_SIZE_BYTES));
        }
        Utils.wipe(last);
        return output;
    }

    static byte[] deriveKey(byte[] inputKeyMaterial, byte[] salt, byte[] context, int outputKeySizeBytes) {
        try (var prk = extract(inputKeyMaterial, salt)) {
            return expand(prk, context, outputKeySizeBytes);
        }
    }

    static byte[] hmac(Key key, byte[]... data) {
        try {
            assert !allZero(key.getEncoded());
            var hmac = Mac.getInstance(HMAC_ALGORITHM);
            hmac.init(key);
            for (byte[] block : data) {
                hmac.update(block);
            }
            return hmac.doFinal();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static DestroyableSecretKey hmacKey(byte[] keyData) {
        try {
            return new DestroyableSecretKey(HMAC_ALGORITHM, keyData);
        } finally {
            Utils.wipe(keyData);
        }
    }

    private HKDF() {}
}
