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

import java.security.MessageDigest;

import javax.crypto.SecretKey;

/**
 * A symmetric key whose {@link #destroy()} wipes the key material. Content keys, wrap keys and HKDF pseudorandom
 * keys are all held in instances of this class and closed as soon as the protocol step that needs them completes.
 * Once destroyed, any attempt to read, compare or hash the key fails with {@link IllegalStateException}.
 */
public final class DestroyableSecretKey implements SecretKey, AutoCloseable {
    private static final long serialVersionUID = 1L;

    private final String algorithm;
    private final byte[] keyMaterial;
    private volatile boolean destroyed;

    DestroyableSecretKey(String algorithm, byte[] keyMaterial) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.keyMaterial = requireNonNull(keyMaterial, "keyMaterial").clone();
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        checkDestroyed();
        return keyMaterial.clone();
    }

    @Override
    public void destroy() {
        if (!destroyed) {
            destroyed = true;
            Utils.wipe(keyMaterial);
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Same as {@link #destroy()}.
     */
    @Override
    public void close() {
        destroy();
    }

    @Override
    public boolean equals(Object other) {
        checkDestroyed();
        if (this == other) {
            return true;
        }
        if (!(other instanceof DestroyableSecretKey that) || that.destroyed) {
            return false;
        }
        return algorithm.equals(that.algorithm) && MessageDigest.isEqual(keyMaterial, that.keyMaterial);
    }

    /**
     * Derived from the algorithm and key length only, so that hashing a key never exposes anything about the key
     * material.
     */
    @Override
    public int hashCode() {
        checkDestroyed();
        return 31 * algorithm.hashCode() + keyMaterial.length;
    }

    @Override
    public String toString() {
        return algorithm + " key (" + keyMaterial.length + " bytes" + (destroyed ? ", destroyed)" : ")");
    }

    private void checkDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Key has been destroyed");
        }
    }
}
