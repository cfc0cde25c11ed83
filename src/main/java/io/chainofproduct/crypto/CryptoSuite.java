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

import java.util.Optional;

/**
 * Names the set of algorithms used to protect a record. The identifier is written into every record so that a
 * reader can refuse records produced with algorithms it does not implement.
 */
public abstract class CryptoSuite {
    public static final CryptoSuite COP_V1 = new CryptoSuite() {
        @Override
        public String identifier() {
            return "COP-v1";
        }

        @Override
        public String hash() {
            return "SHA-256";
        }

        @Override
        public String aead() {
            return "AES-256-GCM";
        }

        @Override
        public String keyWrap() {
            return "X25519-HKDF-SHA256-A256GCM";
        }

        @Override
        public String signature() {
            return "Ed25519";
        }
    };

    public abstract String identifier();
    public abstract String hash();
    public abstract String aead();
    public abstract String keyWrap();
    public abstract String signature();

    private CryptoSuite() {}

    public static Optional<CryptoSuite> forIdentifier(String identifier) {
        return COP_V1.identifier().equals(identifier) ? Optional.of(COP_V1) : Optional.empty();
    }

    @Override
    public final int hashCode() {
        return identifier().hashCode();
    }

    @Override
    public final boolean equals(Object obj) {
        return obj instanceof CryptoSuite that && this.identifier().equals(that.identifier());
    }

    @Override
    public final String toString() {
        return identifier();
    }
}
