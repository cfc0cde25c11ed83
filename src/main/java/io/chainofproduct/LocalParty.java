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

import java.security.KeyPair;
import java.security.PrivateKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainofproduct.crypto.Primitives;

/**
 * A party whose key pairs are generated and held in memory. Suitable for tests and for embedding applications
 * that manage key persistence themselves.
 */
public final class LocalParty implements KeyVault {
    private static final Logger logger = LoggerFactory.getLogger(LocalParty.class);

    private final String partyId;
    private final KeyPair signingKeys;
    private final KeyPair encryptionKeys;

    public LocalParty(String partyId, KeyPair signingKeys, KeyPair encryptionKeys) {
        this.partyId = requireNonNull(partyId, "partyId");
        this.signingKeys = requireNonNull(signingKeys, "signingKeys");
        this.encryptionKeys = requireNonNull(encryptionKeys, "encryptionKeys");
    }

    /**
     * Generates fresh Ed25519 and X25519 key pairs for a new party.
     */
    public static LocalParty generate(String partyId) {
        logger.debug("Generating keys for party {}", partyId);
        return new LocalParty(partyId, Primitives.generateSigningKeyPair(), Primitives.generateEncryptionKeyPair());
    }

    @Override
    public String getPartyId() {
        return partyId;
    }

    @Override
    public PrivateKey getSigningKey() {
        return signingKeys.getPrivate();
    }

    @Override
    public PrivateKey getEncryptionKey() {
        return encryptionKeys.getPrivate();
    }

    public PartyKeys publicKeys() {
        return new PartyKeys(partyId, signingKeys.getPublic(), encryptionKeys.getPublic());
    }

    @Override
    public String toString() {
        return "LocalParty{partyId='" + partyId + "'}";
    }
}
