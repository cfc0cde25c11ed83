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

import java.security.PublicKey;

import com.grack.nanojson.JsonObject;

import io.chainofproduct.crypto.Primitives;
import io.chainofproduct.io.Base64url;

/**
 * The public keys of a party, as published through a {@link KeyRegistry}.
 *
 * @param id the party identifier.
 * @param signingPublicKey the party's Ed25519 public key, used to verify its signatures.
 * @param encryptionPublicKey the party's X25519 public key, used to wrap content keys for it.
 */
public record PartyKeys(String id, PublicKey signingPublicKey, PublicKey encryptionPublicKey) {
    public PartyKeys {
        requireNonNull(id, "id");
        requireNonNull(signingPublicKey, "signingPublicKey");
        requireNonNull(encryptionPublicKey, "encryptionPublicKey");
    }

    public JsonObject toJson() throws MalformedKeyException {
        return JsonObject.builder()
                .value("id", id)
                .value("sig", Base64url.encode(Primitives.encodeSigningPublicKey(signingPublicKey)))
                .value("enc", Base64url.encode(Primitives.encodeEncryptionPublicKey(encryptionPublicKey)))
                .done();
    }

    public static PartyKeys fromJson(JsonObject json) throws StructuralException, MalformedKeyException {
        var id = json.getString("id");
        if (id == null) {
            throw new StructuralException("Party keys have no id");
        }
        return new PartyKeys(id,
                Primitives.decodeSigningPublicKey(Base64url.decode(json.getString("sig"), "sig")),
                Primitives.decodeEncryptionPublicKey(Base64url.decode(json.getString("enc"), "enc")));
    }

    @Override
    public String toString() {
        return "PartyKeys{id='" + id + "'}";
    }
}
