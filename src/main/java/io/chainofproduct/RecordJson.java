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

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.TreeMap;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

import io.chainofproduct.crypto.CryptoSuite;
import io.chainofproduct.crypto.WrappedKeyEntry;
import io.chainofproduct.io.Base64url;

/**
 * JSON encoding of protected records, as stored by the relay service. Binary fields are URL-safe base64 without
 * padding and timestamps are ISO-8601 instants. Decoding checks structure only; integrity is checked by the
 * protocols when a record is opened or verified.
 */
public final class RecordJson {
    private static final String DOC_ID = "doc_id";
    private static final String SELLER_ID = "seller_id";
    private static final String BUYER_ID = "buyer_id";
    private static final String CIPHERTEXT = "ciphertext";
    private static final String NONCE = "nonce";
    private static final String TAG = "tag";
    private static final String KEY_WRAPS = "key_wraps";
    private static final String CONTENT_HASH = "content_hash";
    private static final String AGGREGATE_HASH = "aggregate_hash";
    private static final String SECTIONS = "sections";
    private static final String SIG_SELLER = "sig_seller";
    private static final String SIG_BUYER = "sig_buyer";
    private static final String CREATED_AT = "created_at";
    private static final String META = "meta";
    private static final String SUITE = "suite";
    private static final String WRAPPED_KEY = "wrapped_key";
    private static final String EPK = "epk";
    private static final String RECIPIENT_ID = "recipient_id";

    private RecordJson() {}

    public static String toJson(ProtectedTransaction transaction) {
        var json = new JsonObject();
        json.put(DOC_ID, transaction.getDocId());
        json.put(SELLER_ID, transaction.getSellerId());
        json.put(BUYER_ID, transaction.getBuyerId());
        json.put(CIPHERTEXT, Base64url.encode(transaction.getCiphertext()));
        json.put(NONCE, Base64url.encode(transaction.getNonce()));
        json.put(TAG, Base64url.encode(transaction.getAuthTag()));
        json.put(KEY_WRAPS, keyWrapsToJson(transaction.getKeyWraps()));
        json.put(CONTENT_HASH, Base64url.encode(transaction.getContentHash()));
        json.put(SIG_SELLER, Base64url.encode(transaction.getSigSeller()));
        transaction.getSigBuyer().ifPresent(sig -> json.put(SIG_BUYER, Base64url.encode(sig)));
        json.put(CREATED_AT, transaction.getCreatedAt().toString());
        json.put(META, meta(transaction.getSuite(), false));
        return JsonWriter.string(json);
    }

    public static ProtectedTransaction parseTransaction(String jsonString) throws StructuralException {
        var json = parse(jsonString);
        var builder = ProtectedTransaction.builder()
                .docId(string(json, DOC_ID))
                .parties(string(json, SELLER_ID), string(json, BUYER_ID))
                .ciphertext(bytes(json, CIPHERTEXT), bytes(json, NONCE), bytes(json, TAG))
                .contentHash(bytes(json, CONTENT_HASH))
                .sigSeller(bytes(json, SIG_SELLER))
                .sigBuyer(optionalBytes(json, SIG_BUYER))
                .createdAt(instant(json, CREATED_AT))
                .suite(suite(json));
        keyWrapsFromJson(object(json, KEY_WRAPS)).values().forEach(builder::keyWrap);
        return builder.build();
    }

    public static String toJson(LayeredProtectedTransaction transaction) {
        var json = new JsonObject();
        json.put(DOC_ID, transaction.getDocId());
        json.put(SELLER_ID, transaction.getSellerId());
        json.put(BUYER_ID, transaction.getBuyerId());
        var sections = new JsonObject();
        transaction.getSections().forEach((name, section) -> {
            var sectionJson = new JsonObject();
            sectionJson.put(CIPHERTEXT, Base64url.encode(section.getCiphertext()));
            sectionJson.put(NONCE, Base64url.encode(section.getNonce()));
            sectionJson.put(TAG, Base64url.encode(section.getAuthTag()));
            sectionJson.put(CONTENT_HASH, Base64url.encode(section.getContentHash()));
            sectionJson.put(KEY_WRAPS, keyWrapsToJson(section.getKeyWraps()));
            sections.put(name, sectionJson);
        });
        json.put(SECTIONS, sections);
        json.put(AGGREGATE_HASH, Base64url.encode(transaction.getAggregateHash()));
        json.put(SIG_SELLER, Base64url.encode(transaction.getSigSeller()));
        transaction.getSigBuyer().ifPresent(sig -> json.put(SIG_BUYER, Base64url.encode(sig)));
        json.put(CREATED_AT, transaction.getCreatedAt().toString());
        json.put(META, meta(transaction.getSuite(), true));
        return JsonWriter.string(json);
    }

    public static LayeredProtectedTransaction parseLayeredTransaction(String jsonString)
            throws StructuralException {
        var json = parse(jsonString);
        var sections = new TreeMap<String, ProtectedSection>();
        for (var entry : object(json, SECTIONS).entrySet()) {
            if (!(entry.getValue() instanceof JsonObject)) {
                throw new StructuralException("Section '" + entry.getKey() + "' is not an object");
            }
            var sectionJson = (JsonObject) entry.getValue();
            sections.put(entry.getKey(), new ProtectedSection(bytes(sectionJson, CIPHERTEXT),
                    bytes(sectionJson, NONCE), bytes(sectionJson, TAG), bytes(sectionJson, CONTENT_HASH),
                    keyWrapsFromJson(object(sectionJson, KEY_WRAPS))));
        }
        if (sections.isEmpty()) {
            throw new StructuralException("Layered record has no sections");
        }
        return new LayeredProtectedTransaction(string(json, DOC_ID), string(json, SELLER_ID),
                string(json, BUYER_ID), sections, bytes(json, AGGREGATE_HASH), bytes(json, SIG_SELLER),
                optionalBytes(json, SIG_BUYER), instant(json, CREATED_AT), suite(json));
    }

    public static String toJson(ShareRecord share) {
        var json = new JsonObject();
        json.put("share_id", share.getShareId());
        json.put(DOC_ID, share.getDocId());
        share.getSection().ifPresent(section -> json.put("section", section));
        json.put("from_id", share.getFromId());
        json.put("to_id", share.getToId());
        var wrapped = keyWrapToJson(share.getWrappedKey());
        wrapped.put(RECIPIENT_ID, share.getWrappedKey().recipientId());
        json.put(WRAPPED_KEY, wrapped);
        json.put(CONTENT_HASH, Base64url.encode(share.getContentHash()));
        json.put("timestamp", share.getTimestamp().toString());
        json.put("signature", Base64url.encode(share.getSignature()));
        return JsonWriter.string(json);
    }

    public static ShareRecord parseShareRecord(String jsonString) throws StructuralException {
        var json = parse(jsonString);
        var wrappedJson = object(json, WRAPPED_KEY);
        var section = json.get("section");
        if (section != null && !(section instanceof String)) {
            throw new StructuralException("Field 'section' must be a string");
        }
        return new ShareRecord(string(json, "share_id"), string(json, DOC_ID), (String) section,
                string(json, "from_id"), string(json, "to_id"),
                keyWrapFromJson(string(wrappedJson, RECIPIENT_ID), wrappedJson),
                bytes(json, CONTENT_HASH), instant(json, "timestamp"), bytes(json, "signature"));
    }

    private static JsonObject meta(CryptoSuite suite, boolean layered) {
        return JsonObject.builder()
                .value(SUITE, suite.identifier())
                .value("hash", suite.hash())
                .value("aead", suite.aead())
                .value("key_wrap", suite.keyWrap())
                .value("sig", suite.signature())
                .value("layered", layered)
                .done();
    }

    private static CryptoSuite suite(JsonObject json) throws StructuralException {
        var identifier = string(object(json, META), SUITE);
        return CryptoSuite.forIdentifier(identifier)
                .orElseThrow(() -> new StructuralException("Unsupported suite '" + identifier + "'"));
    }

    private static JsonObject keyWrapsToJson(Map<String, WrappedKeyEntry> keyWraps) {
        var json = new JsonObject();
        keyWraps.forEach((recipientId, entry) -> json.put(recipientId, keyWrapToJson(entry)));
        return json;
    }

    private static JsonObject keyWrapToJson(WrappedKeyEntry entry) {
        var json = new JsonObject();
        json.put(WRAPPED_KEY, Base64url.encode(entry.wrappedKey()));
        json.put(NONCE, Base64url.encode(entry.nonce()));
        json.put(EPK, Base64url.encode(entry.senderPublicKey()));
        return json;
    }

    private static Map<String, WrappedKeyEntry> keyWrapsFromJson(JsonObject json) throws StructuralException {
        var result = new TreeMap<String, WrappedKeyEntry>();
        for (var entry : json.entrySet()) {
            if (!(entry.getValue() instanceof JsonObject)) {
                throw new StructuralException("Key wrap entry is not an object");
            }
            result.put(entry.getKey(), keyWrapFromJson(entry.getKey(), (JsonObject) entry.getValue()));
        }
        if (result.isEmpty()) {
            throw new StructuralException("Record has no key wraps");
        }
        return result;
    }

    private static WrappedKeyEntry keyWrapFromJson(String recipientId, JsonObject json) throws StructuralException {
        return new WrappedKeyEntry(recipientId, bytes(json, WRAPPED_KEY), bytes(json, NONCE), bytes(json, EPK));
    }

    private static JsonObject parse(String jsonString) throws StructuralException {
        try {
            return JsonParser.object().from(jsonString);
        } catch (JsonParserException e) {
            throw new StructuralException("Record is not a JSON object", e);
        }
    }

    private static JsonObject object(JsonObject json, String field) throws StructuralException {
        var value = json.get(field);
        if (!(value instanceof JsonObject)) {
            throw new StructuralException("Missing or invalid object field '" + field + "'");
        }
        return (JsonObject) value;
    }

    private static String string(JsonObject json, String field) throws StructuralException {
        var value = json.get(field);
        if (!(value instanceof String)) {
            throw new StructuralException("Missing or invalid string field '" + field + "'");
        }
        return (String) value;
    }

    private static byte[] bytes(JsonObject json, String field) throws StructuralException {
        return Base64url.decode(string(json, field), field);
    }

    private static byte[] optionalBytes(JsonObject json, String field) throws StructuralException {
        return json.get(field) == null ? null : bytes(json, field);
    }

    private static Instant instant(JsonObject json, String field) throws StructuralException {
        try {
            return Instant.parse(string(json, field));
        } catch (DateTimeParseException e) {
            throw new StructuralException("Field '" + field + "' is not an ISO-8601 instant", e);
        }
    }
}
