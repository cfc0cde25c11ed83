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

import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainofproduct.crypto.DestroyableSecretKey;
import io.chainofproduct.crypto.KdfPurpose;
import io.chainofproduct.crypto.KeyWrapEngine;
import io.chainofproduct.crypto.Primitives;
import io.chainofproduct.crypto.WrappedKeyEntry;

/**
 * Resolves a party's access to a content key, either through its own key wrap or through a share record, and
 * issues new share records. Shared by the whole-document and layered protocols.
 */
final class KeyAccess {
    private static final Logger logger = LoggerFactory.getLogger(KeyAccess.class);

    /**
     * Describes the content a key protects: the document, the section (null for a whole document), the content
     * hash recorded for it and the direct key wraps.
     */
    static final class Target {
        final String docId;
        final String section;
        final byte[] contentHash;
        final Map<String, WrappedKeyEntry> keyWraps;

        Target(String docId, String section, byte[] contentHash, Map<String, WrappedKeyEntry> keyWraps) {
            this.docId = requireNonNull(docId, "docId");
            this.section = section;
            this.contentHash = requireNonNull(contentHash, "contentHash");
            this.keyWraps = requireNonNull(keyWraps, "keyWraps");
        }

        String sectionBinding() {
            return section == null ? "" : section;
        }

        String describe() {
            return section == null ? "document " + docId : "section '" + section + "' of document " + docId;
        }
    }

    private KeyAccess() {}

    /**
     * Opens the content key of the target for the given party.
     *
     * @param share a share record to fall back on if the party has no key wrap of its own, or null.
     * @param registry used to look up the discloser's signing key when a share record is used. May be null if no
     *                 share record is given.
     * @throws AccessDeniedException if the party has no key wrap and no share record applies to it.
     * @throws SignatureInvalidException if the share record's signature does not verify.
     * @throws UnwrapFailureException if the key wrap cannot be opened with the given private key.
     * @throws NotFoundException if the share's discloser is unknown to the registry.
     */
    static DestroyableSecretKey open(Target target, String partyId, PrivateKey encryptionKey, ShareRecord share,
            KeyRegistry registry) throws ProtectionException {
        requireNonNull(partyId, "partyId");
        requireNonNull(encryptionKey, "encryptionKey");

        var direct = target.keyWraps.get(partyId);
        if (direct != null) {
            logger.debug("Party {} opening {} via its own key wrap", partyId, target.describe());
            return KeyWrapEngine.unwrapFrom(direct, encryptionKey, KdfPurpose.CONTENT_KEY_WRAP, target.docId,
                    target.sectionBinding());
        }
        if (share == null) {
            logger.debug("Party {} has no key grant for {}", partyId, target.describe());
            throw new AccessDeniedException("Party has no key wrap and no share record was supplied");
        }

        requireNonNull(registry, "A key registry is required to verify share records");
        if (!verifySignature(share, registry)) {
            throw new SignatureInvalidException("Share record signature does not verify");
        }
        if (!share.getToId().equals(partyId) || !share.getWrappedKey().recipientId().equals(partyId)) {
            throw new AccessDeniedException("Share record was issued to another party");
        }
        if (!share.getDocId().equals(target.docId)) {
            throw new AccessDeniedException("Share record is for another document");
        }
        if (!Objects.equals(share.getSection().orElse(null), target.section)) {
            throw new AccessDeniedException("Share record does not cover the requested content");
        }
        if (!Primitives.equal(share.getContentHash(), target.contentHash)) {
            throw new AccessDeniedException("Share record is bound to different content");
        }
        logger.debug("Party {} opening {} via share {} from {}", partyId, target.describe(), share.getShareId(),
                share.getFromId());
        return KeyWrapEngine.unwrapFrom(share.getWrappedKey(), encryptionKey, KdfPurpose.SHARE_KEY_WRAP,
                target.docId, target.sectionBinding());
    }

    /**
     * Wraps an already opened content key for a new recipient and signs the resulting share record.
     */
    static ShareRecord issue(Target target, DestroyableSecretKey contentKey, String fromId, PrivateKey signingKey,
            String toId, PublicKey recipientEncryptionKey, Clock clock) throws MalformedKeyException {
        var shareId = UUID.randomUUID().toString().replace("-", "");
        var wrapped = KeyWrapEngine.wrapFor(contentKey, toId, recipientEncryptionKey, KdfPurpose.SHARE_KEY_WRAP,
                target.docId, target.sectionBinding());
        var unsigned = new ShareRecord(shareId, target.docId, target.section, fromId, toId, wrapped,
                target.contentHash, clock.instant(), new byte[0]);
        var signature = Primitives.sign(signingKey, unsigned.signedHash());
        logger.info("Party {} shared {} with {} (share {})", fromId, target.describe(), toId, shareId);
        return unsigned.withSignature(signature);
    }

    static boolean verifySignature(ShareRecord share, KeyRegistry registry) throws NotFoundException {
        var discloser = registry.getPublicKeys(share.getFromId());
        var valid = Primitives.verify(discloser.signingPublicKey(), share.signedHash(), share.getSignature());
        if (!valid) {
            logger.debug("Signature on share {} from {} does not verify", share.getShareId(), share.getFromId());
        }
        return valid;
    }

    /**
     * Checks a share record against the content hash recorded for the document or section it names.
     */
    static ShareCheck check(ShareRecord share, String docId, byte[] recordedHash, KeyRegistry registry)
            throws NotFoundException {
        var signatureValid = verifySignature(share, registry);
        var hashBound = share.getDocId().equals(docId) && recordedHash != null
                && Primitives.equal(share.getContentHash(), recordedHash);
        return new ShareCheck(share.getShareId(), share.getFromId(), signatureValid, hashBound);
    }
}
