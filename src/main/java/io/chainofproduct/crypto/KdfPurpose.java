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

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Domain separation labels for key derivation. Keys derived for one purpose never equal keys derived for
 * another from the same shared secret.
 */
public enum KdfPurpose {
    /** Wrapping a content key for the seller or buyer of a transaction. */
    CONTENT_KEY_WRAP("cop-key-wrap"),
    /** Wrapping a content key for a third party named in a share record. */
    SHARE_KEY_WRAP("cop-share-wrap");

    private final String label;

    KdfPurpose(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    byte[] labelBytes() {
        return label.getBytes(UTF_8);
    }
}
