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

/**
 * The output of AEAD encryption: the ciphertext and the detached authentication tag.
 */
public record SealedBox(byte[] ciphertext, byte[] tag) {
    public SealedBox {
        requireNonNull(ciphertext, "ciphertext");
        requireNonNull(tag, "tag");
    }
}
