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

/**
 * The outcome of checking one share record against a transaction.
 *
 * @param shareId the share record identifier.
 * @param fromId the party that issued the share.
 * @param signatureValid whether the share's signature verifies under the issuer's registered signing key.
 * @param hashBound whether the share is bound to the content hash recorded in the transaction.
 */
public record ShareCheck(String shareId, String fromId, boolean signatureValid, boolean hashBound) {
    public boolean isValid() {
        return signatureValid && hashBound;
    }
}
