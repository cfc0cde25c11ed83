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

import java.util.List;

/**
 * The result of verifying the signatures on a protected transaction, using public material only.
 *
 * @param seller the status of the seller's signature.
 * @param buyer the status of the buyer's counter-signature.
 * @param shares the results of checking any share records that were supplied.
 */
public record VerificationResult(SignatureStatus seller, SignatureStatus buyer, List<ShareCheck> shares) {
    public VerificationResult {
        requireNonNull(seller, "seller");
        requireNonNull(buyer, "buyer");
        shares = List.copyOf(shares);
    }

    public boolean sellerOk() {
        return seller == SignatureStatus.VALID;
    }

    public boolean buyerOk() {
        return buyer == SignatureStatus.VALID;
    }

    /**
     * Returns true if every signature present is valid, the seller's signature is present and every share record
     * checks out.
     */
    public boolean isValid() {
        return sellerOk() && buyer != SignatureStatus.INVALID && shares.stream().allMatch(ShareCheck::isValid);
    }
}
