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
 * Thrown when a signature does not verify against the claimed public key.
 */
public final class SignatureInvalidException extends ProtectionException {

    public SignatureInvalidException(String message) {
        super(ErrorKind.SIGNATURE_INVALID, message);
    }

    public SignatureInvalidException(String message, Throwable cause) {
        super(ErrorKind.SIGNATURE_INVALID, message, cause);
    }
}
