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
 * Distinct failure outcomes of the protection protocols. Each kind has a fixed user-facing message that never
 * includes plaintext, key material or other details of the failure, so outer layers (CLI, HTTP) can report
 * errors without creating an oracle.
 */
public enum ErrorKind {
    STRUCTURAL("The document or record is malformed"),
    AUTH_FAILURE("The protected content failed authentication"),
    UNWRAP_FAILURE("The wrapped key could not be opened with the supplied key"),
    HASH_MISMATCH("The content does not match its recorded hash"),
    SIGNATURE_INVALID("A signature failed to verify"),
    ACCESS_DENIED("No key grant exists for the requesting party"),
    NOT_FOUND("The referenced party, document or share does not exist"),
    MALFORMED_KEY("A supplied key is malformed or of the wrong type");

    private final String userMessage;

    ErrorKind(String userMessage) {
        this.userMessage = userMessage;
    }

    public String userMessage() {
        return userMessage;
    }
}
