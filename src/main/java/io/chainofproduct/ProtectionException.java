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

/**
 * Base class of all recoverable failures reported by the protection protocols. Subclasses correspond one-to-one
 * with {@link ErrorKind}s so that callers can distinguish a tampered record from a wrong recipient or a missing
 * grant. Messages are diagnostic only and never contain plaintext or key material.
 */
public abstract class ProtectionException extends Exception {
    private final ErrorKind kind;

    protected ProtectionException(ErrorKind kind, String message) {
        super(message);
        this.kind = requireNonNull(kind, "kind");
    }

    protected ProtectionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
