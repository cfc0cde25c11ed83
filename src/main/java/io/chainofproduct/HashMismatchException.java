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
 * Thrown when a recomputed content or aggregate hash disagrees with the recorded one.
 */
public final class HashMismatchException extends ProtectionException {

    public HashMismatchException(String message) {
        super(ErrorKind.HASH_MISMATCH, message);
    }

    public HashMismatchException(String message, Throwable cause) {
        super(ErrorKind.HASH_MISMATCH, message, cause);
    }
}
