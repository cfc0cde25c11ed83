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
 * Thrown when a key is of the wrong type or cannot be decoded.
 */
public final class MalformedKeyException extends ProtectionException {

    public MalformedKeyException(String message) {
        super(ErrorKind.MALFORMED_KEY, message);
    }

    public MalformedKeyException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_KEY, message, cause);
    }
}
