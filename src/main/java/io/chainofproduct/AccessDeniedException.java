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
 * Thrown when a party has neither a direct key wrap nor a valid, matching share record.
 */
public final class AccessDeniedException extends ProtectionException {

    public AccessDeniedException(String message) {
        super(ErrorKind.ACCESS_DENIED, message);
    }

    public AccessDeniedException(String message, Throwable cause) {
        super(ErrorKind.ACCESS_DENIED, message, cause);
    }
}
