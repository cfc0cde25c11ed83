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
 * Thrown when a wrapped key entry cannot be opened with the supplied private key: it was wrapped for somebody
 * else, for another document or section, or has been tampered with.
 */
public final class UnwrapFailureException extends AuthFailureException {

    public UnwrapFailureException(String message) {
        super(ErrorKind.UNWRAP_FAILURE, message, null);
    }

    public UnwrapFailureException(String message, Throwable cause) {
        super(ErrorKind.UNWRAP_FAILURE, message, cause);
    }
}
