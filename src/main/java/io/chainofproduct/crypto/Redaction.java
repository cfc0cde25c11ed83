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

import java.security.Key;
import java.util.Arrays;

/**
 * Masks secret-bearing values before they are passed to a logger. Keys are never printed, and byte arrays are
 * reduced to their length and the first and last few bytes.
 */
public final class Redaction {

    public static Object redact(Object arg) {
        if (arg instanceof byte[]) {
            return maskForLog((byte[]) arg);
        } else if (arg instanceof Key) {
            var key = (Key) arg;
            return "<" + key.getAlgorithm() + " key>";
        } else {
            return arg;
        }
    }

    private static String maskForLog(byte[] secret) {
        if (secret.length < 16) {
            return "<redacted " + secret.length + " bytes>";
        }
        return Utils.hex(Arrays.copyOf(secret, 3)) + "..." +
                Utils.hex(Arrays.copyOfRange(secret, secret.length - 3, secret.length)) +
                " (" + secret.length + " bytes)";
    }

    private Redaction() {}
}
