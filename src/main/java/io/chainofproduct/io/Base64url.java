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

package io.chainofproduct.io;

import java.util.Base64;

import io.chainofproduct.StructuralException;

/**
 * URL-safe Base64 without padding, used for every binary field of the JSON record format.
 */
public final class Base64url {
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    public static String encode(byte[] data) {
        return ENCODER.encodeToString(data);
    }

    /**
     * Decodes a URL-safe base64 string. Padding is accepted but not required.
     *
     * @param encoded the encoded data.
     * @param field the name of the field being decoded, for error messages.
     * @return the decoded data.
     * @throws StructuralException if the string is not valid base64url.
     */
    public static byte[] decode(String encoded, String field) throws StructuralException {
        if (encoded == null) {
            throw new StructuralException("Missing binary field '" + field + "'");
        }
        try {
            return DECODER.decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new StructuralException("Field '" + field + "' is not valid base64url", e);
        }
    }

    private Base64url() {}
}
