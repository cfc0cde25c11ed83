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

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import co.nstant.in.cbor.CborEncoder;
import co.nstant.in.cbor.CborException;
import co.nstant.in.cbor.model.Array;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.DataItem;
import co.nstant.in.cbor.model.NegativeInteger;
import co.nstant.in.cbor.model.SimpleValue;
import co.nstant.in.cbor.model.UnicodeString;
import co.nstant.in.cbor.model.UnsignedInteger;

/**
 * Writes CBOR transcripts: the byte strings that are fed to hash functions, KDFs and AEAD associated data. Only
 * values with a single encoding are supported (strings, byte arrays, integers, Booleans, null and lists of these),
 * so two equal transcripts always encode to the same bytes. Maps are not supported; callers sort their entries
 * into lists.
 */
public final class CborWriter {

    /**
     * Encodes the given items as a single definite-length CBOR array.
     *
     * @throws IllegalArgumentException if any item (or nested list element) has no transcript encoding.
     */
    public static byte[] transcript(Object... items) {
        var out = new ByteArrayOutputStream();
        try {
            new CborEncoder(out).encode(toDataItem(Arrays.asList(items)));
        } catch (CborException e) {
            throw new IllegalStateException("Unable to encode transcript", e);
        }
        return out.toByteArray();
    }

    private static DataItem toDataItem(Object item) {
        if (item == null) {
            return SimpleValue.NULL;
        }
        if (item instanceof Boolean flag) {
            return flag ? SimpleValue.TRUE : SimpleValue.FALSE;
        }
        if (item instanceof Integer || item instanceof Long || item instanceof Short || item instanceof Byte) {
            return integer(BigInteger.valueOf(((Number) item).longValue()));
        }
        if (item instanceof BigInteger big) {
            return integer(big);
        }
        if (item instanceof byte[] bytes) {
            return new ByteString(bytes);
        }
        if (item instanceof String string) {
            return new UnicodeString(string);
        }
        if (item instanceof List<?> list) {
            var array = new Array();
            list.forEach(element -> array.add(toDataItem(element)));
            return array;
        }
        throw new IllegalArgumentException("No transcript encoding for " + item.getClass().getSimpleName());
    }

    private static DataItem integer(BigInteger value) {
        return value.signum() < 0 ? new NegativeInteger(value) : new UnsignedInteger(value);
    }

    private CborWriter() {}
}
