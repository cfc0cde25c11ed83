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

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;

import javax.security.auth.DestroyFailedException;
import javax.security.auth.Destroyable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Encodes a non-negative integer as exactly {@code length} little-endian bytes, as used for X25519 u-coordinates.
     */
    static byte[] toUnsignedLittleEndian(BigInteger value, int length) {
        require(value.signum() >= 0 && value.bitLength() <= length * 8, "Value does not fit in " + length + " bytes");
        var result = new byte[length];
        var bigEndian = value.toByteArray();
        for (int i = 0; i < length && i < bigEndian.length; ++i) {
            result[i] = bigEndian[bigEndian.length - 1 - i];
        }
        return result;
    }

    static byte[] concat(byte[]... parts) {
        int length = 0;
        for (var part : parts) {
            length += part.length;
        }
        byte[] result = new byte[length];
        int offset = 0;
        for (var part : parts) {
            System.arraycopy(part, 0, result, offset, part.length);
            offset += part.length;
        }
        return result;
    }

    static String hex(byte[] data) {
        return HexFormat.of().formatHex(data);
    }

    static boolean allZero(byte[] data) {
        byte sum = 0;
        for (byte datum : data) {
            sum |= datum;
        }
        return sum == 0;
    }

    /**
     * Attempts to wipe any sensitive data from memory by writing zero bytes over the array contents. This is a
     * best-effort attempt to remove data from memory, because Java's garbage collector may already have copied the
     * data in the heap.
     *
     * @param sensitiveData the sensitive data to wipe. Null arguments are ignored.
     */
    static void wipe(byte[]... sensitiveData) {
        for (var data : sensitiveData) {
            if (data != null) {
                Arrays.fill(data, (byte) 0);
            }
        }
    }

    /**
     * Destroys the given keys. Most JDK private keys throw {@link DestroyFailedException} without wiping anything,
     * so failures are only logged.
     */
    static void destroy(Destroyable... toDestroy) {
        for (var it : toDestroy) {
            if (it == null || it.isDestroyed()) {
                continue;
            }
            try {
                it.destroy();
            } catch (DestroyFailedException e) {
                logger.trace("Unable to destroy key of type {}", it.getClass().getSimpleName(), e);
            }
        }
    }

    private Utils() {}
}
