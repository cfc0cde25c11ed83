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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.concurrent.ThreadLocalRandom;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class UtilsTest {

    @DataProvider
    public Iterator<BigInteger> randomInts() {
        return ThreadLocalRandom.current().longs(20, 0, Long.MAX_VALUE).mapToObj(BigInteger::valueOf).iterator();
    }

    @Test(dataProvider = "randomInts")
    public void shouldEncodeLittleEndian(BigInteger value) {
        byte[] le = Utils.toUnsignedLittleEndian(value, 32);

        assertThat(le).hasSize(32);
        var bigEndian = new byte[32];
        for (int i = 0; i < 32; ++i) {
            bigEndian[i] = le[31 - i];
        }
        assertThat(new BigInteger(1, bigEndian)).isEqualTo(value);
    }

    @Test
    public void shouldEncodeTopBitWithoutSignByte() {
        var value = BigInteger.ONE.shiftLeft(255);

        var le = Utils.toUnsignedLittleEndian(value, 32);

        assertThat(le[31]).isEqualTo((byte) 0x80);
        assertThatThrownBy(() -> Utils.toUnsignedLittleEndian(BigInteger.ONE.shiftLeft(256), 32))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldConcatenateAndWipe() {
        var a = new byte[] { 1, 2 };
        var b = new byte[] { 3 };

        var joined = Utils.concat(a, b, new byte[0]);
        Utils.wipe(a, null, b);

        assertThat(joined).containsExactly(1, 2, 3);
        assertThat(Utils.allZero(a)).isTrue();
        assertThat(Utils.allZero(b)).isTrue();
        assertThat(Utils.allZero(joined)).isFalse();
    }

    @Test
    public void shouldFormatHexWithLeadingZeros() {
        assertThat(Utils.hex(new byte[] { 0, 10, (byte) 0xff })).isEqualTo("000aff");
    }

    @Test
    public void shouldRejectFailedRequirement() {
        assertThatThrownBy(() -> Utils.require(false, "nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("nope");
    }
}
