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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import org.testng.annotations.Test;

import io.chainofproduct.StructuralException;

public class CborWriterTest {

    @Test
    public void shouldEncodeTranscriptAsArray() {
        var transcript = CborWriter.transcript("a", new byte[] { 1, 2 }, List.of(), 10L);

        assertThat(HexFormat.of().formatHex(transcript)).isEqualTo("84616142010280" + "0a");
    }

    @Test
    public void shouldDistinguishStringsFromBytes() {
        assertThat(CborWriter.transcript("ab")).isNotEqualTo(CborWriter.transcript((Object) "ab".getBytes()));
        assertThat(CborWriter.transcript("a", "b")).isNotEqualTo(CborWriter.transcript("ab"));
    }

    @Test
    public void shouldRejectMaps() {
        assertThatThrownBy(() -> CborWriter.transcript(Map.of("a", 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldRoundTripBase64url() throws Exception {
        var data = new byte[] { (byte) 0xfb, (byte) 0xff, 0x00, 0x01 };

        var encoded = Base64url.encode(data);

        assertThat(encoded).isEqualTo("-_8AAQ");
        assertThat(Base64url.decode(encoded, "data")).isEqualTo(data);
        assertThatThrownBy(() -> Base64url.decode("not base64!", "data"))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("data");
    }
}
