/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.cipher;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import io.sealdoc.DocumentParseException;
import io.sealdoc.tree.Scalar;
import io.sealdoc.tree.ValueType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScalarCodecTest {

    @ParameterizedTest
    @CsvSource({
            "1.5, 1.5",
            "3.0, 3",
            "0.0001, 0.0001",
            "1e21, 1000000000000000000000",
            "-2.25, -2.25",
            "0.1, 0.1"
    })
    void floatsUseShortestPlainDecimal(double value, String expected) {
        assertThat(ScalarCodec.formatFloat(value)).isEqualTo(expected);
    }

    @Test
    void nonFiniteFloats() {
        assertThat(ScalarCodec.formatFloat(Double.POSITIVE_INFINITY)).isEqualTo("+Inf");
        assertThat(ScalarCodec.formatFloat(Double.NEGATIVE_INFINITY)).isEqualTo("-Inf");
        assertThat(ScalarCodec.formatFloat(Double.NaN)).isEqualTo("NaN");
        assertThat(ScalarCodec.fromBytes(bytes("+Inf"), ValueType.FLOAT)).isEqualTo(Scalar.of(Double.POSITIVE_INFINITY));
    }

    @Test
    void negativeZeroKeepsItsSign() {
        assertThat(ScalarCodec.formatFloat(-0.0)).isEqualTo("-0");
        assertThat(ScalarCodec.formatFloat(0.0)).isEqualTo("0");
        assertThat(ScalarCodec.fromBytes(bytes("-0"), ValueType.FLOAT)).isEqualTo(Scalar.of(-0.0));
    }

    @Test
    void canonicalText() {
        assertThat(ScalarCodec.toText(Scalar.of("héllo"))).isEqualTo("héllo");
        assertThat(ScalarCodec.toText(Scalar.of(-42L))).isEqualTo("-42");
        assertThat(ScalarCodec.toText(Scalar.of(true))).isEqualTo("True");
        assertThat(ScalarCodec.toText(Scalar.of(false))).isEqualTo("False");
    }

    @ParameterizedTest
    @ValueSource(strings = { "1", "t", "T", "TRUE", "true", "True" })
    void lenientTrue(String text) {
        assertThat(ScalarCodec.parseBool(text)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = { "0", "f", "F", "FALSE", "false", "False" })
    void lenientFalse(String text) {
        assertThat(ScalarCodec.parseBool(text)).isFalse();
    }

    @Test
    void rejectsInvalidText() {
        assertThatThrownBy(() -> ScalarCodec.parseBool("yes")).isInstanceOf(DocumentParseException.class);
        assertThatThrownBy(() -> ScalarCodec.fromBytes(bytes("1.5"), ValueType.INT)).isInstanceOf(DocumentParseException.class);
        assertThatThrownBy(() -> ScalarCodec.fromBytes(bytes("abc"), ValueType.FLOAT)).isInstanceOf(DocumentParseException.class);
        assertThatThrownBy(() -> ScalarCodec.fromBytes(bytes(""), ValueType.NULL)).isInstanceOf(DocumentParseException.class);
    }

    @Test
    void int64Bounds() {
        assertThat(ScalarCodec.fromBytes(bytes(Long.toString(Long.MIN_VALUE)), ValueType.INT)).isEqualTo(Scalar.of(Long.MIN_VALUE));
        assertThatThrownBy(() -> ScalarCodec.fromBytes(bytes("9223372036854775808"), ValueType.INT)).isInstanceOf(DocumentParseException.class);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
