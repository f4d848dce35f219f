/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.cipher;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import io.sealdoc.DocumentParseException;
import io.sealdoc.tree.Scalar;
import io.sealdoc.tree.ValueType;

/**
 * <p>Converts scalars to and from their canonical text. The canonical text is what gets encrypted and
 * what the document MAC is computed over, so it must not change between releases.</p>
 * <ul>
 *     <li>int: base 10</li>
 *     <li>float: the shortest decimal that reads back as the same double, never in exponent form ({@code 1.5}, {@code 3}, {@code 0.0001})</li>
 *     <li>bool: {@code True} or {@code False}</li>
 * </ul>
 */
public final class ScalarCodec {

    private static final Set<String> TRUE = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE = Set.of("0", "f", "F", "FALSE", "false", "False");

    private ScalarCodec() {
    }

    public static String toText(Scalar scalar) {
        if (scalar instanceof Scalar.StringValue s) {
            return s.value();
        }
        else if (scalar instanceof Scalar.IntValue i) {
            return Long.toString(i.value());
        }
        else if (scalar instanceof Scalar.FloatValue f) {
            return formatFloat(f.value());
        }
        else if (scalar instanceof Scalar.BoolValue b) {
            return b.value() ? "True" : "False";
        }
        return "";
    }

    public static byte[] toBytes(Scalar scalar) {
        return toText(scalar).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @param bytes canonical text
     * @param type the type recorded alongside the value
     * @return the scalar
     * @throws DocumentParseException if the text is not valid for the type
     */
    public static Scalar fromBytes(byte[] bytes, ValueType type) {
        String text = new String(bytes, StandardCharsets.UTF_8);
        switch (type) {
            case STRING:
                return Scalar.of(text);
            case INT:
                try {
                    return Scalar.of(Long.parseLong(text));
                }
                catch (NumberFormatException e) {
                    throw new DocumentParseException("encrypted int value does not hold an integer", e);
                }
            case FLOAT:
                return Scalar.of(parseFloat(text));
            case BOOL:
                return Scalar.of(parseBool(text));
            default:
                throw new DocumentParseException("values of type " + type.tag() + " cannot be encrypted");
        }
    }

    public static String formatFloat(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "+Inf" : "-Inf";
        }
        if (value == 0.0 && Double.doubleToRawLongBits(value) != 0L) {
            // BigDecimal has no negative zero
            return "-0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static double parseFloat(String text) {
        switch (text) {
            case "NaN":
                return Double.NaN;
            case "+Inf":
            case "Inf":
                return Double.POSITIVE_INFINITY;
            case "-Inf":
                return Double.NEGATIVE_INFINITY;
            default:
                try {
                    return Double.parseDouble(text);
                }
                catch (NumberFormatException e) {
                    throw new DocumentParseException("encrypted float value does not hold a number", e);
                }
        }
    }

    /**
     * @param text boolean text in any of the spellings {@code 1 t T TRUE true True 0 f F FALSE false False}
     * @return the boolean
     * @throws DocumentParseException for any other text
     */
    public static boolean parseBool(String text) {
        if (TRUE.contains(text)) {
            return true;
        }
        if (FALSE.contains(text)) {
            return false;
        }
        throw new DocumentParseException("encrypted bool value does not hold a boolean");
    }
}
