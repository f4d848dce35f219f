/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tree;

import java.util.Objects;

/**
 * A leaf value. Each variant carries its own type, so that a value comes back from its
 * encrypted form with the type it was encrypted with.
 */
public sealed interface Scalar extends TreeValue permits Scalar.StringValue, Scalar.IntValue, Scalar.FloatValue, Scalar.BoolValue, Scalar.NullValue {

    ValueType type();

    @Override
    default <R> R accept(TreeValueVisitor<R> visitor) {
        return visitor.visitScalar(this);
    }

    static StringValue of(String value) {
        return new StringValue(value);
    }

    static IntValue of(long value) {
        return new IntValue(value);
    }

    static FloatValue of(double value) {
        return new FloatValue(value);
    }

    static BoolValue of(boolean value) {
        return value ? BoolValue.TRUE : BoolValue.FALSE;
    }

    static NullValue nullValue() {
        return NullValue.INSTANCE;
    }

    record StringValue(String value) implements Scalar {
        public StringValue {
            Objects.requireNonNull(value);
        }

        @Override
        public ValueType type() {
            return ValueType.STRING;
        }
    }

    record IntValue(long value) implements Scalar {
        @Override
        public ValueType type() {
            return ValueType.INT;
        }
    }

    record FloatValue(double value) implements Scalar {
        @Override
        public ValueType type() {
            return ValueType.FLOAT;
        }
    }

    record BoolValue(boolean value) implements Scalar {
        static final BoolValue TRUE = new BoolValue(true);
        static final BoolValue FALSE = new BoolValue(false);

        @Override
        public ValueType type() {
            return ValueType.BOOL;
        }
    }

    record NullValue() implements Scalar {
        static final NullValue INSTANCE = new NullValue();

        @Override
        public ValueType type() {
            return ValueType.NULL;
        }
    }
}
