/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tree;

import java.util.Arrays;
import java.util.Optional;

/**
 * The types a scalar may have, with the tag recorded for them in an encrypted value.
 */
public enum ValueType {
    STRING("str"),
    INT("int"),
    FLOAT("float"),
    BOOL("bool"),
    NULL("null");

    private final String tag;

    ValueType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * @param tag the tag found in an encrypted value
     * @return the type, if the tag is known
     */
    public static Optional<ValueType> fromTag(String tag) {
        return Arrays.stream(values()).filter(t -> t.tag.equals(tag)).findFirst();
    }
}
