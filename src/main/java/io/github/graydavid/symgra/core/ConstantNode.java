/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.lang.reflect.Array;
import java.util.StringJoiner;

/**
 * An AtomicValueNode with a fixed data payload. The payload is filtered through the node's type at construction and is
 * never modified afterwards. Constants are never duplicated: cloning a ConstantNode returns the node itself.
 */
public class ConstantNode extends AtomicValueNode {
    private static final int MAX_DATA_STRING_LENGTH = 20;

    private final Object data;

    /**
     * @param data the payload, which is passed through {@link Type#filter(Object)}.
     * @param name an optional name used in diagnostics. May be null.
     * 
     * @throws IllegalArgumentException if data is invalid for type.
     */
    public ConstantNode(Type type, Object data, String name) {
        super(type, name);
        this.data = type.filter(data);
    }

    public ConstantNode(Type type, Object data) {
        this(type, data, null);
    }

    public Object getData() {
        return data;
    }

    @Override
    public Object getTestValue() {
        return data;
    }

    @Override
    public Kind getKind() {
        return Kind.CONSTANT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public ConstantNode cloneNode(String name) {
        return this;
    }

    @Override
    public ConstantNode cloneNode() {
        return this;
    }

    @Override
    public boolean equalsSignature(AtomicValueNode other) {
        if (other == null || !getClass().equals(other.getClass())) {
            return false;
        }
        ConstantNode otherConstant = (ConstantNode) other;
        return getType().equals(otherConstant.getType()) && getType().valuesEqual(data, otherConstant.data);
    }

    @Override
    public String toString() {
        String dataString = dataToString(data).replace("\n", "");
        if (dataString.length() > MAX_DATA_STRING_LENGTH) {
            dataString = dataString.substring(0, 10).strip() + " ... "
                    + dataString.substring(dataString.length() - 10).strip();
        }
        String shownData = dataString;
        return getName().map(name -> name + "{" + shownData + "}").orElse(shownData);
    }

    private static String dataToString(Object data) {
        if (data == null || !data.getClass().isArray()) {
            return String.valueOf(data);
        }
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (int i = 0; i < Array.getLength(data); ++i) {
            joiner.add(dataToString(Array.get(data, i)));
        }
        return joiner.toString();
    }
}
