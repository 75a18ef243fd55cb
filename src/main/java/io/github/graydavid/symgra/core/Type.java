/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.lang.reflect.Array;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Describes the domain of the data that a {@link ValueNode} can carry: e.g. a scalar of a given precision or an array
 * with a given element kind and static shape. Symgra itself never interprets data; it only asks the Type to validate
 * and compare it. Concrete type systems are provided by collaborators by extending this class.
 *
 * Type is a glorified wrapper around a descriptor String. Two Types compare equal if and only if they have the same
 * class and the same descriptor. That means that parameterized Types should encode all of their parameters into the
 * descriptor (e.g. "vector(float64, 3)"), which also gives them a useful toString for free. To avoid clashes between
 * different type providers who happen to choose the same descriptor, equality is class-based as well.
 */
public abstract class Type {
    private final String name;

    protected Type(String name) {
        this.name = requireValidName(name);
    }

    private static String requireValidName(String name) {
        if (name.isBlank()) {
            StringJoiner codePoints = name.codePoints()
                    .collect(() -> new StringJoiner(", ", "[", "]"),
                            (joiner, point) -> joiner.add(String.valueOf(point)), StringJoiner::merge);
            throw new IllegalArgumentException(
                    "Type names must not be blank but found whitespace character in code points: " + codePoints);
        }
        return name;
    }

    @Override
    public final String toString() {
        return name;
    }

    @Override
    public final boolean equals(Object object) {
        if (object == null) {
            return false;
        }
        if (!getClass().equals(object.getClass())) {
            return false;
        }

        Type other = (Type) object;
        return Objects.equals(name, other.name);
    }

    @Override
    public final int hashCode() {
        return Objects.hash(name);
    }

    /**
     * Validates data against this Type, possibly converting it into the Type's canonical representation.
     *
     * @param strict if true, the data must already be in the canonical representation: no conversion is allowed.
     * @param allowDowncast if true (and strict is false), conversions that may lose precision are allowed.
     *
     * @return the (possibly converted) data.
     * @throws IllegalArgumentException if data is not valid for this Type.
     */
    public abstract Object filter(Object data, boolean strict, boolean allowDowncast);

    /** Same as {@link #filter(Object, boolean, boolean)}, with neither strictness nor downcasting. */
    public final Object filter(Object data) {
        return filter(data, false, false);
    }

    /** Answers whether data is already a valid, canonical value for this Type. */
    public boolean isValidValue(Object data) {
        try {
            filter(data, true, false);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Converts a ValueNode of another Type so that it can stand in for a ValueNode of this Type. This is the hook that
     * allows substituting an input with a compatible but more specialized one during cloning.
     *
     * @implSpec the default implementation accepts only ValueNodes of a Type equal to this one and returns them
     *           unchanged.
     *
     * @throws IllegalArgumentException if other cannot be converted.
     */
    public ValueNode filterVariable(ValueNode other) {
        if (equals(other.getType())) {
            return other;
        }
        String message = String.format("Cannot convert Type '%s' of variable '%s' into Type '%s'", other.getType(),
                other, this);
        throw new IllegalArgumentException(message);
    }

    /**
     * Answers whether other belongs to the same family of Types as this one: i.e. whether data of one could be
     * represented in the other, ignoring static details.
     *
     * @implSpec the default implementation is equality.
     */
    public boolean inSameClass(Type other) {
        return equals(other);
    }

    /** Creates a new, unowned ValueNode of this Type. */
    public ValueNode makeVariable(String name) {
        return new ValueNode(this, name);
    }

    /** Same as {@link #makeVariable(String)} without a name. */
    public final ValueNode makeVariable() {
        return makeVariable(null);
    }

    /**
     * Answers whether two valid values of this Type are equal.
     *
     * @implSpec the default implementation uses {@link Objects#deepEquals(Object, Object)}, which handles arrays.
     */
    public boolean valuesEqual(Object a, Object b) {
        return Objects.deepEquals(a, b);
    }

    /**
     * Copies a value so that the copy can be placed into independent storage.
     *
     * @implSpec the default implementation treats non-array values as immutable and returns them as is; arrays are
     *           copied shallowly.
     */
    public Object copyValue(Object value) {
        if (value == null || !value.getClass().isArray()) {
            return value;
        }
        int length = Array.getLength(value);
        Object copy = Array.newInstance(value.getClass().getComponentType(), length);
        System.arraycopy(value, 0, copy, 0, length);
        return copy;
    }
}
