/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Represents a typed value flowing through a graph. A ValueNode is either owned by the {@link ApplicationNode} that
 * computes it (in which case it's one of that node's outputs) or has no owner (in which case it's a root of the graph:
 * an input or an atomic value).
 *
 * ValueNodes are created by front-end construction or by ApplicationNode construction, for the outputs of an
 * Operation. Ownership is assigned exactly once, when the owning ApplicationNode is constructed, and never changes.
 *
 * @apiNote ValueNode is meant to be subclassed only within this package: {@link AtomicValueNode}s are the only other
 *          kind, and the set of kinds is closed (see {@link Kind}).
 */
public class ValueNode implements Node {
    public static final String TEST_VALUE_KEY = "test_value";
    private static final AtomicLong AUTO_NAME_SEQUENCE = new AtomicLong();

    private final Type type;
    private final String name;
    private final String autoName;
    private Tag tag;
    private ApplicationNode owner;
    private int index;

    /**
     * Creates a new, unowned ValueNode.
     *
     * @param name an optional name used in diagnostics. May be null.
     */
    public ValueNode(Type type, String name) {
        this.type = Objects.requireNonNull(type);
        this.name = name;
        this.autoName = "auto_" + AUTO_NAME_SEQUENCE.getAndIncrement();
        this.tag = Tag.validating(TEST_VALUE_KEY, type::filter);
        this.owner = null;
        this.index = -1;
    }

    /** Creates a new, unowned, unnamed ValueNode. */
    public ValueNode(Type type) {
        this(type, null);
    }

    public Type getType() {
        return type;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    /** A name unique to this ValueNode within the process, assigned at creation. */
    public String getAutoName() {
        return autoName;
    }

    public Optional<ApplicationNode> getOwner() {
        return Optional.ofNullable(owner);
    }

    public boolean hasOwner() {
        return owner != null;
    }

    /** The position of this ValueNode among its owner's outputs, present if and only if there's an owner. */
    public OptionalInt getIndex() {
        return (owner == null) ? OptionalInt.empty() : OptionalInt.of(index);
    }

    /**
     * Makes owner the owner of this ValueNode at the given output position. Succeeds without change if the ownership
     * was already assigned exactly this way.
     *
     * @throws IllegalArgumentException if this ValueNode already belongs to a different owner or output position.
     */
    void assignOwner(ApplicationNode owner, int index) {
        checkAssignableOwner(owner, index);
        this.owner = owner;
        this.index = index;
    }

    /**
     * Checks that {@link #assignOwner(ApplicationNode, int)} would succeed for the given arguments, without changing
     * anything.
     *
     * @throws IllegalArgumentException if this ValueNode already belongs to a different owner or output position.
     */
    void checkAssignableOwner(ApplicationNode owner, int index) {
        if (this.owner != null && (this.owner != owner || this.index != index)) {
            throw new IllegalArgumentException(
                    String.format("All output variables passed to ApplicationNode must belong to it: '%s'", this));
        }
    }

    @Override
    public Tag getTag() {
        return tag;
    }

    /**
     * Returns the test value stored in this node's tag.
     *
     * @throws IllegalStateException if no test value was set.
     */
    public Object getTestValue() {
        return tag.get(TEST_VALUE_KEY)
                .orElseThrow(() -> new IllegalStateException(String.format("%s has no test value", this)));
    }

    /**
     * Sets the test value stored in this node's tag, after filtering it through this node's type.
     *
     * @throws IllegalArgumentException if the value is not valid for this node's type.
     */
    public void setTestValue(Object value) {
        tag.put(TEST_VALUE_KEY, value);
    }

    public Kind getKind() {
        return Kind.VARIABLE;
    }

    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    /**
     * Returns a new, unowned ValueNode like this one, with the same name and a copy of this node's tag. Subclasses may
     * return this node itself if the node is not meant to be duplicated.
     */
    public ValueNode cloneNode() {
        return cloneNode(name);
    }

    /** Same as {@link #cloneNode()}, except the returned node has the given name (which may be null). */
    public ValueNode cloneNode(String name) {
        ValueNode copy = new ValueNode(type, name);
        copy.tag = tag.copy();
        return copy;
    }

    @Override
    public List<ApplicationNode> getParents() {
        return (owner == null) ? List.of() : List.of(owner);
    }

    @Override
    public String toString() {
        if (name != null) {
            return name;
        }
        if (owner != null) {
            OptionalInt defaultOutput = owner.getOperation().getDefaultOutput();
            if (defaultOutput.isPresent() && defaultOutput.getAsInt() == index) {
                return owner.getOperation() + ".out";
            }
            return owner.getOperation() + "." + index;
        }
        return "<" + type + ">";
    }

    /** The closed set of ValueNode kinds. */
    public enum Kind {
        VARIABLE,
        CONSTANT,
        NOMINAL;
    }

    /** Allows dispatching on the kind of a ValueNode without instanceof checks. */
    public interface Visitor<R> {
        R visitVariable(ValueNode node);

        R visitConstant(ConstantNode node);

        R visitNominal(NominalNode node);
    }
}
