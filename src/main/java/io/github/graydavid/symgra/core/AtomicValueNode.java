/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

/**
 * A ValueNode that has no ancestors and is never the output of an ApplicationNode: its owner and index are permanently
 * empty. Atomic nodes are compared through their signature rather than their identity when checking whether two
 * graphs compute the same thing.
 */
public abstract class AtomicValueNode extends ValueNode {
    AtomicValueNode(Type type, String name) {
        super(type, name);
    }

    /**
     * @throws IllegalArgumentException always, since atomic nodes cannot have an owner.
     */
    @Override
    final void assignOwner(ApplicationNode owner, int index) {
        checkAssignableOwner(owner, index);
    }

    /**
     * @throws IllegalArgumentException always, since atomic nodes cannot have an owner.
     */
    @Override
    final void checkAssignableOwner(ApplicationNode owner, int index) {
        throw new IllegalArgumentException(String.format("%s instances cannot have an owner: '%s'",
                getClass().getSimpleName(), this));
    }

    /**
     * Answers whether other is of the same kind as this node and stands for the same value: e.g. two constants with
     * the same type and data.
     */
    public abstract boolean equalsSignature(AtomicValueNode other);

    @Override
    public abstract AtomicValueNode cloneNode(String name);

    @Override
    public AtomicValueNode cloneNode() {
        return cloneNode(getName().orElse(null));
    }
}
