/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.Objects;

/**
 * A placeholder ValueNode that enables alpha-equivalent comparisons of inner graphs. NominalNodes are interned by a
 * {@link NominalRegistry}: there's at most one NominalNode per (type, id) pair per registry, so inner graphs that use
 * the same ids in the same input positions are built from literally the same nodes.
 */
public class NominalNode extends AtomicValueNode {
    private final long id;
    private final NominalRegistry registry;

    NominalNode(long id, Type type, String name, NominalRegistry registry) {
        super(type, name);
        this.id = id;
        this.registry = Objects.requireNonNull(registry);
    }

    public long getId() {
        return id;
    }

    @Override
    public Kind getKind() {
        return Kind.NOMINAL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitNominal(this);
    }

    /** Returns the interned node for this node's (type, id) pair, which is this node itself. */
    @Override
    public NominalNode cloneNode(String name) {
        return registry.nominal(id, getType(), name);
    }

    @Override
    public boolean equalsSignature(AtomicValueNode other) {
        if (other == null || !getClass().equals(other.getClass())) {
            return false;
        }
        NominalNode otherNominal = (NominalNode) other;
        return id == otherNominal.id && getType().equals(otherNominal.getType());
    }

    @Override
    public String toString() {
        return "*" + id + "-" + getName().orElse("<" + getType() + ">");
    }
}
