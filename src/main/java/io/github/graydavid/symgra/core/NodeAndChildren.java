/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.List;
import java.util.Objects;

/** A node found during a walk, together with the children that the walk's expansion function produced for it. */
public class NodeAndChildren<T> {
    private final T node;
    private final List<T> children;

    NodeAndChildren(T node, List<T> children) {
        this.node = Objects.requireNonNull(node);
        this.children = Objects.requireNonNull(children);
    }

    public T getNode() {
        return node;
    }

    /** The children of the node, which may be empty but is never null. */
    public List<T> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return node + "->" + children;
    }
}
