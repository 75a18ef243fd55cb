/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.List;

/**
 * A node in a symbolic computation graph. There are two kinds of nodes: {@link ValueNode}s, which represent typed
 * values, and {@link ApplicationNode}s, which represent the application of an {@link Operation} to ValueNodes. Edges
 * are not stored explicitly. Instead, each node knows its parents: a ValueNode's parent is its owner (if any), and an
 * ApplicationNode's parents are its inputs.
 * 
 * Nodes keep identity-based equality: two separately-created nodes are never equal, even if they look the same. Use
 * {@link Equivalence} to compare the computations that nodes represent.
 */
public interface Node {
    /**
     * Returns the parents of this node. The response is unmodifiable.
     */
    List<? extends Node> getParents();

    /** Returns the side-channel debug metadata attached to this node. */
    Tag getTag();
}
