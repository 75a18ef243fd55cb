/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.link;

import java.util.List;
import java.util.Objects;

import io.github.graydavid.symgra.core.ApplicationNode;
import io.github.graydavid.symgra.core.StorageCell;
import io.github.graydavid.symgra.core.Thunk;

/** The thunk that computes a single ApplicationNode, together with the storage that it reads and writes. */
public class NodeThunk implements Thunk {
    private final ApplicationNode node;
    private final Thunk thunk;
    private final List<StorageCell> inputs;
    private final List<StorageCell> outputs;

    public NodeThunk(ApplicationNode node, Thunk thunk, List<StorageCell> inputs, List<StorageCell> outputs) {
        this.node = Objects.requireNonNull(node);
        this.thunk = Objects.requireNonNull(thunk);
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
    }

    public ApplicationNode getNode() {
        return node;
    }

    /** The storage of the node's inputs, in input order. */
    public List<StorageCell> getInputs() {
        return inputs;
    }

    /** The storage of the node's outputs, in output order. */
    public List<StorageCell> getOutputs() {
        return outputs;
    }

    @Override
    public void run() {
        thunk.run();
    }

    @Override
    public String toString() {
        return "NodeThunk[" + node.getOperation() + "]";
    }
}
