/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.List;

/** The inputs and outputs of a copied subgraph, in the same order as the inputs and outputs that were copied. */
public class ClonedGraph {
    private final List<ValueNode> inputs;
    private final List<ValueNode> outputs;

    ClonedGraph(List<ValueNode> inputs, List<ValueNode> outputs) {
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
    }

    public List<ValueNode> getInputs() {
        return inputs;
    }

    public List<ValueNode> getOutputs() {
        return outputs;
    }

    @Override
    public String toString() {
        return "ClonedGraph[" + inputs + " -> " + outputs + "]";
    }
}
