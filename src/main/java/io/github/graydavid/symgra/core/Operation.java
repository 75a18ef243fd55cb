/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * The capability of computing outputs from inputs. Symgra never needs to know what an Operation numerically computes:
 * it only asks the Operation to build nodes, to produce thunks for them, and to describe how its outputs relate to its
 * inputs.
 *
 * Operations are typically stateless and may be shared by many ApplicationNodes. Operations may define equals: two
 * equal Operations are expected to compute the same function, which is what {@link Equivalence} relies upon.
 */
public interface Operation {
    /**
     * Creates a new ApplicationNode applying this Operation to the given inputs. The Operation is responsible for
     * inferring the Types of the node's outputs.
     *
     * @throws IllegalArgumentException if the inputs are not valid for this Operation.
     */
    ApplicationNode makeNode(List<? extends ValueNode> inputs);

    /**
     * Computes the values of node's outputs from the concrete values of its inputs.
     *
     * @param node an ApplicationNode created by this Operation.
     * @param inputs the values of node's inputs, in input order.
     * @param outputs one storage cell per output of node, in output order, which this method must fill.
     *
     * @throws RuntimeException if the inputs are outside of the Operation's domain.
     */
    void perform(ApplicationNode node, List<Object> inputs, List<StorageCell> outputs);

    /**
     * Returns the index of the output that represents the node as a whole, if any.
     *
     * @implSpec the default implementation returns empty, which means that only single-output nodes have a default
     *           output.
     */
    default OptionalInt getDefaultOutput() {
        return OptionalInt.empty();
    }

    /**
     * Describes which of node's outputs may depend on which of its inputs: {@code pattern[i][o]} is true if output o
     * may depend on input i.
     *
     * @implSpec the default implementation says that every output depends on every input.
     */
    default boolean[][] connectionPattern(ApplicationNode node) {
        boolean[][] pattern = new boolean[node.getNumInputs()][node.getNumOutputs()];
        for (boolean[] row : pattern) {
            Arrays.fill(row, true);
        }
        return pattern;
    }

    /**
     * Declares which outputs are views of inputs: i.e. share the storage of an input rather than computing fresh
     * storage. Keys are output indices; values are the indices of the inputs that the output is a view of.
     */
    default Map<Integer, List<Integer>> getViewMap() {
        return Map.of();
    }

    /**
     * Declares which outputs are computed in place, overwriting inputs. Keys are output indices; values are the indices
     * of the inputs that are destroyed.
     */
    default Map<Integer, List<Integer>> getDestroyMap() {
        return Map.of();
    }

    /**
     * Answers whether the Types of this Operation's outputs depend on the values of its inputs, rather than just on
     * their Types. Nodes of such Operations are always rebuilt when their inputs are substituted in non-strict mode.
     */
    default boolean outputTypeDependsOnInputValue() {
        return false;
    }

    /**
     * Creates a thunk that computes node's outputs, reading its inputs from inputStorage and writing its outputs to
     * outputStorage.
     *
     * @implSpec the default implementation reads the current values of inputStorage and delegates to
     *           {@link #perform(ApplicationNode, List, List)} every time the thunk is run.
     */
    default Thunk makeThunk(ApplicationNode node, List<StorageCell> inputStorage, List<StorageCell> outputStorage) {
        List<StorageCell> inputCells = List.copyOf(inputStorage);
        List<StorageCell> outputCells = List.copyOf(outputStorage);
        return () -> {
            List<Object> inputValues = new ArrayList<>(inputCells.size());
            inputCells.forEach(cell -> inputValues.add(cell.get()));
            perform(node, inputValues, outputCells);
        };
    }
}
