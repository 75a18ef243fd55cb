/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Represents one application of an {@link Operation} to a list of input {@link ValueNode}s, producing a list of output
 * ValueNodes. An ApplicationNode references its inputs, which may be shared with other ApplicationNodes, and exclusively
 * owns its outputs: constructing an ApplicationNode makes it the owner of each of its outputs.
 *
 * Inputs and outputs are fixed at construction. To substitute inputs, use
 * {@link #cloneWithNewInputs(List, boolean, boolean)}, which creates a new ApplicationNode.
 */
public class ApplicationNode implements Node {
    private final Operation operation;
    private final List<ValueNode> inputs;
    private final List<ValueNode> outputs;
    private Tag tag;

    /**
     * @throws NullPointerException if operation, inputs, outputs, or any of their elements are null.
     * @throws IllegalArgumentException if any output already belongs to a different owner or output position, or if an
     *         output appears more than once. No output is assigned an owner in that case.
     */
    public ApplicationNode(Operation operation, List<? extends ValueNode> inputs, List<? extends ValueNode> outputs) {
        this.operation = Objects.requireNonNull(operation);
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.tag = Tag.empty();
        Set<ValueNode> seenOutputs = GraphTraversals.newIdentitySet();
        for (int i = 0; i < this.outputs.size(); ++i) {
            ValueNode output = this.outputs.get(i);
            if (!seenOutputs.add(output)) {
                throw new IllegalArgumentException(
                        String.format("Output '%s' appears more than once in %s", output, this.outputs));
            }
            output.checkAssignableOwner(this, i);
        }
        for (int i = 0; i < this.outputs.size(); ++i) {
            this.outputs.get(i).assignOwner(this, i);
        }
    }

    public Operation getOperation() {
        return operation;
    }

    public List<ValueNode> getInputs() {
        return inputs;
    }

    public List<ValueNode> getOutputs() {
        return outputs;
    }

    public int getNumInputs() {
        return inputs.size();
    }

    public int getNumOutputs() {
        return outputs.size();
    }

    @Override
    public Tag getTag() {
        return tag;
    }

    @Override
    public List<ValueNode> getParents() {
        return inputs;
    }

    /**
     * Returns the output that represents this node as a whole: the one designated by the operation, or the sole output
     * if there's only one.
     * 
     * @throws IllegalArgumentException if the operation designates no default output and there are multiple outputs.
     * @throws MisbehaviorException if the operation designates a default output that doesn't exist.
     */
    public ValueNode defaultOutput() {
        OptionalInt defaultOutput = operation.getDefaultOutput();
        if (defaultOutput.isEmpty()) {
            if (outputs.size() == 1) {
                return outputs.get(0);
            }
            throw new IllegalArgumentException(
                    String.format("Multi-output operation %s default output not specified", operation));
        }
        int index = defaultOutput.getAsInt();
        if (index < 0 || index >= outputs.size()) {
            throw new MisbehaviorException(String.format(
                    "Operation %s designates default output %s, but node has only %s outputs", operation, index,
                    outputs.size()));
        }
        return outputs.get(index);
    }

    /**
     * Creates a structurally identical ApplicationNode with freshly-cloned outputs and a copy of this node's tag. The
     * clone shares this node's inputs.
     * 
     * @param cloneInnerGraph if true and the operation is an {@link InnerGraphOperation}, the clone gets a copy of the
     *        operation with a cloned inner graph.
     */
    public ApplicationNode cloneNode(boolean cloneInnerGraph) {
        Operation newOperation = maybeCloneOperation(cloneInnerGraph);
        ApplicationNode copy = new ApplicationNode(newOperation, inputs, cloneOutputs());
        copy.tag = tag.copy();
        return copy;
    }

    private Operation maybeCloneOperation(boolean cloneInnerGraph) {
        if (cloneInnerGraph && operation instanceof InnerGraphOperation) {
            return ((InnerGraphOperation) operation).cloneOperation();
        }
        return operation;
    }

    private List<ValueNode> cloneOutputs() {
        return outputs.stream().map(ValueNode::cloneNode).collect(Collectors.toList());
    }

    /**
     * Duplicates this node with new inputs.
     * 
     * For each (current, new) input pair, nothing needs to happen if the types are equal and the operation's output
     * types don't depend on input values. Otherwise, in strict mode, the new input is converted through
     * {@link Type#filterVariable(ValueNode)} of the current input's type, and the node is rebuilt (through
     * {@link Operation#makeNode(List)}, which reinfers output types) only if the converted type still differs. In
     * non-strict mode, the node is always rebuilt. When the node isn't rebuilt, the result is a clone of this node with
     * the inputs replaced.
     * 
     * @param strict if true, the returned node's outputs are guaranteed to have the same types as this node's.
     * @param cloneInnerGraph same as in {@link #cloneNode(boolean)}.
     * 
     * @throws IllegalArgumentException if the number of inputs differs from this node's or, in strict mode, if a new
     *         input cannot be converted into the current input's type.
     */
    public ApplicationNode cloneWithNewInputs(List<? extends ValueNode> newInputs, boolean strict,
            boolean cloneInnerGraph) {
        return cloneWithNewInputs(newInputs, strict, maybeCloneOperation(cloneInnerGraph));
    }

    ApplicationNode cloneWithNewInputs(List<? extends ValueNode> newInputs, boolean strict, Operation newOperation) {
        List<ValueNode> filteredInputs = new ArrayList<>(newInputs);
        if (filteredInputs.size() != inputs.size()) {
            throw new IllegalArgumentException(String.format("Expected %s inputs for node %s but found %s",
                    inputs.size(), this, filteredInputs.size()));
        }

        boolean remakeNode = false;
        boolean dependsOnValue = operation.outputTypeDependsOnInputValue();
        for (int i = 0; i < inputs.size(); ++i) {
            ValueNode current = inputs.get(i);
            ValueNode replacement = Objects.requireNonNull(filteredInputs.get(i));
            if (!current.getType().equals(replacement.getType()) || dependsOnValue) {
                if (strict) {
                    ValueNode filtered = current.getType().filterVariable(replacement);
                    filteredInputs.set(i, filtered);
                    if (!current.getType().equals(filtered.getType())) {
                        remakeNode = true;
                    }
                } else {
                    remakeNode = true;
                }
            }
        }

        if (remakeNode) {
            ApplicationNode rebuilt = newOperation.makeNode(filteredInputs);
            if (rebuilt.getNumOutputs() != outputs.size()) {
                throw new MisbehaviorException(String.format(
                        "Operation %s rebuilt node with %s outputs, but the original node had %s", newOperation,
                        rebuilt.getNumOutputs(), outputs.size()));
            }
            rebuilt.tag = tag.copy().update(rebuilt.tag);
            return rebuilt;
        }

        ApplicationNode copy = new ApplicationNode(newOperation, filteredInputs, cloneOutputs());
        copy.tag = tag.copy();
        return copy;
    }

    @Override
    public String toString() {
        return GraphTraversals.opAsString(inputs, this);
    }
}
