/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Copies subgraphs, optionally substituting some of their nodes. Copying preserves sharing: a node used in multiple
 * places in the original is copied once and the copy is used in all of those places. {@link ConstantNode}s are never
 * copied.
 */
public class Cloning {
    private Cloning() {}

    /** Same as {@link #clone(List, List, boolean)}, copying inputs. */
    public static ClonedGraph clone(List<? extends ValueNode> inputs, List<? extends ValueNode> outputs) {
        return clone(inputs, outputs, true);
    }

    /** Same as {@link #clone(List, List, boolean, boolean, boolean)}, where orphans are copied just like inputs. */
    public static ClonedGraph clone(List<? extends ValueNode> inputs, List<? extends ValueNode> outputs,
            boolean copyInputs) {
        return clone(inputs, outputs, copyInputs, copyInputs, false);
    }

    /**
     * Copies the subgraph between inputs and outputs.
     *
     * @param copyInputs if true, the copy is rooted at copies of inputs. If false, the copy is rooted at inputs
     *        themselves.
     * @param copyOrphans if true, ownerless nodes that outputs depend on, but that aren't part of inputs, are copied.
     *        If false, they're reused.
     * @param cloneInnerGraphs if true, {@link InnerGraphOperation}s are copied along with their inner graphs.
     *
     * @return the copies of inputs and outputs, in the same order.
     */
    public static ClonedGraph clone(List<? extends ValueNode> inputs, List<? extends ValueNode> outputs,
            boolean copyInputs, boolean copyOrphans, boolean cloneInnerGraphs) {
        CloneMemo memo = cloneGetEquiv(inputs, outputs, copyInputs, copyOrphans, CloneMemo.empty(),
                cloneInnerGraphs);
        return new ClonedGraph(lookUp(inputs, memo), lookUp(outputs, memo));
    }

    private static List<ValueNode> lookUp(List<? extends ValueNode> originals, CloneMemo memo) {
        return originals.stream().map(original -> memo.getValue(original).get()).collect(Collectors.toList());
    }

    /** Same as {@link #cloneGetEquiv(List, List, boolean, boolean, CloneMemo, boolean, boolean)} in strict mode. */
    public static CloneMemo cloneGetEquiv(List<? extends ValueNode> inputs, List<? extends ValueNode> outputs,
            boolean copyInputs, boolean copyOrphans, CloneMemo memo, boolean cloneInnerGraphs) {
        return cloneGetEquiv(inputs, outputs, copyInputs, copyOrphans, memo, cloneInnerGraphs, true);
    }

    /**
     * Copies the subgraph between inputs and outputs, recording every replacement in memo. Anything that memo already
     * replaces is not copied: its replacement is used instead. That's how callers substitute parts of a graph.
     *
     * Inputs are recorded first, then the ApplicationNodes between inputs and outputs are copied in topological order,
     * and finally any outputs that still don't have replacements are copied.
     *
     * @param strict passed to {@link ApplicationNode#cloneWithNewInputs(List, boolean, boolean)}.
     *
     * @return memo, for convenience.
     */
    public static CloneMemo cloneGetEquiv(List<? extends ValueNode> inputs, List<? extends ValueNode> outputs,
            boolean copyInputs, boolean copyOrphans, CloneMemo memo, boolean cloneInnerGraphs, boolean strict) {
        for (ValueNode input : inputs) {
            memo.putValueIfAbsent(input, copyUnlessConstant(input, copyInputs));
        }

        for (ApplicationNode apply : Toposorts.ioToposort(inputs, outputs)) {
            for (ValueNode input : apply.getInputs()) {
                if (!memo.containsValue(input)) {
                    memo.putValue(input, copyUnlessConstant(input, copyOrphans));
                }
            }
            cloneNodeAndCache(apply, memo, cloneInnerGraphs, strict);
        }

        for (ValueNode output : outputs) {
            if (!memo.containsValue(output)) {
                memo.putValue(output, output.cloneNode());
            }
        }
        return memo;
    }

    private static ValueNode copyUnlessConstant(ValueNode node, boolean copy) {
        return (copy && !(node instanceof ConstantNode)) ? node.cloneNode() : node;
    }

    /**
     * Copies node, substituting its inputs with their replacements in memo, and records the copy in memo.
     *
     * If the node's Operation has already been copied (as can happen for Operations with inner graphs), the existing
     * copy is reused. Otherwise, the Operation is copied only if cloneInnerGraphs is true and it's an
     * {@link InnerGraphOperation}.
     *
     * @return the copy, or empty if all of node's outputs already had replacements in memo, in which case nothing
     *         happens.
     * @throws IllegalArgumentException if any of node's inputs has no replacement in memo.
     */
    public static Optional<ApplicationNode> cloneNodeAndCache(ApplicationNode node, CloneMemo memo,
            boolean cloneInnerGraphs, boolean strict) {
        if (node.getOutputs().stream().allMatch(memo::containsValue)) {
            return Optional.empty();
        }

        List<ValueNode> clonedInputs = node.getInputs()
                .stream()
                .map(input -> memo.getValue(input)
                        .orElseThrow(() -> new IllegalArgumentException(
                                String.format("Input %s of node %s has no replacement", input, node))))
                .collect(Collectors.toList());
        Operation operation = node.getOperation();
        Operation newOperation = memo.getOperation(operation).orElseGet(() -> maybeCloneOperation(operation,
                cloneInnerGraphs));
        ApplicationNode newNode = node.cloneWithNewInputs(clonedInputs, strict, newOperation);

        memo.putApplication(node, newNode);
        if (newNode.getOperation() != operation) {
            memo.putOperationIfAbsent(operation, newNode.getOperation());
        }
        for (int i = 0; i < node.getNumOutputs(); ++i) {
            memo.putValueIfAbsent(node.getOutputs().get(i), newNode.getOutputs().get(i));
        }
        return Optional.of(newNode);
    }

    private static Operation maybeCloneOperation(Operation operation, boolean cloneInnerGraphs) {
        if (cloneInnerGraphs && operation instanceof InnerGraphOperation) {
            return ((InnerGraphOperation) operation).cloneOperation();
        }
        return operation;
    }

    /**
     * Replaces every {@link NominalNode} among inputs with a fresh, unnamed ValueNode of the same type, rebuilding the
     * subgraph between inputs and outputs accordingly. This must happen before building a new inner graph from a graph
     * that already has nominal inputs: otherwise, the correspondence between nominal ids and input positions could
     * break, or substitutions could become circular.
     *
     * Assumes that all NominalNodes in the subgraph are part of inputs.
     *
     * @return the replaced inputs and outputs, which are inputs and outputs themselves if there are no nominal inputs.
     */
    public static ClonedGraph replaceNominalsWithDummies(List<? extends ValueNode> inputs,
            List<? extends ValueNode> outputs) {
        Map<ValueNode, ValueNode> replacements = new IdentityHashMap<>();
        for (ValueNode input : inputs) {
            if (input instanceof NominalNode) {
                replacements.put(input, input.getType().makeVariable());
            }
        }
        if (replacements.isEmpty()) {
            return new ClonedGraph(List.copyOf(inputs), List.copyOf(outputs));
        }

        CloneMemo memo = cloneGetEquiv(inputs, outputs, false, false, CloneMemo.withValues(replacements), false);
        return new ClonedGraph(lookUp(inputs, memo), lookUp(outputs, memo));
    }
}
