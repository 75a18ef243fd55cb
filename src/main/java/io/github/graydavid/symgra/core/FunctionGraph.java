/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.symgra.core.GraphValidators.GraphCandidate;
import io.github.graydavid.symgra.core.GraphValidators.GraphValidator;

/**
 * A validated subgraph between a list of inputs and a list of outputs: the thing that gets handed to a linker to be
 * turned into a program. Unlike the implicit graphs that the rest of Symgra works with, FunctionGraph has a global view:
 * it knows all of its ApplicationNodes and ValueNodes and who uses each ValueNode.
 * 
 * FunctionGraph is a description of structure. It doesn't modify the nodes it's created from.
 */
public class FunctionGraph {
    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionGraph.class);
    private static final Collection<GraphValidator> VALIDATORS_FOR_EVERY_GRAPH = List.of(
            GraphValidators.noDuplicateInputs(), GraphValidators.inputsAreUnowned(), GraphValidators.noMissingInputs(),
            GraphValidators.acyclic());

    private final GraphCandidate candidate;
    private volatile List<ApplicationNode> toposort;

    private FunctionGraph(GraphCandidate candidate) {
        this.candidate = candidate;
    }

    /**
     * Tries to construct a FunctionGraph between inputs and outputs. As a part of this process, validators will be run
     * to make sure that a valid FunctionGraph can be created: the validators that every FunctionGraph runs and
     * extraValidators. If any of the validators fails, this method will fail.
     * 
     * @throws IllegalArgumentException if an input is duplicated or owned, or if a non-constant root is missing from
     *         inputs.
     * @throws CycleDetectedException if the graph contains cycles.
     */
    public static FunctionGraph fromInputsOutputs(List<? extends ValueNode> inputs, List<? extends ValueNode> outputs,
            Collection<GraphValidator> extraValidators) {
        return fromCandidate(GraphCandidate.fromInputsOutputs(inputs, outputs), extraValidators);
    }

    /** Same as {@link #fromInputsOutputs(List, List, Collection)}, except with no extra validators to run. */
    public static FunctionGraph fromInputsOutputs(List<? extends ValueNode> inputs,
            List<? extends ValueNode> outputs) {
        return fromInputsOutputs(inputs, outputs, List.of());
    }

    /**
     * Similar to {@link #fromInputsOutputs(List, List, Collection)}, except using a GraphCandidate. This is useful if a
     * user already has access to a GraphCandidate.
     */
    public static FunctionGraph fromCandidate(GraphCandidate candidate, Collection<GraphValidator> extraValidators) {
        Stream.concat(VALIDATORS_FOR_EVERY_GRAPH.stream(), extraValidators.stream())
                .forEach(validator -> validator.validate(candidate));
        LOGGER.debug("Validated function graph with {} inputs, {} outputs, and {} apply nodes",
                candidate.getInputs().size(), candidate.getOutputs().size(), candidate.getApplyNodes().size());
        return new FunctionGraph(candidate);
    }

    public List<ValueNode> getInputs() {
        return candidate.getInputs();
    }

    public List<ValueNode> getOutputs() {
        return candidate.getOutputs();
    }

    /** Returns the ApplicationNodes in this graph, each once, in no particular order. See {@link #toposort()}. */
    public List<ApplicationNode> getApplyNodes() {
        return candidate.getApplyNodes();
    }

    /** Returns all of the ValueNodes in this graph. */
    public List<ValueNode> getVariables() {
        return candidate.getVariables();
    }

    /**
     * Returns the edges in this graph that use the given node, as consumer inputs or graph outputs.
     * 
     * @throws IllegalArgumentException if node is not part of this graph.
     */
    public List<Edge> getClients(ValueNode node) {
        return candidate.getClients(node);
    }

    /**
     * Returns the ApplicationNodes of this graph in an order where every node comes after the nodes it depends on. The
     * order is computed once, on first access.
     */
    public List<ApplicationNode> toposort() {
        List<ApplicationNode> result = toposort;
        if (result == null) {
            result = List.copyOf(Toposorts.ioToposort(getInputs(), getOutputs(), Map.of()));
            toposort = result;
        }
        return result;
    }

    @Override
    public String toString() {
        return "FunctionGraph[" + candidate + "]";
    }
}
