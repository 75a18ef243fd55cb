/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** A utility class for holding graph validation and related classes. */
public class GraphValidators {
    private GraphValidators() {}

    /**
     * A candidate for being a FunctionGraph. This candidate is one step away from becoming a FunctionGraph: it just
     * needs to undergo validation first.
     */
    public static class GraphCandidate {
        private final List<ValueNode> inputs;
        private final List<ValueNode> outputs;
        private final List<ApplicationNode> applyNodes;
        private final List<ValueNode> variables;
        private final Map<ValueNode, List<Edge>> clients;

        private GraphCandidate(List<? extends ValueNode> inputs, List<? extends ValueNode> outputs) {
            this.inputs = List.copyOf(inputs);
            this.outputs = List.copyOf(outputs);
            this.applyNodes = GraphTraversals.applysBetween(this.inputs, this.outputs)
                    .collect(Collectors.toUnmodifiableList());
            this.variables = captureVariables(this.inputs, this.outputs);
            this.clients = captureClients(this.variables, this.applyNodes, this.outputs);
        }

        /**
         * @param inputs the ValueNodes that users will supply values for.
         * @param outputs the ValueNodes that users want computed. The candidate is comprised of everything between
         *        inputs and outputs.
         */
        public static GraphCandidate fromInputsOutputs(List<? extends ValueNode> inputs,
                List<? extends ValueNode> outputs) {
            return new GraphCandidate(inputs, outputs);
        }

        private static List<ValueNode> captureVariables(List<ValueNode> inputs, List<ValueNode> outputs) {
            Set<ValueNode> unique = GraphTraversals.newIdentitySet();
            List<ValueNode> variables = new ArrayList<>();
            inputs.stream().filter(unique::add).forEach(variables::add);
            GraphTraversals.varsBetween(inputs, outputs).filter(unique::add).forEach(variables::add);
            return List.copyOf(variables);
        }

        private static Map<ValueNode, List<Edge>> captureClients(List<ValueNode> variables,
                List<ApplicationNode> applyNodes, List<ValueNode> outputs) {
            Map<ValueNode, List<Edge>> clients = new IdentityHashMap<>();
            variables.forEach(variable -> clients.put(variable, new ArrayList<>()));
            for (ApplicationNode apply : applyNodes) {
                for (int i = 0; i < apply.getNumInputs(); ++i) {
                    clients.computeIfAbsent(apply.getInputs().get(i), ignore -> new ArrayList<>())
                            .add(Edge.toInput(apply, i));
                }
            }
            for (int i = 0; i < outputs.size(); ++i) {
                clients.get(outputs.get(i)).add(Edge.toGraphOutput(i));
            }
            clients.replaceAll((variable, edges) -> List.copyOf(edges));
            return Collections.unmodifiableMap(clients);
        }

        public List<ValueNode> getInputs() {
            return inputs;
        }

        public List<ValueNode> getOutputs() {
            return outputs;
        }

        /** Returns the ApplicationNodes between inputs and outputs, each once, in no particular order. */
        public List<ApplicationNode> getApplyNodes() {
            return applyNodes;
        }

        /** Returns all of the ValueNodes in this candidate: inputs, outputs, orphans, and everything in between. */
        public List<ValueNode> getVariables() {
            return variables;
        }

        /**
         * Returns the edges in this candidate that use the given node.
         * 
         * @throws IllegalArgumentException if node is not part of this candidate.
         */
        public List<Edge> getClients(ValueNode node) {
            List<Edge> edges = clients.get(node);
            if (edges == null) {
                String message = String.format(
                        "Tried to retrieve clients of node '%s', but that node is not part of this graph.", node);
                throw new IllegalArgumentException(message);
            }
            return edges;
        }

        @Override
        public String toString() {
            return "inputs=" + inputs + ";outputs=" + outputs;
        }
    }

    /**
     * Validates a GraphCandidate, seeing whether it should be promoted to a full-fledged FunctionGraph or not.
     */
    @FunctionalInterface
    public interface GraphValidator {
        /**
         * Checks whether the GraphCandidate is valid.
         * 
         * @throws IllegalArgumentException if the candidate is invalid and should not be promoted to a FunctionGraph.
         *         The lack of this exception means the candidate is valid.
         */
        void validate(GraphCandidate candidate);
    }

    /** Returns a validator that checks that no ValueNode appears among the inputs more than once. */
    public static GraphValidator noDuplicateInputs() {
        return candidate -> {
            Set<ValueNode> unique = GraphTraversals.newIdentitySet();
            for (ValueNode input : candidate.getInputs()) {
                if (!unique.add(input)) {
                    throw new IllegalArgumentException(String.format("Input '%s' appears more than once in %s", input,
                            candidate.getInputs()));
                }
            }
        };
    }

    /** Returns a validator that checks that no input is the output of an ApplicationNode. */
    public static GraphValidator inputsAreUnowned() {
        return candidate -> candidate.getInputs().stream().filter(ValueNode::hasOwner).findFirst().ifPresent(input -> {
            throw new IllegalArgumentException(String.format(
                    "Input '%s' is the output of an already existing node: %s", input, input.getOwner().get()));
        });
    }

    /**
     * Returns a validator that checks that every ownerless ValueNode needed to compute the outputs is either an input
     * or a constant.
     */
    public static GraphValidator noMissingInputs() {
        return candidate -> GraphTraversals.orphansBetween(candidate.getInputs(), candidate.getOutputs())
                .filter(orphan -> !(orphan instanceof ConstantNode))
                .findFirst()
                .ifPresent(missing -> {
                    throw new IllegalArgumentException(String.format(
                            "Graph requires input '%s', which was not provided in %s", missing,
                            candidate.getInputs()));
                });
    }

    /**
     * Returns a validator that checks that the candidate has no cycles.
     * 
     * @apiNote unlike other validators, this one fails with {@link CycleDetectedException}.
     */
    public static GraphValidator acyclic() {
        return candidate -> Toposorts.ioToposort(candidate.getInputs(), candidate.getOutputs());
    }
}
