/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pure functions for finding things in graphs. Graphs are implicit: they're whatever is reachable from some output
 * ValueNodes through owner and input back-edges.
 *
 * Unless otherwise noted, streams returned by this class are lazy: the graph is explored only as far as the stream is
 * consumed. The graph must not be modified while a stream is being consumed.
 */
public class GraphTraversals {
    private GraphTraversals() {}

    /**
     * Walks through a graph, starting from the given nodes and expanding each node into its children, either
     * breadth-first or depth-first. Each node appears at most once in the response, based on identity, even if it's
     * reachable in multiple ways or appears multiple times in nodes.
     *
     * @param expand returns the children of a node. May return null or an empty collection if there are none.
     * @param bfs if true, nodes are visited first-in-first-out (breadth-first). If false, nodes are visited
     *        last-in-first-out (depth-first): the children of the most recently expanded node are visited first, from
     *        last to first. That's not the same as a classical recursive pre-order depth-first search.
     */
    public static <T> Stream<T> walk(Collection<? extends T> nodes,
            Function<? super T, ? extends Collection<? extends T>> expand, boolean bfs) {
        return walkWithChildren(nodes, expand, bfs).map(NodeAndChildren::getNode);
    }

    /** Same as {@link #walk(Collection, Function, boolean)}, except each node is accompanied by its children. */
    public static <T> Stream<NodeAndChildren<T>> walkWithChildren(Collection<? extends T> nodes,
            Function<? super T, ? extends Collection<? extends T>> expand, boolean bfs) {
        WalkIterator<T> iterator = new WalkIterator<>(nodes, expand, bfs);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private static class WalkIterator<T> implements Iterator<NodeAndChildren<T>> {
        private final Deque<T> pending;
        private final Set<T> seen;
        private final Function<? super T, ? extends Collection<? extends T>> expand;
        private final boolean bfs;
        private NodeAndChildren<T> next;

        private WalkIterator(Collection<? extends T> nodes, Function<? super T, ? extends Collection<? extends T>> expand,
                boolean bfs) {
            this.pending = new ArrayDeque<>(nodes);
            this.seen = newIdentitySet();
            this.expand = Objects.requireNonNull(expand);
            this.bfs = bfs;
            this.next = null;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            while (!pending.isEmpty()) {
                T node = bfs ? pending.pollFirst() : pending.pollLast();
                if (seen.add(node)) {
                    Collection<? extends T> expanded = expand.apply(node);
                    List<T> children = (expanded == null) ? List.of() : List.copyOf(expanded);
                    pending.addAll(children);
                    next = new NodeAndChildren<>(node, children);
                    return true;
                }
            }
            return false;
        }

        @Override
        public NodeAndChildren<T> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            NodeAndChildren<T> current = next;
            next = null;
            return current;
        }
    }

    static <T> Set<T> newIdentitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    static <T> Set<T> newIdentitySet(Collection<? extends T> items) {
        Set<T> set = newIdentitySet();
        set.addAll(items);
        return set;
    }

    private static <T> List<T> reversed(List<? extends T> list) {
        List<T> reversed = new ArrayList<>(list);
        Collections.reverse(reversed);
        return reversed;
    }

    /**
     * Returns every ValueNode that contributes to the given outputs (inclusive), in the order found by a depth-first
     * walk backwards through owners. The walk never proceeds past a blocker, although blockers themselves are included.
     */
    public static Stream<ValueNode> ancestors(Collection<? extends ValueNode> outputs,
            Collection<? extends ValueNode> blockers) {
        Set<ValueNode> blockerSet = newIdentitySet(blockers);
        return walk(outputs, node -> {
            if (node.hasOwner() && !blockerSet.contains(node)) {
                return reversed(node.getOwner().get().getInputs());
            }
            return null;
        }, false);
    }

    public static Stream<ValueNode> ancestors(Collection<? extends ValueNode> outputs) {
        return ancestors(outputs, List.of());
    }

    /** Returns the ownerless {@link #ancestors(Collection, Collection)}: the roots needed to compute outputs. */
    public static Stream<ValueNode> graphInputs(Collection<? extends ValueNode> outputs,
            Collection<? extends ValueNode> blockers) {
        return ancestors(outputs, blockers).filter(node -> !node.hasOwner());
    }

    public static Stream<ValueNode> graphInputs(Collection<? extends ValueNode> outputs) {
        return graphInputs(outputs, List.of());
    }

    /**
     * Returns the graph inputs that a user would have to supply to compute outputs: i.e. excluding constants and shared
     * values.
     */
    public static Stream<ValueNode> explicitGraphInputs(Collection<? extends ValueNode> outputs) {
        return graphInputs(outputs)
                .filter(node -> !(node instanceof ConstantNode) && !(node instanceof SharedValueNode));
    }

    /**
     * Returns the ValueNodes involved in the subgraph between ins and outs, breadth-first from outs. That includes ins,
     * outs, the orphans between them, and every output of every intermediate ApplicationNode. The walk doesn't proceed
     * past any member of ins.
     */
    public static Stream<ValueNode> varsBetween(Collection<? extends ValueNode> ins,
            Collection<? extends ValueNode> outs) {
        Set<ValueNode> inSet = newIdentitySet(ins);
        return walk(outs, node -> {
            if (node.hasOwner() && !inSet.contains(node)) {
                ApplicationNode owner = node.getOwner().get();
                List<ValueNode> neighbors = new ArrayList<>(owner.getInputs());
                neighbors.addAll(owner.getOutputs());
                return reversed(neighbors);
            }
            return null;
        }, true);
    }

    /** Returns the ownerless ValueNodes that outs depend upon that are not part of ins. */
    public static Stream<ValueNode> orphansBetween(Collection<? extends ValueNode> ins,
            Collection<? extends ValueNode> outs) {
        Set<ValueNode> inSet = newIdentitySet(ins);
        return varsBetween(ins, outs).filter(node -> !node.hasOwner() && !inSet.contains(node));
    }

    /**
     * Returns the ApplicationNodes in the subgraph between ins and outs, including the owners of outs, but not the
     * owners of ins. Each ApplicationNode appears once.
     */
    public static Stream<ApplicationNode> applysBetween(Collection<? extends ValueNode> ins,
            Collection<? extends ValueNode> outs) {
        Set<ValueNode> inSet = newIdentitySet(ins);
        Set<ApplicationNode> found = newIdentitySet();
        return varsBetween(ins, outs).filter(node -> node.hasOwner() && !inSet.contains(node))
                .map(node -> node.getOwner().get())
                .filter(found::add);
    }

    /**
     * Returns the closest ValueNodes to outputs that are needed to compute outputs, assuming that ancestorsToInclude
     * are available, and such that none of the returned nodes depend on each other. A member of ancestorsToInclude is
     * returned if it's reachable from outputs. A regular node is returned once it's confirmed not to depend on the
     * current frontier.
     *
     * With no ancestors to include, the response is simply outputs without duplicates.
     */
    public static List<ValueNode> truncatedGraphInputs(List<? extends ValueNode> outputs,
            Collection<? extends ValueNode> ancestorsToInclude) {
        List<ValueNode> truncatedInputs = new ArrayList<>();
        List<ValueNode> candidates = new ArrayList<>(outputs);
        if (ancestorsToInclude.isEmpty()) {
            Set<ValueNode> unique = newIdentitySet();
            candidates.stream().filter(unique::add).forEach(truncatedInputs::add);
            return truncatedInputs;
        }

        Set<ValueNode> blockers = newIdentitySet(ancestorsToInclude);
        Set<ValueNode> ancestorSet = newIdentitySet(ancestorsToInclude);
        Set<ValueNode> seen = newIdentitySet();
        while (!candidates.isEmpty()) {
            ValueNode variable = candidates.remove(candidates.size() - 1);
            if (seen.contains(variable)) {
                continue;
            }
            if (ancestorSet.contains(variable)) {
                Set<ValueNode> otherAncestors = newIdentitySet(ancestorSet);
                otherAncestors.remove(variable);
                boolean dependent = variableDependsOn(variable, otherAncestors);
                truncatedInputs.add(variable);
                if (dependent) {
                    addUnseenInputs(variable, seen, candidates);
                }
            } else {
                boolean dependent = variableDependsOn(variable, blockers);
                blockers.add(variable);
                if (dependent) {
                    addUnseenInputs(variable, seen, candidates);
                } else {
                    truncatedInputs.add(variable);
                }
            }
            seen.add(variable);
        }
        return truncatedInputs;
    }

    // A dependent node always has an owner
    private static void addUnseenInputs(ValueNode variable, Set<ValueNode> seen, List<ValueNode> candidates) {
        variable.getOwner()
                .get()
                .getInputs()
                .stream()
                .filter(input -> !seen.contains(input))
                .forEach(candidates::add);
    }

    /**
     * Returns the connection pattern of the subgraph between inputs and outputs: {@code pattern[i][o]} is true if
     * outputs[o] may depend on inputs[i]. Computed by propagating each Operation's own connection pattern through the
     * subgraph in topological order.
     *
     * @throws MisbehaviorException if an Operation returns a connection pattern of the wrong shape.
     */
    public static boolean[][] ioConnectionPattern(List<? extends ValueNode> inputs,
            List<? extends ValueNode> outputs) {
        List<ApplicationNode> innerNodes = Toposorts.ioToposort(inputs, outputs);
        int numInputs = inputs.size();
        Map<ValueNode, boolean[]> patternByVariable = new IdentityHashMap<>();
        for (int i = 0; i < numInputs; ++i) {
            boolean[] inputPattern = new boolean[numInputs];
            inputPattern[i] = true;
            patternByVariable.put(inputs.get(i), inputPattern);
        }

        for (ApplicationNode node : innerNodes) {
            boolean[][] operationPattern = requireValidConnectionPattern(node);
            for (int outIndex = 0; outIndex < node.getNumOutputs(); ++outIndex) {
                boolean[] outPattern = new boolean[numInputs];
                for (int inIndex = 0; inIndex < node.getNumInputs(); ++inIndex) {
                    boolean[] inPattern = patternByVariable.get(node.getInputs().get(inIndex));
                    if (inPattern != null && operationPattern[inIndex][outIndex]) {
                        for (int i = 0; i < numInputs; ++i) {
                            outPattern[i] = outPattern[i] || inPattern[i];
                        }
                    }
                }
                patternByVariable.put(node.getOutputs().get(outIndex), outPattern);
            }
        }

        boolean[][] globalPattern = new boolean[numInputs][outputs.size()];
        for (int o = 0; o < outputs.size(); ++o) {
            boolean[] outPattern = patternByVariable.getOrDefault(outputs.get(o), new boolean[numInputs]);
            for (int i = 0; i < numInputs; ++i) {
                globalPattern[i][o] = outPattern[i];
            }
        }
        return globalPattern;
    }

    private static boolean[][] requireValidConnectionPattern(ApplicationNode node) {
        boolean[][] pattern = node.getOperation().connectionPattern(node);
        boolean validShape = pattern != null && pattern.length == node.getNumInputs();
        for (int i = 0; validShape && i < pattern.length; ++i) {
            validShape = pattern[i] != null && pattern[i].length == node.getNumOutputs();
        }
        if (!validShape) {
            throw new MisbehaviorException(String.format(
                    "Operation %s returned a connection pattern that isn't %sx%s for node %s", node.getOperation(),
                    node.getNumInputs(), node.getNumOutputs(), node));
        }
        return pattern;
    }

    /**
     * Follows the view maps of the owners of node transitively, returning the ValueNodes at the end of each chain: those
     * that are not views of anything else.
     */
    public static List<ValueNode> viewRoots(ValueNode node) {
        if (!node.hasOwner()) {
            return List.of(node);
        }
        ApplicationNode owner = node.getOwner().get();
        List<Integer> viewedInputs = owner.getOperation().getViewMap().get(node.getIndex().getAsInt());
        if (viewedInputs == null) {
            return List.of(node);
        }
        List<ValueNode> roots = new ArrayList<>();
        for (int inputIndex : viewedInputs) {
            roots.addAll(viewRoots(owner.getInputs().get(inputIndex)));
        }
        return roots;
    }

    /** Answers whether any of dependsOn is part of the graph that computes apply (including apply itself). */
    public static boolean applyDependsOn(ApplicationNode apply, Collection<? extends ApplicationNode> dependsOn) {
        Set<ApplicationNode> dependsOnSet = newIdentitySet(dependsOn);
        Set<ValueNode> computed = newIdentitySet();
        Set<ApplicationNode> done = newIdentitySet();
        List<ApplicationNode> todo = new ArrayList<>(List.of(apply));
        while (!todo.isEmpty()) {
            ApplicationNode current = todo.remove(todo.size() - 1);
            if (done.contains(current)) {
                continue;
            }
            boolean ready = current.getInputs()
                    .stream()
                    .allMatch(input -> computed.contains(input) || !input.hasOwner());
            if (ready) {
                done.add(current);
                computed.addAll(current.getOutputs());
                if (dependsOnSet.contains(current)) {
                    return true;
                }
            } else {
                todo.add(current);
                current.getInputs()
                        .stream()
                        .filter(ValueNode::hasOwner)
                        .map(input -> input.getOwner().get())
                        .forEach(todo::add);
            }
        }
        return false;
    }

    public static boolean applyDependsOn(ApplicationNode apply, ApplicationNode dependsOn) {
        return applyDependsOn(apply, List.of(dependsOn));
    }

    /** Answers whether any of dependsOn is an ancestor of variable (including variable itself). */
    public static boolean variableDependsOn(ValueNode variable, Collection<? extends ValueNode> dependsOn) {
        Set<ValueNode> dependsOnSet = newIdentitySet(dependsOn);
        return ancestors(List.of(variable)).anyMatch(dependsOnSet::contains);
    }

    public static boolean variableDependsOn(ValueNode variable, ValueNode dependsOn) {
        return variableDependsOn(variable, List.of(dependsOn));
    }

    /**
     * Returns all ValueNodes whose name or auto name is name, searching depth-first from outputs through owners and
     * into the inner graphs of {@link InnerGraphOperation}s.
     */
    public static List<ValueNode> getVarByName(Collection<? extends ValueNode> outputs, String name) {
        Objects.requireNonNull(name);
        return GraphTraversals.<ValueNode>walk(outputs, GraphTraversals::expandIntoInnerGraphs, false)
                .filter(node -> name.equals(node.getName().orElse(null)) || name.equals(node.getAutoName()))
                .collect(Collectors.toList());
    }

    private static List<ValueNode> expandIntoInnerGraphs(ValueNode node) {
        if (!node.hasOwner()) {
            return null;
        }
        ApplicationNode owner = node.getOwner().get();
        List<ValueNode> children = new ArrayList<>(owner.getInputs());
        if (owner.getOperation() instanceof InnerGraphOperation) {
            children.addAll(((InnerGraphOperation) owner.getOperation()).getInnerOutputs());
        }
        return children;
    }

    /**
     * Same as {@link #getVarByName(Collection, String)}, except requires exactly one match.
     *
     * @throws IllegalArgumentException if there isn't exactly one match.
     */
    public static ValueNode getSingleVarByName(Collection<? extends ValueNode> outputs, String name) {
        List<ValueNode> matches = getVarByName(outputs, name);
        if (matches.size() != 1) {
            throw new IllegalArgumentException(
                    String.format("Expected exactly one variable named '%s' but found %s: %s", name, matches.size(),
                            matches));
        }
        return matches.get(0);
    }

    /** The default way of describing a leaf ValueNode: its toString. */
    public static String defaultLeafFormatter(ValueNode node) {
        return String.valueOf(node);
    }

    /** The default way of describing an ApplicationNode given descriptions of its inputs: {@code op(arg, ...)}. */
    public static String defaultNodeFormatter(ApplicationNode node, List<String> argStrings) {
        return node.getOperation() + "(" + String.join(", ", argStrings) + ")";
    }

    /** Describes the subgraph between inputs and node's inputs, followed by node itself. */
    public static String opAsString(Collection<? extends ValueNode> inputs, ApplicationNode node) {
        return opAsString(inputs, node, GraphTraversals::defaultLeafFormatter, GraphTraversals::defaultNodeFormatter);
    }

    public static String opAsString(Collection<? extends ValueNode> inputs, ApplicationNode node,
            Function<? super ValueNode, String> leafFormatter,
            BiFunction<? super ApplicationNode, List<String>, String> nodeFormatter) {
        List<String> argStrings = asString(inputs, node.getInputs(), leafFormatter, nodeFormatter);
        return nodeFormatter.apply(node, argStrings);
    }

    /**
     * Returns one description per output of the subgraph between inputs and outputs. If an ApplicationNode is used by
     * several others, its first occurrence is described as {@code *n -> description} and all subsequent occurrences as
     * {@code *n}. Multi-output ApplicationNodes have their output index appended as {@code ::index}.
     */
    public static List<String> asString(Collection<? extends ValueNode> inputs, List<? extends ValueNode> outputs) {
        return asString(inputs, outputs, GraphTraversals::defaultLeafFormatter, GraphTraversals::defaultNodeFormatter);
    }

    public static List<String> asString(Collection<? extends ValueNode> inputs, List<? extends ValueNode> outputs,
            Function<? super ValueNode, String> leafFormatter,
            BiFunction<? super ApplicationNode, List<String>, String> nodeFormatter) {
        return new StringDescriber(inputs, outputs, leafFormatter, nodeFormatter).describeAll(outputs);
    }

    private static class StringDescriber {
        private final Set<ValueNode> inputs;
        private final Set<ValueNode> orphans;
        private final List<ApplicationNode> multi;
        private final Set<ApplicationNode> done;
        private final Function<? super ValueNode, String> leafFormatter;
        private final BiFunction<? super ApplicationNode, List<String>, String> nodeFormatter;

        private StringDescriber(Collection<? extends ValueNode> inputs, List<? extends ValueNode> outputs,
                Function<? super ValueNode, String> leafFormatter,
                BiFunction<? super ApplicationNode, List<String>, String> nodeFormatter) {
            this.inputs = newIdentitySet(inputs);
            this.orphans = newIdentitySet(orphansBetween(inputs, outputs).collect(Collectors.toList()));
            this.done = newIdentitySet();
            this.leafFormatter = leafFormatter;
            this.nodeFormatter = nodeFormatter;

            Set<ApplicationNode> seen = newIdentitySet();
            Set<ApplicationNode> multiOrder = new LinkedHashSet<>();
            for (ValueNode output : outputs) {
                output.getOwner().filter(owner -> !seen.add(owner)).ifPresent(multiOrder::add);
            }
            applysBetween(inputs, outputs).forEach(apply -> {
                for (ValueNode input : apply.getInputs()) {
                    if (this.inputs.contains(input) || orphans.contains(input) || !input.hasOwner()) {
                        continue;
                    }
                    ApplicationNode inputOwner = input.getOwner().get();
                    if (!seen.add(inputOwner)) {
                        multiOrder.add(inputOwner);
                    }
                }
            });
            this.multi = List.copyOf(multiOrder);
        }

        private List<String> describeAll(List<? extends ValueNode> nodes) {
            return nodes.stream().map(this::describe).collect(Collectors.toList());
        }

        private String describe(ValueNode node) {
            if (!node.hasOwner() || inputs.contains(node) || orphans.contains(node)) {
                return leafFormatter.apply(node);
            }
            ApplicationNode owner = node.getOwner().get();
            String indexSuffix = (owner.getNumOutputs() == 1) ? "" : "::" + node.getIndex().getAsInt();
            if (done.contains(owner)) {
                return "*" + multiIndex(owner) + indexSuffix;
            }
            done.add(owner);
            String description = nodeFormatter.apply(owner, describeAll(owner.getInputs()));
            return multi.contains(owner) ? "*" + multiIndex(owner) + " -> " + description : description;
        }

        private int multiIndex(ApplicationNode node) {
            return multi.indexOf(node) + 1;
        }
    }
}
