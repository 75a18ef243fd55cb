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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Dependency-respecting orderings of graph nodes. Every ordering contains each reachable node exactly once, and every
 * node comes after all of its dependencies.
 */
public class Toposorts {
    private Toposorts() {}

    /**
     * Sorts every node reachable from outputs through deps so that each node comes after everything it depends on.
     * Among nodes that are ready at the same time, the order is first-in-first-out, based on the order in which deps
     * returns dependencies.
     *
     * @param deps returns the dependencies of a node. Must behave like a pure function: it's called at most once per
     *        node. Must return either null, a List, or a LinkedHashSet, so that the order is deterministic.
     *
     * @throws IllegalArgumentException if deps returns a collection with no deterministic order.
     * @throws CycleDetectedException if some nodes depend on themselves.
     */
    public static <T> List<T> generalToposort(Collection<? extends T> outputs,
            Function<? super T, ? extends Collection<? extends T>> deps) {
        return generalToposort(outputs, deps, null);
    }

    /**
     * Same as {@link #generalToposort(Collection, Function)}, except also fills clients (if non-null) with a mapping
     * from each node to the nodes that depend on it.
     */
    public static <T> List<T> generalToposort(Collection<? extends T> outputs,
            Function<? super T, ? extends Collection<? extends T>> deps, Map<T, List<T>> clients) {
        DependencyCache<T> cache = new DependencyCache<>(deps);
        List<NodeAndChildren<T>> searchResults = GraphTraversals.walkWithChildren(outputs, cache::get, false)
                .collect(Collectors.toList());

        Map<T, List<T>> foundClients = new IdentityHashMap<>();
        Deque<T> sources = new ArrayDeque<>();
        for (NodeAndChildren<T> result : searchResults) {
            for (T child : result.getChildren()) {
                foundClients.computeIfAbsent(child, ignore -> new ArrayList<>()).add(result.getNode());
            }
            if (cache.get(result.getNode()).isEmpty()) {
                sources.add(result.getNode());
            }
        }
        if (clients != null) {
            clients.putAll(foundClients);
        }

        Set<T> resolved = GraphTraversals.newIdentitySet();
        List<T> sorted = new ArrayList<>(searchResults.size());
        while (!sources.isEmpty()) {
            T node = sources.pollFirst();
            if (resolved.add(node)) {
                sorted.add(node);
                for (T client : foundClients.getOrDefault(node, List.of())) {
                    List<T> remaining = cache.removeDependency(client, node);
                    if (remaining.isEmpty()) {
                        sources.add(client);
                    }
                }
            }
        }

        if (sorted.size() != searchResults.size()) {
            throw new CycleDetectedException(String.format("Graph contains cycles: sorted %s of %s discovered nodes",
                    sorted.size(), searchResults.size()));
        }
        return sorted;
    }

    /** Memoizes a dependency function, remembering which dependencies are still unresolved. */
    private static class DependencyCache<T> {
        private final Function<? super T, ? extends Collection<? extends T>> deps;
        private final Map<T, List<T>> cache;

        private DependencyCache(Function<? super T, ? extends Collection<? extends T>> deps) {
            this.deps = Objects.requireNonNull(deps);
            this.cache = new IdentityHashMap<>();
        }

        private List<T> get(T node) {
            List<T> cached = cache.get(node);
            if (cached != null) {
                return cached;
            }
            Collection<? extends T> dependencies = deps.apply(node);
            List<T> computed = new ArrayList<>();
            if (dependencies != null && !dependencies.isEmpty()) {
                if (!(dependencies instanceof List) && !(dependencies instanceof LinkedHashSet)) {
                    throw new IllegalArgumentException(
                            "Non-deterministic collections found; make toposort non-deterministic: "
                                    + dependencies.getClass());
                }
                computed.addAll(dependencies);
            }
            cache.put(node, computed);
            return computed;
        }

        private List<T> removeDependency(T client, T dependency) {
            List<T> remaining = cache.get(client)
                    .stream()
                    .filter(candidate -> candidate != dependency)
                    .collect(Collectors.toList());
            cache.put(client, remaining);
            return remaining;
        }
    }

    /**
     * Sorts the ApplicationNodes between inputs and outputs. Nodes in inputs are treated as already available, so the
     * owners of inputs are never included.
     *
     * @throws CycleDetectedException if some nodes depend on themselves.
     */
    public static List<ApplicationNode> ioToposort(Collection<? extends ValueNode> inputs,
            List<? extends ValueNode> outputs) {
        Set<ValueNode> computed = GraphTraversals.newIdentitySet(inputs);
        Set<ApplicationNode> expanded = GraphTraversals.newIdentitySet();
        List<ApplicationNode> todo = new ArrayList<>();
        for (int i = outputs.size() - 1; i >= 0; --i) {
            outputs.get(i).getOwner().ifPresent(todo::add);
        }
        List<ApplicationNode> order = new ArrayList<>();
        while (!todo.isEmpty()) {
            ApplicationNode current = todo.remove(todo.size() - 1);
            if (computed.containsAll(current.getOutputs())) {
                continue;
            }
            boolean ready = current.getInputs()
                    .stream()
                    .allMatch(input -> computed.contains(input) || !input.hasOwner());
            if (ready) {
                computed.addAll(current.getOutputs());
                order.add(current);
            } else {
                if (!expanded.add(current)) {
                    throw new CycleDetectedException(
                            String.format("Graph contains cycles: node %s depends on its own outputs", current));
                }
                todo.add(current);
                current.getInputs()
                        .stream()
                        .filter(input -> input.hasOwner() && !computed.contains(input))
                        .map(input -> input.getOwner().get())
                        .forEach(todo::add);
            }
        }
        return order;
    }

    /**
     * Same as {@link #ioToposort(Collection, List)}, except orderings adds extra constraints: each key must come after
     * all of the nodes in its value. Constraints are usually between ApplicationNodes.
     *
     * @throws IllegalArgumentException if a member of inputs has ordering constraints.
     */
    public static List<ApplicationNode> ioToposort(Collection<? extends ValueNode> inputs,
            List<? extends ValueNode> outputs, Map<? extends Node, ? extends List<? extends Node>> orderings) {
        return ioToposort(inputs, outputs, orderings, null);
    }

    /**
     * Same as {@link #ioToposort(Collection, List, Map)}, except also fills clients (if non-null) with a mapping from
     * each node in the sorted subgraph to the nodes that depend on it.
     */
    public static List<ApplicationNode> ioToposort(Collection<? extends ValueNode> inputs,
            List<? extends ValueNode> outputs, Map<? extends Node, ? extends List<? extends Node>> orderings,
            Map<Node, List<Node>> clients) {
        if (orderings.isEmpty() && clients == null) {
            return ioToposort(inputs, outputs);
        }

        Set<ValueNode> inputSet = GraphTraversals.newIdentitySet(inputs);
        Function<Node, List<Node>> deps;
        if (orderings.isEmpty()) {
            deps = node -> inputSet.contains(node) ? List.of() : structuralDependencies(node);
        } else {
            deps = node -> {
                List<? extends Node> extra = orderings.get(node);
                if (extra == null) {
                    extra = List.of();
                }
                if (inputSet.contains(node)) {
                    if (!extra.isEmpty()) {
                        throw new IllegalArgumentException(
                                String.format("Graph input %s cannot have ordering constraints: %s", node, extra));
                    }
                    return List.of();
                }
                List<Node> dependencies = new ArrayList<>(structuralDependencies(node));
                dependencies.addAll(extra);
                return dependencies;
            };
        }

        List<Node> sorted = generalToposort(outputs, deps, clients);
        return sorted.stream()
                .filter(node -> node instanceof ApplicationNode)
                .map(node -> (ApplicationNode) node)
                .collect(Collectors.toList());
    }

    private static List<Node> structuralDependencies(Node node) {
        return Collections.unmodifiableList(node.getParents());
    }
}
