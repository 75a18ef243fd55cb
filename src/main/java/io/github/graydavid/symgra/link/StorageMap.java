/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.link;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import io.github.graydavid.symgra.core.ApplicationNode;
import io.github.graydavid.symgra.core.ConstantNode;
import io.github.graydavid.symgra.core.FunctionGraph;
import io.github.graydavid.symgra.core.StorageCell;
import io.github.graydavid.symgra.core.ValueNode;

/** Maps each ValueNode of a scheduled graph to the storage cell that holds its value during execution. */
public class StorageMap {
    private final Map<ValueNode, StorageCell> cells;

    private StorageMap() {
        this.cells = new LinkedHashMap<>();
    }

    public static StorageMap empty() {
        return new StorageMap();
    }

    /**
     * Makes sure that every ValueNode used by order, as well as fgraph's inputs and outputs, has a storage cell.
     * Existing mappings are kept. Constants get cells pre-filled with their data. Everything else gets a new, empty
     * cell.
     * 
     * @param inputStorage the cells to use for fgraph's inputs, in order. Empty means to allocate new cells.
     * @param outputStorage the cells to use for fgraph's outputs, in order. Empty means to allocate new cells.
     * 
     * @throws IllegalArgumentException if inputStorage or outputStorage are non-empty but sized differently from
     *         fgraph's inputs or outputs; if they conflict with existing mappings; or if a node in order uses a
     *         non-constant ValueNode that has no cell and that no other node in order computes.
     */
    public void allocate(FunctionGraph fgraph, List<ApplicationNode> order, List<StorageCell> inputStorage,
            List<StorageCell> outputStorage) {
        List<ValueNode> inputs = fgraph.getInputs();
        if (inputStorage.isEmpty()) {
            inputs.forEach(input -> cells.computeIfAbsent(input, ignore -> new StorageCell()));
        } else {
            putAll(inputs, inputStorage, "input");
        }
        if (!outputStorage.isEmpty()) {
            putAll(fgraph.getOutputs(), outputStorage, "output");
        }

        for (ApplicationNode node : order) {
            for (ValueNode input : node.getInputs()) {
                if (!cells.containsKey(input)) {
                    if (!(input instanceof ConstantNode)) {
                        throw new IllegalArgumentException(String.format(
                                "Node %s uses %s, which has no storage and is neither a constant nor computed earlier",
                                node, input));
                    }
                    cells.put(input, new StorageCell(((ConstantNode) input).getData()));
                }
            }
            for (ValueNode output : node.getOutputs()) {
                cells.computeIfAbsent(output, ignore -> new StorageCell());
            }
        }
        for (ValueNode output : fgraph.getOutputs()) {
            if (output instanceof ConstantNode) {
                cells.computeIfAbsent(output, ignore -> new StorageCell(((ConstantNode) output).getData()));
            }
        }
    }

    private void putAll(List<ValueNode> nodes, List<StorageCell> storage, String kind) {
        if (nodes.size() != storage.size()) {
            throw new IllegalArgumentException(String.format("Expected %s %s storage cells but found %s",
                    nodes.size(), kind, storage.size()));
        }
        for (int i = 0; i < nodes.size(); ++i) {
            put(nodes.get(i), storage.get(i));
        }
    }

    /**
     * Maps node to cell.
     * 
     * @throws IllegalArgumentException if node is already mapped to a different cell.
     */
    public void put(ValueNode node, StorageCell cell) {
        StorageCell existing = cells.putIfAbsent(node, cell);
        if (existing != null && existing != cell) {
            throw new IllegalArgumentException(
                    String.format("Node %s already has storage %s, which conflicts with %s", node, existing, cell));
        }
    }

    public Optional<StorageCell> get(ValueNode node) {
        return Optional.ofNullable(cells.get(node));
    }

    /** @throws IllegalArgumentException if node has no storage. */
    public StorageCell require(ValueNode node) {
        StorageCell cell = cells.get(node);
        if (cell == null) {
            throw new IllegalArgumentException(String.format("Node %s has no storage", node));
        }
        return cell;
    }

    public List<StorageCell> requireAll(List<? extends ValueNode> nodes) {
        return nodes.stream().map(this::require).collect(Collectors.toList());
    }

    public boolean contains(ValueNode node) {
        return cells.containsKey(node);
    }

    public Set<ValueNode> getNodes() {
        return Collections.unmodifiableSet(cells.keySet());
    }

    public Collection<StorageCell> getCells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    public int size() {
        return cells.size();
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
