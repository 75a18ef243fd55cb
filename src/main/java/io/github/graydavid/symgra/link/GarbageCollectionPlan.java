/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.link;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import io.github.graydavid.symgra.core.ApplicationNode;
import io.github.graydavid.symgra.core.StorageCell;
import io.github.graydavid.symgra.core.ValueNode;

/**
 * For each position in a schedule, the storage cells that can be cleared right after the node at that position runs.
 * A cell can be cleared once the last node that reads it has run, as long as the cell holds a value computed inside the
 * schedule and that value is not an output of the graph.
 */
public class GarbageCollectionPlan {
    private final List<List<StorageCell>> cellsToClear;

    private GarbageCollectionPlan(List<List<StorageCell>> cellsToClear) {
        this.cellsToClear = cellsToClear;
    }

    /** Returns a plan that never clears anything. */
    public static GarbageCollectionPlan none(int numPositions) {
        return new GarbageCollectionPlan(Collections.nCopies(numPositions, List.of()));
    }

    /** Computes a plan for order from last-use analysis. */
    public static GarbageCollectionPlan fromLastUse(List<ApplicationNode> order, List<ValueNode> graphOutputs,
            StorageMap storageMap) {
        Set<ValueNode> computed = Collections.newSetFromMap(new IdentityHashMap<>());
        Map<ValueNode, ApplicationNode> lastUser = new IdentityHashMap<>();
        for (ApplicationNode node : order) {
            computed.addAll(node.getOutputs());
            node.getInputs().forEach(input -> lastUser.put(input, node));
        }
        Set<ValueNode> outputs = Collections.newSetFromMap(new IdentityHashMap<>());
        outputs.addAll(graphOutputs);

        List<List<StorageCell>> cellsToClear = new ArrayList<>(order.size());
        for (ApplicationNode node : order) {
            List<StorageCell> cells = node.getInputs()
                    .stream()
                    .filter(input -> computed.contains(input) && !outputs.contains(input)
                            && lastUser.get(input) == node)
                    .map(storageMap::require)
                    .distinct()
                    .collect(Collectors.toUnmodifiableList());
            cellsToClear.add(cells);
        }
        return new GarbageCollectionPlan(Collections.unmodifiableList(cellsToClear));
    }

    /** @throws IndexOutOfBoundsException if position is not part of the plan. */
    public List<StorageCell> getCellsToClearAfter(int position) {
        return cellsToClear.get(position);
    }

    public int size() {
        return cellsToClear.size();
    }
}
