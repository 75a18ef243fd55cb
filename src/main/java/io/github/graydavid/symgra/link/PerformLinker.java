/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.link;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.symgra.core.ApplicationNode;
import io.github.graydavid.symgra.core.FunctionGraph;
import io.github.graydavid.symgra.core.StorageCell;
import io.github.graydavid.symgra.core.Thunk;
import io.github.graydavid.symgra.core.ValueNode;

/**
 * The sequential Linker: links a graph into a program that runs one thunk per ApplicationNode, in schedule order, each
 * thunk created by the node's own {@link io.github.graydavid.symgra.core.Operation#makeThunk(ApplicationNode, List, List)
 * Operation}. If garbage collection is allowed, the program clears each intermediate value right after the last node
 * that needs it runs.
 */
public class PerformLinker extends LocalLinker {
    private static final Logger LOGGER = LoggerFactory.getLogger(PerformLinker.class);

    private final FunctionGraph fgraph;
    private final List<ValueNode> noRecycling;

    private PerformLinker(boolean allowGc, Function<FunctionGraph, List<ApplicationNode>> scheduler,
            FunctionGraph fgraph, Collection<? extends ValueNode> noRecycling) {
        super(allowGc, scheduler);
        this.fgraph = fgraph;
        this.noRecycling = List.copyOf(noRecycling);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public PerformLinker accept(FunctionGraph fgraph, Collection<? extends ValueNode> noRecycling) {
        return new PerformLinker(allowsGc(), getScheduler().orElse(null), Objects.requireNonNull(fgraph),
                noRecycling);
    }

    @Override
    public PerformLinker accept(FunctionGraph fgraph) {
        return accept(fgraph, List.of());
    }

    @Override
    public PerformLinker withAllowGc(boolean allowGc) {
        return new PerformLinker(allowGc, getScheduler().orElse(null), fgraph, noRecycling);
    }

    @Override
    public LinkedProgramParts makeAll(List<StorageCell> inputStorage, List<StorageCell> outputStorage,
            StorageMap storageMap) {
        if (fgraph == null) {
            throw new IllegalStateException("PerformLinker must be bound to a FunctionGraph with accept first");
        }
        List<ApplicationNode> order = schedule(fgraph);
        storageMap.allocate(fgraph, order, inputStorage, outputStorage);

        List<NodeThunk> thunks = new ArrayList<>(order.size());
        for (ApplicationNode node : order) {
            List<StorageCell> inputCells = storageMap.requireAll(node.getInputs());
            List<StorageCell> outputCells = storageMap.requireAll(node.getOutputs());
            Thunk thunk = node.getOperation().makeThunk(node, inputCells, outputCells);
            thunks.add(new NodeThunk(node, thunk, inputCells, outputCells));
        }

        GarbageCollectionPlan gcPlan = allowsGc()
                ? GarbageCollectionPlan.fromLastUse(order, fgraph.getOutputs(), storageMap)
                : GarbageCollectionPlan.none(order.size());
        List<StorageCell> noRecyclingCells = noRecyclingCells(fgraph, noRecycling, storageMap);
        Thunk program = new SequentialProgram(thunks, gcPlan, noRecyclingCells);

        List<Container> inputs = fgraph.getInputs()
                .stream()
                .map(input -> Container.builder(input, storageMap.require(input)).build())
                .collect(Collectors.toList());
        List<Container> outputs = fgraph.getOutputs()
                .stream()
                .map(output -> Container.builder(output, storageMap.require(output)).readonly().build())
                .collect(Collectors.toList());
        LOGGER.debug("Linked program of {} thunks (gc: {}, no-recycling cells: {})", thunks.size(), allowsGc(),
                noRecyclingCells.size());
        return new LinkedProgramParts(program, inputs, outputs, thunks, order, storageMap);
    }

    /** The cells of the noRecycling nodes, except for fgraph's inputs, which are set by callers between runs. */
    static List<StorageCell> noRecyclingCells(FunctionGraph fgraph, List<ValueNode> noRecycling,
            StorageMap storageMap) {
        Set<ValueNode> inputs = Collections.newSetFromMap(new IdentityHashMap<>());
        inputs.addAll(fgraph.getInputs());
        return noRecycling.stream()
                .filter(node -> !inputs.contains(node))
                .map(storageMap::get)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    /** Runs a list of thunks in order, collecting garbage along the way. */
    private static class SequentialProgram implements Thunk {
        private final List<NodeThunk> thunks;
        private final GarbageCollectionPlan gcPlan;
        private final List<StorageCell> noRecyclingCells;

        private SequentialProgram(List<NodeThunk> thunks, GarbageCollectionPlan gcPlan,
                List<StorageCell> noRecyclingCells) {
            this.thunks = List.copyOf(thunks);
            this.gcPlan = gcPlan;
            this.noRecyclingCells = List.copyOf(noRecyclingCells);
        }

        @Override
        public void run() {
            noRecyclingCells.forEach(StorageCell::clear);
            for (int i = 0; i < thunks.size(); ++i) {
                NodeThunk thunk = thunks.get(i);
                try {
                    thunk.run();
                } catch (RuntimeException e) {
                    throw new ThunkException(thunk.getNode(), i, thunk.getInputs(), thunk.getOutputs(), e);
                }
                gcPlan.getCellsToClearAfter(i).forEach(StorageCell::clear);
            }
        }
    }

    public static class Builder {
        private boolean allowGc = true;
        private Function<FunctionGraph, List<ApplicationNode>> scheduler;

        private Builder() {}

        /** Whether programs clear intermediate values once they're no longer needed. Defaults to true. */
        public Builder allowGc(boolean allowGc) {
            this.allowGc = allowGc;
            return this;
        }

        /** Overrides the default schedule, {@link FunctionGraph#toposort()}. */
        public Builder scheduler(Function<FunctionGraph, List<ApplicationNode>> scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler);
            return this;
        }

        /** Creates a PerformLinker that isn't bound to any graph yet. */
        public PerformLinker build() {
            return new PerformLinker(allowGc, scheduler, null, List.of());
        }
    }
}
