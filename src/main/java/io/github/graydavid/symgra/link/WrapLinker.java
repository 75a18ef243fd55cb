/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.link;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.symgra.core.ApplicationNode;
import io.github.graydavid.symgra.core.FunctionGraph;
import io.github.graydavid.symgra.core.StorageCell;
import io.github.graydavid.symgra.core.Thunk;
import io.github.graydavid.symgra.core.ValueNode;

/**
 * Runs several LocalLinkers side by side on the same graph. Each underlying linker gets its own storage. Before every
 * run, the values of the first linker's inputs are copied into every other linker's inputs. Then, for each node in the
 * shared schedule, a {@link Wrapper} is called with each linker's thunk for that node: the Wrapper decides what to run
 * and can compare results, trace execution, and so on. Everything runs sequentially in the current thread.
 * 
 * Users set inputs and read outputs through the containers of the first linker.
 */
public class WrapLinker extends Linker {
    private static final Logger LOGGER = LoggerFactory.getLogger(WrapLinker.class);

    private final List<LocalLinker> linkers;
    private final Wrapper wrapper;
    private final PreRunHook pre;
    private final FunctionGraph fgraph;
    private final List<ValueNode> noRecycling;

    private WrapLinker(List<LocalLinker> linkers, Wrapper wrapper, PreRunHook pre, FunctionGraph fgraph,
            Collection<? extends ValueNode> noRecycling) {
        super(linkers.stream().allMatch(LocalLinker::allowsGc), null);
        this.linkers = List.copyOf(linkers);
        this.wrapper = Objects.requireNonNull(wrapper);
        this.pre = Objects.requireNonNull(pre);
        this.fgraph = fgraph;
        this.noRecycling = List.copyOf(noRecycling);
    }

    /**
     * Starts building a WrapLinker.
     * 
     * @param linkers the linkers to run side by side. The first one is the primary linker, whose containers users
     *        interact with.
     * @throws IllegalArgumentException if linkers is empty.
     */
    public static Builder builder(List<? extends LocalLinker> linkers, Wrapper wrapper) {
        return new Builder(linkers, wrapper);
    }

    /** Creates a WrapLinker whose Wrapper calls each of wrappers in order. */
    public static WrapLinker many(List<? extends LocalLinker> linkers, List<? extends Wrapper> wrappers) {
        List<Wrapper> sequence = List.copyOf(wrappers);
        Wrapper combined = (fgraph, position, node, thunks) -> sequence
                .forEach(wrapper -> wrapper.wrap(fgraph, position, node, thunks));
        return builder(linkers, combined).build();
    }

    public List<LocalLinker> getLinkers() {
        return linkers;
    }

    @Override
    public WrapLinker accept(FunctionGraph fgraph, Collection<? extends ValueNode> noRecycling) {
        Objects.requireNonNull(fgraph);
        List<LocalLinker> accepted = linkers.stream()
                .map(linker -> linker.accept(fgraph, noRecycling))
                .collect(Collectors.toList());
        return new WrapLinker(accepted, wrapper, pre, fgraph, noRecycling);
    }

    @Override
    public WrapLinker accept(FunctionGraph fgraph) {
        return accept(fgraph, List.of());
    }

    @Override
    public WrapLinker withAllowGc(boolean allowGc) {
        List<LocalLinker> changed = linkers.stream()
                .map(linker -> linker.withAllowGc(allowGc))
                .collect(Collectors.toList());
        return new WrapLinker(changed, wrapper, pre, fgraph, noRecycling);
    }

    /**
     * {@inheritDoc}
     * 
     * @throws IllegalStateException if the underlying linkers don't all schedule the graph's nodes in the same order.
     */
    @Override
    public LinkedProgram makeThunk() {
        if (fgraph == null) {
            throw new IllegalStateException("WrapLinker must be bound to a FunctionGraph with accept first");
        }
        List<LinkedProgramParts> parts = linkers.stream()
                .map(linker -> linker.makeAll(List.of(), List.of(), StorageMap.empty()))
                .collect(Collectors.toList());
        List<ApplicationNode> order = parts.get(0).getOrder();
        if (!parts.stream().allMatch(part -> part.getOrder().equals(order))) {
            throw new IllegalStateException("All linkers to WrapLinker should execute operations in the same order.");
        }

        List<List<NodeThunk>> thunkGroups = new ArrayList<>(order.size());
        for (int i = 0; i < order.size(); ++i) {
            int position = i;
            thunkGroups.add(parts.stream().map(part -> part.getThunks().get(position)).collect(Collectors.toList()));
        }
        List<GarbageCollectionPlan> gcPlans = new ArrayList<>(parts.size());
        List<List<StorageCell>> noRecyclingCells = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); ++i) {
            LinkedProgramParts part = parts.get(i);
            gcPlans.add(linkers.get(i).allowsGc()
                    ? GarbageCollectionPlan.fromLastUse(order, fgraph.getOutputs(), part.getStorageMap())
                    : GarbageCollectionPlan.none(order.size()));
            noRecyclingCells.add(PerformLinker.noRecyclingCells(fgraph, noRecycling, part.getStorageMap()));
        }
        List<List<Container>> inputContainers = parts.stream()
                .map(LinkedProgramParts::getInputs)
                .collect(Collectors.toList());

        Thunk program = new WrappedProgram(order, thunkGroups, gcPlans, noRecyclingCells, inputContainers);
        LOGGER.debug("Linked wrapped program of {} nodes across {} linkers", order.size(), linkers.size());
        return new LinkedProgram(program, parts.get(0).getInputs(), parts.get(0).getOutputs());
    }

    private class WrappedProgram implements Thunk {
        private final List<ApplicationNode> order;
        private final List<List<NodeThunk>> thunkGroups;
        private final List<GarbageCollectionPlan> gcPlans;
        private final List<List<StorageCell>> noRecyclingCells;
        private final List<List<Container>> inputContainers;

        private WrappedProgram(List<ApplicationNode> order, List<List<NodeThunk>> thunkGroups,
                List<GarbageCollectionPlan> gcPlans, List<List<StorageCell>> noRecyclingCells,
                List<List<Container>> inputContainers) {
            this.order = order;
            this.thunkGroups = thunkGroups;
            this.gcPlans = gcPlans;
            this.noRecyclingCells = noRecyclingCells;
            this.inputContainers = inputContainers;
        }

        @Override
        public void run() {
            List<Container> primaryInputs = inputContainers.get(0);
            for (List<Container> otherInputs : inputContainers.subList(1, inputContainers.size())) {
                for (int i = 0; i < primaryInputs.size(); ++i) {
                    Container primary = primaryInputs.get(i);
                    StorageCell other = otherInputs.get(i).getStorage();
                    if (primary.getStorage().isEmpty()) {
                        other.clear();
                    } else {
                        other.set(primary.getType().copyValue(primary.get()));
                    }
                }
            }
            noRecyclingCells.forEach(cells -> cells.forEach(StorageCell::clear));

            List<Object> inputValues = primaryInputs.stream().map(Container::get).collect(Collectors.toList());
            pre.beforeRun(WrapLinker.this, inputValues, order, thunkGroups);
            for (int i = 0; i < order.size(); ++i) {
                ApplicationNode node = order.get(i);
                List<NodeThunk> thunks = thunkGroups.get(i);
                try {
                    wrapper.wrap(fgraph, i, node, thunks);
                } catch (RuntimeException e) {
                    NodeThunk primary = thunks.get(0);
                    throw new ThunkException(node, i, primary.getInputs(), primary.getOutputs(), e);
                }
                for (GarbageCollectionPlan gcPlan : gcPlans) {
                    gcPlan.getCellsToClearAfter(i).forEach(StorageCell::clear);
                }
            }
        }
    }

    /** Decides what happens for each node of a wrapped program. */
    @FunctionalInterface
    public interface Wrapper {
        /**
         * @param position the node's position in the schedule.
         * @param thunks the thunk of each underlying linker for node, in linker order. Nothing runs unless this
         *        method runs it.
         */
        void wrap(FunctionGraph fgraph, int position, ApplicationNode node, List<NodeThunk> thunks);
    }

    /** Called once per run, after inputs have been copied and before any node is wrapped. */
    @FunctionalInterface
    public interface PreRunHook {
        /**
         * @param inputValues the values of the primary linker's inputs.
         * @param thunkGroups for each position in order, the thunks of each underlying linker.
         */
        void beforeRun(WrapLinker linker, List<Object> inputValues, List<ApplicationNode> order,
                List<List<NodeThunk>> thunkGroups);
    }

    public static class Builder {
        private final List<LocalLinker> linkers;
        private final Wrapper wrapper;
        private PreRunHook pre = (linker, inputValues, order, thunkGroups) -> {
        };

        private Builder(List<? extends LocalLinker> linkers, Wrapper wrapper) {
            if (linkers.isEmpty()) {
                throw new IllegalArgumentException("WrapLinker needs at least one linker");
            }
            this.linkers = List.copyOf(linkers);
            this.wrapper = Objects.requireNonNull(wrapper);
        }

        /** Sets the hook to call at the start of every run. By default, nothing happens. */
        public Builder pre(PreRunHook pre) {
            this.pre = Objects.requireNonNull(pre);
            return this;
        }

        public WrapLinker build() {
            return new WrapLinker(linkers, wrapper, pre, null, List.of());
        }
    }
}
