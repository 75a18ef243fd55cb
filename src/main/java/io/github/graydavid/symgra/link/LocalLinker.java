/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.link;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;

import io.github.graydavid.symgra.core.ApplicationNode;
import io.github.graydavid.symgra.core.FunctionGraph;
import io.github.graydavid.symgra.core.StorageCell;
import io.github.graydavid.symgra.core.ValueNode;

/**
 * A Linker that runs programs in the current thread and that can expose the parts of a program: the thunks of its
 * individual nodes and the storage they share. {@link WrapLinker} is built from LocalLinkers.
 */
public abstract class LocalLinker extends Linker {
    protected LocalLinker(boolean allowGc, Function<FunctionGraph, List<ApplicationNode>> scheduler) {
        super(allowGc, scheduler);
    }

    @Override
    public abstract LocalLinker accept(FunctionGraph fgraph, Collection<? extends ValueNode> noRecycling);

    @Override
    public LocalLinker accept(FunctionGraph fgraph) {
        return accept(fgraph, List.of());
    }

    @Override
    public abstract LocalLinker withAllowGc(boolean allowGc);

    @Override
    public LinkedProgram makeThunk() {
        return makeThunk(List.of(), List.of(), StorageMap.empty());
    }

    /** Same as {@link #makeAll(List, List, StorageMap)}, keeping only the program and its containers. */
    public LinkedProgram makeThunk(List<StorageCell> inputStorage, List<StorageCell> outputStorage,
            StorageMap storageMap) {
        return makeAll(inputStorage, outputStorage, storageMap).toLinkedProgram();
    }

    /**
     * Links the bound graph into a program, exposing all of the program's parts.
     * 
     * @param inputStorage the cells to use for the graph's inputs. Empty means to allocate new cells.
     * @param outputStorage the cells to use for the graph's outputs. Empty means to allocate new cells.
     * @param storageMap storage already assigned to some ValueNodes. Filled with the storage of every ValueNode the
     *        program uses.
     * 
     * @throws IllegalStateException if this Linker isn't bound to a graph.
     */
    public abstract LinkedProgramParts makeAll(List<StorageCell> inputStorage, List<StorageCell> outputStorage,
            StorageMap storageMap);
}
