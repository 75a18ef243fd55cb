/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.link;

import java.util.List;
import java.util.Objects;

import io.github.graydavid.symgra.core.ApplicationNode;
import io.github.graydavid.symgra.core.Thunk;

/**
 * Everything a {@link LocalLinker} produces for a graph: the program and its containers, plus the individual node
 * thunks in the order the program runs them and the storage they share.
 */
public class LinkedProgramParts {
    private final LinkedProgram linkedProgram;
    private final List<NodeThunk> thunks;
    private final List<ApplicationNode> order;
    private final StorageMap storageMap;

    public LinkedProgramParts(Thunk program, List<Container> inputs, List<Container> outputs, List<NodeThunk> thunks,
            List<ApplicationNode> order, StorageMap storageMap) {
        this.linkedProgram = new LinkedProgram(program, inputs, outputs);
        this.thunks = List.copyOf(thunks);
        this.order = List.copyOf(order);
        this.storageMap = Objects.requireNonNull(storageMap);
    }

    public LinkedProgram toLinkedProgram() {
        return linkedProgram;
    }

    public Thunk getProgram() {
        return linkedProgram.getProgram();
    }

    public List<Container> getInputs() {
        return linkedProgram.getInputs();
    }

    public List<Container> getOutputs() {
        return linkedProgram.getOutputs();
    }

    /** The thunks of each node, in the same order as {@link #getOrder()}. */
    public List<NodeThunk> getThunks() {
        return thunks;
    }

    public List<ApplicationNode> getOrder() {
        return order;
    }

    public StorageMap getStorageMap() {
        return storageMap;
    }
}
