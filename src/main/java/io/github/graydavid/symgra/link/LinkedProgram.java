/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.link;

import java.util.List;
import java.util.Objects;

import io.github.graydavid.symgra.core.Thunk;

/**
 * A runnable program produced by a {@link Linker}, together with the containers for its inputs and outputs. To run
 * the program, set the input containers, run the program, and then read the output containers.
 */
public class LinkedProgram {
    private final Thunk program;
    private final List<Container> inputs;
    private final List<Container> outputs;

    public LinkedProgram(Thunk program, List<Container> inputs, List<Container> outputs) {
        this.program = Objects.requireNonNull(program);
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
    }

    public Thunk getProgram() {
        return program;
    }

    /** One container per graph input, in graph input order. */
    public List<Container> getInputs() {
        return inputs;
    }

    /** One container per graph output, in graph output order. */
    public List<Container> getOutputs() {
        return outputs;
    }

    /** Convenience for running {@link #getProgram()}. */
    public void run() {
        program.run();
    }
}
