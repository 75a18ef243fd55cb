/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.link;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Wraps a {@link LinkedProgram} as a function from input values to output values. */
public class CompiledFunction {
    private final LinkedProgram program;

    public CompiledFunction(LinkedProgram program) {
        this.program = Objects.requireNonNull(program);
    }

    public LinkedProgram getLinkedProgram() {
        return program;
    }

    /**
     * Sets each input container to the corresponding argument, runs the program, and returns the values of the output
     * containers.
     * 
     * @return the output values, in graph output order. Values may be null.
     * @throws IllegalArgumentException if the number of arguments doesn't match the number of graph inputs, or if an
     *         argument is invalid for its input's Type.
     */
    public List<Object> call(Object... args) {
        List<Container> inputs = program.getInputs();
        if (args.length != inputs.size()) {
            throw new IllegalArgumentException(
                    String.format("Function call takes exactly %s args (%s given)", inputs.size(), args.length));
        }
        for (int i = 0; i < args.length; ++i) {
            inputs.get(i).set(args[i]);
        }
        program.run();
        List<Object> results = new ArrayList<>(program.getOutputs().size());
        program.getOutputs().forEach(output -> results.add(output.get()));
        return Collections.unmodifiableList(results);
    }
}
