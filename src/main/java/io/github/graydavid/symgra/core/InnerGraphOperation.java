/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.List;

/**
 * An Operation that wraps a nested graph of its own (e.g. a loop body or the branches of a conditional). The inner
 * graph's inputs are usually {@link NominalNode}s, so that two inner graphs with the same structure compare as
 * equivalent no matter which concrete nodes they were built from.
 */
public interface InnerGraphOperation extends Operation {
    List<ValueNode> getInnerInputs();

    List<ValueNode> getInnerOutputs();

    /**
     * Returns a copy of this Operation with a cloned inner graph. The copy must compute the same function as this
     * Operation.
     */
    InnerGraphOperation cloneOperation();
}
