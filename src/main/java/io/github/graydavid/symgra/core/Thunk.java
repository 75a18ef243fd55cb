/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

/**
 * A zero-argument unit of work bound to fixed input and output storage. Operations produce thunks for individual
 * ApplicationNodes, and linkers assemble those thunks into whole programs, which are themselves thunks.
 */
@FunctionalInterface
public interface Thunk {
    /**
     * Runs the unit of work, reading from and writing to the storage that the thunk was bound to.
     * 
     * @throws RuntimeException if the work fails. Linkers will annotate such failures with the failing node before
     *         propagating them.
     */
    void run();
}
