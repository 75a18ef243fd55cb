/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

/**
 * Thrown when a topological sort finds that some nodes can never be scheduled because they (transitively) depend on
 * themselves. The exception identifies the condition, not the offending nodes.
 */
public class CycleDetectedException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public CycleDetectedException(String message) {
        super(message);
    }
}
