/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

/**
 * A single-slot, mutable holder for a value computed (or supplied) during the execution of a graph. Storage cells are
 * the only sanctioned way for thunks to exchange data. An empty cell holds null.
 */
public class StorageCell {
    private Object value;

    public StorageCell() {
        this.value = null;
    }

    public StorageCell(Object value) {
        this.value = value;
    }

    public Object get() {
        return value;
    }

    public void set(Object value) {
        this.value = value;
    }

    public void clear() {
        this.value = null;
    }

    public boolean isEmpty() {
        return value == null;
    }

    @Override
    public String toString() {
        return "<" + value + ">";
    }
}
