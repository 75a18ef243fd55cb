/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.link;

import java.util.Objects;

import io.github.graydavid.symgra.core.StorageCell;
import io.github.graydavid.symgra.core.Type;
import io.github.graydavid.symgra.core.ValueNode;

/**
 * Joins a Type with the storage cell that holds a value of that Type during execution. Containers are how the users of
 * a linked program supply inputs and read outputs: every value written through a Container is validated by its Type.
 */
public class Container {
    private final Type type;
    private final StorageCell storage;
    private final String name;
    private final boolean readonly;
    private final boolean strict;
    private final boolean allowDowncast;

    private Container(Builder builder) {
        this.type = builder.type;
        this.storage = builder.storage;
        this.name = builder.name;
        this.readonly = builder.readonly;
        this.strict = builder.strict;
        this.allowDowncast = builder.allowDowncast;
    }

    /** Starts building a Container for node's Type, named after node (if it has a name). */
    public static Builder builder(ValueNode node, StorageCell storage) {
        return new Builder(node.getType(), storage).name(node.getName().orElse(null));
    }

    public static Builder builder(Type type, StorageCell storage) {
        return new Builder(type, storage);
    }

    public Type getType() {
        return type;
    }

    /** The name used in diagnostics. May be null. */
    public String getName() {
        return name;
    }

    public boolean isReadonly() {
        return readonly;
    }

    StorageCell getStorage() {
        return storage;
    }

    public Object get() {
        return storage.get();
    }

    /**
     * Filters value through this Container's Type and stores the result. A null value clears the storage.
     * 
     * @throws IllegalStateException if this Container is readonly.
     * @throws IllegalArgumentException if the Type rejects value.
     */
    public void set(Object value) {
        if (readonly) {
            throw new IllegalStateException(String.format("Cannot set readonly storage: %s", name));
        }
        if (value == null) {
            storage.clear();
            return;
        }
        try {
            storage.set(type.filter(value, strict, allowDowncast));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(e.getMessage() + String.format(" (Container name '%s')", name), e);
        }
    }

    @Override
    public String toString() {
        return storage.toString();
    }

    public static class Builder {
        private final Type type;
        private final StorageCell storage;
        private String name;
        private boolean readonly;
        private boolean strict;
        private boolean allowDowncast;

        private Builder(Type type, StorageCell storage) {
            this.type = Objects.requireNonNull(type);
            this.storage = Objects.requireNonNull(storage);
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /** Prevents setting values through the Container. */
        public Builder readonly() {
            this.readonly = true;
            return this;
        }

        /** Requires values to already be in the Type's canonical representation. */
        public Builder strict() {
            this.strict = true;
            return this;
        }

        /** Allows conversions that may lose precision, unless the Container is strict. */
        public Builder allowDowncast() {
            this.allowDowncast = true;
            return this;
        }

        public Container build() {
            return new Container(this);
        }
    }
}
