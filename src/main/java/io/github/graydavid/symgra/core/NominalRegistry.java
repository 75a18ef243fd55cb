/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Interns {@link NominalNode}s by their (type, id) pair. A registry only ever grows: nodes live as long as the registry
 * that created them. Tests and drivers that want isolation create their own registries; everyone else can use
 * {@link #shared()}.
 */
public class NominalRegistry {
    private static final NominalRegistry SHARED = new NominalRegistry();

    private final Map<Key, NominalNode> nodes = new ConcurrentHashMap<>();

    /** The process-wide registry, which lives as long as the process. */
    public static NominalRegistry shared() {
        return SHARED;
    }

    /**
     * Returns the NominalNode for (type, id), creating it with the given name if it doesn't exist yet. If it already
     * exists, name is ignored.
     */
    public NominalNode nominal(long id, Type type, String name) {
        Objects.requireNonNull(type);
        return nodes.computeIfAbsent(new Key(type, id), key -> new NominalNode(id, type, name, this));
    }

    public NominalNode nominal(long id, Type type) {
        return nominal(id, type, null);
    }

    public int size() {
        return nodes.size();
    }

    private static class Key {
        private final Type type;
        private final long id;

        private Key(Type type, long id) {
            this.type = type;
            this.id = id;
        }

        @Override
        public boolean equals(Object object) {
            if (!(object instanceof Key)) {
                return false;
            }
            Key other = (Key) object;
            return id == other.id && type.equals(other.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, id);
        }
    }
}
