/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * A mutable, side-channel bag of debug metadata attached to nodes (e.g. a cached test value or a trace of where the
 * node was created). Tags never affect graph semantics: traversal, cloning, and equivalence ignore them, except that
 * cloning copies them.
 *
 * Some keys may be validated: a validated key's value is passed through a filter on every put, and the filter's result
 * is what's stored. ValueNodes use this to make sure their test values are valid for their Type.
 */
public class Tag {
    private final Map<String, Object> entries;
    private final Map<String, UnaryOperator<Object>> validators;

    private Tag(Map<String, Object> entries, Map<String, UnaryOperator<Object>> validators) {
        this.entries = entries;
        this.validators = validators;
    }

    /** Creates an empty Tag without any validated keys. */
    public static Tag empty() {
        return new Tag(new LinkedHashMap<>(), Map.of());
    }

    /**
     * Creates an empty Tag where values put under key are first passed through validator.
     *
     * @param validator should throw an exception if the value is invalid; otherwise, returns the value to store.
     */
    public static Tag validating(String key, UnaryOperator<Object> validator) {
        return new Tag(new LinkedHashMap<>(), Map.of(key, validator));
    }

    /**
     * Associates value with key, replacing any previous value.
     *
     * @throws RuntimeException whatever a validator for key throws, in which case the Tag is unchanged.
     */
    public void put(String key, Object value) {
        Objects.requireNonNull(key);
        UnaryOperator<Object> validator = validators.get(key);
        Object stored = (validator == null) ? value : validator.apply(value);
        entries.put(key, stored);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public void remove(String key) {
        entries.remove(key);
    }

    public Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }

    /** Returns an independent copy of this Tag, keeping the same validators. */
    public Tag copy() {
        return new Tag(new LinkedHashMap<>(entries), validators);
    }

    /** Puts all of other's entries into this Tag (through this Tag's validators) and returns this Tag. */
    public Tag update(Tag other) {
        other.entries.forEach(this::put);
        return this;
    }

    @Override
    public String toString() {
        return "Tag" + entries;
    }
}
