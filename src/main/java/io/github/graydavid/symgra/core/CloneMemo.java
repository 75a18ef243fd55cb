/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records what {@link Cloning} has replaced with what: original ValueNodes to their replacements, original
 * ApplicationNodes to their clones, and original Operations to their clones (for Operations with inner graphs). All
 * mappings are keyed by identity. A memo may be seeded before cloning, in which case the seeded replacements are used
 * instead of clones.
 */
public class CloneMemo {
    private final Map<ValueNode, ValueNode> values;
    private final Map<ApplicationNode, ApplicationNode> applications;
    private final Map<Operation, Operation> operations;

    private CloneMemo() {
        this.values = new IdentityHashMap<>();
        this.applications = new IdentityHashMap<>();
        this.operations = new IdentityHashMap<>();
    }

    public static CloneMemo empty() {
        return new CloneMemo();
    }

    /** Creates a memo that already replaces each key of seed with its value. */
    public static CloneMemo withValues(Map<? extends ValueNode, ? extends ValueNode> seed) {
        CloneMemo memo = new CloneMemo();
        memo.values.putAll(seed);
        return memo;
    }

    public boolean containsValue(ValueNode original) {
        return values.containsKey(original);
    }

    public Optional<ValueNode> getValue(ValueNode original) {
        return Optional.ofNullable(values.get(original));
    }

    public void putValue(ValueNode original, ValueNode replacement) {
        values.put(original, replacement);
    }

    public void putValueIfAbsent(ValueNode original, ValueNode replacement) {
        values.putIfAbsent(original, replacement);
    }

    public Optional<ApplicationNode> getApplication(ApplicationNode original) {
        return Optional.ofNullable(applications.get(original));
    }

    void putApplication(ApplicationNode original, ApplicationNode clone) {
        applications.put(original, clone);
    }

    public Optional<Operation> getOperation(Operation original) {
        return Optional.ofNullable(operations.get(original));
    }

    void putOperationIfAbsent(Operation original, Operation clone) {
        operations.putIfAbsent(original, clone);
    }

    /** An unmodifiable view of the value replacements. */
    public Map<ValueNode, ValueNode> getValues() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "CloneMemo[values=" + values.size() + ", applications=" + applications.size() + ", operations="
                + operations.size() + "]";
    }
}
