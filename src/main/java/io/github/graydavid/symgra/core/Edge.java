/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.util.Objects;
import java.util.Optional;

/**
 * An edge in a {@link FunctionGraph}: a use of a ValueNode, either as an input of a consuming ApplicationNode at a
 * given input position, or as an output of the graph itself at a given output position.
 * 
 * @apiNote Edge is meant to *describe* graphs. The ValueNode being used is not part of the Edge: Edges are always
 *          looked up by the ValueNode they use.
 */
public class Edge {
    private final ApplicationNode consumer;
    private final int position;

    private Edge(ApplicationNode consumer, int position) {
        this.consumer = consumer;
        this.position = position;
    }

    /** @throws IllegalArgumentException if consumer doesn't have an input at position. */
    public static Edge toInput(ApplicationNode consumer, int position) {
        if (position < 0 || position >= consumer.getNumInputs()) {
            String message = String.format(
                    "Expected consuming node '%s' to have an input at position %s, but it only has %s inputs",
                    consumer, position, consumer.getNumInputs());
            throw new IllegalArgumentException(message);
        }
        return new Edge(consumer, position);
    }

    /** @throws IllegalArgumentException if position is negative. */
    public static Edge toGraphOutput(int position) {
        if (position < 0) {
            throw new IllegalArgumentException("Graph output positions must be non-negative: " + position);
        }
        return new Edge(null, position);
    }

    /** The consuming ApplicationNode, or empty if this edge is a graph output. */
    public Optional<ApplicationNode> getConsumer() {
        return Optional.ofNullable(consumer);
    }

    public int getPosition() {
        return position;
    }

    public boolean isGraphOutput() {
        return consumer == null;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof Edge)) {
            return false;
        }

        Edge other = (Edge) object;
        return this.consumer == other.consumer && this.position == other.position;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(consumer), position);
    }

    @Override
    public String toString() {
        String consumerString = isGraphOutput() ? "output" : consumer.getOperation().toString();
        return "{" + consumerString + "}->{" + position + "}";
    }
}
