/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

/**
 * Marks a ValueNode whose data lives outside of any particular graph (e.g. model parameters held by the front-end).
 * Such nodes are roots of a graph, but users never supply them explicitly.
 * 
 * @see GraphTraversals#explicitGraphInputs(java.util.Collection)
 */
public interface SharedValueNode {
}
