/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.core;

import java.lang.reflect.Array;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks whether graphs represent the same computations. The comparison is structural: two ApplicationNodes are equal
 * if their Operations are equal and their inputs are pairwise equal, regardless of node identity. Operations are
 * compared with equals, so an Operation that knows nothing about commutativity makes {@code add(x, y)} and
 * {@code add(y, x)} different. Ownerless inputs are equal if they're the same node, or if they're atomic and have the
 * same signature (see {@link AtomicValueNode#equalsSignature(AtomicValueNode)}).
 */
public class Equivalence {
    private Equivalence() {}

    /** Same as {@link #equalComputations(List, List, List, List, boolean)}, with no input correspondence. */
    public static boolean equalComputations(List<? extends ValueNode> xs, List<? extends ValueNode> ys) {
        return equalComputations(xs, ys, List.of(), List.of(), true);
    }

    /**
     * Answers whether, for each i, xs[i] and ys[i] compute the same thing.
     *
     * @param inXs free inputs of xs that are considered equal to the free inputs of ys at the same position.
     * @param inYs see inXs.
     * @param strictDtype if false, constants whose data is represented differently (e.g. Integer vs. Double) but which
     *        have the same numeric value are considered equal.
     *
     * @throws IllegalArgumentException if xs and ys have different sizes.
     */
    public static boolean equalComputations(List<? extends ValueNode> xs, List<? extends ValueNode> ys,
            List<? extends ValueNode> inXs, List<? extends ValueNode> inYs, boolean strictDtype) {
        if (xs.size() != ys.size()) {
            throw new IllegalArgumentException(String.format(
                    "The number of graphs in each argument must match: %s vs. %s", xs.size(), ys.size()));
        }
        Set<ValueNode> inXSet = GraphTraversals.newIdentitySet(inXs);
        for (int i = 0; i < xs.size(); ++i) {
            ValueNode x = xs.get(i);
            ValueNode y = ys.get(i);
            if (x.hasOwner() != y.hasOwner()) {
                return false;
            }
            if (x.hasOwner() && x.getIndex().getAsInt() != y.getIndex().getAsInt()) {
                return false;
            }
            if (!inXSet.contains(x) && !y.getType().inSameClass(x.getType())) {
                return false;
            }
        }
        if (inXs.size() != inYs.size()) {
            return false;
        }
        for (int i = 0; i < inXs.size(); ++i) {
            if (!inYs.get(i).getType().inSameClass(inXs.get(i).getType())) {
                return false;
            }
        }

        Comparison comparison = new Comparison(strictDtype);
        for (int i = 0; i < inXs.size(); ++i) {
            comparison.common.add(new Pair(inXs.get(i), inYs.get(i)));
        }
        for (int i = 0; i < xs.size(); ++i) {
            ValueNode x = xs.get(i);
            ValueNode y = ys.get(i);
            if (!x.hasOwner()) {
                if (x instanceof AtomicValueNode && y instanceof AtomicValueNode) {
                    if (!atomicSignaturesEqual(x, y)) {
                        return false;
                    }
                } else if (!comparison.common.contains(new Pair(x, y)) && x != y) {
                    return false;
                }
            }
        }

        for (int i = 0; i < xs.size(); ++i) {
            ValueNode x = xs.get(i);
            if (x.hasOwner()) {
                ApplicationNode xOwner = x.getOwner().get();
                ApplicationNode yOwner = ys.get(i).getOwner().get();
                if (!comparison.compareNodes(xOwner, yOwner)) {
                    return false;
                }
            }
        }
        return true;
    }

    /** The state of one comparison: node pairs already proven equal, and those already proven different. */
    private static class Comparison {
        private final boolean strictDtype;
        private final Set<Pair> common;
        private final Set<Pair> different;

        private Comparison(boolean strictDtype) {
            this.strictDtype = strictDtype;
            this.common = new HashSet<>();
            this.different = new HashSet<>();
        }

        /**
         * Compares two ApplicationNodes by walking their inputs depth first with an explicit stack, so that long chains
         * don't exhaust the call stack.
         */
        private boolean compareNodes(ApplicationNode nodeX, ApplicationNode nodeY) {
            Boolean initial = compareShallow(nodeX, nodeY);
            if (initial != null) {
                return initial;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(nodeX, nodeY));
            Boolean inputResult = null;
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (inputResult != null) {
                    if (!inputResult) {
                        different.add(frame.inputPair());
                        stack.pop();
                        continue;
                    }
                    frame.nextInput++;
                    inputResult = null;
                }

                Frame pushed = null;
                boolean equal = true;
                while (equal && pushed == null && frame.nextInput < frame.x.getNumInputs()) {
                    Pair pair = frame.inputPair();
                    ValueNode dx = pair.x;
                    ValueNode dy = pair.y;
                    if (common.contains(pair)) {
                        frame.nextInput++;
                    } else if (dx.hasOwner() && dy.hasOwner()
                            && dx.getIndex().getAsInt() == dy.getIndex().getAsInt()) {
                        ApplicationNode ownerX = dx.getOwner().get();
                        ApplicationNode ownerY = dy.getOwner().get();
                        Boolean ownersEqual = compareShallow(ownerX, ownerY);
                        if (ownersEqual == null) {
                            pushed = new Frame(ownerX, ownerY);
                        } else if (ownersEqual) {
                            frame.nextInput++;
                        } else {
                            different.add(pair);
                            equal = false;
                        }
                    } else if (!dx.hasOwner() && !dy.hasOwner() && inputsEqual(dx, dy)) {
                        frame.nextInput++;
                    } else {
                        equal = false;
                    }
                }
                if (pushed != null) {
                    stack.push(pushed);
                    continue;
                }

                stack.pop();
                if (equal) {
                    for (int i = 0; i < frame.x.getNumOutputs(); ++i) {
                        common.add(new Pair(frame.x.getOutputs().get(i), frame.y.getOutputs().get(i)));
                    }
                }
                inputResult = equal;
            }
            return inputResult;
        }

        /**
         * Decides the comparison from the nodes themselves and already known pairs, or returns null if the inputs have
         * to be compared.
         */
        private Boolean compareShallow(ApplicationNode nodeX, ApplicationNode nodeY) {
            if (nodeX == nodeY) {
                return true;
            }
            if (!Objects.equals(nodeX.getOperation(), nodeY.getOperation())) {
                return false;
            }
            if (nodeX.getNumInputs() != nodeY.getNumInputs() || nodeX.getNumOutputs() != nodeY.getNumOutputs()) {
                return false;
            }

            boolean allInCommon = true;
            for (int i = 0; i < nodeX.getNumOutputs(); ++i) {
                Pair pair = new Pair(nodeX.getOutputs().get(i), nodeY.getOutputs().get(i));
                if (different.contains(pair)) {
                    return false;
                }
                allInCommon = allInCommon && common.contains(pair);
            }
            return allInCommon ? Boolean.TRUE : null;
        }

        private boolean inputsEqual(ValueNode dx, ValueNode dy) {
            if (dx == dy) {
                return true;
            }
            if (atomicSignaturesEqual(dx, dy)) {
                return true;
            }
            if (!strictDtype && dx instanceof ConstantNode && dy instanceof ConstantNode) {
                return numericallyEqual(((ConstantNode) dx).getData(), ((ConstantNode) dy).getData());
            }
            return false;
        }
    }

    /** A pair of ApplicationNodes under comparison and the position of the next input pair to compare. */
    private static class Frame {
        private final ApplicationNode x;
        private final ApplicationNode y;
        private int nextInput;

        private Frame(ApplicationNode x, ApplicationNode y) {
            this.x = x;
            this.y = y;
        }

        private Pair inputPair() {
            return new Pair(x.getInputs().get(nextInput), y.getInputs().get(nextInput));
        }
    }

    /** Answers whether both nodes are atomic and stand for the same value, e.g. equal constants or nominals. */
    private static boolean atomicSignaturesEqual(ValueNode x, ValueNode y) {
        return x instanceof AtomicValueNode && y instanceof AtomicValueNode
                && ((AtomicValueNode) x).equalsSignature((AtomicValueNode) y);
    }

    /**
     * Compares numbers and arrays of numbers by value, regardless of their representation. Anything else is compared
     * with {@link Objects#deepEquals(Object, Object)}.
     */
    static boolean numericallyEqual(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            Number na = (Number) a;
            Number nb = (Number) b;
            if (isIntegral(na) && isIntegral(nb)) {
                return na.longValue() == nb.longValue();
            }
            return na.doubleValue() == nb.doubleValue();
        }
        if (a != null && b != null && a.getClass().isArray() && b.getClass().isArray()) {
            int length = Array.getLength(a);
            if (length != Array.getLength(b)) {
                return false;
            }
            for (int i = 0; i < length; ++i) {
                if (!numericallyEqual(Array.get(a, i), Array.get(b, i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.deepEquals(a, b);
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short
                || number instanceof Byte;
    }

    /** A pair of nodes, compared by identity. */
    private static class Pair {
        private final ValueNode x;
        private final ValueNode y;

        private Pair(ValueNode x, ValueNode y) {
            this.x = x;
            this.y = y;
        }

        @Override
        public boolean equals(Object object) {
            if (!(object instanceof Pair)) {
                return false;
            }
            Pair other = (Pair) object;
            return x == other.x && y == other.y;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(x) + System.identityHashCode(y);
        }
    }
}
