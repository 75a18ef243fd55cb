/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.symgra.link;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import io.github.graydavid.symgra.core.ApplicationNode;
import io.github.graydavid.symgra.core.StorageCell;
import io.github.graydavid.symgra.core.ValueNode;

/**
 * An exception thrown when running a linked program fails: it identifies the ApplicationNode whose thunk failed, its
 * position in the program's schedule, and the values its inputs had at the time of the failure.
 * 
 * Warning: {@link Throwable#Throwable(Throwable)}, as a part of calculating its own non-existent message, will call
 * {@link #getMessage()} on its cause and use that instead. Since ThunkException's {@link #getMessage()} spans several
 * lines describing the failed node, the types and values of its inputs, and the values of its outputs, it's
 * recommended that you use a different constructor for a Throwable when ThunkException is the cause.
 */
public class ThunkException extends RuntimeException {
    private static final long serialVersionUID = 1;

    private final transient ApplicationNode failedNode;
    private final int position;
    private final transient List<Object> inputValues;
    private final transient List<Object> outputValues;
    private volatile String message = null;

    /**
     * @param inputStorage the storage of failedNode's inputs, whose current values are captured immediately.
     * @param outputStorage the storage of failedNode's outputs, captured the same way.
     */
    public ThunkException(ApplicationNode failedNode, int position, List<StorageCell> inputStorage,
            List<StorageCell> outputStorage, Throwable cause) {
        super(String.format("Error running node at position %s: %s", position, failedNode.getOperation()), cause);
        this.failedNode = Objects.requireNonNull(failedNode);
        this.position = position;
        this.inputValues = snapshot(inputStorage);
        this.outputValues = snapshot(outputStorage);
    }

    private static List<Object> snapshot(List<StorageCell> storage) {
        List<Object> values = new ArrayList<>(storage.size());
        storage.forEach(cell -> values.add(cell.get()));
        return Collections.unmodifiableList(values);
    }

    /** Returns the node whose thunk failed. */
    public ApplicationNode getFailedNode() {
        return failedNode;
    }

    /** Returns the position of the failed node in the program's schedule. */
    public int getPosition() {
        return position;
    }

    /** Returns the values of the failed node's inputs when it failed. Values may be null. */
    public List<Object> getInputValues() {
        return inputValues;
    }

    /** Returns the values of the failed node's outputs when it failed: usually unset, so null. */
    public List<Object> getOutputValues() {
        return outputValues;
    }

    /**
     * {@inheritDoc}
     * 
     * In addition to RuntimeException's implementation, this method also describes the failed node, along with the
     * types and values of its inputs and the values of its outputs.
     * 
     * @implNote the message is calculated on first use and cached without locking, so concurrent callers may each
     *           calculate it. The failed node is described only in terms of its direct inputs.
     */
    @Override
    public String getMessage() {
        if (message == null) {
            message = calculateMessage();
        }
        return message;
    }

    private String calculateMessage() {
        StringBuilder message = new StringBuilder();
        message.append(super.getMessage());
        message.append("\nApply node that caused the error: ").append(failedNode);
        message.append("\nInputs types: ")
                .append(failedNode.getInputs().stream().map(ValueNode::getType).collect(Collectors.toList()));
        message.append("\nInputs values: ")
                .append(inputValues.stream().map(ThunkException::describeValue).collect(Collectors.toList()));
        message.append("\nOutputs values: ")
                .append(outputValues.stream().map(ThunkException::describeValue).collect(Collectors.toList()));
        return message.toString();
    }

    private static String describeValue(Object value) {
        if (value != null && value.getClass().isArray()) {
            return value.getClass().getComponentType().getSimpleName() + "[" + Array.getLength(value)
                    + "]";
        }
        return String.valueOf(value);
    }
}
