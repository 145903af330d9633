package com.largomodo.badgelayout.core.domain;

/**
 * Thrown when badges were requested but not a single one fits on a sheet.
 * <p>
 * Checked so callers must decide how to surface "nothing fits, reduce margin or
 * badge size"; a zero-capacity layout with no demand is not an error.
 */
public class InsufficientCapacityException extends Exception {

    private final int requestedItems;

    /**
     * Constructs exception with descriptive message.
     *
     * @param message        details about the geometry that left no room
     * @param requestedItems number of badges that could not be placed
     */
    public InsufficientCapacityException(String message, int requestedItems) {
        super(message);
        this.requestedItems = requestedItems;
    }

    public int getRequestedItems() {
        return requestedItems;
    }
}
