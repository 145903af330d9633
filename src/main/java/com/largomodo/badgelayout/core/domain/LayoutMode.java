package com.largomodo.badgelayout.core.domain;

/**
 * Layout modes offered to the user.
 * The calculator behind each mode is picked by LayoutCalculatorFactory.
 */
public enum LayoutMode {
    GRID,     // plain rows and columns
    COMPACT;  // staggered honeycomb, never worse than GRID

    public static LayoutMode fromCliArgument(String arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Layout mode cannot be null. Supported: GRID, COMPACT");
        }
        try {
            return valueOf(arg.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid layout mode: " + arg + ". Supported: GRID, COMPACT");
        }
    }
}
