package com.largomodo.badgelayout.core.layout;

import com.largomodo.badgelayout.core.domain.LayoutMode;

/**
 * Factory for the calculator behind each layout mode.
 * Calculators are stateless, so one shared instance per mode is safe across threads.
 */
public class LayoutCalculatorFactory {

    private final GridLayoutCalculator grid = new GridLayoutCalculator();
    private final CompactLayoutCalculator compact = new CompactLayoutCalculator(grid);

    public LayoutCalculator get(LayoutMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Layout mode cannot be null");
        }
        return switch (mode) {
            case GRID -> grid;
            case COMPACT -> compact;
        };
    }
}
