package com.largomodo.badgelayout.core.domain;

/**
 * Packing strategy that actually produced a sheet's positions.
 * <p>
 * Compact mode picks between HEXAGONAL and UNIFORM columns, and drops back to
 * GRID when the honeycomb would hold fewer badges than the plain grid. NONE
 * marks a sheet whose printable area cannot hold a single badge.
 */
public enum Arrangement {
    GRID,       // row-major grid, block centred in the printable area
    HEXAGONAL,  // hex-pitch columns packed flush against the left margin
    UNIFORM,    // evenly spread columns, block centred horizontally
    NONE
}
