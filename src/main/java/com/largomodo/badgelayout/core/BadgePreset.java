package com.largomodo.badgelayout.core;

/**
 * Common button badge sizes offered as one-click presets.
 * GeometryFactory adds the bleed on both sides of the face.
 */
public enum BadgePreset {
    SMALL(32, 5),
    STANDARD(58, 5),
    LARGE(75, 5);

    private final double badgeMm;
    private final double bleedMm;

    BadgePreset(double badgeMm, double bleedMm) {
        this.badgeMm = badgeMm;
        this.bleedMm = bleedMm;
    }

    public double getBadgeMm() {
        return badgeMm;
    }

    public double getBleedMm() {
        return bleedMm;
    }
}
