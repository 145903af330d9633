package com.largomodo.badgelayout.core.domain;

/**
 * Centre of one placed badge, in device pixels.
 *
 * @param x horizontal centre coordinate
 * @param y vertical centre coordinate
 */
public record Position(double x, double y) {

    /**
     * Euclidean distance between the two centres.
     */
    public double distanceTo(Position other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}
