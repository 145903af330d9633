package com.largomodo.badgelayout.core.layout;

import com.largomodo.badgelayout.core.domain.Arrangement;
import com.largomodo.badgelayout.core.domain.LayoutMode;
import com.largomodo.badgelayout.core.domain.Position;
import com.largomodo.badgelayout.core.domain.SingleSheetLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Honeycomb packer: column-major placement with odd columns shifted down by half
 * a vertical pitch so their badges nest between the neighbours'.
 * <p>
 * Column count is chosen by comparing two spacing models:
 * <ul>
 * <li>UNIFORM: the most columns that still fit when the leftover width is spread
 * evenly between them, tolerating gaps down to {@link #GAP_RELAXATION} of the
 * requested spacing. The block is centred.</li>
 * <li>HEXAGONAL: columns at the true hex-close-pack pitch
 * ({@code diameter * sqrt(3)/2 + spacing}), flush against the left margin.</li>
 * </ul>
 * Hexagonal wins only when it promises strictly more columns. Columns that would
 * cross the right margin are dropped whole, never clamped.
 * <p>
 * Staggering costs a row in odd columns on some sheets; when the honeycomb ends
 * up holding fewer badges than the plain grid, the grid arrangement is returned
 * instead so compact mode never packs worse than grid mode.
 */
public class CompactLayoutCalculator implements LayoutCalculator {

    /**
     * Fraction of the requested spacing accepted between uniform columns to gain one more column.
     */
    static final double GAP_RELAXATION = 0.5;

    /**
     * Whether a hexagonal layout promising the same column count as the uniform one wins.
     */
    static final boolean HEX_WINS_TIES = false;

    // sin(60°): row spacing of a hex-close-pack relative to its column pitch
    private static final double HEX_FACTOR = Math.sqrt(3) / 2;

    // Absorbs floating-point noise in the evenly spread column widths
    private static final double BOUNDS_TOLERANCE = 1e-6;

    private static final Logger log = LoggerFactory.getLogger(CompactLayoutCalculator.class);

    private final GridLayoutCalculator gridCalculator;

    public CompactLayoutCalculator() {
        this(new GridLayoutCalculator());
    }

    CompactLayoutCalculator(GridLayoutCalculator gridCalculator) {
        this.gridCalculator = gridCalculator;
    }

    @Override
    public SingleSheetLayout compute(int diameterPx, int spacingPx, int marginPx,
                                     int sheetWidthPx, int sheetHeightPx) {
        if (diameterPx <= 0) {
            throw new IllegalArgumentException("Diameter must be positive: " + diameterPx);
        }
        int spacing = Math.max(0, spacingPx);
        int margin = Math.max(0, marginPx);
        int radius = diameterPx / 2;

        // long arithmetic: a margin near Integer.MAX_VALUE must not wrap around
        long availableWidthPx = (long) sheetWidthPx - 2L * margin;
        long availableHeightPx = (long) sheetHeightPx - 2L * margin;

        if (availableWidthPx < diameterPx || availableHeightPx < diameterPx) {
            log.debug("Compact: printable area {}x{}px smaller than badge {}px",
                    availableWidthPx, availableHeightPx, diameterPx);
            return SingleSheetLayout.empty(LayoutMode.COMPACT, Arrangement.NONE, margin, radius);
        }
        // Bounded by the sheet width from here on
        int availableWidth = (int) availableWidthPx;

        ColumnPlan plan = chooseColumns(diameterPx, spacing, availableWidth);
        double verticalPitch = Math.max(plan.pitch() * HEX_FACTOR, (double) diameterPx + spacing);

        double startX;
        if (plan.arrangement() == Arrangement.HEXAGONAL) {
            startX = margin + radius;
        } else {
            double blockWidth = plan.columns() == 1
                    ? diameterPx
                    : (plan.columns() - 1) * plan.pitch() + diameterPx;
            startX = margin + (availableWidth - blockWidth) / 2 + radius;
        }

        double rightLimit = (double) sheetWidthPx - margin + BOUNDS_TOLERANCE;
        double bottomLimit = (double) sheetHeightPx - margin;

        List<Position> positions = new ArrayList<>();
        int filledColumns = 0;
        int longestColumn = 0;

        for (int col = 0; col < plan.columns(); col++) {
            double x = plan.columns() == 1 ? startX : startX + col * plan.pitch();

            // Containment policy: drop the whole column rather than clamp it
            if (x - radius < margin - BOUNDS_TOLERANCE || x + radius > rightLimit) {
                log.debug("Compact: skipping column {} at x={} (outside margins)", col, x);
                continue;
            }

            double yStart = margin + radius + (col % 2 == 0 ? 0 : verticalPitch / 2);
            int inColumn = 0;
            // Indexed rows: y is derived from the row number, never accumulated
            for (int row = 0; ; row++) {
                double y = yStart + row * verticalPitch;
                if (y + radius > bottomLimit) {
                    break;
                }
                positions.add(new Position(x, y));
                inColumn++;
            }

            if (inColumn > 0) {
                filledColumns++;
                longestColumn = Math.max(longestColumn, inColumn);
            }
        }

        SingleSheetLayout honeycomb = new SingleSheetLayout(LayoutMode.COMPACT, plan.arrangement(), positions,
                filledColumns, longestColumn, plan.pitch(), verticalPitch, margin, radius);

        SingleSheetLayout grid = gridCalculator.computeGrid(LayoutMode.COMPACT, diameterPx, spacing, margin,
                sheetWidthPx, sheetHeightPx);
        if (grid.capacity() > honeycomb.capacity()) {
            log.debug("Compact: {} honeycomb holds {}, grid holds {}; using grid",
                    plan.arrangement(), honeycomb.capacity(), grid.capacity());
            return grid;
        }

        log.debug("Compact: {} with {} columns, pitch {}x{}px, capacity {}", plan.arrangement(),
                filledColumns, plan.pitch(), verticalPitch, honeycomb.capacity());
        return honeycomb;
    }

    /**
     * Picks column count and horizontal pitch from the uniform search and the hex estimate.
     * Caller guarantees at least one badge fits across the available width.
     */
    ColumnPlan chooseColumns(int diameterPx, int spacingPx, int availableWidth) {
        ColumnPlan uniform = searchUniformColumns(diameterPx, spacingPx, availableWidth);

        double hexPitch = diameterPx * HEX_FACTOR + spacingPx;
        int maxColsHex = Math.max(1, (int) Math.floor((availableWidth + hexPitch) / hexPitch));

        boolean hexWins = maxColsHex > uniform.columns()
                || (HEX_WINS_TIES && maxColsHex == uniform.columns());
        if (hexWins) {
            return new ColumnPlan(maxColsHex, hexPitch, Arrangement.HEXAGONAL);
        }
        return uniform;
    }

    /**
     * Largest column count whose evenly spread gaps stay at or above the relaxed spacing.
     */
    ColumnPlan searchUniformColumns(int diameterPx, int spacingPx, int availableWidth) {
        int bestColumns = 0;
        double bestPitch = (double) diameterPx + spacingPx;
        int maxColumns = availableWidth / diameterPx;

        for (int testCols = 1; testCols <= maxColumns; testCols++) {
            double requiredWidth;
            double pitch;
            if (testCols == 1) {
                requiredWidth = diameterPx;
                pitch = (double) diameterPx + spacingPx;
            } else {
                double spaceForGaps = availableWidth - (double) testCols * diameterPx;
                if (spaceForGaps < 0) {
                    break;
                }
                double perGapSpacing = spaceForGaps / (testCols - 1);
                if (perGapSpacing < GAP_RELAXATION * spacingPx) {
                    continue;
                }
                requiredWidth = (double) testCols * diameterPx + (testCols - 1) * perGapSpacing;
                pitch = diameterPx + perGapSpacing;
            }

            if (requiredWidth <= availableWidth + BOUNDS_TOLERANCE) {
                bestColumns = testCols;
                bestPitch = pitch;
            }
        }

        return new ColumnPlan(bestColumns, bestPitch, Arrangement.UNIFORM);
    }

    /**
     * Planned column count and pitch before the per-column bounds check.
     */
    record ColumnPlan(int columns, double pitch, Arrangement arrangement) {
    }
}
