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
 * Row/column grid with a fixed pitch of diameter + spacing in both directions.
 * <p>
 * The block of cells is centred inside the printable area and positions are
 * emitted row-major. Every pair of centres is a whole number of pitches apart,
 * so badges can never overlap.
 */
public class GridLayoutCalculator implements LayoutCalculator {

    private static final Logger log = LoggerFactory.getLogger(GridLayoutCalculator.class);

    @Override
    public SingleSheetLayout compute(int diameterPx, int spacingPx, int marginPx,
                                     int sheetWidthPx, int sheetHeightPx) {
        return computeGrid(LayoutMode.GRID, diameterPx, spacingPx, marginPx, sheetWidthPx, sheetHeightPx);
    }

    /**
     * Grid computation shared with the compact calculator's density fallback.
     *
     * @param mode mode to stamp on the result (GRID, or COMPACT when used as fallback)
     */
    SingleSheetLayout computeGrid(LayoutMode mode, int diameterPx, int spacingPx, int marginPx,
                                  int sheetWidthPx, int sheetHeightPx) {
        if (diameterPx <= 0) {
            throw new IllegalArgumentException("Diameter must be positive: " + diameterPx);
        }
        int spacing = Math.max(0, spacingPx);
        int margin = Math.max(0, marginPx);
        int radius = diameterPx / 2;

        // long arithmetic: a margin or spacing near Integer.MAX_VALUE must not wrap around
        long availableWidth = (long) sheetWidthPx - 2L * margin;
        long availableHeight = (long) sheetHeightPx - 2L * margin;

        // A forced single row/column wider than the printable area would break containment
        if (availableWidth < diameterPx || availableHeight < diameterPx) {
            log.debug("Grid: printable area {}x{}px smaller than badge {}px", availableWidth, availableHeight, diameterPx);
            return SingleSheetLayout.empty(mode, Arrangement.NONE, margin, radius);
        }

        long pitch = (long) diameterPx + spacing;
        int cols = (int) Math.max(1, availableWidth / pitch);
        int rows = (int) Math.max(1, availableHeight / pitch);

        // A forced single cell (area fits the badge but not its spacing) is pinned to the margin
        double blockWidth = Math.min((double) cols * pitch, availableWidth);
        double blockHeight = Math.min((double) rows * pitch, availableHeight);
        double startX = margin + (availableWidth - blockWidth) / 2;
        double startY = margin + (availableHeight - blockHeight) / 2;

        List<Position> positions = new ArrayList<>();
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                double x = startX + (double) col * pitch + radius;
                double y = startY + (double) row * pitch + radius;
                positions.add(new Position(x, y));
            }
        }

        log.debug("Grid: {} cols x {} rows, pitch {}px, margin {}px", cols, rows, pitch, margin);
        return new SingleSheetLayout(mode, Arrangement.GRID, positions, cols, rows, pitch, pitch, margin, radius);
    }
}
