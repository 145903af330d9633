package com.largomodo.badgelayout.core;

import com.largomodo.badgelayout.core.domain.GeometryConfig;
import com.largomodo.badgelayout.core.domain.InsufficientCapacityException;
import com.largomodo.badgelayout.core.domain.LayoutMode;
import com.largomodo.badgelayout.core.domain.LayoutSummary;
import com.largomodo.badgelayout.core.domain.MultiPageLayoutPlanner;
import com.largomodo.badgelayout.core.domain.MultiPageLayoutResult;
import com.largomodo.badgelayout.core.domain.PagePlanner;
import com.largomodo.badgelayout.core.domain.SingleSheetLayout;
import com.largomodo.badgelayout.core.layout.LayoutCalculatorFactory;
import com.largomodo.badgelayout.util.UnitConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for badge layout queries.
 * <p>
 * Coordinates the query workflow:
 * 1. Convert spacing and margin from millimetres to pixels (once per query)
 * 2. Compute the single-sheet layout for the requested mode
 * 3. Partition the batch across pages with the configured planner
 * <p>
 * Holds no per-query state: every call is a pure function of its arguments, so
 * one engine can serve concurrent callers without locking. A diameter or paper
 * change is handled by passing a new {@link GeometryConfig}.
 */
public class LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutCalculatorFactory calculators = new LayoutCalculatorFactory();
    private final PagePlanner planner;
    private final int dpi;

    public LayoutEngine() {
        this(new MultiPageLayoutPlanner(), UnitConverter.DEFAULT_DPI);
    }

    /**
     * @param planner page planner used for multi-page partitioning
     * @param dpi     resolution used to convert spacing and margin, must match the
     *                resolution the GeometryConfig was built at
     */
    public LayoutEngine(PagePlanner planner, int dpi) {
        if (planner == null) {
            throw new IllegalArgumentException("Page planner cannot be null");
        }
        if (dpi <= 0) {
            throw new IllegalArgumentException("DPI must be positive, got: " + dpi);
        }
        this.planner = planner;
        this.dpi = dpi;
    }

    /**
     * Lays out a batch of badges across as many sheets as needed.
     *
     * @param totalItems number of badges, must not be negative
     * @param mode       layout mode
     * @param spacingMm  minimum gap between badge edges (negative treated as 0)
     * @param marginMm   page margin (negative treated as 0)
     * @param config     geometry snapshot for this query
     * @return page plan; a single empty page when totalItems is 0
     * @throws InsufficientCapacityException if badges were requested but none fits on a sheet
     */
    public MultiPageLayoutResult layout(int totalItems, LayoutMode mode, double spacingMm, double marginMm,
                                        GeometryConfig config) throws InsufficientCapacityException {
        SingleSheetLayout sheet = sheetLayout(mode, spacingMm, marginMm, config);
        MultiPageLayoutResult result = planner.partition(totalItems, sheet);
        log.debug("{} badges -> {} page(s) at {} per sheet", totalItems, result.totalPages(), sheet.capacity());
        return result;
    }

    /**
     * Computes the positions for one sheet without partitioning.
     */
    public SingleSheetLayout sheetLayout(LayoutMode mode, double spacingMm, double marginMm, GeometryConfig config) {
        if (mode == null) {
            throw new IllegalArgumentException("Layout mode cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Geometry config cannot be null");
        }
        int spacingPx = toPixels("spacing", spacingMm);
        int marginPx = toPixels("margin", marginMm);
        return calculators.get(mode).compute(config, spacingPx, marginPx);
    }

    /**
     * Capacity information for a mode, without page partitioning.
     */
    public LayoutSummary summarize(LayoutMode mode, double spacingMm, double marginMm, GeometryConfig config) {
        return LayoutSummary.of(sheetLayout(mode, spacingMm, marginMm, config), spacingMm, marginMm);
    }

    public int getDpi() {
        return dpi;
    }

    private int toPixels(String name, double mm) {
        if (mm < 0) {
            log.debug("Negative {} {}mm treated as 0", name, mm);
            return 0;
        }
        return UnitConverter.mmToPixels(mm, dpi);
    }
}
