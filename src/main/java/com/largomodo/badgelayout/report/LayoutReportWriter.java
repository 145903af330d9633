package com.largomodo.badgelayout.report;

import com.largomodo.badgelayout.core.domain.LayoutSummary;
import com.largomodo.badgelayout.core.domain.MultiPageLayoutResult;
import com.largomodo.badgelayout.core.domain.PageAssignment;
import com.largomodo.badgelayout.core.domain.Position;
import com.largomodo.badgelayout.core.domain.SingleSheetLayout;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;

/**
 * Renders a page plan as plain text for the command line.
 * <p>
 * Page, slot and item numbers are printed 1-based ("Page 1: ... (items 1-11)");
 * the underlying plan stays 0-based.
 */
public class LayoutReportWriter {

    private final PrintWriter out;
    private final boolean includePositions;

    public LayoutReportWriter(PrintWriter out, boolean includePositions) {
        if (out == null) {
            throw new IllegalArgumentException("Output writer cannot be null");
        }
        this.out = out;
        this.includePositions = includePositions;
    }

    public void writePlan(MultiPageLayoutResult result) {
        SingleSheetLayout sheet = result.sheetLayout();
        out.printf(Locale.ROOT, "Layout: %s (%s), %d column(s), pitch %.1f x %.1f px%n",
                sheet.mode(), sheet.arrangement(), sheet.columns(),
                sheet.horizontalPitchPx(), sheet.verticalPitchPx());
        out.printf(Locale.ROOT, "Capacity per sheet: %d%n", result.capacityPerSheet());
        out.printf(Locale.ROOT, "Badges: %d on %d page(s)%n", result.totalItems(), result.totalPages());

        for (PageAssignment page : result.pages()) {
            if (page.isEmpty()) {
                out.printf(Locale.ROOT, "Page %d: empty%n", page.pageIndex() + 1);
                continue;
            }
            out.printf(Locale.ROOT, "Page %d: %d badge(s) (items %d-%d)%n",
                    page.pageIndex() + 1, page.itemsOnPage(), page.firstItemIndex() + 1, page.endItemIndex());
            if (includePositions) {
                writePositions(page.positions());
            }
        }
        out.flush();
    }

    /**
     * One line per mode, for side-by-side capacity comparison.
     */
    public void writeComparison(List<LayoutSummary> summaries) {
        out.println("Mode comparison:");
        for (LayoutSummary summary : summaries) {
            out.printf(Locale.ROOT, "  %-8s %3d per sheet (%s, %d column(s))%n",
                    summary.mode(), summary.capacityPerSheet(), summary.arrangement(), summary.columns());
        }
        out.flush();
    }

    private void writePositions(List<Position> positions) {
        for (int slot = 0; slot < positions.size(); slot++) {
            Position p = positions.get(slot);
            out.printf(Locale.ROOT, "  slot %d: (%.1f, %.1f)%n", slot + 1, p.x(), p.y());
        }
    }
}
