package com.largomodo.badgelayout.report;

import com.largomodo.badgelayout.core.LayoutEngine;
import com.largomodo.badgelayout.core.domain.GeometryConfig;
import com.largomodo.badgelayout.core.domain.InsufficientCapacityException;
import com.largomodo.badgelayout.core.domain.LayoutMode;
import com.largomodo.badgelayout.core.domain.LayoutSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LayoutReportWriterTest {

    private static final GeometryConfig A4_68MM = new GeometryConfig(803, 2480, 3507);

    private final LayoutEngine engine = new LayoutEngine();
    private StringWriter buffer;

    @BeforeEach
    void setUp() {
        buffer = new StringWriter();
    }

    @Test
    void testPlanListsEveryPage() throws InsufficientCapacityException {
        new LayoutReportWriter(new PrintWriter(buffer), false)
                .writePlan(engine.layout(25, LayoutMode.COMPACT, 1, 5, A4_68MM));

        String text = buffer.toString();
        assertTrue(text.contains("Layout: COMPACT (HEXAGONAL), 3 column(s)"), text);
        assertTrue(text.contains("Capacity per sheet: 11"), text);
        assertTrue(text.contains("Badges: 25 on 3 page(s)"), text);
        assertTrue(text.contains("Page 1: 11 badge(s) (items 1-11)"), text);
        assertTrue(text.contains("Page 2: 11 badge(s) (items 12-22)"), text);
        assertTrue(text.contains("Page 3: 3 badge(s) (items 23-25)"), text);
        assertFalse(text.contains("slot"), "Positions are only listed on request");
    }

    @Test
    void testPositionsListedWhenRequested() throws InsufficientCapacityException {
        new LayoutReportWriter(new PrintWriter(buffer), true)
                .writePlan(engine.layout(2, LayoutMode.COMPACT, 1, 5, A4_68MM));

        String text = buffer.toString();
        assertTrue(text.contains("  slot 1: (460.0, 460.0)"), text);
        assertTrue(text.contains("  slot 2: (460.0, 1274.0)"), text);
        assertFalse(text.contains("slot 3"));
    }

    @Test
    void testEmptyBatchPrintsPlaceholderPage() throws InsufficientCapacityException {
        new LayoutReportWriter(new PrintWriter(buffer), true)
                .writePlan(engine.layout(0, LayoutMode.GRID, 1, 5, A4_68MM));

        assertTrue(buffer.toString().contains("Page 1: empty"));
    }

    @Test
    void testComparisonHasOneLinePerMode() {
        List<LayoutSummary> summaries = List.of(
                engine.summarize(LayoutMode.GRID, 1, 5, A4_68MM),
                engine.summarize(LayoutMode.COMPACT, 1, 5, A4_68MM));

        new LayoutReportWriter(new PrintWriter(buffer), false).writeComparison(summaries);

        String[] lines = buffer.toString().split("\\R");
        assertEquals(3, lines.length);
        assertEquals("Mode comparison:", lines[0]);
        assertTrue(lines[1].contains("GRID") && lines[1].contains("8 per sheet"), lines[1]);
        assertTrue(lines[2].contains("COMPACT") && lines[2].contains("11 per sheet"), lines[2]);
    }

    @Test
    void testNullWriterRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LayoutReportWriter(null, false));
    }
}
