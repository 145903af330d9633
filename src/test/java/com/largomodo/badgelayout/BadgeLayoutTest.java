package com.largomodo.badgelayout;

import com.largomodo.badgelayout.core.BadgePreset;
import com.largomodo.badgelayout.core.PaperSize;
import com.largomodo.badgelayout.core.domain.LayoutMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for BadgeLayout CLI argument parsing and exit codes.
 * <p>
 * Focus: defaults, enum parsing, validation, report output.
 * Output is captured through CommandLine.setOut/setErr instead of System.out.
 */
class BadgeLayoutTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cmd = BadgeLayout.newCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @Test
    void testDefaults() {
        BadgeLayout badgeLayout = new BadgeLayout();
        new CommandLine(badgeLayout).parseArgs();

        assertEquals(0, badgeLayout.count);
        assertEquals(LayoutMode.COMPACT, badgeLayout.mode);
        assertEquals(3, badgeLayout.spacingMm);
        assertEquals(6, badgeLayout.marginMm);
        assertEquals(58, badgeLayout.badgeMm);
        assertEquals(5, badgeLayout.bleedMm);
        assertNull(badgeLayout.preset);
        assertEquals(PaperSize.A4, badgeLayout.paper);
        assertEquals(300, badgeLayout.dpi);
        assertFalse(badgeLayout.positions);
        assertFalse(badgeLayout.compare);
    }

    @Test
    void testEnumOptionsAreCaseInsensitive() {
        BadgeLayout badgeLayout = new BadgeLayout();
        CommandLine commandLine = new CommandLine(badgeLayout).setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.parseArgs("--mode", "grid", "--paper", "a3", "--preset", "Large");

        assertEquals(LayoutMode.GRID, badgeLayout.mode);
        assertEquals(PaperSize.A3, badgeLayout.paper);
        assertEquals(BadgePreset.LARGE, badgeLayout.preset);
    }

    @Test
    void testBatchSplitAcrossPages() {
        int exitCode = cmd.execute("-n", "25", "-d", "58", "-b", "5", "-s", "1", "--margin", "5");

        assertEquals(0, exitCode, err.toString());
        String text = out.toString();
        assertTrue(text.contains("Paper: A4 (210.0 x 297.0 mm, 2480 x 3507 px at 300 dpi)"), text);
        assertTrue(text.contains("badge diameter 803 px (68.0 mm)"), text);
        assertTrue(text.contains("Capacity per sheet: 11"), text);
        assertTrue(text.contains("Badges: 25 on 3 page(s)"), text);
        assertTrue(text.contains("Page 3: 3 badge(s) (items 23-25)"), text);
    }

    @Test
    void testGridMode() {
        int exitCode = cmd.execute("-n", "25", "-m", "grid", "-s", "1", "--margin", "5");

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("Layout: GRID (GRID)"), out.toString());
        assertTrue(out.toString().contains("Capacity per sheet: 8"), out.toString());
    }

    @Test
    void testPresetOverridesDiameter() {
        // 42mm printed badge with default 3mm spacing and 6mm margin: the grid holds more than the honeycomb
        int exitCode = cmd.execute("--preset", "small", "-d", "90", "-n", "10");

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("badge diameter 496 px"), out.toString());
        assertTrue(out.toString().contains("Capacity per sheet: 24"), out.toString());
    }

    @Test
    void testZeroCountPrintsPlaceholderPage() {
        int exitCode = cmd.execute();

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("Page 1: empty"), out.toString());
    }

    @Test
    void testCompareListsBothModes() {
        int exitCode = cmd.execute("-n", "11", "-s", "1", "--margin", "5", "--compare");

        assertEquals(0, exitCode, err.toString());
        String text = out.toString();
        assertTrue(text.contains("Mode comparison:"), text);
        assertTrue(text.contains("GRID") && text.contains("8 per sheet"), text);
        assertTrue(text.contains("11 per sheet"), text);
    }

    @Test
    void testPositionsFlag() {
        int exitCode = cmd.execute("-n", "1", "-s", "1", "--margin", "5", "--positions");

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("slot 1: (460.0, 460.0)"), out.toString());
    }

    @Test
    void testNothingFitsReturnsExecutionError() {
        int exitCode = cmd.execute("-n", "1", "--margin", "200");

        assertEquals(1, exitCode, "Valid arguments that leave no room are not a usage error");
    }

    @Test
    void testAbsurdMarginLeavesNoRoom() {
        // 1e9 mm saturates the pixel conversion at Integer.MAX_VALUE
        int exitCode = cmd.execute("-n", "1", "-m", "grid", "--margin", "1e9");

        assertEquals(1, exitCode);
        assertFalse(out.toString().contains("Page 1: 1 badge(s)"), out.toString());
    }

    @ParameterizedTest
    @CsvSource({
        "-n,-1",
        "--dpi,0",
        "--mode,hex",
        "--paper,B5",
        "--count,many"
    })
    void testInvalidArgumentsReturnUsageError(String option, String value) {
        int exitCode = cmd.execute(option, value);

        assertEquals(2, exitCode, "Should reject " + option + " " + value);
        assertFalse(err.toString().isBlank(), "Usage error should explain the problem");
    }

    @Test
    void testVersion() {
        int exitCode = cmd.execute("--version");

        assertEquals(0, exitCode);
        assertEquals("1.0.0", out.toString().trim());
    }
}
