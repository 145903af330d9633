package com.largomodo.badgelayout;

import com.largomodo.badgelayout.core.BadgePreset;
import com.largomodo.badgelayout.core.GeometryFactory;
import com.largomodo.badgelayout.core.LayoutEngine;
import com.largomodo.badgelayout.core.PaperSize;
import com.largomodo.badgelayout.core.domain.GeometryConfig;
import com.largomodo.badgelayout.core.domain.InsufficientCapacityException;
import com.largomodo.badgelayout.core.domain.LayoutMode;
import com.largomodo.badgelayout.core.domain.LayoutSummary;
import com.largomodo.badgelayout.core.domain.MultiPageLayoutPlanner;
import com.largomodo.badgelayout.core.domain.MultiPageLayoutResult;
import com.largomodo.badgelayout.report.LayoutReportWriter;
import com.largomodo.badgelayout.util.UnitConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI entry point for planning badge print sheets.
 * <p>
 * Uses Picocli framework for argument parsing with automatic help generation
 * and type-safe enum conversion. Resolves the badge size into a geometry
 * snapshot, runs the layout engine once and prints the page plan.
 * <p>
 * Smart defaults:
 * - No --preset: badge size from --diameter and --bleed
 * - --preset given: preset size wins over --diameter and --bleed
 * - --count 0: prints the single placeholder page
 */
@Command(
        name = "badgelayout",
        mixinStandardHelpOptions = true,
        resourceBundle = "badgelayout.badgelayout",
        version = "${bundle:application.version}",
        header = "Plans how many round badges fit on each printed sheet.",
        description = {
                "Lays out circular badges on fixed-size sheets, either as a plain grid or as a",
                "staggered honeycomb that fits more badges per page, and splits a batch across pages."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:Nothing fits on a sheet, or another execution error",
                "2:Invalid command line arguments"
        }
)
public class BadgeLayout implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BadgeLayout.class);

    @Option(names = {"-n", "--count"}, defaultValue = "0",
            description = "Number of badges to place (default: ${DEFAULT-VALUE})")
    int count;

    @Option(names = {"-m", "--mode"}, defaultValue = "COMPACT",
            description = {
                    "Layout mode.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    LayoutMode mode;

    @Option(names = {"-s", "--spacing"}, defaultValue = "3",
            description = "Minimum gap between badge edges in mm (default: ${DEFAULT-VALUE})")
    double spacingMm;

    @Option(names = "--margin", defaultValue = "6",
            description = "Page margin in mm (default: ${DEFAULT-VALUE})")
    double marginMm;

    @Option(names = {"-d", "--diameter"}, defaultValue = "58",
            description = "Badge face diameter in mm, 10-100 (default: ${DEFAULT-VALUE})")
    double badgeMm;

    @Option(names = {"-b", "--bleed"}, defaultValue = "5",
            description = "Bleed around the badge face in mm, 0-10 (default: ${DEFAULT-VALUE})")
    double bleedMm;

    @Option(names = "--preset",
            description = "Preset badge size, overrides --diameter and --bleed. Valid values: ${COMPLETION-CANDIDATES}")
    BadgePreset preset;

    @Option(names = "--paper", defaultValue = "A4",
            description = "Paper size. Valid values: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    PaperSize paper;

    @Option(names = "--dpi", defaultValue = "300",
            description = "Print resolution (default: ${DEFAULT-VALUE})")
    int dpi;

    @Option(names = "--positions", description = "List the centre of every slot")
    boolean positions;

    @Option(names = "--compare", description = "Also print grid and compact capacity side by side")
    boolean compare;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the options shared by main() and tests.
     */
    static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new BadgeLayout());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        return cmd;
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (count < 0) {
            throw new ParameterException(spec.commandLine(), "Badge count cannot be negative: " + count);
        }
        if (dpi <= 0) {
            throw new ParameterException(spec.commandLine(), "DPI must be positive: " + dpi);
        }

        GeometryFactory geometryFactory = new GeometryFactory(dpi);
        GeometryConfig config = preset != null
                ? geometryFactory.forPreset(preset, paper)
                : geometryFactory.forBadge(badgeMm, bleedMm, paper);
        log.debug("Geometry: {} at {} dpi -> {}", paper, dpi, config);

        LayoutEngine engine = new LayoutEngine(new MultiPageLayoutPlanner(), dpi);
        PrintWriter out = spec.commandLine().getOut();
        LayoutReportWriter report = new LayoutReportWriter(out, positions);

        // Printed size after truncation to whole pixels
        double printedMm = UnitConverter.pixelsToMm(config.itemDiameterPx(), dpi);
        out.printf(Locale.ROOT, "Paper: %s (%.1f x %.1f mm, %d x %d px at %d dpi), badge diameter %d px (%.1f mm)%n",
                paper, paper.getWidthMm(), paper.getHeightMm(), config.sheetWidthPx(), config.sheetHeightPx(),
                dpi, config.itemDiameterPx(), printedMm);

        MDC.put("mode", mode.name());
        try {
            MultiPageLayoutResult result = engine.layout(count, mode, spacingMm, marginMm, config);
            report.writePlan(result);

            if (compare) {
                List<LayoutSummary> summaries = new ArrayList<>();
                for (LayoutMode candidate : LayoutMode.values()) {
                    summaries.add(engine.summarize(candidate, spacingMm, marginMm, config));
                }
                report.writeComparison(summaries);
            }
        } catch (InsufficientCapacityException e) {
            // Not an argument error: the values are valid, they just leave no room
            log.error("Cannot place {} badge(s): {}", e.getRequestedItems(), e.getMessage());
            return 1;
        } finally {
            MDC.remove("mode");
        }

        log.info("Layout complete: {} badge(s), {} mode", count, mode);
        return 0;
    }
}
