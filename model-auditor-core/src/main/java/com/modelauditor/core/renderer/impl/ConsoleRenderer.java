package com.modelauditor.core.renderer.impl;

import com.modelauditor.core.renderer.OutputRenderer;
import com.modelauditor.core.renderer.RenderContext;
import com.modelauditor.core.report.GeneratedReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Renderer that prints reports to the console with optional ANSI colors.
 *
 * <p>Colors and the separator line come from {@link RenderContext#colors()} and
 * {@link RenderContext#separator()}. Binary reports are listed by size only.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(List<GeneratedReport> reports, RenderContext context) {
        boolean useColors = context.colors();
        String separator = context.separator();
        logger.debug("Rendering {} report(s) to console (colors: {})", reports.size(), useColors);

        for (int i = 0; i < reports.size(); i++) {
            GeneratedReport report = reports.get(i);
            String header = useColors ? ANSI_BOLD + ANSI_CYAN : "";
            String reset = useColors ? ANSI_RESET : "";
            out.println(header + report.fileName() + reset);
            out.println();
            if (report.isBinary()) {
                out.println("(binary " + report.fileExtension() + " document, " + report.bytes().length + " bytes)");
            } else {
                out.println(report.content());
            }
            if (i < reports.size() - 1) {
                printSeparator(separator, useColors);
            }
        }
    }

    private void printSeparator(String separator, boolean useColors) {
        String color = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";
        int repeatCount = Math.max(1, 80 / separator.length());
        out.println(color + separator.repeat(repeatCount) + reset);
    }
}
