package com.modelauditor.core.renderer.impl;

import com.modelauditor.core.renderer.RenderContext;
import com.modelauditor.core.report.GeneratedReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ByteArrayOutputStream buffer;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withColorsDisabled_printsPlainHeaderAndContent() {
        GeneratedReport report = new GeneratedReport("audit-report", "# memo", "md", "text/markdown");
        RenderContext context = RenderContext.of(".").withColors(false);

        renderer.render(List.of(report), context);

        assertThat(output()).contains("audit-report.md", "# memo");
        assertThat(output()).doesNotContain("\u001B[");
    }

    @Test
    void render_withDefaultSettings_usesAnsiColors() {
        GeneratedReport report = new GeneratedReport("audit-report", "# memo", "md", "text/markdown");

        renderer.render(List.of(report), RenderContext.of("."));

        assertThat(output()).contains("\u001B[1m\u001B[36maudit-report.md\u001B[0m");
    }

    @Test
    void render_withMultipleReports_separatesThem() {
        GeneratedReport first = new GeneratedReport("audit-report", "first", "md", "text/markdown");
        GeneratedReport second = new GeneratedReport("audit-report", "second", "json", "application/json");
        RenderContext context = RenderContext.of(".").withColors(false);

        renderer.render(List.of(first, second), context);

        String text = output();
        assertThat(text).contains("-".repeat(78));
        assertThat(text.indexOf("first")).isLessThan(text.indexOf("---")).isLessThan(text.indexOf("second"));
    }

    @Test
    void render_withCustomSeparator_usesIt() {
        GeneratedReport first = new GeneratedReport("a", "first", "md", "text/markdown");
        GeneratedReport second = new GeneratedReport("b", "second", "md", "text/markdown");
        RenderContext context = RenderContext.of(".").withColors(false).withSeparator("==");

        renderer.render(List.of(first, second), context);

        assertThat(output()).contains("=".repeat(80));
    }

    @Test
    void render_withSingleReport_printsNoSeparator() {
        GeneratedReport report = new GeneratedReport("audit-report", "only", "md", "text/markdown");
        RenderContext context = RenderContext.of(".").withColors(false);

        renderer.render(List.of(report), context);

        assertThat(output()).doesNotContain("---");
    }

    @Test
    void render_binaryReport_printsSizeInsteadOfContent() {
        GeneratedReport report = GeneratedReport.binary("audit-datatape", new byte[] {1, 2, 3, 4}, "xlsx",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

        renderer.render(List.of(report), RenderContext.of(".").withColors(false));

        assertThat(output()).contains("audit-datatape.xlsx", "(binary xlsx document, 4 bytes)");
    }
}
