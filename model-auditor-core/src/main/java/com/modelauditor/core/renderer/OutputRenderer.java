package com.modelauditor.core.renderer;

import com.modelauditor.core.report.GeneratedReport;

import java.util.List;

/**
 * Writes generated report documents to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI). The CLI
 * always runs the filesystem renderer and adds the console renderer on request.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.modelauditor.core.renderer.OutputRenderer}
 *
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the documents.
     *
     * @param reports generated documents
     * @param context rendering context with configuration and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(List<GeneratedReport> reports, RenderContext context);
}
