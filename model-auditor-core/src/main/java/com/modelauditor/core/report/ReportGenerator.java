package com.modelauditor.core.report;

import com.modelauditor.core.model.AuditReport;

/**
 * Turns an {@link AuditReport} into one output document.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI) and selected
 * by id in the {@code output.formats} configuration or the CLI's {@code --format} option.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.modelauditor.core.report.ReportGenerator}
 *
 * @see GeneratedReport
 */
public interface ReportGenerator {

    /**
     * Returns the format id, lowercase (e.g., "markdown", "json", "csv").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used by {@code list formats}.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension of generated documents.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Generates the document. A report without issues still produces a document
     * stating that no structural issues were found.
     *
     * @param report audit result
     * @return generated document
     */
    GeneratedReport generate(AuditReport report);
}
