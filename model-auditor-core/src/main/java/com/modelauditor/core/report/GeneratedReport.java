package com.modelauditor.core.report;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Represents a generated report document, either text or a binary container
 * such as a workbook.
 *
 * @param name base file name without extension
 * @param content text content; empty for binary documents
 * @param fileExtension file extension for this content
 * @param contentType MIME type of the content
 * @param binary raw bytes of a binary document, null for text
 */
public record GeneratedReport(
    String name,
    String content,
    String fileExtension,
    String contentType,
    byte[] binary
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedReport {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
        binary = binary == null ? null : binary.clone();
    }

    /**
     * Creates a text document.
     */
    public GeneratedReport(String name, String content, String fileExtension, String contentType) {
        this(name, content, fileExtension, contentType, null);
    }

    /**
     * Creates a binary document.
     *
     * @param name base file name without extension
     * @param bytes document bytes
     * @param fileExtension file extension
     * @param contentType MIME type
     * @return report with empty text content
     */
    public static GeneratedReport binary(String name, byte[] bytes, String fileExtension, String contentType) {
        return new GeneratedReport(name, "", fileExtension, contentType, Objects.requireNonNull(bytes, "bytes"));
    }

    public boolean isBinary() {
        return binary != null;
    }

    /**
     * Returns the bytes written to disk: the binary payload, or the UTF-8 text.
     *
     * @return document bytes
     */
    public byte[] bytes() {
        return binary != null ? binary.clone() : content.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Returns the file name the document is written under.
     *
     * @return name plus extension
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
