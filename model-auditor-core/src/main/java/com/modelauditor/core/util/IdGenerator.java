package com.modelauditor.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic identifiers derived from SHA-256.
 *
 * <p>Issue identifiers must be identical across runs on an unmodified workbook so a
 * report can be diffed against a baseline. Ids are therefore hashes of stable
 * content (issue kind, primary coordinate) and never random or time-based.
 *
 * <pre>{@code
 * String id = IdGenerator.generate("CIRCULAR_REFERENCE", "Model!B4");
 * // 16 lowercase hex characters, same value on every run
 * }</pre>
 */
public final class IdGenerator {

    private static final int SHORT_ID_LENGTH = 16;
    private static final String SEPARATOR = "\u001F";

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a short id from one or more components.
     *
     * @param components values identifying the entity, in a fixed order
     * @return 16-character hex id
     * @throws IllegalArgumentException if no component is given
     */
    public static String generate(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        return generateFromString(String.join(SEPARATOR, components));
    }

    /**
     * Generates a short id from a single string.
     *
     * @param input non-blank input
     * @return 16-character hex id
     */
    public static String generateFromString(String input) {
        return generateFullHash(input).substring(0, SHORT_ID_LENGTH);
    }

    /**
     * Returns the full SHA-256 hex digest of the input.
     *
     * @param input non-blank input
     * @return 64-character hex digest
     */
    public static String generateFullHash(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Input must not be null or blank");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
