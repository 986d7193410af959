package com.modelauditor.core.formula;

import java.util.Objects;

/**
 * Reference to a cell or name in another workbook.
 *
 * @param workbook linked file name or path as recorded by the workbook
 * @param sheet sheet inside the linked workbook, null for workbook-level names
 * @param target address or name inside the linked workbook
 */
public record ExternalReference(String workbook, String sheet, String target) {

    public ExternalReference {
        Objects.requireNonNull(workbook, "workbook must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }

    /**
     * Renders the reference the way a formula would show it.
     *
     * @return e.g. {@code [Budget.xlsx]Plan!B4}
     */
    public String display() {
        return "[" + workbook + "]" + (sheet == null ? "" : sheet) + "!" + target;
    }
}
